package io.lattice.storage;

import java.util.Arrays;

/**
 * LIFO stack of vacant slot indexes awaiting reuse.
 * <p>
 * Not thread-safe: the owning {@link SlotArena} is always mutated under its
 * caller's exclusive lock.
 */
final class FreeSlotList {

    private int[] indexes;
    private int size;

    FreeSlotList(int initialCapacity) {
        this.indexes = new int[Math.max(1, initialCapacity)];
    }

    /**
     * Push a vacant slot index onto the stack.
     *
     * @param index the slot index
     */
    void push(int index) {
        if (size == indexes.length) {
            indexes = Arrays.copyOf(indexes, indexes.length * 2);
        }
        indexes[size++] = index;
    }

    /**
     * Pop the most recently freed slot index.
     *
     * @return the slot index, or -1 if empty
     */
    int pop() {
        if (size == 0) {
            return -1;
        }
        return indexes[--size];
    }
}
