package io.lattice.storage;

import io.lattice.kernel.ObjectId;

import java.util.Arrays;
import java.util.function.BiConsumer;

/**
 * Slot-based table mapping generational identifiers to values.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>{@link #insert(Object)} always succeeds and returns an identifier no live value shares.</li>
 *   <li>{@link #remove(ObjectId)} frees the slot and bumps its generation; removing twice is a no-op.</li>
 *   <li>An identifier issued for a freed slot never resolves again, even after the slot is reused.</li>
 *   <li>A slot whose generation counter is exhausted is retired instead of reused.</li>
 * </ul>
 * Not thread-safe; callers serialize access.
 *
 * @param <T> the stored value type
 */
public final class SlotArena<T> {
    private static final int DEFAULT_CAPACITY = 16;

    private Object[] values;
    private int[] generations;
    private int highWater;
    private int size;
    private final FreeSlotList freeSlots;

    public SlotArena() {
        this(DEFAULT_CAPACITY);
    }

    public SlotArena(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        this.values = new Object[initialCapacity];
        this.generations = new int[initialCapacity];
        this.freeSlots = new FreeSlotList(initialCapacity);
    }

    /**
     * Store a value and issue a fresh identifier for it.
     *
     * @param value the value, never null
     * @return the identifier of the new slot
     */
    public ObjectId insert(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        int index = freeSlots.pop();
        if (index < 0) {
            if (highWater == values.length) {
                grow();
            }
            index = highWater++;
        }
        values[index] = value;
        size++;
        return new ObjectId(index, generations[index]);
    }

    /**
     * Resolve an identifier.
     *
     * @param id the identifier
     * @return the live value, or null if the identifier is stale, vacant or out of range
     */
    @SuppressWarnings("unchecked")
    public T get(ObjectId id) {
        if (id == null) {
            return null;
        }
        int index = id.index();
        if (index < 0 || index >= highWater) {
            return null;
        }
        if (generations[index] != id.generation()) {
            return null;
        }
        return (T) values[index];
    }

    public boolean contains(ObjectId id) {
        return get(id) != null;
    }

    /**
     * Free the slot referenced by {@code id}.
     *
     * @param id the identifier
     * @return true if a live value was removed
     */
    public boolean remove(ObjectId id) {
        if (get(id) == null) {
            return false;
        }
        int index = id.index();
        values[index] = null;
        size--;
        int next = generations[index] + 1;
        generations[index] = next;
        if (next != 0) {
            freeSlots.push(index);
        }
        // next == 0 wrapped: the slot stays retired
        return true;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Visit every live value in slot order.
     *
     * @param action receives the identifier and the value
     */
    @SuppressWarnings("unchecked")
    public void forEach(BiConsumer<ObjectId, T> action) {
        for (int index = 0; index < highWater; index++) {
            Object value = values[index];
            if (value != null) {
                action.accept(new ObjectId(index, generations[index]), (T) value);
            }
        }
    }

    // Visible for tests: forces the generation counter of a slot.
    void setGeneration(int index, int generation) {
        generations[index] = generation;
    }

    private void grow() {
        int newCapacity = values.length * 2;
        if (newCapacity < 0) {
            throw new IllegalStateException("Arena capacity exhausted");
        }
        values = Arrays.copyOf(values, newCapacity);
        generations = Arrays.copyOf(generations, newCapacity);
    }
}
