package io.lattice.kernel;

/**
 * 64-bit generational object identifier.
 * Layout: [32 bits slot index][32 bits generation].
 * <p>
 * Both halves are unsigned. A raw value round-trips exactly through
 * {@link #toRaw()} and {@link #fromRaw(long)}, but only a successful
 * arena lookup establishes that an identifier is live.
 */
public final class ObjectId implements Comparable<ObjectId> {
    private static final int GENERATION_BITS = 32;
    private static final long GENERATION_MASK = (1L << GENERATION_BITS) - 1;

    private final long value;

    public ObjectId(int index, int generation) {
        this.value = ((index & GENERATION_MASK) << GENERATION_BITS) | (generation & GENERATION_MASK);
    }

    private ObjectId(long value) {
        this.value = value;
    }

    public static ObjectId fromRaw(long value) {
        return new ObjectId(value);
    }

    public long toRaw() {
        return value;
    }

    /**
     * Slot index, to be read as unsigned.
     */
    public int index() {
        return (int) (value >>> GENERATION_BITS);
    }

    /**
     * Generation tag, to be read as unsigned.
     */
    public int generation() {
        return (int) (value & GENERATION_MASK);
    }

    @Override
    public int compareTo(ObjectId other) {
        return Long.compareUnsigned(this.value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        ObjectId other = (ObjectId) obj;
        return value == other.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "ObjectId{index=" + Integer.toUnsignedString(index())
                + ", generation=" + Integer.toUnsignedString(generation()) + "}";
    }
}
