package fr.lapetina.embedding.accelerator.memory;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Pooling key: a float array shape or a byte buffer capacity.
 */
record SizeClass(Kind kind, int[] dims) {

    enum Kind {
        FLOAT_ARRAY,
        BYTE_BUFFER
    }

    static SizeClass ofShape(int... shape) {
        if (shape == null || shape.length == 0) {
            throw new IllegalArgumentException("Shape must have at least one dimension");
        }
        long elements = 1;
        for (int dim : shape) {
            if (dim <= 0) {
                throw new IllegalArgumentException("Shape dimensions must be positive: " + Arrays.toString(shape));
            }
            elements *= dim;
        }
        if (elements > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Shape too large for a single array: " + Arrays.toString(shape));
        }
        return new SizeClass(Kind.FLOAT_ARRAY, shape.clone());
    }

    static SizeClass ofBytes(int capacity) {
        return new SizeClass(Kind.BYTE_BUFFER, new int[]{capacity});
    }

    int elementCount() {
        int count = 1;
        for (int dim : dims) {
            count *= dim;
        }
        return count;
    }

    long byteSize() {
        return kind == Kind.FLOAT_ARRAY ? (long) elementCount() * Float.BYTES : dims[0];
    }

    String label() {
        String joined = Arrays.stream(dims).mapToObj(Integer::toString).collect(Collectors.joining("x"));
        return kind == Kind.FLOAT_ARRAY ? "float[" + joined + "]" : "bytes[" + joined + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SizeClass that)) return false;
        return kind == that.kind && Arrays.equals(dims, that.dims);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        return label();
    }
}
