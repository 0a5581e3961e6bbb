package com.olap.bench.domain;

/**
 * Mixed-radix conversion between a linear index and a tuple of per-dimension
 * indices, similar to numpy's {@code unravel_index}.
 *
 * Dimension 0 cycles fastest. For cardinalities (5, 4, 3):
 * <pre>
 * idx0 = n % 5
 * idx1 = (n / 5) % 4
 * idx2 = (n / 20) % 3
 * </pre>
 */
public final class Unranking {

    private Unranking() {
    }

    /**
     * Number of tuples in the Cartesian product, 0 when any cardinality is 0.
     */
    public static long size(int[] cardinalities) {
        long size = 1;
        for (int cardinality : cardinalities) {
            if (cardinality < 0) {
                throw new IllegalArgumentException("Negative cardinality: " + cardinality);
            }
            size = Math.multiplyExact(size, cardinality);
        }
        return size;
    }

    /**
     * Converts a linear index into per-dimension indices.
     *
     * @param n linear index in {@code [0, size(cardinalities))}
     * @param cardinalities per-dimension lengths
     * @return the index tuple
     */
    public static int[] unrank(long n, int[] cardinalities) {
        long size = size(cardinalities);
        if (n < 0 || n >= size) {
            throw new IndexOutOfBoundsException("Index " + n + " outside [0, " + size + ")");
        }
        int[] indices = new int[cardinalities.length];
        long denom = 1;
        for (int i = 0; i < cardinalities.length; i++) {
            indices[i] = (int) ((n / denom) % cardinalities[i]);
            denom *= cardinalities[i];
        }
        return indices;
    }

    /**
     * Inverse of {@link #unrank}.
     */
    public static long rank(int[] indices, int[] cardinalities) {
        if (indices.length != cardinalities.length) {
            throw new IllegalArgumentException(
                "Expected " + cardinalities.length + " indices, got " + indices.length);
        }
        long n = 0;
        long denom = 1;
        for (int i = 0; i < cardinalities.length; i++) {
            if (indices[i] < 0 || indices[i] >= cardinalities[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " outside [0, " + cardinalities[i] + ") for dimension " + i);
            }
            n += indices[i] * denom;
            denom *= cardinalities[i];
        }
        return n;
    }
}
