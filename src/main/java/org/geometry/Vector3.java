package org.geometry;

import java.util.Arrays;

/**
 * An immutable 3-component vector of doubles.
 * Used for normals, direction cosines and the columns of a {@link RotationMatrix}.
 */
public final class Vector3 {

    public static final int DIM = 3;

    private final double[] data;

    private Vector3(double x, double y, double z) {
        this.data = new double[]{x, y, z};
    }

    public static Vector3 of(double x, double y, double z) {
        return new Vector3(x, y, z);
    }

    /**
     * Builds a vector from a raw array.
     * The input array is copied to keep immutability.
     *
     * @param values raw components (must be non-null and of length 3)
     * @throws IllegalArgumentException if the array is null or its length is not 3
     */
    public static Vector3 of(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length != DIM) {
            throw new IllegalArgumentException("Dimension mismatch: expected " + DIM + " but got " + values.length);
        }
        return new Vector3(values[0], values[1], values[2]);
    }

    /**
     * Returns the value at the given component index.
     *
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    public double get(int index) {
        if (index < 0 || index >= DIM) {
            throw new IndexOutOfBoundsException("index=" + index + ", dim=" + DIM);
        }
        return data[index];
    }

    public double x() {
        return data[0];
    }

    public double y() {
        return data[1];
    }

    public double z() {
        return data[2];
    }

    /**
     * Returns a defensive copy of the internal data.
     */
    public double[] toArrayCopy() {
        return Arrays.copyOf(data, DIM);
    }

    public double dot(Vector3 other) {
        requireNonNull(other);
        return data[0] * other.data[0] + data[1] * other.data[1] + data[2] * other.data[2];
    }

    /**
     * Right-handed cross product {@code this × other}.
     */
    public Vector3 cross(Vector3 other) {
        requireNonNull(other);
        double[] a = this.data;
        double[] b = other.data;
        return new Vector3(
                a[1] * b[2] - a[2] * b[1],
                a[2] * b[0] - a[0] * b[2],
                a[0] * b[1] - a[1] * b[0]
        );
    }

    /**
     * Computes the L2 norm (Euclidean length).
     * Components are scaled by the largest magnitude first, so the sum of squares
     * neither overflows nor underflows for finite non-zero vectors.
     */
    public double norm() {
        double max = maxAbs();
        if (max == 0.0 || !Double.isFinite(max)) {
            return max;
        }
        double x = data[0] / max;
        double y = data[1] / max;
        double z = data[2] / max;
        return max * Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * Largest absolute component (infinity norm).
     */
    public double maxAbs() {
        return Math.max(Math.abs(data[0]), Math.max(Math.abs(data[1]), Math.abs(data[2])));
    }

    /**
     * Returns the squared L2 norm (||v||^2).
     */
    public double normSquared() {
        return data[0] * data[0] + data[1] * data[1] + data[2] * data[2];
    }

    /**
     * Returns an L2-normalized vector (length = 1).
     *
     * @throws IllegalStateException if the vector is a zero vector.
     */
    public Vector3 normalized() {
        double max = maxAbs();
        if (max == 0.0) {
            throw new IllegalStateException("Cannot normalize a zero vector");
        }
        Vector3 scaled = new Vector3(data[0] / max, data[1] / max, data[2] / max);
        double n = scaled.norm();
        return new Vector3(scaled.data[0] / n, scaled.data[1] / n, scaled.data[2] / n);
    }

    public Vector3 add(Vector3 other) {
        requireNonNull(other);
        return new Vector3(data[0] + other.data[0], data[1] + other.data[1], data[2] + other.data[2]);
    }

    public Vector3 subtract(Vector3 other) {
        requireNonNull(other);
        return new Vector3(data[0] - other.data[0], data[1] - other.data[1], data[2] - other.data[2]);
    }

    public Vector3 scale(double alpha) {
        return new Vector3(alpha * data[0], alpha * data[1], alpha * data[2]);
    }

    /**
     * Component-wise absolute value.
     */
    public Vector3 abs() {
        return new Vector3(Math.abs(data[0]), Math.abs(data[1]), Math.abs(data[2]));
    }

    public boolean isZero() {
        return data[0] == 0.0 && data[1] == 0.0 && data[2] == 0.0;
    }

    public boolean isFinite() {
        return Double.isFinite(data[0]) && Double.isFinite(data[1]) && Double.isFinite(data[2]);
    }

    /**
     * Component-wise comparison with an absolute tolerance.
     */
    public boolean equalsWithin(Vector3 other, double tolerance) {
        requireNonNull(other);
        for (int i = 0; i < DIM; i++) {
            if (Math.abs(data[i] - other.data[i]) > tolerance) return false;
        }
        return true;
    }

    private static void requireNonNull(Vector3 other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
    }

    @Override
    public String toString() {
        return "Vector3" + Arrays.toString(data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Vector3 other = (Vector3) obj;
        return Arrays.equals(this.data, other.data);
    }
}
