package org.geometry;

import java.util.Arrays;

/**
 * An immutable 3x3 matrix relating two coordinate frames.
 *
 * Matrices built by this library from unit-norm input are orthonormal and right-handed
 * (determinant +1), but the type itself does not enforce it: {@link #isOrthonormal(double)}
 * and {@link #isRightHanded(double)} let callers check.
 *
 * Columns are the images of the source-frame unit axes, i.e. for a gradient-to-patient
 * matrix column 0 is the read axis, column 1 the line axis and column 2 the partition axis.
 */
public final class RotationMatrix {

    private static final RotationMatrix IDENTITY = new RotationMatrix(new double[][]{
            {1.0, 0.0, 0.0},
            {0.0, 1.0, 0.0},
            {0.0, 0.0, 1.0}
    });

    private final double[][] m; // row-major, always 3x3

    private RotationMatrix(double[][] rows) {
        this.m = rows;
    }

    /**
     * Builds a matrix from row-major values. The input is deep-copied.
     *
     * @throws IllegalArgumentException if the array is null or not 3x3
     */
    public static RotationMatrix of(double[][] rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows must not be null");
        }
        if (rows.length != 3) {
            throw new IllegalArgumentException("Expected 3 rows but got " + rows.length);
        }
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) {
            if (rows[r] == null || rows[r].length != 3) {
                throw new IllegalArgumentException("Row " + r + " must have exactly 3 entries");
            }
            copy[r] = Arrays.copyOf(rows[r], 3);
        }
        return new RotationMatrix(copy);
    }

    /**
     * Builds a matrix whose columns are the given vectors.
     */
    public static RotationMatrix fromColumns(Vector3 c0, Vector3 c1, Vector3 c2) {
        if (c0 == null || c1 == null || c2 == null) {
            throw new IllegalArgumentException("columns must not be null");
        }
        double[][] rows = new double[3][3];
        for (int r = 0; r < 3; r++) {
            rows[r][0] = c0.get(r);
            rows[r][1] = c1.get(r);
            rows[r][2] = c2.get(r);
        }
        return new RotationMatrix(rows);
    }

    public static RotationMatrix identity() {
        return IDENTITY;
    }

    public double get(int row, int col) {
        checkIndex(row, "row");
        checkIndex(col, "col");
        return m[row][col];
    }

    public Vector3 column(int col) {
        checkIndex(col, "col");
        return Vector3.of(m[0][col], m[1][col], m[2][col]);
    }

    public Vector3 row(int row) {
        checkIndex(row, "row");
        return Vector3.of(m[row]);
    }

    /**
     * Matrix product {@code this · other}.
     */
    public RotationMatrix multiply(RotationMatrix other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                out[r][c] = m[r][0] * other.m[0][c] + m[r][1] * other.m[1][c] + m[r][2] * other.m[2][c];
            }
        }
        return new RotationMatrix(out);
    }

    /**
     * Matrix-vector product {@code this · v}.
     */
    public Vector3 apply(Vector3 v) {
        if (v == null) {
            throw new IllegalArgumentException("v must not be null");
        }
        return Vector3.of(row(0).dot(v), row(1).dot(v), row(2).dot(v));
    }

    public RotationMatrix transpose() {
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                out[c][r] = m[r][c];
            }
        }
        return new RotationMatrix(out);
    }

    public double determinant() {
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }

    /**
     * True if every column has unit norm and the columns are pairwise orthogonal,
     * both within the given absolute tolerance.
     */
    public boolean isOrthonormal(double tolerance) {
        for (int i = 0; i < 3; i++) {
            Vector3 ci = column(i);
            if (Math.abs(ci.norm() - 1.0) > tolerance) return false;
            for (int j = i + 1; j < 3; j++) {
                if (Math.abs(ci.dot(column(j))) > tolerance) return false;
            }
        }
        return true;
    }

    public boolean isRightHanded(double tolerance) {
        return Math.abs(determinant() - 1.0) <= tolerance;
    }

    /**
     * Entry-wise comparison with an absolute tolerance.
     */
    public boolean equalsWithin(RotationMatrix other, double tolerance) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                if (Math.abs(m[r][c] - other.m[r][c]) > tolerance) return false;
            }
        }
        return true;
    }

    /**
     * Returns a row-major deep copy.
     */
    public double[][] toArrayCopy() {
        double[][] out = new double[3][];
        for (int r = 0; r < 3; r++) {
            out[r] = Arrays.copyOf(m[r], 3);
        }
        return out;
    }

    private static void checkIndex(int index, String name) {
        if (index < 0 || index >= 3) {
            throw new IndexOutOfBoundsException(name + "=" + index + ", dim=3");
        }
    }

    @Override
    public String toString() {
        return "RotationMatrix" + Arrays.deepToString(m);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(m);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RotationMatrix other)) return false;
        return Arrays.deepEquals(m, other.m);
    }
}
