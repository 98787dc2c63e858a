package org.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Rotations about a single coordinate axis.
 *
 * Angles are in radians and follow the vector-operator convention: a positive angle
 * turns vectors counterclockwise when looking down the axis towards the origin, so
 * {@code about(Axis.Z, b)} is {@code [[cos b, -sin b, 0], [sin b, cos b, 0], [0, 0, 1]]}.
 */
public final class ElementaryRotations {

    public enum Axis {
        X(Vector3D.PLUS_I),
        Y(Vector3D.PLUS_J),
        Z(Vector3D.PLUS_K);

        private final Vector3D direction;

        Axis(Vector3D direction) {
            this.direction = direction;
        }
    }

    private ElementaryRotations() {
    }

    public static RotationMatrix about(Axis axis, double angle) {
        if (axis == null) {
            throw new IllegalArgumentException("axis must not be null");
        }
        if (!Double.isFinite(angle)) {
            throw new IllegalArgumentException("angle must be finite: " + angle);
        }
        Rotation rotation = new Rotation(axis.direction, angle, RotationConvention.VECTOR_OPERATOR);
        return RotationMatrix.of(rotation.getMatrix());
    }

    public static RotationMatrix rx(double angle) {
        return about(Axis.X, angle);
    }

    public static RotationMatrix ry(double angle) {
        return about(Axis.Y, angle);
    }

    public static RotationMatrix rz(double angle) {
        return about(Axis.Z, angle);
    }
}
