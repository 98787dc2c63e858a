package org.gradient;

import org.geometry.RotationMatrix;
import org.geometry.Vector3;
import org.orientation.Orientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the gradient basis (read, line, partition) for a slice normal.
 *
 * The device only rotates about two physical axes, never about the readout direction,
 * so the line axis always stays in a canonical plane: the first two axes for sagittal
 * and coronal slices, the last two for transversal ones. The line axis is therefore
 * fixed by the normal alone, and the read axis follows as line × partition.
 *
 * The builder is frame-agnostic: the result is expressed in whatever frame the normal is.
 */
public final class GradientBasisBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(GradientBasisBuilder.class);

    /**
     * Builds the basis with the patient-space sign convention.
     *
     * @param normal partition direction; re-normalized here
     * @param orientation orientation of the slice, normally from the classifier
     * @param beta in-plane angle in radians, clockwise around the partition axis
     * @return matrix with columns (read, line, partition)
     * @throws DegenerateOrientationException if the normal has no component in the line plane
     */
    public RotationMatrix buildBasis(Vector3 normal, Orientation orientation, double beta) {
        return buildBasis(normal, orientation, beta, LineAxisConvention.PATIENT);
    }

    public RotationMatrix buildBasis(Vector3 normal, Orientation orientation, double beta,
                                     LineAxisConvention convention) {
        RotationMatrix basis = buildBasis(normal, orientation, convention);
        return rotateInPlane(basis, beta);
    }

    /**
     * Builds the unrotated basis (beta = 0).
     */
    public RotationMatrix buildBasis(Vector3 normal, Orientation orientation, LineAxisConvention convention) {
        if (normal == null) throw new IllegalArgumentException("normal must not be null");
        if (orientation == null) throw new IllegalArgumentException("orientation must not be null");
        if (convention == null) throw new IllegalArgumentException("convention must not be null");
        if (!normal.isFinite()) {
            throw new IllegalArgumentException("normal must have finite components: " + normal);
        }
        if (normal.isZero()) {
            throw new IllegalArgumentException("normal must not be a zero vector");
        }

        Vector3 partition = normal.normalized();
        Vector3 line = convention.unnormalized(partition, orientation);
        double n = line.norm();
        if (n == 0.0) {
            LOGGER.warn("Degenerate {} normal {}", orientation.label(), normal);
            throw new DegenerateOrientationException(orientation,
                    "Degenerate orientation: normal " + normal + " has no component in the "
                            + orientation.label() + " line plane");
        }
        line = line.scale(1.0 / n);
        Vector3 read = line.cross(partition);

        return RotationMatrix.fromColumns(read, line, partition);
    }

    /**
     * Rotates the read and line axes by beta within their plane; the partition axis is kept.
     * Equivalent to {@code basis · R_z(beta)}, so rotating by beta and then -beta restores the basis.
     */
    public RotationMatrix rotateInPlane(RotationMatrix basis, double beta) {
        if (basis == null) throw new IllegalArgumentException("basis must not be null");
        if (!Double.isFinite(beta)) {
            throw new IllegalArgumentException("beta must be finite: " + beta);
        }
        if (beta == 0.0) {
            return basis;
        }
        double c = Math.cos(beta);
        double s = Math.sin(beta);
        Vector3 read = basis.column(0);
        Vector3 line = basis.column(1);

        // read' = c*read + s*line, line' = c*line - s*read
        Vector3 rotatedRead = read.scale(c).add(line.scale(s));
        Vector3 rotatedLine = line.scale(c).subtract(read.scale(s));
        return RotationMatrix.fromColumns(rotatedRead, rotatedLine, basis.column(2));
    }
}
