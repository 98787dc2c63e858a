package org.gradient;

import org.geometry.Vector3;
import org.orientation.Orientation;

/**
 * How the line (phase) axis is chosen for a partition direction n = (n1, n2, n3).
 *
 * For sagittal and coronal slices the line axis lies in the plane of the first two axes,
 * for transversal slices in the plane of the last two. The two conventions differ only in sign.
 */
public enum LineAxisConvention {

    /** Signs used when the normal is given in patient coordinates. */
    PATIENT {
        @Override
        Vector3 unnormalized(Vector3 n, Orientation o) {
            return switch (o) {
                case SAGITTAL -> Vector3.of(-n.y(), n.x(), 0.0);
                case CORONAL -> Vector3.of(n.y(), -n.x(), 0.0);
                case TRANSVERSAL -> Vector3.of(0.0, -n.z(), n.y());
            };
        }
    },

    /** Signs used when the direction cosines are given in device coordinates. */
    DEVICE {
        @Override
        Vector3 unnormalized(Vector3 n, Orientation o) {
            return switch (o) {
                case SAGITTAL -> Vector3.of(n.y(), -n.x(), 0.0);
                case CORONAL -> Vector3.of(-n.y(), n.x(), 0.0);
                case TRANSVERSAL -> Vector3.of(0.0, n.z(), -n.y());
            };
        }
    };

    abstract Vector3 unnormalized(Vector3 partition, Orientation orientation);
}
