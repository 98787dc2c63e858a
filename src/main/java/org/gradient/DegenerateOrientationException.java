package org.gradient;

import org.orientation.Orientation;

/**
 * Thrown when a normal is aligned with the axis a line direction must be orthogonal to,
 * so no in-plane line axis can be built for the requested orientation.
 */
public class DegenerateOrientationException extends IllegalArgumentException {

    private final Orientation orientation;

    public DegenerateOrientationException(Orientation orientation, String message) {
        super(message);
        this.orientation = orientation;
    }

    public Orientation orientation() {
        return orientation;
    }
}
