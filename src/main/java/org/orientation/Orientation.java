package org.orientation;

/**
 * Canonical slice orientation, named after the patient axis the slice normal is closest to.
 * Produced by {@link OrientationClassifier}; callers never pick one by hand.
 */
public enum Orientation {
    SAGITTAL(0, "Sag"),
    CORONAL(1, "Cor"),
    TRANSVERSAL(2, "Tra");

    private final int axisIndex;
    private final String label;

    Orientation(int axisIndex, String label) {
        this.axisIndex = axisIndex;
        this.label = label;
    }

    /**
     * @return the index of the dominant component: 0 = sagittal, 1 = coronal, 2 = transversal.
     */
    public int axisIndex() {
        return axisIndex;
    }

    public String label() {
        return label;
    }

    public static Orientation ofAxisIndex(int axisIndex) {
        for (Orientation o : values()) {
            if (o.axisIndex == axisIndex) return o;
        }
        throw new IllegalArgumentException("axisIndex must be 0, 1 or 2 but was " + axisIndex);
    }
}
