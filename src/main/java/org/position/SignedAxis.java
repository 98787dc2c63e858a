package org.position;

/**
 * One row of a signed permutation: the device axis takes patient axis {@code patientAxis},
 * negated when {@code flip} is set.
 */
public record SignedAxis(int patientAxis, boolean flip) {

    public SignedAxis {
        if (patientAxis < 0 || patientAxis > 2) {
            throw new IllegalArgumentException("patientAxis must be 0, 1 or 2 but was " + patientAxis);
        }
    }

    static SignedAxis plus(int patientAxis) {
        return new SignedAxis(patientAxis, false);
    }

    static SignedAxis minus(int patientAxis) {
        return new SignedAxis(patientAxis, true);
    }

    public double sign() {
        return flip ? -1.0 : 1.0;
    }

    @Override
    public String toString() {
        String[] names = {"sag", "cor", "tra"};
        return (flip ? "-" : "+") + names[patientAxis];
    }
}
