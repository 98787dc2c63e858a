package org.orientation;

/**
 * The classifier's decision table, in priority order.
 * Each rule sees the absolute components (sag, cor, tra) and either decides or passes.
 *
 * Components count as tied when they differ by at most {@link OrientationClassifier#TIE_TOLERANCE}.
 * The first four rules make exact ties reproducible; {@link #DOMINANT_AXIS} always decides.
 */
public enum TieRule {

    ALL_EQUAL {
        @Override
        Orientation decide(double sag, double cor, double tra) {
            return tied(sag, cor) && tied(sag, tra) ? Orientation.TRANSVERSAL : null;
        }
    },

    SAG_COR_TIED {
        @Override
        Orientation decide(double sag, double cor, double tra) {
            if (!tied(sag, cor)) return null;
            return sag < tra ? Orientation.CORONAL : Orientation.TRANSVERSAL;
        }
    },

    SAG_TRA_TIED {
        @Override
        Orientation decide(double sag, double cor, double tra) {
            if (!tied(sag, tra)) return null;
            return sag < cor ? Orientation.CORONAL : Orientation.TRANSVERSAL;
        }
    },

    COR_TRA_TIED {
        @Override
        Orientation decide(double sag, double cor, double tra) {
            if (!tied(cor, tra)) return null;
            return cor < sag ? Orientation.SAGITTAL : Orientation.TRANSVERSAL;
        }
    },

    DOMINANT_AXIS {
        @Override
        Orientation decide(double sag, double cor, double tra) {
            if (sag > cor && sag > tra) return Orientation.SAGITTAL;
            if (cor > tra) return Orientation.CORONAL;
            return Orientation.TRANSVERSAL;
        }
    };

    /**
     * @return the orientation if this rule applies, or {@code null} to pass to the next rule
     */
    abstract Orientation decide(double sag, double cor, double tra);

    static boolean tied(double a, double b) {
        return Math.abs(a - b) <= OrientationClassifier.TIE_TOLERANCE;
    }
}
