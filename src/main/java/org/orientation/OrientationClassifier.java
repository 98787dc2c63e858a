package org.orientation;

import org.geometry.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a slice normal is sagittal, coronal or transversal.
 *
 * Scanner-reported direction cosines are truncated to a few decimals, so two or three
 * components are often exactly equal. A naive argmax would then pick an axis depending
 * on rounding noise; instead ties are resolved by the fixed rule order of {@link TieRule}.
 *
 * Stateless and thread-safe.
 */
public final class OrientationClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrientationClassifier.class);

    /** Absolute difference at or below which two component magnitudes are tied. */
    public static final double TIE_TOLERANCE = 1e-6;

    /**
     * Classifies a normal. Only magnitudes are compared, so the vector need not be normalized.
     *
     * @throws IllegalArgumentException if the vector is null, zero or has a non-finite component
     */
    public Orientation classify(Vector3 normal) {
        return classifyWithRule(normal).orientation();
    }

    /**
     * @throws IllegalArgumentException if the array is null or its length is not 3
     */
    public Orientation classify(double[] normal) {
        return classify(Vector3.of(normal));
    }

    /**
     * Same as {@link #classify(Vector3)} but also reports which rule of the table fired.
     */
    public Classification classifyWithRule(Vector3 normal) {
        requireUsable(normal);
        Vector3 a = normal.abs();
        double sag = a.x();
        double cor = a.y();
        double tra = a.z();

        for (TieRule rule : TieRule.values()) {
            Orientation o = rule.decide(sag, cor, tra);
            if (o != null) {
                LOGGER.debug("classify {} -> {} ({})", normal, o.label(), rule);
                return new Classification(o, rule);
            }
        }
        // DOMINANT_AXIS never passes
        throw new IllegalStateException("No classification rule matched " + normal);
    }

    /**
     * Tolerance-free classification: the axis with the largest squared component,
     * the lowest index winning an exact tie. Used on device-space direction cosines.
     *
     * @throws IllegalArgumentException if the vector is null, zero or has a non-finite component
     */
    public Orientation dominantAxis(Vector3 directionCosines) {
        requireUsable(directionCosines);
        int best = 0;
        double bestSq = directionCosines.get(0) * directionCosines.get(0);
        for (int i = 1; i < Vector3.DIM; i++) {
            double sq = directionCosines.get(i) * directionCosines.get(i);
            if (sq > bestSq) {
                best = i;
                bestSq = sq;
            }
        }
        return Orientation.ofAxisIndex(best);
    }

    private static void requireUsable(Vector3 v) {
        if (v == null) {
            throw new IllegalArgumentException("normal must not be null");
        }
        if (!v.isFinite()) {
            throw new IllegalArgumentException("normal must have finite components: " + v);
        }
        if (v.isZero()) {
            throw new IllegalArgumentException("Cannot classify a zero vector");
        }
    }
}
