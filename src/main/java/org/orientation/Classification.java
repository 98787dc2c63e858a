package org.orientation;

/**
 * Result of classifying one normal: the orientation and the rule that decided it.
 */
public record Classification(Orientation orientation, TieRule rule) {
}
