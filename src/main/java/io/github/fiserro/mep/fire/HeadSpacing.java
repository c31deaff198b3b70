package io.github.fiserro.mep.fire;

/**
 * Sprinkler head spacing limits.
 *
 * @param maxSpacingFt  between heads, ft
 * @param maxDistanceFt from head to wall, ft
 */
public record HeadSpacing(double maxSpacingFt, double maxDistanceFt) {
}
