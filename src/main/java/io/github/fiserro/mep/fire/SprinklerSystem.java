package io.github.fiserro.mep.fire;

/**
 * Sprinkler system design.
 *
 * @param hazardClass hazard class the design is based on
 * @param coverage    protection area per head, ft²
 * @param density     design density, GPM/ft²
 * @param headCount   heads required for the protected area
 * @param designArea  hydraulic design area, ft²
 * @param flowRate    design flow, GPM
 * @param pressure    required pressure, PSI
 * @param pipeSize    main size, inches
 */
public record SprinklerSystem(
    HazardClass hazardClass,
    double coverage,
    double density,
    long headCount,
    double designArea,
    long flowRate,
    long pressure,
    double pipeSize) {
}
