package io.github.fiserro.mep.hvac;

/**
 * Additive components of a cooling load, in BTU/hr.
 *
 * @param solarGain        solar gain scaled by design temperature difference
 * @param conductionGain   envelope conduction gain scaled by design temperature difference
 * @param infiltrationGain air infiltration gain
 * @param internalGain     lighting and equipment gain
 * @param occupantSensible sensible heat from occupants
 * @param occupantLatent   latent heat from occupants
 * @param total            rounded total
 */
public record CoolingLoadBreakdown(
    double solarGain,
    double conductionGain,
    double infiltrationGain,
    double internalGain,
    double occupantSensible,
    double occupantLatent,
    long total) {
}
