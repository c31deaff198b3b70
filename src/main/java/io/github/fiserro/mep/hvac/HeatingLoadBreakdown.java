package io.github.fiserro.mep.hvac;

/**
 * Additive components of a heating load, in BTU/hr.
 *
 * @param envelopeLoss     conduction loss through the envelope, scaled by design temperature difference
 * @param infiltrationLoss air infiltration loss
 * @param occupantGain     heat given off by occupants, subtracted from the losses
 * @param total            rounded total, never negative
 */
public record HeatingLoadBreakdown(
    double envelopeLoss,
    double infiltrationLoss,
    double occupantGain,
    long total) {
}
