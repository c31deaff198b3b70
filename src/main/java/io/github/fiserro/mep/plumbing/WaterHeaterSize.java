package io.github.fiserro.mep.plumbing;

/**
 * Water heater sizing.
 *
 * @param tankCapacityGal storage tank, gallons (multiple of 10)
 * @param recoveryRateGph recovery rate, gallons per hour
 */
public record WaterHeaterSize(long tankCapacityGal, long recoveryRateGph) {
}
