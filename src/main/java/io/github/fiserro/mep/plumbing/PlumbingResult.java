package io.github.fiserro.mep.plumbing;

/**
 * Plumbing results.
 *
 * @param fixtureUnits  WSFU used for sizing
 * @param flowRate      peak supply flow, GPM
 * @param pipeSize      supply pipe, inches
 * @param frictionLoss  friction loss in the selected pipe, PSI per 100 ft
 * @param drainPipeSize drain, inches
 * @param waterHeater   water heater sizing
 */
public record PlumbingResult(
    double fixtureUnits,
    double flowRate,
    double pipeSize,
    double frictionLoss,
    double drainPipeSize,
    WaterHeaterSize waterHeater) {
}
