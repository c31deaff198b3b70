package io.github.fiserro.mep.fire;

/**
 * Fire pump rating (NFPA 20).
 *
 * @param pumpCapacity rated capacity, GPM
 * @param pumpPressure rated pressure boost, PSI
 * @param horsepower   driver horsepower
 * @param pumpType     pump arrangement
 */
public record FirePump(
    long pumpCapacity,
    long pumpPressure,
    long horsepower,
    PumpType pumpType) {
}
