package io.github.fiserro.mep.electrical;

/**
 * Electrical results for one load.
 *
 * @param demandLoad          W
 * @param current             A
 * @param breakerSize         A
 * @param wireSize            conductor label, e.g. {@code "4 AWG"}
 * @param voltageDrop         % of nominal voltage
 * @param shortCircuitCurrent available fault current, A
 */
public record ElectricalResult(
    long demandLoad,
    double current,
    int breakerSize,
    String wireSize,
    double voltageDrop,
    long shortCircuitCurrent) {
}
