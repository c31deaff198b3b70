package io.github.fiserro.mep.fire;

/**
 * Standpipe system design (NFPA 14).
 *
 * @param systemType      standpipe class
 * @param flowRate        GPM
 * @param pressure        required pressure at the base, PSI
 * @param pipeSize        riser size, inches
 * @param hoseConnections number of hose connections
 */
public record StandpipeSystem(
    String systemType,
    long flowRate,
    long pressure,
    double pipeSize,
    int hoseConnections) {
}
