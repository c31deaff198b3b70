package io.github.fiserro.mep.fire;

/**
 * Fire protection results.
 *
 * @param sprinkler   sprinkler system
 * @param standpipe   standpipe system
 * @param firePump    fire pump sized for the combined sprinkler and standpipe demand
 * @param hydrantFlow required fire flow, GPM
 * @param headSpacing head spacing for the sprinkler coverage
 */
public record FireProtectionResult(
    SprinklerSystem sprinkler,
    StandpipeSystem standpipe,
    FirePump firePump,
    long hydrantFlow,
    HeadSpacing headSpacing) {
}
