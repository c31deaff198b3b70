package io.github.fiserro.mep.hvac;

/**
 * HVAC results for one zone.
 *
 * @param heatingLoad       BTU/hr
 * @param coolingLoad       BTU/hr
 * @param ventilationRate   outdoor air, CFM
 * @param equipmentCapacity cooling equipment, tons
 * @param ductSize          round duct diameter, inches
 * @param breakdown         components of the heating and cooling loads
 */
public record HvacResult(
    long heatingLoad,
    long coolingLoad,
    long ventilationRate,
    double equipmentCapacity,
    int ductSize,
    Breakdown breakdown) {

  public record Breakdown(HeatingLoadBreakdown heating, CoolingLoadBreakdown cooling) {
  }
}
