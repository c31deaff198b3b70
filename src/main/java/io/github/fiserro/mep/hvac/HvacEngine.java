package io.github.fiserro.mep.hvac;

import io.github.fiserro.mep.Rounding;
import io.github.fiserro.mep.StandardSizeTable;

/**
 * HVAC design calculations based on simplified ASHRAE methods.
 *
 * <p>Areas are in square feet, temperatures in °F, loads in BTU/hr, airflow in CFM and
 * velocities in feet per minute. All methods are pure; no input is rejected.
 */
public final class HvacEngine {

  public static final double DEFAULT_WINTER_OUTDOOR_TEMP = 0;
  public static final double DEFAULT_WINTER_INDOOR_TEMP = 70;
  public static final double DEFAULT_SUMMER_OUTDOOR_TEMP = 95;
  public static final double DEFAULT_SUMMER_INDOOR_TEMP = 75;
  public static final double DEFAULT_DUCT_VELOCITY_FPM = 1000;

  public static final double BTU_PER_TON = 12000;

  static final double ENVELOPE_LOSS_PER_SQ_FT = 30;
  static final double HEATING_REFERENCE_DELTA = 70;
  static final double INFILTRATION_PER_SQ_FT_DEGREE = 0.018;
  static final double OCCUPANT_SENSIBLE_GAIN = 250;
  static final double OCCUPANT_LATENT_GAIN = 200;

  static final double SOLAR_GAIN_PER_SQ_FT = 40;
  static final double CONDUCTION_GAIN_PER_SQ_FT = 15;
  static final double COOLING_REFERENCE_DELTA = 20;
  static final double LIGHTING_WATTS_PER_SQ_FT = 1.5;
  static final double EQUIPMENT_WATTS_PER_SQ_FT = 1.0;
  static final double BTU_PER_WATT = 3.412;

  static final StandardSizeTable<Integer> DUCT_SIZES =
      StandardSizeTable.ofSizes(6, 8, 10, 12, 14, 16, 18, 20, 24, 30, 36, 42, 48);

  private HvacEngine() {
  }

  /**
   * Heating load: envelope loss normalized to a 70 °F design difference plus infiltration, less
   * the heat given off by occupants. Never negative.
   */
  public static long heatingLoad(double area, double occupancy, double outdoorTemp, double indoorTemp) {
    return heatingLoadBreakdown(area, occupancy, outdoorTemp, indoorTemp).total();
  }

  /** Components of {@link #heatingLoad}; only the total is rounded. */
  public static HeatingLoadBreakdown heatingLoadBreakdown(double area, double occupancy,
      double outdoorTemp, double indoorTemp) {
    double tempDiff = indoorTemp - outdoorTemp;
    double envelopeLoss = area * ENVELOPE_LOSS_PER_SQ_FT * (tempDiff / HEATING_REFERENCE_DELTA);
    double infiltrationLoss = area * INFILTRATION_PER_SQ_FT_DEGREE * tempDiff;
    double occupantGain = occupancy * OCCUPANT_SENSIBLE_GAIN;

    long total = Math.max(0, Math.round(envelopeLoss + infiltrationLoss - occupantGain));
    return new HeatingLoadBreakdown(envelopeLoss, infiltrationLoss, occupantGain, total);
  }

  /**
   * Cooling load (CLTD style): solar and conduction gains normalized to a 20 °F design difference,
   * infiltration, lighting and equipment, and occupant sensible and latent heat.
   */
  public static long coolingLoad(double area, double occupancy, double outdoorTemp, double indoorTemp) {
    return coolingLoadBreakdown(area, occupancy, outdoorTemp, indoorTemp).total();
  }

  /** Components of {@link #coolingLoad}, solar and conduction already scaled by the temperature factor. */
  public static CoolingLoadBreakdown coolingLoadBreakdown(double area, double occupancy,
      double outdoorTemp, double indoorTemp) {
    double tempDiff = outdoorTemp - indoorTemp;
    double tempFactor = tempDiff / COOLING_REFERENCE_DELTA;

    double solarGain = area * SOLAR_GAIN_PER_SQ_FT;
    double conductionGain = area * CONDUCTION_GAIN_PER_SQ_FT;
    double infiltrationGain = area * INFILTRATION_PER_SQ_FT_DEGREE * tempDiff;
    double internalGain = (area * LIGHTING_WATTS_PER_SQ_FT + area * EQUIPMENT_WATTS_PER_SQ_FT) * BTU_PER_WATT;
    double occupantSensible = occupancy * OCCUPANT_SENSIBLE_GAIN;
    double occupantLatent = occupancy * OCCUPANT_LATENT_GAIN;

    long total = Math.round((solarGain + conductionGain) * tempFactor
        + infiltrationGain + internalGain + occupantSensible + occupantLatent);
    return new CoolingLoadBreakdown(solarGain * tempFactor, conductionGain * tempFactor,
        infiltrationGain, internalGain, occupantSensible, occupantLatent, total);
  }

  /** Outdoor air requirement in CFM, rounded to the nearest whole CFM. */
  public static long ventilationRate(double area, double occupancy, SpaceType spaceType) {
    SpaceType rates = spaceType == null ? SpaceType.OFFICE : spaceType;
    return Math.round(occupancy * rates.cfmPerPerson() + area * rates.cfmPerSquareFoot());
  }

  /** Same as {@link #ventilationRate(double, double, SpaceType)} with the space type given by name. */
  public static long ventilationRate(double area, double occupancy, String spaceType) {
    return ventilationRate(area, occupancy, SpaceType.fromName(spaceType));
  }

  /** Equipment capacity in tons, rounded up to the next half ton. */
  public static double equipmentCapacity(double coolingLoad) {
    return Rounding.ceilToStep(coolingLoad / BTU_PER_TON, 0.5);
  }

  /**
   * Round duct diameter in inches for the given airflow, snapped to the closest standard duct
   * size (not the next larger one).
   */
  public static int ductSize(double airflowCfm, double velocityFpm) {
    double areaSqFt = airflowCfm / velocityFpm;
    double diameterIn = Math.sqrt(4 * areaSqFt / Math.PI) * 12;
    return DUCT_SIZES.closest(diameterIn);
  }

  /** Duct size at a design velocity of 1000 ft/min. */
  public static int ductSize(double airflowCfm) {
    return ductSize(airflowCfm, DEFAULT_DUCT_VELOCITY_FPM);
  }
}
