package io.github.fiserro.mep.fire;

import static io.github.fiserro.mep.StandardSizeTable.entry;

import io.github.fiserro.mep.Rounding;
import io.github.fiserro.mep.StandardSizeTable;

/**
 * Fire protection calculations based on simplified NFPA 13, 14 and 20 rules and the ISO fire-flow
 * formula.
 *
 * <p>Areas are in square feet, heights and elevations in feet, flows in GPM and pressures in PSI.
 */
public final class FireProtectionEngine {

  public static final double DEFAULT_CEILING_HEIGHT_FT = 12;

  static final double PSI_PER_FOOT_OF_ELEVATION = 0.433;

  static final double MIN_DESIGN_AREA = 1500;
  static final int DESIGN_AREA_HEADS = 5;
  static final double SPRINKLER_FRICTION_SHARE = 0.3;

  /** Sprinkler main size by design flow: the first entry whose limit exceeds the flow. */
  static final StandardSizeTable<Double> SPRINKLER_MAIN_SIZES = StandardSizeTable.of(
      entry(100, 2.0),
      entry(200, 2.5),
      entry(400, 3.0),
      entry(750, 4.0),
      entry(1200, 5.0),
      entry(2000, 6.0),
      entry(Double.POSITIVE_INFINITY, 8.0));

  static final String STANDPIPE_CLASS = "Class I (2.5\" hose)";
  static final int STANDPIPE_BASE_FLOORS = 3;
  static final long STANDPIPE_BASE_FLOW = 500;
  static final long STANDPIPE_FLOW_PER_EXTRA_FLOOR = 250;
  static final long STANDPIPE_MAX_FLOW = 1250;
  static final double STANDPIPE_RESIDUAL_PRESSURE = 100;
  static final double STANDPIPE_FRICTION_PER_FOOT = 0.1;
  static final int STANDPIPE_SMALL_RISER_MAX_FLOORS = 5;

  static final double PUMP_CAPACITY_FACTOR = 1.5;
  static final double PUMP_FRICTION_PER_FOOT = 0.15;
  static final double PUMP_EFFICIENCY = 0.70;
  static final double GPM_PSI_PER_HP = 1714;

  static final double HYDRANT_FLOW_COEFFICIENT = 18;
  static final double MIN_HYDRANT_FLOW = 500;
  static final double MAX_HYDRANT_FLOW = 12000;

  private FireProtectionEngine() {
  }

  /**
   * Sprinkler design for a protected area. The design area covers the five most remote heads but
   * is never less than 1500 ft². Required pressure is the hazard's base pressure plus elevation
   * to the ceiling plus a 30% friction allowance.
   */
  public static SprinklerSystem sprinklerSystem(double area, HazardClass hazardClass, double ceilingHeightFt) {
    HazardClass hazard = hazardClass == null ? HazardClass.ORDINARY_I : hazardClass;
    double coverage = hazard.coverage();
    double density = hazard.density();

    long headCount = (long) Math.ceil(area / coverage);
    double designArea = Math.max(MIN_DESIGN_AREA, coverage * DESIGN_AREA_HEADS);
    long flowRate = Math.round(designArea * density);

    double basePressure = hazard.basePressure();
    double elevationPressure = ceilingHeightFt * PSI_PER_FOOT_OF_ELEVATION;
    long pressure = Math.round(basePressure + elevationPressure + basePressure * SPRINKLER_FRICTION_SHARE);

    double pipeSize = SPRINKLER_MAIN_SIZES.above(flowRate);
    return new SprinklerSystem(hazard, coverage, density, headCount, designArea, flowRate, pressure, pipeSize);
  }

  /** Sprinkler design with the hazard class given by name; unknown names mean Ordinary I. */
  public static SprinklerSystem sprinklerSystem(double area, String hazardClass, double ceilingHeightFt) {
    return sprinklerSystem(area, HazardClass.fromName(hazardClass), ceilingHeightFt);
  }

  /** Sprinkler design for a 12 ft ceiling. */
  public static SprinklerSystem sprinklerSystem(double area, HazardClass hazardClass) {
    return sprinklerSystem(area, hazardClass, DEFAULT_CEILING_HEIGHT_FT);
  }

  /**
   * Class I standpipe: 500 GPM up to three floors plus 250 GPM per additional floor, capped at
   * 1250 GPM. Pressure is 100 PSI residual plus elevation and 0.1 PSI/ft friction.
   */
  public static StandpipeSystem standpipeSystem(int floors, double buildingHeightFt) {
    long flowRate = floors <= STANDPIPE_BASE_FLOORS
        ? STANDPIPE_BASE_FLOW
        : Math.min(STANDPIPE_MAX_FLOW,
            STANDPIPE_BASE_FLOW + (floors - STANDPIPE_BASE_FLOORS) * STANDPIPE_FLOW_PER_EXTRA_FLOOR);

    double elevationPressure = buildingHeightFt * PSI_PER_FOOT_OF_ELEVATION;
    double frictionLoss = buildingHeightFt * STANDPIPE_FRICTION_PER_FOOT;
    long pressure = Math.round(STANDPIPE_RESIDUAL_PRESSURE + elevationPressure + frictionLoss);

    double pipeSize = floors <= STANDPIPE_SMALL_RISER_MAX_FLOORS ? 4.0 : 6.0;
    return new StandpipeSystem(STANDPIPE_CLASS, flowRate, pressure, pipeSize, floors);
  }

  /**
   * Fire pump rated at 150% of the system demand (rounded up to 100 GPM) and the pressure
   * deficit (rounded up to 5 PSI), assuming 70% pump efficiency.
   */
  public static FirePump firePump(double totalFlowGpm, double staticPressurePsi,
      double requiredPressurePsi, double elevationFt) {
    long capacity = (long) Rounding.ceilToStep(totalFlowGpm * PUMP_CAPACITY_FACTOR, 100);

    double elevationPressure = elevationFt * PSI_PER_FOOT_OF_ELEVATION;
    double frictionLoss = elevationFt * PUMP_FRICTION_PER_FOOT;
    double deficit = requiredPressurePsi - staticPressurePsi + elevationPressure + frictionLoss;
    long pressure = (long) Rounding.ceilToStep(Math.max(0, deficit), 5);

    long horsepower = (long) Rounding.ceilToStep(
        capacity * pressure / (GPM_PSI_PER_HP * PUMP_EFFICIENCY), 5);

    return new FirePump(capacity, pressure, horsepower, PumpType.select(capacity, pressure));
  }

  /**
   * Required fire flow ({@code C * sqrt(area) * 18}) limited to 500-12,000 GPM and rounded to the
   * nearest 250 GPM.
   */
  public static long hydrantFlow(double buildingAreaFt2, ConstructionType constructionType) {
    ConstructionType construction = constructionType == null ? ConstructionType.TYPE_III : constructionType;
    double fireFlow = construction.factor() * Math.sqrt(buildingAreaFt2) * HYDRANT_FLOW_COEFFICIENT;
    fireFlow = Math.max(MIN_HYDRANT_FLOW, Math.min(MAX_HYDRANT_FLOW, fireFlow));
    return Rounding.roundToStep(fireFlow, 250);
  }

  /** Fire flow with the construction type given by name; unknown names mean Type III. */
  public static long hydrantFlow(double buildingAreaFt2, String constructionType) {
    return hydrantFlow(buildingAreaFt2, ConstructionType.fromName(constructionType));
  }

  /** Maximum head spacing for a coverage area; the wall distance is half the spacing. */
  public static HeadSpacing headSpacing(double coverage) {
    double maxSpacing = Math.sqrt(coverage);
    double maxDistance = maxSpacing / 2;
    return new HeadSpacing(Rounding.round(maxSpacing, 1), Rounding.round(maxDistance, 1));
  }
}
