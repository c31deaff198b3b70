package io.github.fiserro.mep.electrical;

import com.google.common.collect.ImmutableMap;
import io.github.fiserro.mep.ConstantTable;
import io.github.fiserro.mep.Rounding;
import io.github.fiserro.mep.StandardSizeTable;
import java.util.Arrays;

/**
 * Electrical design calculations based on simplified NEC rules.
 *
 * <p>Loads are in watts, currents in amperes, distances in feet (one way). Phase counts other than
 * 3 are treated as single phase.
 */
public final class ElectricalEngine {

  public static final double DEFAULT_POWER_FACTOR = 0.85;
  public static final int DEFAULT_TEMPERATURE_RATING = 75;
  public static final double DEFAULT_IMPEDANCE_PCT = 5.75;

  /** Continuous loads may not exceed 80% of a breaker or conductor rating. */
  static final double CONTINUOUS_LOAD_LIMIT = 0.8;

  static final double DEFAULT_RESISTANCE_PER_1000_FT = 0.1;

  static final StandardSizeTable<Integer> BREAKER_SIZES = StandardSizeTable.ofSizes(
      15, 20, 25, 30, 35, 40, 45, 50, 60, 70, 80, 90, 100,
      110, 125, 150, 175, 200, 225, 250, 300, 350, 400,
      450, 500, 600, 700, 800, 1000, 1200);

  static final ConstantTable<Integer, Double> TEMPERATURE_CORRECTION = ConstantTable.of(
      "temperature rating",
      ImmutableMap.of(60, 0.88, 75, 1.0, 90, 1.04),
      1.0);

  /** Copper conductor resistance at 75 °C, ohms per 1000 ft, keyed by gauge size. */
  static final ConstantTable<String, Double> RESISTANCE_PER_1000_FT = ConstantTable.of(
      "conductor resistance",
      ImmutableMap.<String, Double>builder()
          .put("14", 3.07)
          .put("12", 1.93)
          .put("10", 1.21)
          .put("8", 0.764)
          .put("6", 0.491)
          .put("4", 0.308)
          .put("3", 0.245)
          .put("2", 0.194)
          .put("1", 0.154)
          .put("1/0", 0.122)
          .put("2/0", 0.0967)
          .put("3/0", 0.0766)
          .put("4/0", 0.0608)
          .put("250", 0.0515)
          .put("300", 0.0429)
          .put("350", 0.0367)
          .put("400", 0.0321)
          .put("500", 0.0258)
          .build(),
      DEFAULT_RESISTANCE_PER_1000_FT);

  private static final double SQRT_3 = Math.sqrt(3);

  private ElectricalEngine() {
  }

  /** Demand load in watts: connected load times demand factor. */
  public static long demandLoad(double connectedLoadW, double demandFactor) {
    return Math.round(connectedLoadW * demandFactor);
  }

  /** Line current in amperes, rounded to one decimal. */
  public static double current(double loadW, double voltage, int phases, double powerFactor) {
    double current = phases == 3
        ? loadW / (SQRT_3 * voltage * powerFactor)
        : loadW / (voltage * powerFactor);
    return Rounding.round(current, 1);
  }

  /** Line current at a power factor of 0.85. */
  public static double current(double loadW, double voltage, int phases) {
    return current(loadW, voltage, phases, DEFAULT_POWER_FACTOR);
  }

  /**
   * Smallest standard breaker that carries the load. Continuous loads require a rating of
   * {@code current / 0.8}.
   */
  public static int breakerSize(double current, boolean continuous) {
    double requiredRating = continuous ? current / CONTINUOUS_LOAD_LIMIT : current;
    return BREAKER_SIZES.atLeast(requiredRating);
  }

  /** Breaker size for a continuous load. */
  public static int breakerSize(double current) {
    return breakerSize(current, true);
  }

  /**
   * Smallest conductor whose temperature-corrected ampacity carries {@code current / 0.8}.
   *
   * @return a label such as {@code "6 AWG"} or {@code "250 kcmil"}; {@code "1000 kcmil"} when no
   *     tabulated conductor is large enough
   */
  public static String wireSize(double current, ConductorMaterial material, int tempRating) {
    return wireGauge(current, material, tempRating).label();
  }

  /** Copper conductor with 75 °C insulation. */
  public static String wireSize(double current) {
    return wireSize(current, ConductorMaterial.COPPER, DEFAULT_TEMPERATURE_RATING);
  }

  /** Same selection as {@link #wireSize}, returning the gauge; a null material means copper. */
  public static WireGauge wireGauge(double current, ConductorMaterial material, int tempRating) {
    ConductorMaterial conductor = material == null ? ConductorMaterial.COPPER : material;
    double tempFactor = TEMPERATURE_CORRECTION.get(tempRating);
    return ampacityTable(conductor, tempFactor).atLeast(current / CONTINUOUS_LOAD_LIMIT);
  }

  /** Ampacity ladder of all gauges for a material, corrected for the insulation rating. */
  static StandardSizeTable<WireGauge> ampacityTable(ConductorMaterial material, double tempFactor) {
    return new StandardSizeTable<>(Arrays.stream(WireGauge.values())
        .map(gauge -> StandardSizeTable.entry(material.ampacity(gauge) * tempFactor, gauge))
        .toList());
  }

  /**
   * Voltage drop as a percentage of the nominal voltage, rounded to two decimals. Single-phase
   * circuits count the conductor length twice (out and back).
   *
   * @param wireSize conductor label as returned by {@link #wireSize}; the {@code AWG} or
   *                 {@code kcmil} suffix is optional. Unknown sizes use 0.1 Ω per 1000 ft.
   */
  public static double voltageDrop(double current, double distanceFt, double voltage,
      String wireSize, int phases) {
    double resistance = RESISTANCE_PER_1000_FT.get(sizeKey(wireSize));
    double lengthFactor = distanceFt / 1000;
    double drop = phases == 3
        ? SQRT_3 * current * resistance * lengthFactor
        : 2 * current * resistance * lengthFactor;
    return Rounding.round(drop / voltage * 100, 2);
  }

  private static String sizeKey(String wireSize) {
    if (wireSize == null) {
      return null;
    }
    return wireSize.replace(" AWG", "").replace(" kcmil", "").trim();
  }

  /** Available fault current at the transformer secondary, in amperes. */
  public static long shortCircuitCurrent(double transformerKva, double voltage, double impedancePct) {
    return Math.round(transformerKva * 1000 / (SQRT_3 * voltage * (impedancePct / 100)));
  }

  /** Fault current for a transformer with 5.75% impedance. */
  public static long shortCircuitCurrent(double transformerKva, double voltage) {
    return shortCircuitCurrent(transformerKva, voltage, DEFAULT_IMPEDANCE_PCT);
  }
}
