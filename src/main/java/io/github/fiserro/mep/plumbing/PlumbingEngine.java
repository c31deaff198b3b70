package io.github.fiserro.mep.plumbing;

import static io.github.fiserro.mep.StandardSizeTable.entry;

import io.github.fiserro.mep.Rounding;
import io.github.fiserro.mep.StandardSizeTable;
import java.util.Map;

/**
 * Plumbing design calculations based on simplified UPC/IPC methods.
 *
 * <p>Flows are in GPM, pressures in PSI, lengths in feet and pipe sizes in nominal inches.
 */
public final class PlumbingEngine {

  public static final double DEFAULT_PRESSURE_AVAILABLE_PSI = 50;
  public static final double DEFAULT_DRAIN_SLOPE = 0.25;
  public static final double DEFAULT_PEAK_DEMAND = 0.4;

  static final double TARGET_VELOCITY_FPS = 5;
  static final double GALLONS_PER_CUBIC_FOOT = 7.48;
  /** Share of the available pressure a run may lose before the pipe is upsized. */
  static final double MAX_PRESSURE_LOSS_RATIO = 0.5;

  static final double HAZEN_WILLIAMS_COPPER = 140;
  static final double PSI_PER_FOOT_OF_HEAD = 0.433;

  static final double GALLONS_PER_FIXTURE = 12;
  static final double RECOVERY_SHARE = 0.7;

  /** Type L copper tube. */
  static final StandardSizeTable<Double> COPPER_PIPE_SIZES =
      StandardSizeTable.ofSizes(0.5, 0.75, 1, 1.25, 1.5, 2, 2.5, 3, 4, 5, 6, 8, 10, 12);

  /** Maximum drainage fixture units per drain size at 1/4" per foot (UPC Table 7-6). */
  static final StandardSizeTable<Double> DRAIN_CAPACITIES = StandardSizeTable.of(
      entry(3, 1.5),
      entry(6, 2.0),
      entry(12, 2.5),
      entry(20, 3.0),
      entry(160, 4.0),
      entry(360, 5.0),
      entry(620, 6.0),
      entry(1400, 8.0),
      entry(2500, 10.0),
      entry(3900, 12.0));

  private PlumbingEngine() {
  }

  /**
   * Total water supply fixture units.
   *
   * @param fixtureCounts fixture counts keyed by fixture name, e.g. {@code "Lavatory"}; fixtures
   *                      that are not tabulated count as one unit each
   */
  public static double totalFixtureUnits(Map<String, ? extends Number> fixtureCounts) {
    double total = 0;
    for (Map.Entry<String, ? extends Number> fixture : fixtureCounts.entrySet()) {
      total += FixtureType.unitsFor(fixture.getKey()) * fixture.getValue().doubleValue();
    }
    return total;
  }

  /**
   * Peak flow for a fixture-unit load (Hunter's curve approximation for flush-tank systems).
   * The breakpoints and exponents are fixed.
   */
  public static double fixtureUnitsToGpm(double wsfu) {
    if (wsfu <= 0) {
      return 0;
    }
    if (wsfu <= 10) {
      return Math.sqrt(wsfu) * 3.5;
    }
    if (wsfu <= 50) {
      return Math.pow(wsfu, 0.45) * 8;
    }
    if (wsfu <= 200) {
      return Math.pow(wsfu, 0.38) * 15;
    }
    return Math.pow(wsfu, 0.35) * 20;
  }

  /**
   * Supply pipe size for a fixture-unit load. The pipe is sized for 5 ft/s, then upsized by one
   * standard size if the run would lose more than half of the available pressure.
   *
   * <p>The loss is evaluated at the computed diameter, which grows with the flow, so on long runs
   * a smaller load can be upsized while a slightly larger load in the same standard size is not.
   * The result is never smaller than the size for 5 ft/s alone.
   */
  public static double pipeSize(double fixtureUnits, double lengthFt, double pressureAvailablePsi) {
    double flowGpm = fixtureUnitsToGpm(fixtureUnits);
    double flowCfs = flowGpm / (GALLONS_PER_CUBIC_FOOT * 60);
    double requiredArea = flowCfs / TARGET_VELOCITY_FPS;
    double diameterIn = Math.sqrt(4 * requiredArea / Math.PI) * 12;

    double pressureLossPsi = frictionLoss(flowGpm, diameterIn, lengthFt) * lengthFt / 100;

    double size = COPPER_PIPE_SIZES.atLeast(diameterIn);
    if (pressureLossPsi > pressureAvailablePsi * MAX_PRESSURE_LOSS_RATIO) {
      size = COPPER_PIPE_SIZES.nextLarger(size);
    }
    return size;
  }

  /** Pipe size with 50 PSI available. */
  public static double pipeSize(double fixtureUnits, double lengthFt) {
    return pipeSize(fixtureUnits, lengthFt, DEFAULT_PRESSURE_AVAILABLE_PSI);
  }

  /**
   * Friction loss per 100 ft of copper pipe (Hazen-Williams, C = 140), rounded to two decimals.
   * No flow means no loss. The length does not change the per-100-ft figure.
   */
  public static double frictionLoss(double flowGpm, double diameterIn, double lengthFt) {
    if (flowGpm == 0) {
      return 0;
    }
    double headLossFt = 4.52 * Math.pow(flowGpm, 1.85)
        / (Math.pow(HAZEN_WILLIAMS_COPPER, 1.85) * Math.pow(diameterIn, 4.87));
    return Rounding.round(headLossFt * PSI_PER_FOOT_OF_HEAD, 2);
  }

  /**
   * Drain size for a drainage fixture-unit load. Capacities are tabulated for 1/4" per foot and
   * scale with the square root of the slope.
   */
  public static double drainPipeSize(double dfu, double slope) {
    double slopeFactor = Math.sqrt(slope / DEFAULT_DRAIN_SLOPE);
    return DRAIN_CAPACITIES.atLeast(dfu / slopeFactor);
  }

  /** Drain size at the reference slope of 1/4" per foot. */
  public static double drainPipeSize(double dfu) {
    return drainPipeSize(dfu, DEFAULT_DRAIN_SLOPE);
  }

  /**
   * Storage water heater sized at 12 gallons per fixture times the peak demand factor. The tank
   * is rounded up to 10 gallons, recovery covers 70% of the peak draw per hour.
   */
  public static WaterHeaterSize waterHeaterSize(int fixtureCount, double peakDemand) {
    double baseCapacity = fixtureCount * GALLONS_PER_FIXTURE;
    long tank = (long) Rounding.ceilToStep(baseCapacity * peakDemand, 10);
    long recovery = (long) Math.ceil(baseCapacity * peakDemand * RECOVERY_SHARE);
    return new WaterHeaterSize(tank, recovery);
  }

  /** Water heater with a peak demand factor of 0.4. */
  public static WaterHeaterSize waterHeaterSize(int fixtureCount) {
    return waterHeaterSize(fixtureCount, DEFAULT_PEAK_DEMAND);
  }
}
