package io.github.fiserro.mep;

/**
 * Rounding policies used by the calculation modules.
 *
 * <p>Halves round towards positive infinity ({@link Math#round(double)}). Non-finite values are
 * returned unchanged by {@link #round(double, int)}.
 */
public final class Rounding {

  private Rounding() {
  }

  /** Rounds to the given number of decimal places. */
  public static double round(double value, int decimals) {
    if (!Double.isFinite(value)) {
      return value;
    }
    double scale = Math.pow(10, decimals);
    return Math.round(value * scale) / scale;
  }

  /** Rounds up to the next multiple of {@code step}. */
  public static double ceilToStep(double value, double step) {
    return Math.ceil(value / step) * step;
  }

  /** Rounds to the nearest multiple of {@code step}. */
  public static long roundToStep(double value, long step) {
    return Math.round(value / step) * step;
  }
}
