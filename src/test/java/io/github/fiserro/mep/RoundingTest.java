package io.github.fiserro.mep;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link Rounding}.
 */
class RoundingTest {

  @ParameterizedTest(name = "round({0}, {1}) = {2}")
  @CsvSource({
      "70.75, 1, 70.8",
      "1.005, 1, 1.0",
      "2.5, 0, 3.0",
      "-2.5, 0, -2.0",
      "0.12345, 2, 0.12",
  })
  @DisplayName("Halves round towards positive infinity")
  void round(double value, int decimals, double expected) {
    assertEquals(expected, Rounding.round(value, decimals), 1e-9);
  }

  @Test
  @DisplayName("Non-finite values pass through")
  void nonFinite() {
    assertTrue(Double.isNaN(Rounding.round(Double.NaN, 2)));
    assertEquals(Double.POSITIVE_INFINITY, Rounding.round(Double.POSITIVE_INFINITY, 1));
  }

  @ParameterizedTest(name = "ceilToStep({0}, {1}) = {2}")
  @CsvSource({
      "0, 0.5, 0",
      "5.7, 0.5, 6.0",
      "6.0, 0.5, 6.0",
      "1050, 100, 1100",
      "31.66, 5, 35",
  })
  @DisplayName("Rounds up to the next step")
  void ceilToStep(double value, double step, double expected) {
    assertEquals(expected, Rounding.ceilToStep(value, step), 1e-9);
  }

  @ParameterizedTest(name = "roundToStep({0}, {1}) = {2}")
  @CsvSource({
      "1800, 250, 1750",
      "1875, 250, 2000",
      "2160, 250, 2250",
  })
  @DisplayName("Rounds to the nearest step")
  void roundToStep(double value, long step, long expected) {
    assertEquals(expected, Rounding.roundToStep(value, step));
  }
}
