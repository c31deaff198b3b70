package io.github.fiserro.mep.fire;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.fiserro.mep.config.EngineDefaults;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link FireProtectionCalculator}.
 */
class FireProtectionCalculatorTest {

  private final FireProtectionCalculator calculator = new FireProtectionCalculator();

  @Test
  @DisplayName("Pump is sized for the sprinkler and standpipe flows combined")
  void pumpForCombinedFlow() {
    FireProtectionResult result = calculator.calculate(calculator.inputBuilder()
        .area(20000)
        .ceilingHeightFt(15)
        .floors(3)
        .buildingHeightFt(36)
        .staticPressurePsi(60)
        .requiredPressurePsi(80)
        .elevationFt(20)
        .build());

    assertEquals(225, result.sprinkler().flowRate());
    assertEquals(500, result.standpipe().flowRate());
    assertEquals(1100, result.firePump().pumpCapacity());
    assertEquals(35, result.firePump().pumpPressure());
    assertEquals(2500, result.hydrantFlow());
  }

  @Test
  @DisplayName("Head spacing follows the hazard class coverage")
  void headSpacingFromCoverage() {
    FireProtectionResult result = calculator.calculate(calculator.inputBuilder()
        .area(10000)
        .hazardClass(HazardClass.LIGHT)
        .floors(1)
        .build());

    assertEquals(15.0, result.headSpacing().maxSpacingFt(), 1e-9);
    assertEquals(7.5, result.headSpacing().maxDistanceFt(), 1e-9);
  }

  @Test
  @DisplayName("Configured defaults change hazard class and construction type")
  void configuredDefaults() {
    FireProtectionCalculator configured = new FireProtectionCalculator(EngineDefaults.BUILT_IN.toBuilder()
        .hazardClass(HazardClass.EXTRA)
        .constructionType(ConstructionType.TYPE_V)
        .build());

    FireProtectionResult result = configured.calculate(configured.inputBuilder().area(10000).floors(1).build());

    assertEquals(HazardClass.EXTRA, result.sprinkler().hazardClass());
    assertEquals(2250, result.hydrantFlow());
  }

  @Test
  @DisplayName("Flat record uses display names for categorical values")
  void calculateRecord() {
    Map<String, Object> result = calculator.calculateRecord(Map.of(
        "area", 20000,
        "hazardClass", "Ordinary I",
        "ceilingHeightFt", 15,
        "floors", 3,
        "buildingHeightFt", 36,
        "staticPressurePsi", 60,
        "requiredPressurePsi", 80,
        "elevationFt", 20,
        "constructionType", "Type III"));

    @SuppressWarnings("unchecked")
    Map<String, Object> sprinkler = (Map<String, Object>) result.get("sprinkler");
    @SuppressWarnings("unchecked")
    Map<String, Object> pump = (Map<String, Object>) result.get("firePump");

    assertEquals("Ordinary I", sprinkler.get("hazardClass"));
    assertEquals(154, ((Number) sprinkler.get("headCount")).intValue());
    assertEquals("Horizontal Split Case", pump.get("pumpType"));
    assertEquals(2500, ((Number) result.get("hydrantFlow")).intValue());
  }
}
