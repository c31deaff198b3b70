package io.github.fiserro.mep;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.fiserro.mep.hvac.HvacCalculator;
import io.github.fiserro.mep.hvac.HvacInput;
import io.github.fiserro.mep.hvac.SpaceType;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CalculationRecords}.
 */
class CalculationRecordsTest {

  @Test
  @DisplayName("Absent keys keep builder defaults")
  void readInputDefaults() {
    HvacInput input = CalculationRecords.readInput(Map.of("area", 500), HvacInput.class);

    assertEquals(500, input.area());
    assertEquals(70, input.winterIndoorTemp());
    assertEquals(SpaceType.OFFICE, input.spaceType());
  }

  @Test
  @DisplayName("Enums are read from display names")
  void readInputEnum() {
    HvacInput input = CalculationRecords.readInput(Map.of("spaceType", "GYM"), HvacInput.class);

    assertEquals(SpaceType.GYM, input.spaceType());
  }

  @Test
  @DisplayName("Values of the wrong type are rejected")
  void readInputWrongType() {
    assertThrows(IllegalArgumentException.class,
        () -> CalculationRecords.readInput(Map.of("area", List.of(1, 2)), HvacInput.class));
  }

  @Test
  @DisplayName("Records flatten to their components with display names")
  void toMap() {
    HvacInput input = HvacInput.builder().area(1000).occupancy(10).build();

    Map<String, Object> values = CalculationRecords.toMap(input);

    assertEquals(Set.of("area", "occupancy", "winterOutdoorTemp", "winterIndoorTemp", "summerOutdoorTemp",
        "summerIndoorTemp", "spaceType", "airflowCfm", "ductVelocityFpm"), values.keySet());
    assertEquals("office", values.get("spaceType"));
  }

  @Test
  @DisplayName("Flat values override the defaults record")
  void calculate() {
    HvacCalculator calculator = new HvacCalculator();
    HvacInput defaults = calculator.inputBuilder().area(1000).occupancy(10).build();

    Map<String, Object> result = CalculationRecords.calculate(calculator, HvacInput.class, defaults,
        Map.of("winterOutdoorTemp", 20));

    assertEquals(19829L, ((Number) result.get("heatingLoad")).longValue());
  }
}
