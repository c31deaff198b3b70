package io.github.fiserro.mep.hvac;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.fiserro.mep.config.EngineDefaults;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HvacCalculator}.
 */
class HvacCalculatorTest {

  private final HvacCalculator calculator = new HvacCalculator();

  @Nested
  @DisplayName("Defaults")
  class DefaultsTests {

    @Test
    @DisplayName("Design temperatures and space type come from the built-in defaults")
    void builtInDefaults() {
      HvacInput input = HvacInput.builder().area(1000).occupancy(10).build();

      assertEquals(0, input.winterOutdoorTemp());
      assertEquals(70, input.winterIndoorTemp());
      assertEquals(95, input.summerOutdoorTemp());
      assertEquals(75, input.summerIndoorTemp());
      assertEquals(SpaceType.OFFICE, input.spaceType());
      assertEquals(1000, input.ductVelocityFpm());

      HvacResult result = calculator.calculate(input);
      assertEquals(28760, result.heatingLoad());
      assertEquals(68390, result.coolingLoad());
    }

    @Test
    @DisplayName("Configured defaults are applied to the input builder")
    void configuredDefaults() {
      EngineDefaults defaults = EngineDefaults.BUILT_IN.toBuilder()
          .summerOutdoorTemp(105)
          .spaceType(SpaceType.CLASSROOM)
          .build();
      HvacCalculator configured = new HvacCalculator(defaults);

      HvacInput input = configured.inputBuilder().area(1000).occupancy(10).build();
      HvacResult result = configured.calculate(input);

      assertEquals(105, input.summerOutdoorTemp());
      assertEquals(220, result.ventilationRate());
      assertEquals(HvacEngine.coolingLoad(1000, 10, 105, 75), result.coolingLoad());
    }
  }

  @Nested
  @DisplayName("Composite result")
  class CompositeTests {

    @Test
    @DisplayName("Equipment capacity follows the computed cooling load")
    void capacityFromCoolingLoad() {
      HvacResult result = calculator.calculate(calculator.inputBuilder().area(1000).occupancy(10).build());

      assertEquals(6.0, result.equipmentCapacity(), 1e-9);
    }

    @Test
    @DisplayName("Duct is sized for the supply airflow when given")
    void ductForSupplyAirflow() {
      HvacResult result = calculator.calculate(
          calculator.inputBuilder().area(1000).occupancy(10).airflowCfm(1200).build());

      assertEquals(14, result.ductSize());
    }

    @Test
    @DisplayName("Duct is sized for the ventilation rate without a supply airflow")
    void ductForVentilation() {
      HvacResult result = calculator.calculate(calculator.inputBuilder().area(1000).occupancy(10).build());

      assertEquals(110, result.ventilationRate());
      assertEquals(HvacEngine.ductSize(110), result.ductSize());
    }

    @Test
    @DisplayName("Heating uses winter and cooling uses summer temperatures")
    void seasonalTemperatures() {
      HvacResult result = calculator.calculate(calculator.inputBuilder()
          .area(1000)
          .occupancy(10)
          .winterOutdoorTemp(20)
          .summerOutdoorTemp(100)
          .build());

      assertEquals(HvacEngine.heatingLoad(1000, 10, 20, 70), result.heatingLoad());
      assertEquals(HvacEngine.coolingLoad(1000, 10, 100, 75), result.coolingLoad());
    }
  }

  @Nested
  @DisplayName("Flat records")
  class RecordTests {

    @Test
    @DisplayName("Missing keys keep defaults and categorical values use display names")
    void calculateRecord() {
      Map<String, Object> result = calculator.calculateRecord(Map.of(
          "area", 1000,
          "occupancy", 10,
          "spaceType", "Classroom"));

      assertEquals(28760L, ((Number) result.get("heatingLoad")).longValue());
      assertEquals(220L, ((Number) result.get("ventilationRate")).longValue());
      @SuppressWarnings("unchecked")
      Map<String, Object> breakdown = (Map<String, Object>) result.get("breakdown");
      @SuppressWarnings("unchecked")
      Map<String, Object> heating = (Map<String, Object>) breakdown.get("heating");
      assertEquals(28760L, ((Number) heating.get("total")).longValue());
    }

    @Test
    @DisplayName("Unknown keys are ignored")
    void unknownKeys() {
      Map<String, Object> result = calculator.calculateRecord(Map.of(
          "area", 1000,
          "occupancy", 10,
          "projectName", "Tower A"));

      assertEquals(68390L, ((Number) result.get("coolingLoad")).longValue());
    }
  }

  @Test
  @DisplayName("Concurrent calculations give the same results as sequential ones")
  void concurrentCalculations() throws Exception {
    List<HvacInput> inputs = IntStream.range(1, 200)
        .mapToObj(i -> calculator.inputBuilder().area(i * 100).occupancy(i).build())
        .toList();
    List<HvacResult> expected = inputs.stream().map(calculator::calculate).toList();

    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<HvacResult>> futures = inputs.stream()
          .map(input -> executor.submit(() -> calculator.calculate(input)))
          .toList();
      for (int i = 0; i < futures.size(); i++) {
        assertEquals(expected.get(i), futures.get(i).get());
      }
    } finally {
      executor.shutdown();
    }
  }
}
