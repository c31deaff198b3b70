package io.github.fiserro.mep.fire;

import io.github.fiserro.mep.CalculationRecords;
import io.github.fiserro.mep.Calculator;
import io.github.fiserro.mep.config.EngineDefaults;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs all fire protection calculations for a building.
 *
 * <p>The fire pump is sized for the sprinkler and standpipe flows combined; head spacing follows
 * the sprinkler coverage of the hazard class.
 */
@Slf4j
public class FireProtectionCalculator implements Calculator<FireProtectionInput, FireProtectionResult> {

  private final EngineDefaults defaults;

  public FireProtectionCalculator() {
    this(EngineDefaults.BUILT_IN);
  }

  public FireProtectionCalculator(EngineDefaults defaults) {
    this.defaults = defaults;
  }

  /** Input builder pre-populated with this calculator's defaults. */
  public FireProtectionInput.FireProtectionInputBuilder inputBuilder() {
    return FireProtectionInput.builder()
        .hazardClass(defaults.hazardClass())
        .ceilingHeightFt(defaults.ceilingHeightFt())
        .constructionType(defaults.constructionType());
  }

  @Override
  public FireProtectionResult calculate(FireProtectionInput input) {
    SprinklerSystem sprinkler = FireProtectionEngine.sprinklerSystem(
        input.area(), input.hazardClass(), input.ceilingHeightFt());
    StandpipeSystem standpipe = FireProtectionEngine.standpipeSystem(input.floors(), input.buildingHeightFt());
    FirePump pump = FireProtectionEngine.firePump(sprinkler.flowRate() + standpipe.flowRate(),
        input.staticPressurePsi(), input.requiredPressurePsi(), input.elevationFt());
    long hydrantFlow = FireProtectionEngine.hydrantFlow(input.area(), input.constructionType());
    HeadSpacing spacing = FireProtectionEngine.headSpacing(sprinkler.coverage());

    log.debug("Calculated fire protection: sprinkler={}, standpipe={}, pump={}, hydrant={}, spacing={}",
        sprinkler, standpipe, pump, hydrantFlow, spacing);

    return new FireProtectionResult(sprinkler, standpipe, pump, hydrantFlow, spacing);
  }

  /** Calculates from a flat parameter map and returns a flat result map. */
  public Map<String, Object> calculateRecord(Map<String, ?> values) {
    return CalculationRecords.calculate(this, FireProtectionInput.class, inputBuilder().build(), values);
  }
}
