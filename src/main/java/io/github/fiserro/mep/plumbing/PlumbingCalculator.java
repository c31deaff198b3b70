package io.github.fiserro.mep.plumbing;

import io.github.fiserro.mep.CalculationRecords;
import io.github.fiserro.mep.Calculator;
import io.github.fiserro.mep.config.EngineDefaults;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs all plumbing calculations for a system.
 *
 * <p>Friction loss is reported for the selected standard pipe size, not the theoretical diameter.
 */
@Slf4j
public class PlumbingCalculator implements Calculator<PlumbingInput, PlumbingResult> {

  private final EngineDefaults defaults;

  public PlumbingCalculator() {
    this(EngineDefaults.BUILT_IN);
  }

  public PlumbingCalculator(EngineDefaults defaults) {
    this.defaults = defaults;
  }

  /** Input builder pre-populated with this calculator's defaults. */
  public PlumbingInput.PlumbingInputBuilder inputBuilder() {
    return PlumbingInput.builder()
        .pressureAvailablePsi(defaults.pressureAvailablePsi())
        .drainSlope(defaults.drainSlope())
        .peakDemand(defaults.peakDemand());
  }

  @Override
  public PlumbingResult calculate(PlumbingInput input) {
    double wsfu = input.fixtureCounts().isEmpty()
        ? input.fixtureUnits()
        : PlumbingEngine.totalFixtureUnits(input.fixtureCounts());
    double flow = PlumbingEngine.fixtureUnitsToGpm(wsfu);
    double pipe = PlumbingEngine.pipeSize(wsfu, input.pipeLengthFt(), input.pressureAvailablePsi());
    double friction = PlumbingEngine.frictionLoss(flow, pipe, input.pipeLengthFt());
    double drain = PlumbingEngine.drainPipeSize(input.drainageFixtureUnits(), input.drainSlope());
    WaterHeaterSize heater = PlumbingEngine.waterHeaterSize(input.fixtureCount(), input.peakDemand());

    log.debug("Calculated plumbing: wsfu={}, flow={}, pipe={}, friction={}, drain={}, heater={}",
        wsfu, flow, pipe, friction, drain, heater);

    return new PlumbingResult(wsfu, flow, pipe, friction, drain, heater);
  }

  /** Calculates from a flat parameter map and returns a flat result map. */
  public Map<String, Object> calculateRecord(Map<String, ?> values) {
    return CalculationRecords.calculate(this, PlumbingInput.class, inputBuilder().build(), values);
  }
}
