package io.github.fiserro.mep.electrical;

import io.github.fiserro.mep.CalculationRecords;
import io.github.fiserro.mep.Calculator;
import io.github.fiserro.mep.config.EngineDefaults;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs all electrical calculations for a load.
 *
 * <p>The chain follows the design order: demand load, current drawn by the demand load, breaker
 * and conductor for that current, voltage drop on the selected conductor. Short-circuit current
 * depends only on the supply transformer.
 */
@Slf4j
public class ElectricalCalculator implements Calculator<ElectricalInput, ElectricalResult> {

  private final EngineDefaults defaults;

  public ElectricalCalculator() {
    this(EngineDefaults.BUILT_IN);
  }

  public ElectricalCalculator(EngineDefaults defaults) {
    this.defaults = defaults;
  }

  /** Input builder pre-populated with this calculator's defaults. */
  public ElectricalInput.ElectricalInputBuilder inputBuilder() {
    return ElectricalInput.builder()
        .powerFactor(defaults.powerFactor())
        .continuousLoad(defaults.continuousLoad())
        .material(defaults.conductorMaterial())
        .temperatureRating(defaults.temperatureRating())
        .transformerImpedancePct(defaults.transformerImpedancePct());
  }

  @Override
  public ElectricalResult calculate(ElectricalInput input) {
    long demandLoad = ElectricalEngine.demandLoad(input.connectedLoadW(), input.demandFactor());
    double current = ElectricalEngine.current(demandLoad, input.voltage(), input.phases(), input.powerFactor());
    int breaker = ElectricalEngine.breakerSize(current, input.continuousLoad());
    String wire = ElectricalEngine.wireSize(current, input.material(), input.temperatureRating());
    double voltageDrop = ElectricalEngine.voltageDrop(
        current, input.distanceFt(), input.voltage(), wire, input.phases());
    long shortCircuit = ElectricalEngine.shortCircuitCurrent(
        input.transformerKva(), input.voltage(), input.transformerImpedancePct());

    log.debug("Calculated electrical: demand={}, current={}, breaker={}, wire={}, drop={}%, isc={}",
        demandLoad, current, breaker, wire, voltageDrop, shortCircuit);

    return new ElectricalResult(demandLoad, current, breaker, wire, voltageDrop, shortCircuit);
  }

  /** Calculates from a flat parameter map and returns a flat result map. */
  public Map<String, Object> calculateRecord(Map<String, ?> values) {
    return CalculationRecords.calculate(this, ElectricalInput.class, inputBuilder().build(), values);
  }
}
