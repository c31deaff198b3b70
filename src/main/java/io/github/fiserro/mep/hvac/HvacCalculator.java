package io.github.fiserro.mep.hvac;

import io.github.fiserro.mep.CalculationRecords;
import io.github.fiserro.mep.Calculator;
import io.github.fiserro.mep.config.EngineDefaults;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs all HVAC calculations for a zone.
 *
 * <p>Equipment capacity is derived from the computed cooling load. The duct is sized for the
 * given supply airflow, or for the ventilation rate when no airflow is given.
 */
@Slf4j
public class HvacCalculator implements Calculator<HvacInput, HvacResult> {

  private final EngineDefaults defaults;

  public HvacCalculator() {
    this(EngineDefaults.BUILT_IN);
  }

  public HvacCalculator(EngineDefaults defaults) {
    this.defaults = defaults;
  }

  /** Input builder pre-populated with this calculator's defaults. */
  public HvacInput.HvacInputBuilder inputBuilder() {
    return HvacInput.builder()
        .winterOutdoorTemp(defaults.winterOutdoorTemp())
        .winterIndoorTemp(defaults.winterIndoorTemp())
        .summerOutdoorTemp(defaults.summerOutdoorTemp())
        .summerIndoorTemp(defaults.summerIndoorTemp())
        .spaceType(defaults.spaceType())
        .ductVelocityFpm(defaults.ductVelocityFpm());
  }

  @Override
  public HvacResult calculate(HvacInput input) {
    HeatingLoadBreakdown heating = HvacEngine.heatingLoadBreakdown(
        input.area(), input.occupancy(), input.winterOutdoorTemp(), input.winterIndoorTemp());
    CoolingLoadBreakdown cooling = HvacEngine.coolingLoadBreakdown(
        input.area(), input.occupancy(), input.summerOutdoorTemp(), input.summerIndoorTemp());
    long ventilation = HvacEngine.ventilationRate(input.area(), input.occupancy(), input.spaceType());
    double tons = HvacEngine.equipmentCapacity(cooling.total());

    double airflow = input.airflowCfm() > 0 ? input.airflowCfm() : ventilation;
    int duct = HvacEngine.ductSize(airflow, input.ductVelocityFpm());

    log.debug("Calculated HVAC: heating={}, cooling={}, ventilation={}, tons={}, duct={} (airflow={})",
        heating.total(), cooling.total(), ventilation, tons, duct, airflow);

    return new HvacResult(heating.total(), cooling.total(), ventilation, tons, duct,
        new HvacResult.Breakdown(heating, cooling));
  }

  /** Calculates from a flat parameter map and returns a flat result map. */
  public Map<String, Object> calculateRecord(Map<String, ?> values) {
    return CalculationRecords.calculate(this, HvacInput.class, inputBuilder().build(), values);
  }
}
