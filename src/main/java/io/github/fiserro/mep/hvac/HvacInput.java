package io.github.fiserro.mep.hvac;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.github.fiserro.mep.config.EngineDefaults;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * Parameters of one HVAC zone.
 *
 * @param area              floor area, ft²
 * @param occupancy         number of occupants
 * @param winterOutdoorTemp heating design outdoor temperature, °F
 * @param winterIndoorTemp  heating design indoor temperature, °F
 * @param summerOutdoorTemp cooling design outdoor temperature, °F
 * @param summerIndoorTemp  cooling design indoor temperature, °F
 * @param spaceType         space type driving ventilation rates
 * @param airflowCfm        supply airflow used for duct sizing, CFM; zero or less sizes the duct
 *                          for the zone's ventilation rate
 * @param ductVelocityFpm   design duct velocity, ft/min
 */
@Builder(toBuilder = true, builderClassName = "HvacInputBuilder")
@JsonDeserialize(builder = HvacInput.HvacInputBuilder.class)
public record HvacInput(
    @PositiveOrZero double area,
    @PositiveOrZero double occupancy,
    double winterOutdoorTemp,
    double winterIndoorTemp,
    double summerOutdoorTemp,
    double summerIndoorTemp,
    SpaceType spaceType,
    @PositiveOrZero double airflowCfm,
    @Positive double ductVelocityFpm) {

  @JsonPOJOBuilder(withPrefix = "")
  public static class HvacInputBuilder {

    public HvacInputBuilder() {
      EngineDefaults defaults = EngineDefaults.BUILT_IN;
      winterOutdoorTemp = defaults.winterOutdoorTemp();
      winterIndoorTemp = defaults.winterIndoorTemp();
      summerOutdoorTemp = defaults.summerOutdoorTemp();
      summerIndoorTemp = defaults.summerIndoorTemp();
      spaceType = defaults.spaceType();
      ductVelocityFpm = defaults.ductVelocityFpm();
    }
  }
}
