package io.github.fiserro.mep.electrical;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.github.fiserro.mep.config.EngineDefaults;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * Parameters of one electrical load or feeder.
 *
 * @param connectedLoadW          connected load, W
 * @param demandFactor            demand factor, 0-1
 * @param voltage                 system voltage, V (120, 208, 240, 480)
 * @param phases                  1 or 3
 * @param powerFactor             power factor
 * @param continuousLoad          whether the load runs for three hours or more
 * @param material                conductor material
 * @param temperatureRating       conductor insulation rating, °C (60, 75, 90)
 * @param distanceFt              one-way circuit length, ft
 * @param transformerKva          supply transformer rating, kVA
 * @param transformerImpedancePct supply transformer impedance, %
 */
@Builder(toBuilder = true, builderClassName = "ElectricalInputBuilder")
@JsonDeserialize(builder = ElectricalInput.ElectricalInputBuilder.class)
public record ElectricalInput(
    @PositiveOrZero double connectedLoadW,
    @DecimalMin("0") @DecimalMax("1") double demandFactor,
    @Positive double voltage,
    @Min(1) @Max(3) int phases,
    @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") double powerFactor,
    boolean continuousLoad,
    ConductorMaterial material,
    int temperatureRating,
    @PositiveOrZero double distanceFt,
    @PositiveOrZero double transformerKva,
    @Positive double transformerImpedancePct) {

  @JsonPOJOBuilder(withPrefix = "")
  public static class ElectricalInputBuilder {

    public ElectricalInputBuilder() {
      EngineDefaults defaults = EngineDefaults.BUILT_IN;
      phases = 1;
      powerFactor = defaults.powerFactor();
      continuousLoad = defaults.continuousLoad();
      material = defaults.conductorMaterial();
      temperatureRating = defaults.temperatureRating();
      transformerImpedancePct = defaults.transformerImpedancePct();
    }
  }
}
