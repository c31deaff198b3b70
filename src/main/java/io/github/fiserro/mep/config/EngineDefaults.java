package io.github.fiserro.mep.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.github.fiserro.mep.electrical.ConductorMaterial;
import io.github.fiserro.mep.electrical.ElectricalEngine;
import io.github.fiserro.mep.fire.ConstructionType;
import io.github.fiserro.mep.fire.FireProtectionEngine;
import io.github.fiserro.mep.fire.HazardClass;
import io.github.fiserro.mep.hvac.HvacEngine;
import io.github.fiserro.mep.hvac.SpaceType;
import io.github.fiserro.mep.plumbing.PlumbingEngine;
import lombok.Builder;

/**
 * Default values for optional calculation parameters. Calculators start every input builder from
 * these values, so a deployment can change e.g. design temperatures without touching callers.
 */
@Builder(toBuilder = true, builderClassName = "EngineDefaultsBuilder")
@JsonDeserialize(builder = EngineDefaults.EngineDefaultsBuilder.class)
public record EngineDefaults(
    // HVAC
    double winterOutdoorTemp,
    double winterIndoorTemp,
    double summerOutdoorTemp,
    double summerIndoorTemp,
    SpaceType spaceType,
    double ductVelocityFpm,
    // Electrical
    double powerFactor,
    boolean continuousLoad,
    ConductorMaterial conductorMaterial,
    int temperatureRating,
    double transformerImpedancePct,
    // Plumbing
    double pressureAvailablePsi,
    double drainSlope,
    double peakDemand,
    // Fire protection
    double ceilingHeightFt,
    HazardClass hazardClass,
    ConstructionType constructionType) {

  public static final EngineDefaults BUILT_IN = EngineDefaults.builder().build();

  @JsonPOJOBuilder(withPrefix = "")
  public static class EngineDefaultsBuilder {

    public EngineDefaultsBuilder() {
      winterOutdoorTemp = HvacEngine.DEFAULT_WINTER_OUTDOOR_TEMP;
      winterIndoorTemp = HvacEngine.DEFAULT_WINTER_INDOOR_TEMP;
      summerOutdoorTemp = HvacEngine.DEFAULT_SUMMER_OUTDOOR_TEMP;
      summerIndoorTemp = HvacEngine.DEFAULT_SUMMER_INDOOR_TEMP;
      spaceType = SpaceType.OFFICE;
      ductVelocityFpm = HvacEngine.DEFAULT_DUCT_VELOCITY_FPM;
      powerFactor = ElectricalEngine.DEFAULT_POWER_FACTOR;
      continuousLoad = true;
      conductorMaterial = ConductorMaterial.COPPER;
      temperatureRating = ElectricalEngine.DEFAULT_TEMPERATURE_RATING;
      transformerImpedancePct = ElectricalEngine.DEFAULT_IMPEDANCE_PCT;
      pressureAvailablePsi = PlumbingEngine.DEFAULT_PRESSURE_AVAILABLE_PSI;
      drainSlope = PlumbingEngine.DEFAULT_DRAIN_SLOPE;
      peakDemand = PlumbingEngine.DEFAULT_PEAK_DEMAND;
      ceilingHeightFt = FireProtectionEngine.DEFAULT_CEILING_HEIGHT_FT;
      hazardClass = HazardClass.ORDINARY_I;
      constructionType = ConstructionType.TYPE_III;
    }
  }
}
