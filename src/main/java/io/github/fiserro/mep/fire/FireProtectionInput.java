package io.github.fiserro.mep.fire;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.github.fiserro.mep.config.EngineDefaults;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * Parameters of a building's fire protection systems.
 *
 * @param area                protected area, ft²
 * @param hazardClass         occupancy hazard class
 * @param ceilingHeightFt     ceiling height, ft
 * @param floors              number of floors served by the standpipe
 * @param buildingHeightFt    building height, ft
 * @param staticPressurePsi   static pressure available from the supply, PSI
 * @param requiredPressurePsi pressure required at the highest outlet, PSI
 * @param elevationFt         elevation from the pump to the highest outlet, ft
 * @param constructionType    building construction type
 */
@Builder(toBuilder = true, builderClassName = "FireProtectionInputBuilder")
@JsonDeserialize(builder = FireProtectionInput.FireProtectionInputBuilder.class)
public record FireProtectionInput(
    @PositiveOrZero double area,
    HazardClass hazardClass,
    @PositiveOrZero double ceilingHeightFt,
    @PositiveOrZero int floors,
    @PositiveOrZero double buildingHeightFt,
    @PositiveOrZero double staticPressurePsi,
    @PositiveOrZero double requiredPressurePsi,
    double elevationFt,
    ConstructionType constructionType) {

  @JsonPOJOBuilder(withPrefix = "")
  public static class FireProtectionInputBuilder {

    public FireProtectionInputBuilder() {
      EngineDefaults defaults = EngineDefaults.BUILT_IN;
      hazardClass = defaults.hazardClass();
      ceilingHeightFt = defaults.ceilingHeightFt();
      constructionType = defaults.constructionType();
    }
  }
}
