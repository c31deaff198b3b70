package io.github.fiserro.mep.plumbing;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.collect.ImmutableMap;
import io.github.fiserro.mep.config.EngineDefaults;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;
import lombok.Builder;

/**
 * Parameters of a plumbing system.
 *
 * @param fixtureCounts        fixture counts by fixture name; when not empty they replace
 *                             {@code fixtureUnits}
 * @param fixtureUnits         water supply fixture units (WSFU)
 * @param pipeLengthFt         developed length of the supply run, ft
 * @param pressureAvailablePsi pressure available for friction losses, PSI
 * @param drainageFixtureUnits drainage fixture units (DFU)
 * @param drainSlope           drain slope, inches per foot
 * @param fixtureCount         number of fixtures served by the water heater
 * @param peakDemand           water heater peak demand factor (0.3-0.5 typical)
 */
@Builder(toBuilder = true, builderClassName = "PlumbingInputBuilder")
@JsonDeserialize(builder = PlumbingInput.PlumbingInputBuilder.class)
public record PlumbingInput(
    Map<String, Integer> fixtureCounts,
    @PositiveOrZero double fixtureUnits,
    @PositiveOrZero double pipeLengthFt,
    @Positive double pressureAvailablePsi,
    @PositiveOrZero double drainageFixtureUnits,
    @Positive double drainSlope,
    @PositiveOrZero int fixtureCount,
    @Positive double peakDemand) {

  public PlumbingInput {
    fixtureCounts = fixtureCounts == null ? ImmutableMap.of() : ImmutableMap.copyOf(fixtureCounts);
  }

  @JsonPOJOBuilder(withPrefix = "")
  public static class PlumbingInputBuilder {

    public PlumbingInputBuilder() {
      EngineDefaults defaults = EngineDefaults.BUILT_IN;
      fixtureCounts = ImmutableMap.of();
      pressureAvailablePsi = defaults.pressureAvailablePsi();
      drainSlope = defaults.drainSlope();
      peakDemand = defaults.peakDemand();
    }
  }
}
