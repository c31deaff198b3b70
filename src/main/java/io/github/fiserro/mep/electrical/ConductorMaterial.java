package io.github.fiserro.mep.electrical;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;
import io.github.fiserro.mep.ConstantTable;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Conductor material. Aluminum carries about 62% of the copper ampacity. */
@Getter
@Accessors(fluent = true)
public enum ConductorMaterial {
  COPPER("copper", 1.0),
  ALUMINUM("aluminum", 0.62),
  ;

  private static final ConstantTable<String, ConductorMaterial> BY_NAME = ConstantTable.of("conductor material",
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(ConductorMaterial::displayName, Function.identity())),
      COPPER);

  @JsonValue
  private final String displayName;
  private final double ampacityRatio;

  ConductorMaterial(String displayName, double ampacityRatio) {
    this.displayName = displayName;
    this.ampacityRatio = ampacityRatio;
  }

  /** 75 °C ampacity of this material for a gauge, rounded to whole amperes. */
  public long ampacity(WireGauge gauge) {
    return this == COPPER ? gauge.copperAmpacity() : Math.round(gauge.copperAmpacity() * ampacityRatio);
  }

  /** Case-insensitive lookup; unknown names resolve to {@link #COPPER}. */
  @JsonCreator
  public static ConductorMaterial fromName(String name) {
    return BY_NAME.get(name == null ? null : name.trim().toLowerCase(Locale.ROOT));
  }
}
