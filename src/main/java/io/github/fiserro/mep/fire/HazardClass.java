package io.github.fiserro.mep.fire;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;
import io.github.fiserro.mep.ConstantTable;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import lombok.Getter;
import lombok.experimental.Accessors;

/** NFPA 13 occupancy hazard classes with their design criteria. */
@Getter
@Accessors(fluent = true)
public enum HazardClass {
  LIGHT("Light", 0.10, 225, 7),
  ORDINARY_I("Ordinary I", 0.15, 130, 10),
  ORDINARY_II("Ordinary II", 0.20, 130, 15),
  EXTRA("Extra", 0.30, 100, 20),
  ;

  private static final ConstantTable<String, HazardClass> BY_NAME = ConstantTable.of("hazard class",
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(
          hazard -> hazard.displayName().toLowerCase(Locale.ROOT), Function.identity())),
      ORDINARY_I);

  @JsonValue
  private final String displayName;
  /** Design density, GPM/ft². */
  private final double density;
  /** Protection area per sprinkler head, ft². */
  private final double coverage;
  /** Minimum pressure at the most remote head, PSI. */
  private final double basePressure;

  HazardClass(String displayName, double density, double coverage, double basePressure) {
    this.displayName = displayName;
    this.density = density;
    this.coverage = coverage;
    this.basePressure = basePressure;
  }

  /** Case-insensitive lookup; unknown names resolve to {@link #ORDINARY_I}. */
  @JsonCreator
  public static HazardClass fromName(String name) {
    return BY_NAME.get(name == null ? null : name.trim().toLowerCase(Locale.ROOT));
  }
}
