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

/** Building construction types with their ISO fire-flow construction factor. */
@Getter
@Accessors(fluent = true)
public enum ConstructionType {
  TYPE_I("Type I", 0.6),     // fire resistive
  TYPE_II("Type II", 0.8),   // noncombustible
  TYPE_III("Type III", 1.0), // ordinary
  TYPE_IV("Type IV", 0.8),   // heavy timber
  TYPE_V("Type V", 1.2),     // wood frame
  ;

  private static final ConstantTable<String, ConstructionType> BY_NAME = ConstantTable.of("construction type",
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(
          type -> type.displayName().toLowerCase(Locale.ROOT), Function.identity())),
      TYPE_III);

  @JsonValue
  private final String displayName;
  private final double factor;

  ConstructionType(String displayName, double factor) {
    this.displayName = displayName;
    this.factor = factor;
  }

  /** Case-insensitive lookup; unknown names resolve to {@link #TYPE_III} (factor 1.0). */
  @JsonCreator
  public static ConstructionType fromName(String name) {
    return BY_NAME.get(name == null ? null : name.trim().toLowerCase(Locale.ROOT));
  }
}
