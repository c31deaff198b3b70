package io.github.fiserro.mep.hvac;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;
import io.github.fiserro.mep.ConstantTable;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Space types with their outdoor air requirements (ASHRAE 62.1 style people + area rates).
 */
@Getter
@Accessors(fluent = true)
public enum SpaceType {
  OFFICE("office", 5, 0.06),
  CLASSROOM("classroom", 10, 0.12),
  RETAIL("retail", 7.5, 0.12),
  RESTAURANT("restaurant", 7.5, 0.18),
  WAREHOUSE("warehouse", 0, 0.06),
  GYM("gym", 20, 0.06),
  ;

  private static final ConstantTable<String, SpaceType> BY_NAME = ConstantTable.of("space type",
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(SpaceType::displayName, Function.identity())),
      OFFICE);

  @JsonValue
  private final String displayName;
  /** CFM per occupant. */
  private final double cfmPerPerson;
  /** CFM per square foot of floor area. */
  private final double cfmPerSquareFoot;

  SpaceType(String displayName, double cfmPerPerson, double cfmPerSquareFoot) {
    this.displayName = displayName;
    this.cfmPerPerson = cfmPerPerson;
    this.cfmPerSquareFoot = cfmPerSquareFoot;
  }

  /** Case-insensitive lookup by display name; unknown names resolve to {@link #OFFICE}. */
  @JsonCreator
  public static SpaceType fromName(String name) {
    return BY_NAME.get(name == null ? null : name.trim().toLowerCase(Locale.ROOT));
  }
}
