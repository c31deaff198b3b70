package io.github.fiserro.mep.fire;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Fire pump arrangement. */
@Getter
@Accessors(fluent = true)
public enum PumpType {
  HORIZONTAL_SPLIT_CASE("Horizontal Split Case"),
  VERTICAL_TURBINE("Vertical Turbine"),
  HORIZONTAL_SPLIT_CASE_LARGE("Horizontal Split Case (Large)"),
  ;

  @JsonValue
  private final String displayName;

  PumpType(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Selects the pump type for a rated capacity and pressure.
   *
   * @param capacityGpm rated capacity, GPM
   * @param pressurePsi rated pressure, PSI
   */
  public static PumpType select(double capacityGpm, double pressurePsi) {
    if (capacityGpm <= 1500 && pressurePsi <= 100) {
      return HORIZONTAL_SPLIT_CASE;
    }
    if (capacityGpm <= 1000 && pressurePsi > 100) {
      return VERTICAL_TURBINE;
    }
    return HORIZONTAL_SPLIT_CASE_LARGE;
  }
}
