package io.github.fiserro.mep.plumbing;

import com.google.common.collect.ImmutableMap;
import io.github.fiserro.mep.ConstantTable;
import java.util.Arrays;
import java.util.Locale;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Plumbing fixtures with their water supply fixture units (UPC Table 6-3). */
@Getter
@Accessors(fluent = true)
public enum FixtureType {
  WATER_CLOSET_TANK("Water Closet (Tank)", 3),
  WATER_CLOSET_FLUSH_VALVE("Water Closet (Flush Valve)", 5),
  URINAL_FLUSH_VALVE("Urinal (Flush Valve)", 5),
  URINAL_TANK("Urinal (Tank)", 3),
  LAVATORY("Lavatory", 1),
  KITCHEN_SINK("Sink (Kitchen)", 2),
  SERVICE_SINK("Sink (Service)", 3),
  BATHTUB("Bathtub", 3),
  SHOWER("Shower", 2),
  DOMESTIC_DISHWASHER("Dishwasher (Domestic)", 2),
  WASHING_MACHINE("Washing Machine", 3),
  DRINKING_FOUNTAIN("Drinking Fountain", 0.5),
  HOSE_BIBB("Hose Bibb", 3),
  ;

  /** Fixture units assumed for fixtures that are not tabulated. */
  public static final double DEFAULT_FIXTURE_UNITS = 1;

  private static final ConstantTable<String, Double> UNITS_BY_NAME = ConstantTable.of("fixture type",
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(
          fixture -> normalize(fixture.displayName()), fixture -> fixture.fixtureUnits())),
      DEFAULT_FIXTURE_UNITS);

  private final String displayName;
  private final double fixtureUnits;

  FixtureType(String displayName, double fixtureUnits) {
    this.displayName = displayName;
    this.fixtureUnits = fixtureUnits;
  }

  /** Fixture units for a fixture name (case-insensitive); unknown fixtures count as one unit. */
  public static double unitsFor(String fixtureName) {
    return UNITS_BY_NAME.get(fixtureName == null ? null : normalize(fixtureName));
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
