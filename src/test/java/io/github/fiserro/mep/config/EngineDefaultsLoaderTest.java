package io.github.fiserro.mep.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.fiserro.mep.electrical.ConductorMaterial;
import io.github.fiserro.mep.fire.HazardClass;
import io.github.fiserro.mep.hvac.SpaceType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link EngineDefaultsLoader}.
 */
class EngineDefaultsLoaderTest {

  private EngineDefaultsLoader loader;

  @BeforeEach
  void setUp() {
    loader = new EngineDefaultsLoader();
  }

  @Test
  void load_withoutResource_shouldUseBuiltInDefaults() {
    EngineDefaults defaults = loader.load();

    assertSame(EngineDefaults.BUILT_IN, defaults);
    assertEquals(0, defaults.winterOutdoorTemp());
    assertEquals(70, defaults.winterIndoorTemp());
    assertEquals(95, defaults.summerOutdoorTemp());
    assertEquals(75, defaults.summerIndoorTemp());
    assertEquals(SpaceType.OFFICE, defaults.spaceType());
    assertEquals(1000, defaults.ductVelocityFpm());
    assertEquals(0.85, defaults.powerFactor());
    assertTrue(defaults.continuousLoad());
    assertEquals(ConductorMaterial.COPPER, defaults.conductorMaterial());
    assertEquals(75, defaults.temperatureRating());
    assertEquals(5.75, defaults.transformerImpedancePct());
    assertEquals(50, defaults.pressureAvailablePsi());
    assertEquals(0.25, defaults.drainSlope());
    assertEquals(0.4, defaults.peakDemand());
    assertEquals(12, defaults.ceilingHeightFt());
    assertEquals(HazardClass.ORDINARY_I, defaults.hazardClass());
  }

  @Test
  void loadResource_withOverrides_shouldKeepOtherDefaults() {
    EngineDefaults defaults = loader.loadResource("/mep-defaults-override.json");

    assertEquals(100, defaults.summerOutdoorTemp());
    assertEquals(HazardClass.ORDINARY_II, defaults.hazardClass());
    assertEquals(ConductorMaterial.ALUMINUM, defaults.conductorMaterial());
    assertEquals(90, defaults.temperatureRating());
    // untouched values keep their built-in defaults
    assertEquals(75, defaults.summerIndoorTemp());
    assertEquals(SpaceType.OFFICE, defaults.spaceType());
    assertEquals(0.25, defaults.drainSlope());
  }

  @Test
  void loadResource_withMalformedJson_shouldThrow() {
    EngineConfigurationException e = assertThrows(EngineConfigurationException.class,
        () -> loader.loadResource("/mep-defaults-malformed.json"));

    assertTrue(e.getMessage().contains("mep-defaults-malformed.json"));
  }

  @Test
  void load_fromFile_shouldApplyOverrides(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("defaults.json");
    Files.writeString(file, "{\"spaceType\": \"Classroom\", \"peakDemand\": 0.5, \"comment\": \"site A\"}");

    EngineDefaults defaults = loader.load(file);

    assertEquals(SpaceType.CLASSROOM, defaults.spaceType());
    assertEquals(0.5, defaults.peakDemand());
  }

  @Test
  void load_fromMissingFile_shouldThrow(@TempDir Path dir) {
    assertThrows(EngineConfigurationException.class, () -> loader.load(dir.resolve("missing.json")));
  }

  @Test
  void load_fromMap_shouldApplyOverrides() {
    EngineDefaults defaults = loader.load(Map.of("ceilingHeightFt", 20, "constructionType", "Type V"));

    assertEquals(20, defaults.ceilingHeightFt());
    assertEquals("Type V", defaults.constructionType().displayName());
  }

  @Test
  void load_fromMapWithWrongType_shouldThrow() {
    assertThrows(EngineConfigurationException.class,
        () -> loader.load(Map.of("ceilingHeightFt", List.of(20))));
  }
}
