package io.github.fiserro.mep.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.fiserro.mep.CalculationRecords;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads {@link EngineDefaults} from JSON. Keys missing from the document keep their built-in
 * values; unknown keys are ignored.
 *
 * <p>Example {@code mep-defaults.json}:
 * <pre>
 * {"summerOutdoorTemp": 100, "hazardClass": "Ordinary II"}
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class EngineDefaultsLoader {

  public static final String DEFAULT_RESOURCE = "/mep-defaults.json";

  private final ObjectMapper mapper;

  public EngineDefaultsLoader() {
    this(CalculationRecords.mapper());
  }

  /** Loads {@value #DEFAULT_RESOURCE} from the classpath, or the built-in defaults if absent. */
  public EngineDefaults load() {
    return loadResource(DEFAULT_RESOURCE);
  }

  /**
   * Loads defaults from a classpath resource.
   *
   * @param resource absolute classpath resource name
   * @return loaded defaults, or {@link EngineDefaults#BUILT_IN} if the resource does not exist
   * @throws EngineConfigurationException if the resource cannot be parsed
   */
  public EngineDefaults loadResource(String resource) {
    try (InputStream in = EngineDefaultsLoader.class.getResourceAsStream(resource)) {
      if (in == null) {
        log.info("Engine defaults resource '{}' not found, using built-in defaults", resource);
        return EngineDefaults.BUILT_IN;
      }
      EngineDefaults defaults = mapper.readValue(in, EngineDefaults.class);
      log.info("Loaded engine defaults from resource '{}'", resource);
      log.debug("Engine defaults: {}", defaults);
      return defaults;
    } catch (IOException e) {
      throw new EngineConfigurationException("Failed to read engine defaults from resource '" + resource + "'", e);
    }
  }

  /**
   * Loads defaults from a file.
   *
   * @throws EngineConfigurationException if the file is missing or cannot be parsed
   */
  public EngineDefaults load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      EngineDefaults defaults = mapper.readValue(in, EngineDefaults.class);
      log.info("Loaded engine defaults from file '{}'", file);
      log.debug("Engine defaults: {}", defaults);
      return defaults;
    } catch (IOException e) {
      throw new EngineConfigurationException("Failed to read engine defaults from file '" + file + "'", e);
    }
  }

  /**
   * Applies overrides given as a flat map, e.g. values collected from project settings.
   *
   * @throws EngineConfigurationException if a value has the wrong type
   */
  public EngineDefaults load(Map<String, ?> overrides) {
    try {
      return mapper.convertValue(overrides, EngineDefaults.class);
    } catch (IllegalArgumentException e) {
      throw new EngineConfigurationException("Invalid engine default overrides " + overrides, e);
    }
  }
}
