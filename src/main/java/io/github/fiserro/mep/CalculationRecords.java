package io.github.fiserro.mep;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts between flat parameter maps and the typed input/result records.
 *
 * <p>Callers hand the engine a plain map of named values (as loaded from project data) and get a
 * plain map back. Nested result records (load breakdowns, fire sub-systems) become nested maps.
 * Categorical values use their display names, e.g. {@code "Ordinary I"} or {@code "office"}.
 */
@Slf4j
public final class CalculationRecords {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private CalculationRecords() {
  }

  /** Shared mapper; records and enums in this library are configured through annotations. */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Builds an input record from a flat map. Keys that are absent keep the builder defaults,
   * unknown keys are ignored.
   *
   * @throws IllegalArgumentException if a value cannot be converted to the declared type
   */
  public static <I> I readInput(Map<String, ?> values, Class<I> inputType) {
    return MAPPER.convertValue(values, inputType);
  }

  /** Flattens a record into a mutable map keyed by component name. */
  public static Map<String, Object> toMap(Object record) {
    return new LinkedHashMap<>(MAPPER.convertValue(record, MAP_TYPE));
  }

  /**
   * Runs a calculator over a flat map: overlays {@code values} onto {@code defaults}, converts the
   * result to a typed input, calculates and flattens the result.
   */
  public static <I, R> Map<String, Object> calculate(Calculator<I, R> calculator,
      Class<I> inputType, I defaults, Map<String, ?> values) {
    Map<String, Object> merged = toMap(defaults);
    merged.putAll(values);
    I input = readInput(merged, inputType);
    log.debug("Calculating {} from {}", inputType.getSimpleName(), merged);
    return toMap(calculator.calculate(input));
  }
}
