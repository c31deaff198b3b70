package io.github.fiserro.mep;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only keyed lookup of coefficients with an explicit default.
 *
 * <p>A key that is missing from the table resolves to the table's default value instead of
 * failing. The fallback is logged at debug level so unexpected categories can be traced.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
@Slf4j
public final class ConstantTable<K, V> {

  private final String name;
  private final ImmutableMap<K, V> values;
  private final V defaultValue;

  private ConstantTable(String name, Map<K, V> values, V defaultValue) {
    this.name = name;
    this.values = ImmutableMap.copyOf(values);
    this.defaultValue = defaultValue;
  }

  /**
   * Creates a table.
   *
   * @param name         table name used in log messages
   * @param values       the tabulated entries
   * @param defaultValue value returned for keys that are not tabulated
   */
  public static <K, V> ConstantTable<K, V> of(String name, Map<K, V> values, V defaultValue) {
    return new ConstantTable<>(name, values, defaultValue);
  }

  public V get(K key) {
    V value = key == null ? null : values.get(key);
    if (value == null) {
      log.debug("No {} entry for '{}', using default {}", name, key, defaultValue);
      return defaultValue;
    }
    return value;
  }

  boolean contains(K key) {
    return key != null && values.containsKey(key);
  }

  V defaultValue() {
    return defaultValue;
  }

  ImmutableMap<K, V> values() {
    return values;
  }
}
