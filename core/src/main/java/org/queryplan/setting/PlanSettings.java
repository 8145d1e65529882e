/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.setting;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.queryplan.common.setting.Settings;
import org.queryplan.planner.distributed.view.ParentResolution;

/**
 * Settings loaded from a flat json object keyed by setting name:
 *
 * <pre>
 * { "plans.import.scan.type": "FileScan", "plans.view.parent_resolution": "STRICT", ... }
 * </pre>
 *
 * <p>Defaults ship in {@value #DEFAULTS_RESOURCE}. Instances are immutable; {@link #with(Key,
 * Object)} returns a copy.
 */
public class PlanSettings extends Settings {

  private static final Logger LOG = LogManager.getLogger();

  public static final String DEFAULTS_RESOURCE = "query-plan-defaults.json";

  private final Map<Key, Object> values;

  private PlanSettings(Map<Key, Object> values) {
    this.values = values;
  }

  /** Settings from the bundled defaults resource. */
  public static PlanSettings defaults() {
    try (InputStream inputStream =
        PlanSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (inputStream == null) {
        throw new IllegalStateException("Missing settings resource " + DEFAULTS_RESOURCE);
      }
      return fromInputStream(inputStream);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read settings resource " + DEFAULTS_RESOURCE, e);
    }
  }

  /**
   * Reads settings from a json object. Unknown setting names are logged and ignored.
   *
   * @param inputStream json bytes
   * @return settings
   */
  public static PlanSettings fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    Map<String, Object> raw;
    try {
      raw = objectMapper.readValue(inputStream, new TypeReference<>() {});
    } catch (IOException e) {
      LOG.error("Plan settings file is malformed. Verify and reload.");
      throw new IllegalArgumentException("Malformed plan settings json: " + e.getMessage(), e);
    }
    Map<Key, Object> values = new EnumMap<>(Key.class);
    raw.forEach(
        (name, value) -> {
          Optional<Key> key = Key.of(name);
          if (key.isPresent()) {
            values.put(key.get(), value);
          } else {
            LOG.warn("Ignoring unknown plan setting {}", name);
          }
        });
    return new PlanSettings(values);
  }

  /**
   * Returns a copy with one setting replaced.
   *
   * @param key setting
   * @param value new value
   * @return new settings
   */
  public PlanSettings with(Key key, Object value) {
    Preconditions.checkNotNull(key, "setting key");
    Preconditions.checkNotNull(value, "value of setting %s", key.getKeyValue());
    Map<Key, Object> copy = new EnumMap<>(Key.class);
    copy.putAll(values);
    copy.put(key, value);
    return new PlanSettings(copy);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <T> T getSettingValue(Key key) {
    if (!values.containsKey(key)) {
      throw new IllegalStateException("Setting " + key.getKeyValue() + " is not configured");
    }
    return (T) values.get(key);
  }

  @Override
  public List<?> getSettings() {
    return values.entrySet().stream()
        .map(e -> e.getKey().getKeyValue() + "=" + e.getValue())
        .collect(Collectors.toList());
  }

  public String getString(Key key) {
    return String.valueOf((Object) getSettingValue(key));
  }

  public boolean getBoolean(Key key) {
    Object value = getSettingValue(key);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return Boolean.parseBoolean(String.valueOf(value));
  }

  public ParentResolution getParentResolution() {
    return ParentResolution.fromString(getString(Key.VIEW_PARENT_RESOLUTION));
  }
}
