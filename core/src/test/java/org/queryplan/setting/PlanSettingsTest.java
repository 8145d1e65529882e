/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.queryplan.common.setting.Settings.Key;
import org.queryplan.planner.distributed.view.ParentResolution;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanSettingsTest {

  @Test
  void should_load_bundled_defaults() {
    PlanSettings settings = PlanSettings.defaults();

    assertEquals("FileScan", settings.getString(Key.IMPORT_SCAN_TYPE));
    assertEquals("DbInsert", settings.getString(Key.IMPORT_INSERT_TYPE));
    assertEquals("SubQuery", settings.getString(Key.IMPORT_PLAN_KIND));
    assertEquals("myrial", settings.getString(Key.IMPORT_LANGUAGE));
    assertFalse(settings.getBoolean(Key.IMPORT_PROFILING));
    assertTrue(settings.getBoolean(Key.IMPORT_OVERWRITE));
    assertEquals(ParentResolution.STRICT, settings.getParentResolution());
    assertEquals(Key.values().length, settings.getSettings().size());
  }

  @Test
  void should_ignore_unknown_keys_and_fail_on_unset_ones() {
    PlanSettings settings =
        PlanSettings.fromInputStream(
            stream("{\"plans.import.scan.type\": \"HdfsScan\", \"plans.unknown\": 1}"));

    assertEquals("HdfsScan", settings.getString(Key.IMPORT_SCAN_TYPE));
    assertEquals(1, settings.getSettings().size());
    assertThrows(IllegalStateException.class, () -> settings.getString(Key.IMPORT_LANGUAGE));
  }

  @Test
  void should_parse_boolean_strings() {
    PlanSettings settings =
        PlanSettings.fromInputStream(stream("{\"plans.import.profiling\": \"true\"}"));

    assertTrue(settings.getBoolean(Key.IMPORT_PROFILING));
  }

  @Test
  void should_return_modified_copy() {
    PlanSettings defaults = PlanSettings.defaults();

    PlanSettings changed = defaults.with(Key.VIEW_PARENT_RESOLUTION, ParentResolution.FIRST_MATCH);

    assertEquals(ParentResolution.FIRST_MATCH, changed.getParentResolution());
    assertEquals(ParentResolution.STRICT, defaults.getParentResolution());
    assertThrows(NullPointerException.class, () -> defaults.with(Key.IMPORT_LANGUAGE, null));
  }

  @Test
  void should_reject_malformed_settings() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class, () -> PlanSettings.fromInputStream(stream("{")));

    assertTrue(exception.getMessage().startsWith("Malformed plan settings json"));
  }

  private static InputStream stream(String json) {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }
}
