/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Settings abstraction shared by every module. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Operator type written for generated scan operators. */
    IMPORT_SCAN_TYPE("plans.import.scan.type"),

    /** Operator type written for generated insert operators. */
    IMPORT_INSERT_TYPE("plans.import.insert.type"),

    /** Plan kind (execution strategy) of generated plans. */
    IMPORT_PLAN_KIND("plans.import.kind"),

    /** Source language tag of generated plans. */
    IMPORT_LANGUAGE("plans.import.language"),

    /** Whether generated plans request profiling. */
    IMPORT_PROFILING("plans.import.profiling"),

    /** Whether generated insert operators overwrite an existing relation. */
    IMPORT_OVERWRITE("plans.import.overwrite"),

    /** How an operator view resolves its parent when several operators claim it. */
    VIEW_PARENT_RESOLUTION("plans.view.parent_resolution");

    @Getter private final String keyValue;

    private static final Map<String, Key> ALL_KEYS =
        Arrays.stream(Key.values())
            .collect(ImmutableMap.toImmutableMap(Key::getKeyValue, Function.identity()));

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  public abstract List<?> getSettings();
}
