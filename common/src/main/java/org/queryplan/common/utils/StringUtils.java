/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.common.utils;

import java.util.Locale;
import lombok.experimental.UtilityClass;

@UtilityClass
public class StringUtils {

  /**
   * Format a message in the root locale, so messages do not change with the JVM default.
   *
   * @param format format string
   * @param args arguments
   * @return formatted string
   */
  public static String format(final String format, Object... args) {
    return String.format(Locale.ROOT, format, args);
  }
}
