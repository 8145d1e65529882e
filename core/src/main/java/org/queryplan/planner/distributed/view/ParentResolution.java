/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.view;

import java.util.Locale;

/** What an operator view does when several operators list it as their child. */
public enum ParentResolution {

  /** Fail with a duplicate parent claim. */
  STRICT,

  /** Return the first claimant in plan order and log a warning. */
  FIRST_MATCH;

  /**
   * Parses a policy name, ignoring case.
   *
   * @param value policy name
   * @return policy
   */
  public static ParentResolution fromString(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown parent resolution policy: " + value, e);
    }
  }
}
