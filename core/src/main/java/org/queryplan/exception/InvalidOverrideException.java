/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.exception;

import lombok.Getter;
import org.queryplan.common.utils.StringUtils;

/** A caller-supplied operator property tries to replace a computed field. */
@Getter
public class InvalidOverrideException extends PlanModelException {

  private final String key;

  public InvalidOverrideException(String key, String operatorKind) {
    super(
        StringUtils.format(
            "Property [%s] is computed by the plan builder and cannot be overridden on %s"
                + " operators",
            key, operatorKind));
    this.key = key;
  }
}
