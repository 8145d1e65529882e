/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.exception;

import lombok.Getter;
import org.queryplan.common.utils.StringUtils;

/** A required document field or operator property is absent. */
@Getter
public class MissingFieldException extends PlanModelException {

  private final String fieldName;

  private final String path;

  public MissingFieldException(String fieldName, String path) {
    super(StringUtils.format("Missing field [%s] at [%s]", fieldName, path.isEmpty() ? "/" : path));
    this.fieldName = fieldName;
    this.path = path;
  }
}
