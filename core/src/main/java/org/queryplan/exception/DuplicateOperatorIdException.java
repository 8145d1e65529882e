/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.exception;

import lombok.Getter;
import org.queryplan.common.utils.StringUtils;

/** Two operators of the same plan share an id. */
@Getter
public class DuplicateOperatorIdException extends PlanModelException {

  private final int operatorId;

  public DuplicateOperatorIdException(int operatorId) {
    super(StringUtils.format("Operator id %d is used by more than one operator", operatorId));
    this.operatorId = operatorId;
  }
}
