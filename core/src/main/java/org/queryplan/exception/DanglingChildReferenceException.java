/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.exception;

import lombok.Getter;
import org.queryplan.common.utils.StringUtils;

/** A child reference points at an operator id that does not exist in the plan. */
@Getter
public class DanglingChildReferenceException extends PlanModelException {

  private final int operatorId;

  private final int missingChildId;

  public DanglingChildReferenceException(int operatorId, int missingChildId) {
    super(
        StringUtils.format(
            "Operator %d references child %d which is not part of the plan",
            operatorId, missingChildId));
    this.operatorId = operatorId;
    this.missingChildId = missingChildId;
  }
}
