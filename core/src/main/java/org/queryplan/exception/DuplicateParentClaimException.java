/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.exception;

import lombok.Getter;
import org.queryplan.common.utils.StringUtils;

/** More than one operator lists the same operator as its child. */
@Getter
public class DuplicateParentClaimException extends PlanModelException {

  private final int childId;

  private final int firstParentId;

  private final int secondParentId;

  public DuplicateParentClaimException(int childId, int firstParentId, int secondParentId) {
    super(
        StringUtils.format(
            "Operator %d is claimed as a child by both operator %d and operator %d",
            childId, firstParentId, secondParentId));
    this.childId = childId;
    this.firstParentId = firstParentId;
    this.secondParentId = secondParentId;
  }
}
