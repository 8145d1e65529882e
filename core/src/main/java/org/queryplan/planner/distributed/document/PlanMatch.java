/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.document;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.queryplan.planner.distributed.view.QueryPlan;

/**
 * One result of a {@link PlanQuery}: the matched object, where it lives in the document, the match
 * of its enclosing scope and the plan it belongs to.
 *
 * <p>The value is the live node of the backing document, not a copy.
 */
@Getter
@RequiredArgsConstructor
public class PlanMatch {

  /** Matched fragment or operator object. */
  private final ObjectNode value;

  /** Absolute location of the value, e.g. {@code /plan/fragments/1/operators/0}. */
  private final JsonPointer path;

  /** Match of the enclosing fragment for operators, null for fragments. */
  private final PlanMatch context;

  /** Plan the document belongs to. */
  private final QueryPlan plan;

  /** Returns the position of the value inside its enclosing array. */
  public int getIndex() {
    return path.last().getMatchingIndex();
  }

  @Override
  public String toString() {
    return "PlanMatch{path='" + path + "'}";
  }
}
