/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.document;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.FRAGMENTS_POINTER;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OPERATORS;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.queryplan.planner.distributed.view.QueryPlan;

/**
 * Locates fragments and operators inside a plan document.
 *
 * <p>Two query shapes exist: every fragment of the plan, and every operator within a scope (the
 * whole plan or one fragment). Each call walks the current document again, so a query issued after
 * a mutation sees the new state. Nothing is cached. A missing or non-array container yields an
 * empty stream, and array elements that are not JSON objects are skipped.
 */
public final class PlanQuery {

  private static final JsonPointer OPERATORS_POINTER = JsonPointer.compile("/" + OPERATORS);

  private PlanQuery() {}

  /**
   * Finds every fragment of the plan, in document order.
   *
   * @param plan plan to search
   * @return lazy stream of fragment matches
   */
  public static Stream<PlanMatch> fragments(QueryPlan plan) {
    return elements(plan.getDocument().at(FRAGMENTS_POINTER), FRAGMENTS_POINTER, null, plan);
  }

  /**
   * Finds every operator of the plan, fragment by fragment, in document order.
   *
   * @param plan plan to search
   * @return lazy stream of operator matches
   */
  public static Stream<PlanMatch> operators(QueryPlan plan) {
    return fragments(plan).flatMap(PlanQuery::operators);
  }

  /**
   * Finds every operator of one fragment, in document order.
   *
   * @param fragment fragment match produced by {@link #fragments(QueryPlan)}
   * @return lazy stream of operator matches
   */
  public static Stream<PlanMatch> operators(PlanMatch fragment) {
    return elements(
        fragment.getValue().get(OPERATORS),
        fragment.getPath().append(OPERATORS_POINTER),
        fragment,
        fragment.getPlan());
  }

  private static Stream<PlanMatch> elements(
      JsonNode array, JsonPointer arrayPath, PlanMatch context, QueryPlan plan) {
    if (array == null || !array.isArray()) {
      return Stream.empty();
    }
    return IntStream.range(0, array.size())
        .filter(i -> array.get(i) != null && array.get(i).isObject())
        .mapToObj(
            i -> new PlanMatch((ObjectNode) array.get(i), arrayPath.appendIndex(i), context, plan));
  }
}
