/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.queryplan.planner.distributed.PlanFixtures.DUPLICATE_PARENT;
import static org.queryplan.planner.distributed.PlanFixtures.SHUFFLE_JOIN;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.queryplan.exception.DuplicateOperatorIdException;
import org.queryplan.exception.DuplicateParentClaimException;
import org.queryplan.exception.MissingFieldException;
import org.queryplan.planner.distributed.PlanFixtures;
import org.queryplan.planner.distributed.view.PlanOperator;
import org.queryplan.planner.distributed.view.QueryPlan;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanIndexTest {

  @Test
  void should_index_operators_and_edges() {
    PlanIndex index = PlanFixtures.plan(SHUFFLE_JOIN).index();

    assertEquals(8, index.size());
    assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7), List.copyOf(index.getOperatorIds()));
    assertEquals("SymmetricHashJoin", index.getOperator(6).orElseThrow().getType());
    assertEquals(Set.of(4, 5), index.childIdsOf(6));
    assertEquals(List.of(4, 5), ids(index.childrenOf(6)));
    assertEquals(6, index.parentOf(4).orElseThrow().getId());
    assertTrue(index.parentOf(7).isEmpty());
    assertTrue(index.getOperator(99).isEmpty());
    assertTrue(index.childIdsOf(99).isEmpty());
  }

  @Test
  void should_list_roots_of_every_fragment() {
    PlanIndex index = PlanFixtures.plan(SHUFFLE_JOIN).index();

    // producers feed consumers by operator id, not by a child reference
    assertEquals(List.of(1, 3, 7), ids(index.roots()));
  }

  @Test
  void should_report_dangling_references_without_failing() {
    QueryPlan plan =
        QueryPlan.parse(
            "{\"plan\": {\"fragments\": [{\"operators\": ["
                + "{\"opId\": 0, \"opType\": \"FileScan\"},"
                + "{\"opId\": 1, \"opType\": \"SymmetricHashJoin\", \"argChild1\": 0,"
                + " \"argChild2\": 8}]}]}}");

    PlanIndex index = plan.index();

    assertEquals(Map.of(1, Set.of(8)), index.danglingReferences());
    assertEquals(List.of(0), ids(index.childrenOf(1)));
  }

  @Test
  void should_fail_on_duplicate_ids() {
    QueryPlan plan =
        QueryPlan.parse(
            "{\"plan\": {\"fragments\": ["
                + "{\"operators\": [{\"opId\": 0, \"opType\": \"FileScan\"}]},"
                + "{\"operators\": [{\"opId\": 0, \"opType\": \"FileScan\"}]}]}}");

    DuplicateOperatorIdException exception =
        assertThrows(DuplicateOperatorIdException.class, plan::index);

    assertEquals(0, exception.getOperatorId());
  }

  @Test
  void should_fail_on_duplicate_parent_claims() {
    QueryPlan plan = PlanFixtures.plan(DUPLICATE_PARENT);

    assertThrows(DuplicateParentClaimException.class, plan::index);
  }

  @Test
  void should_fail_on_operator_without_id() {
    QueryPlan plan =
        QueryPlan.parse("{\"plan\": {\"fragments\": [{\"operators\": [{\"opType\": \"X\"}]}]}}");

    assertThrows(MissingFieldException.class, plan::index);
  }

  @Test
  void should_not_follow_later_document_changes() {
    // Given
    QueryPlan plan = PlanFixtures.plan(SHUFFLE_JOIN);
    PlanIndex snapshot = plan.index();

    // When
    plan.getOperator(7).orElseThrow().put("argChild", 5);
    plan.getOperator(6).orElseThrow().remove("argChild2");

    // Then
    assertEquals(6, snapshot.parentOf(5).orElseThrow().getId());
    assertEquals(7, plan.index().parentOf(5).orElseThrow().getId());
  }

  private static List<Integer> ids(List<PlanOperator> operators) {
    return operators.stream().map(PlanOperator::getId).collect(Collectors.toList());
  }
}
