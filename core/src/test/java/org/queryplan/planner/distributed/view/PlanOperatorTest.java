/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.queryplan.planner.distributed.PlanFixtures.DUPLICATE_PARENT;
import static org.queryplan.planner.distributed.PlanFixtures.SHUFFLE_JOIN;
import static org.queryplan.planner.distributed.PlanFixtures.TWO_FRAGMENT_IMPORT;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.queryplan.exception.DuplicateParentClaimException;
import org.queryplan.exception.MissingFieldException;
import org.queryplan.exception.PlanModelException;
import org.queryplan.planner.distributed.PlanFixtures;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanOperatorTest {

  @Test
  void should_expose_id_name_and_type() {
    QueryPlan plan = PlanFixtures.plan(TWO_FRAGMENT_IMPORT);

    PlanOperator scan = plan.getOperators().get(0);
    PlanOperator secondScan = plan.getOperators().get(2);

    assertEquals(0, scan.getId());
    assertEquals("FileScan", scan.getType());
    assertEquals("scan A", scan.getName().orElseThrow());
    assertTrue(secondScan.getName().isEmpty());
  }

  @Test
  void should_fail_with_missing_field_for_absent_property() {
    PlanOperator scan = PlanFixtures.plan(TWO_FRAGMENT_IMPORT).getOperators().get(0);

    MissingFieldException exception =
        assertThrows(MissingFieldException.class, () -> scan.get("relationKey"));

    assertEquals("relationKey", exception.getFieldName());
    assertEquals("/plan/fragments/0/operators/0", exception.getPath());
    assertTrue(scan.find("relationKey").isEmpty());
  }

  @Test
  void should_reject_non_integer_id() {
    QueryPlan plan =
        QueryPlan.parse(
            "{\"plan\": {\"fragments\": [{\"operators\": [{\"opId\": \"a\", \"opType\": \"X\"}]}]}}");

    PlanOperator operator = plan.getOperators().get(0);

    assertThrows(PlanModelException.class, operator::getId);
    assertTrue(operator.findId().isEmpty());
  }

  @Test
  void should_read_and_write_properties_in_place() {
    // Given
    QueryPlan plan = PlanFixtures.plan(TWO_FRAGMENT_IMPORT);
    PlanOperator insert = plan.getOperators().get(1);

    // When
    insert.put("opName", new TextNode("renamed"));
    insert.put("argPartitions", List.of(1, 2));
    insert.put("options", Map.of("compress", true));
    JsonNode removed = insert.remove("argOverwriteTable").orElseThrow();

    // Then
    JsonNode node = plan.getDocument().at("/plan/fragments/0/operators/1");
    assertEquals("renamed", node.get("opName").asText());
    assertEquals(2, node.get("argPartitions").size());
    assertTrue(node.get("options").get("compress").booleanValue());
    assertTrue(removed.booleanValue());
    assertFalse(insert.containsKey("argOverwriteTable"));
    assertTrue(insert.remove("argOverwriteTable").isEmpty());
  }

  @Test
  void should_iterate_properties_in_document_order() {
    PlanOperator insert = PlanFixtures.plan(TWO_FRAGMENT_IMPORT).getOperators().get(1);

    assertEquals(
        List.of("opId", "opName", "opType", "argChild", "argOverwriteTable", "relationKey"),
        insert.keys());
    assertEquals(6, insert.size());
    assertEquals("opId", insert.entries().get(0).getKey());
    assertEquals(1, insert.entries().get(0).getValue().intValue());
  }

  @Test
  void should_derive_children_from_child_named_integer_properties() {
    QueryPlan plan = PlanFixtures.plan(SHUFFLE_JOIN);

    PlanOperator join = plan.getOperator(6).orElseThrow();
    PlanOperator consumer = plan.getOperator(4).orElseThrow();

    assertEquals(Set.of(4, 5), join.getChildIds());
    assertEquals(
        List.of(4, 5),
        join.getChildren().stream().map(PlanOperator::getId).collect(Collectors.toList()));
    assertTrue(consumer.getChildIds().isEmpty());
  }

  @Test
  void should_ignore_non_integer_child_values_and_dangling_ids() {
    QueryPlan plan =
        QueryPlan.parse(
            "{\"plan\": {\"fragments\": [{\"operators\": ["
                + "{\"opId\": 0, \"opType\": \"X\", \"argChild\": \"1\", \"childFlag\": true,"
                + " \"CHILD_ID\": 7, \"argChildren\": [1]}]}]}}");

    PlanOperator operator = plan.getOperators().get(0);

    assertEquals(Set.of(7), operator.getChildIds());
    assertTrue(operator.getChildren().isEmpty());
  }

  @Test
  void should_derive_parent_and_fragment() {
    QueryPlan plan = PlanFixtures.plan(SHUFFLE_JOIN);

    PlanOperator consumer = plan.getOperator(5).orElseThrow();
    PlanOperator insert = plan.getOperator(7).orElseThrow();

    assertEquals(6, consumer.getParent().orElseThrow().getId());
    assertTrue(insert.getParent().isEmpty());
    assertEquals(plan.getFragments().get(2), consumer.getFragment());
    assertSame(plan, consumer.getPlan());
  }

  @Test
  void should_fail_on_duplicate_parent_claim_when_strict() {
    PlanOperator scan = PlanFixtures.plan(DUPLICATE_PARENT).getOperator(0).orElseThrow();

    DuplicateParentClaimException exception =
        assertThrows(DuplicateParentClaimException.class, scan::getParent);

    assertEquals(0, exception.getChildId());
    assertEquals(1, exception.getFirstParentId());
    assertEquals(2, exception.getSecondParentId());
  }

  @Test
  void should_report_duplicate_parent_claim_when_a_claimant_has_no_id() {
    QueryPlan plan =
        QueryPlan.parse(
            "{\"plan\": {\"fragments\": [{\"operators\": ["
                + "{\"opId\": 0, \"opType\": \"FileScan\"},"
                + "{\"opType\": \"DbInsert\", \"argChild\": 0},"
                + "{\"opId\": 2, \"opType\": \"DbInsert\", \"argChild\": 0}]}]}}");
    PlanOperator scan = plan.getOperator(0).orElseThrow();

    DuplicateParentClaimException exception =
        assertThrows(DuplicateParentClaimException.class, scan::getParent);

    assertEquals(0, exception.getChildId());
    assertEquals(PlanOperator.UNKNOWN_ID, exception.getFirstParentId());
    assertEquals(2, exception.getSecondParentId());
  }

  @Test
  void should_pick_first_claimant_when_first_match() {
    QueryPlan plan =
        new QueryPlan(
            PlanFixtures.document(DUPLICATE_PARENT),
            NamingConventionChildReferenceResolver.getInstance(),
            ParentResolution.FIRST_MATCH);

    assertEquals(1, plan.getOperator(0).orElseThrow().getParent().orElseThrow().getId());
  }
}
