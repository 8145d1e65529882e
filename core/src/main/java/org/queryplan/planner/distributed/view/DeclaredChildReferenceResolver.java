/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.view;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_TYPE;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolves child references from an explicit table of child fields per operator type. Operator
 * types missing from the table are handled by a fallback resolver.
 */
public class DeclaredChildReferenceResolver implements ChildReferenceResolver {

  private final Map<String, Set<String>> childFieldsByType;

  private final ChildReferenceResolver fallback;

  public DeclaredChildReferenceResolver(
      Map<String, ? extends Set<String>> childFieldsByType, ChildReferenceResolver fallback) {
    ImmutableMap.Builder<String, Set<String>> builder = ImmutableMap.builder();
    childFieldsByType.forEach((type, fields) -> builder.put(type, ImmutableSet.copyOf(fields)));
    this.childFieldsByType = builder.build();
    this.fallback = fallback;
  }

  /** Child fields of the operator types the engine ships, naming convention for the rest. */
  public static DeclaredChildReferenceResolver engineDefaults() {
    Set<String> single = Set.of("argChild");
    Set<String> binary = Set.of("argChild1", "argChild2");
    return new DeclaredChildReferenceResolver(
        ImmutableMap.<String, Set<String>>builder()
            .put("FileScan", Set.of())
            .put("DbQueryScan", Set.of())
            .put("TableScan", Set.of())
            .put("DbInsert", single)
            .put("Apply", single)
            .put("Filter", single)
            .put("ColumnSelect", single)
            .put("Aggregate", single)
            .put("SingleGroupByAggregate", single)
            .put("DupElim", single)
            .put("SinkRoot", single)
            .put("CollectProducer", single)
            .put("BroadcastProducer", single)
            .put("ShuffleProducer", single)
            .put("SymmetricHashJoin", binary)
            .put("RightHashJoin", binary)
            .build(),
        NamingConventionChildReferenceResolver.getInstance());
  }

  @Override
  public Set<String> childFields(ObjectNode operator) {
    JsonNode type = operator.get(OP_TYPE);
    if (type != null && type.isTextual() && childFieldsByType.containsKey(type.asText())) {
      return childFieldsByType.get(type.asText());
    }
    return fallback.childFields(operator);
  }
}
