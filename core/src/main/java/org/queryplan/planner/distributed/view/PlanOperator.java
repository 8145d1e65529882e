/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.view;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_ID;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_NAME;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_TYPE;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.queryplan.exception.DuplicateParentClaimException;
import org.queryplan.exception.MissingFieldException;
import org.queryplan.exception.PlanModelException;
import org.queryplan.planner.distributed.document.PlanJsonCodec;
import org.queryplan.planner.distributed.document.PlanMatch;

/**
 * View over one operator.
 *
 * <p>Property access reads and writes the backing operator object in place. Structural relations
 * (children, parent) are derived from the child reference properties every time they are asked
 * for, by scanning the whole plan; use {@link QueryPlan#index()} when many lookups are needed.
 */
@Log4j2
public class PlanOperator {

  /** Stands in for the id of a claimant that has no integer id. */
  static final int UNKNOWN_ID = -1;

  private final PlanMatch match;

  public PlanOperator(PlanMatch match) {
    this.match = match;
  }

  /** Backing operator object. */
  public ObjectNode getNode() {
    return match.getValue();
  }

  /** Location of the operator inside the document. */
  public JsonPointer getPath() {
    return match.getPath();
  }

  public QueryPlan getPlan() {
    return match.getPlan();
  }

  /** Fragment this operator was found in. */
  public PlanFragment getFragment() {
    return new PlanFragment(match.getContext());
  }

  /** Operator id, unique across the plan. */
  public int getId() {
    JsonNode id = get(OP_ID);
    if (!id.isIntegralNumber() || !id.canConvertToInt()) {
      throw new PlanModelException(
          "Operator id at " + getPath() + " must be an integer but was " + id);
    }
    return id.intValue();
  }

  /** Operator id, or empty if the operator has no integer id. */
  public Optional<Integer> findId() {
    JsonNode id = getNode().get(OP_ID);
    if (id == null || !id.isIntegralNumber() || !id.canConvertToInt()) {
      return Optional.empty();
    }
    return Optional.of(id.intValue());
  }

  /** Display label; optional on the wire. */
  public Optional<String> getName() {
    return find(OP_NAME).filter(JsonNode::isTextual).map(JsonNode::asText);
  }

  /** Operator kind, e.g. {@code FileScan} or {@code DbInsert}. */
  public String getType() {
    return get(OP_TYPE).asText();
  }

  /**
   * Returns a property value.
   *
   * @param key property name
   * @return live property node
   * @throws MissingFieldException if the operator has no such property
   */
  public JsonNode get(String key) {
    JsonNode value = getNode().get(key);
    if (value == null) {
      throw new MissingFieldException(key, getPath().toString());
    }
    return value;
  }

  public Optional<JsonNode> find(String key) {
    return Optional.ofNullable(getNode().get(key));
  }

  /** Sets a property on the backing operator object. */
  public PlanOperator put(String key, JsonNode value) {
    getNode().set(key, value);
    return this;
  }

  /** Sets a property, converting a plain Java value (scalar, map, list) into a document node. */
  public PlanOperator put(String key, Object value) {
    return put(key, (JsonNode) PlanJsonCodec.mapper().valueToTree(value));
  }

  /**
   * Removes a property.
   *
   * @param key property name
   * @return previous value, empty if the property was absent
   */
  public Optional<JsonNode> remove(String key) {
    return Optional.ofNullable(getNode().remove(key));
  }

  public boolean containsKey(String key) {
    return getNode().has(key);
  }

  /** Property names in document order. */
  public List<String> keys() {
    return ImmutableList.copyOf(getNode().fieldNames());
  }

  /** Property name and value pairs in document order. */
  public List<Map.Entry<String, JsonNode>> entries() {
    ImmutableList.Builder<Map.Entry<String, JsonNode>> entries = ImmutableList.builder();
    getNode()
        .fields()
        .forEachRemaining(e -> entries.add(new AbstractMap.SimpleImmutableEntry<>(e)));
    return entries.build();
  }

  public int size() {
    return getNode().size();
  }

  /** Ids this operator references as children. */
  public Set<Integer> getChildIds() {
    return getPlan().getChildReferenceResolver().childIds(getNode());
  }

  /**
   * Resolves the child references against every operator of the plan. References to ids that no
   * operator carries resolve to nothing.
   *
   * @return child operators in plan order
   */
  public List<PlanOperator> getChildren() {
    Set<Integer> childIds = getChildIds();
    if (childIds.isEmpty()) {
      return List.of();
    }
    return getPlan().getOperators().stream()
        .filter(op -> op.findId().filter(childIds::contains).isPresent())
        .collect(Collectors.toList());
  }

  /**
   * Finds the operator that lists this operator as a child by scanning the whole plan.
   *
   * @return parent operator, empty if no operator references this one
   * @throws DuplicateParentClaimException if several operators claim this operator and the plan
   *     resolves parents strictly
   */
  public Optional<PlanOperator> getParent() {
    int id = getId();
    PlanOperator parent = null;
    for (PlanOperator candidate : getPlan().getOperators()) {
      if (!candidate.getChildIds().contains(id)) {
        continue;
      }
      if (parent == null) {
        parent = candidate;
        continue;
      }
      if (getPlan().getParentResolution() == ParentResolution.STRICT) {
        throw new DuplicateParentClaimException(
            id, parent.findId().orElse(UNKNOWN_ID), candidate.findId().orElse(UNKNOWN_ID));
      }
      log.warn(
          "Operator {} is claimed by operators {} and {}, using the first one",
          id,
          parent.findId().orElse(null),
          candidate.findId().orElse(null));
      break;
    }
    return Optional.ofNullable(parent);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PlanOperator && ((PlanOperator) o).getNode() == getNode();
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(getNode());
  }

  @Override
  public String toString() {
    return "PlanOperator{path='" + getPath() + "', node=" + getNode() + '}';
  }
}
