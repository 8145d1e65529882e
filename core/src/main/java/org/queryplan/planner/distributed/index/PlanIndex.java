/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.queryplan.exception.DuplicateOperatorIdException;
import org.queryplan.exception.DuplicateParentClaimException;
import org.queryplan.planner.distributed.view.PlanOperator;
import org.queryplan.planner.distributed.view.QueryPlan;

/**
 * Snapshot of the operators of a plan keyed by id, with forward (parent to children) and reverse
 * (child to parent) edges computed once.
 *
 * <p>The snapshot does not follow later changes to the document. Build a new one through {@link
 * QueryPlan#index()} after adding, removing or rewiring operators.
 */
public class PlanIndex {

  private final Map<Integer, PlanOperator> operators;

  private final Map<Integer, Set<Integer>> children;

  private final Map<Integer, Integer> parents;

  private PlanIndex(
      Map<Integer, PlanOperator> operators,
      Map<Integer, Set<Integer>> children,
      Map<Integer, Integer> parents) {
    this.operators = Collections.unmodifiableMap(operators);
    this.children = Collections.unmodifiableMap(children);
    this.parents = Collections.unmodifiableMap(parents);
  }

  /**
   * Indexes every operator of the plan.
   *
   * @param plan plan view
   * @return index
   * @throws DuplicateOperatorIdException if two operators share an id
   * @throws DuplicateParentClaimException if two operators reference the same child
   */
  public static PlanIndex build(QueryPlan plan) {
    Map<Integer, PlanOperator> operators = new LinkedHashMap<>();
    Map<Integer, Set<Integer>> children = new LinkedHashMap<>();
    for (PlanOperator operator : plan.getOperators()) {
      int id = operator.getId();
      if (operators.putIfAbsent(id, operator) != null) {
        throw new DuplicateOperatorIdException(id);
      }
      children.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(operator.getChildIds())));
    }

    Map<Integer, Integer> parents = new LinkedHashMap<>();
    children.forEach(
        (parentId, childIds) -> {
          for (Integer childId : childIds) {
            Integer previous = parents.putIfAbsent(childId, parentId);
            if (previous != null) {
              throw new DuplicateParentClaimException(childId, previous, parentId);
            }
          }
        });
    return new PlanIndex(operators, children, parents);
  }

  public Optional<PlanOperator> getOperator(int operatorId) {
    return Optional.ofNullable(operators.get(operatorId));
  }

  /** Operator ids in plan order. */
  public Set<Integer> getOperatorIds() {
    return operators.keySet();
  }

  public int size() {
    return operators.size();
  }

  /** Ids referenced as children by the operator, including dangling ones. */
  public Set<Integer> childIdsOf(int operatorId) {
    return children.getOrDefault(operatorId, Set.of());
  }

  /** Children of the operator that exist in the plan, in reference order. */
  public List<PlanOperator> childrenOf(int operatorId) {
    return childIdsOf(operatorId).stream()
        .filter(operators::containsKey)
        .map(operators::get)
        .collect(Collectors.toList());
  }

  public Optional<PlanOperator> parentOf(int operatorId) {
    Integer parentId = parents.get(operatorId);
    return parentId == null ? Optional.empty() : getOperator(parentId);
  }

  /** Operators no other operator references, i.e. the sinks of the data flow. */
  public List<PlanOperator> roots() {
    return operators.entrySet().stream()
        .filter(e -> !parents.containsKey(e.getKey()))
        .map(Map.Entry::getValue)
        .collect(Collectors.toList());
  }

  /**
   * Child references pointing at ids no operator carries.
   *
   * @return operator id to the missing child ids it references
   */
  public Map<Integer, Set<Integer>> danglingReferences() {
    Map<Integer, Set<Integer>> dangling = new LinkedHashMap<>();
    children.forEach(
        (operatorId, childIds) -> {
          Set<Integer> missing =
              childIds.stream()
                  .filter(childId -> !operators.containsKey(childId))
                  .collect(Collectors.toCollection(LinkedHashSet::new));
          if (!missing.isEmpty()) {
            dangling.put(operatorId, missing);
          }
        });
    return dangling;
  }

  @Override
  public String toString() {
    return "PlanIndex{operators=" + operators.size() + ", edges=" + parents.size() + '}';
  }
}
