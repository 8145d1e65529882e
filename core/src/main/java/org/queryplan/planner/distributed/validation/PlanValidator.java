/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.validation;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.FRAGMENTS;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OPERATORS;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_ID;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_TYPE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OVERRIDE_WORKERS;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.PLAN;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.queryplan.exception.DanglingChildReferenceException;
import org.queryplan.exception.DuplicateOperatorIdException;
import org.queryplan.exception.DuplicateParentClaimException;
import org.queryplan.exception.MissingFieldException;
import org.queryplan.exception.PlanModelException;
import org.queryplan.planner.distributed.view.PlanFragment;
import org.queryplan.planner.distributed.view.PlanOperator;
import org.queryplan.planner.distributed.view.QueryPlan;

/**
 * Checks the structural rules of a plan document that the document shape itself does not enforce:
 *
 * <ul>
 *   <li>the plan has a fragment list, and every fragment has workers and operators
 *   <li>every operator has an integer id and a type
 *   <li>operator ids are unique across the whole plan
 *   <li>every child reference points at an operator of the plan
 *   <li>no operator is claimed as a child by more than one operator
 * </ul>
 */
@Log4j2
public class PlanValidator {

  /**
   * Validates the plan.
   *
   * @param plan plan view
   * @return list of error messages, empty if the plan is valid
   */
  public List<String> validate(QueryPlan plan) {
    List<String> errors =
        violations(plan).stream().map(PlanModelException::getMessage).collect(Collectors.toList());
    errors.forEach(error -> log.debug("Plan validation error: {}", error));
    return errors;
  }

  /**
   * Validates the plan and throws the first violation found.
   *
   * @param plan plan view
   * @throws PlanModelException the first violation, as its specific subtype
   */
  public void validateOrThrow(QueryPlan plan) {
    List<PlanModelException> violations = violations(plan);
    if (!violations.isEmpty()) {
      throw violations.get(0);
    }
  }

  /** Violations in check order: document shape, duplicate ids, dangling references, parents. */
  List<PlanModelException> violations(QueryPlan plan) {
    List<PlanModelException> violations = new ArrayList<>();

    JsonNode planNode = plan.getDocument().get(PLAN);
    if (planNode == null || !planNode.isObject()) {
      violations.add(new MissingFieldException(PLAN, ""));
      return violations;
    }
    JsonNode fragments = planNode.get(FRAGMENTS);
    if (fragments == null || !fragments.isArray()) {
      violations.add(new MissingFieldException(FRAGMENTS, "/" + PLAN));
      return violations;
    }

    Map<Integer, List<PlanOperator>> operatorsById = new LinkedHashMap<>();
    for (PlanFragment fragment : plan.getFragments()) {
      checkFragment(fragment, violations);
      for (PlanOperator operator : fragment.getOperators()) {
        Optional<Integer> id = checkOperator(operator, violations);
        id.ifPresent(i -> operatorsById.computeIfAbsent(i, k -> new ArrayList<>()).add(operator));
      }
    }

    operatorsById.forEach(
        (id, operators) -> {
          if (operators.size() > 1) {
            violations.add(new DuplicateOperatorIdException(id));
          }
        });

    Map<Integer, Integer> parents = new LinkedHashMap<>();
    Set<String> reportedClaims = new LinkedHashSet<>();
    for (PlanOperator operator : plan.getOperators()) {
      Optional<Integer> id = operator.findId();
      if (id.isEmpty()) {
        continue;
      }
      for (Integer childId : operator.getChildIds()) {
        if (!operatorsById.containsKey(childId)) {
          violations.add(new DanglingChildReferenceException(id.get(), childId));
          continue;
        }
        Integer previous = parents.putIfAbsent(childId, id.get());
        if (previous != null && reportedClaims.add(childId + "/" + id.get())) {
          violations.add(new DuplicateParentClaimException(childId, previous, id.get()));
        }
      }
    }
    return violations;
  }

  private void checkFragment(PlanFragment fragment, List<PlanModelException> violations) {
    String path = fragment.getPath().toString();
    JsonNode workers = fragment.getNode().get(OVERRIDE_WORKERS);
    if (workers == null || !workers.isArray()) {
      violations.add(new MissingFieldException(OVERRIDE_WORKERS, path));
    } else if (workers.isEmpty()) {
      violations.add(new PlanModelException("Fragment " + path + " has no workers"));
    } else {
      for (JsonNode worker : workers) {
        if (!worker.isIntegralNumber() || !worker.canConvertToInt()) {
          violations.add(
              new PlanModelException(
                  "Worker id " + worker + " of fragment " + path + " is not an integer"));
        }
      }
    }
    JsonNode operators = fragment.getNode().get(OPERATORS);
    if (operators == null || !operators.isArray()) {
      violations.add(new MissingFieldException(OPERATORS, path));
    } else if (operators.isEmpty()) {
      violations.add(new PlanModelException("Fragment " + path + " has no operators"));
    }
  }

  private Optional<Integer> checkOperator(
      PlanOperator operator, List<PlanModelException> violations) {
    String path = operator.getPath().toString();
    if (!operator.containsKey(OP_TYPE)) {
      violations.add(new MissingFieldException(OP_TYPE, path));
    }
    if (!operator.containsKey(OP_ID)) {
      violations.add(new MissingFieldException(OP_ID, path));
      return Optional.empty();
    }
    Optional<Integer> id = operator.findId();
    if (id.isEmpty()) {
      violations.add(
          new PlanModelException(
              "Operator id at " + path + " must be an integer but was " + operator.get(OP_ID)));
    }
    return id;
  }
}
