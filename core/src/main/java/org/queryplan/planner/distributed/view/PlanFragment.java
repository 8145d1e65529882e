/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.view;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.OVERRIDE_WORKERS;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.queryplan.exception.MissingFieldException;
import org.queryplan.exception.PlanModelException;
import org.queryplan.planner.distributed.document.PlanMatch;
import org.queryplan.planner.distributed.document.PlanQuery;

/** View over one fragment: the workers eligible to run it and its operators. */
public class PlanFragment {

  private final PlanMatch match;

  public PlanFragment(PlanMatch match) {
    this.match = match;
  }

  /** Backing fragment object. */
  public ObjectNode getNode() {
    return match.getValue();
  }

  /** Location of the fragment inside the document. */
  public JsonPointer getPath() {
    return match.getPath();
  }

  /** Position of the fragment in the plan. */
  public int getIndex() {
    return match.getIndex();
  }

  public QueryPlan getPlan() {
    return match.getPlan();
  }

  /**
   * Returns the worker ids eligible to run this fragment.
   *
   * @return worker ids in document order
   */
  public List<Integer> getWorkers() {
    JsonNode workers = getNode().get(OVERRIDE_WORKERS);
    if (workers == null || !workers.isArray()) {
      throw new MissingFieldException(OVERRIDE_WORKERS, getPath().toString());
    }
    List<Integer> result = new ArrayList<>(workers.size());
    for (JsonNode worker : workers) {
      if (!worker.canConvertToInt() || !worker.isIntegralNumber()) {
        throw new PlanModelException(
            "Worker id " + worker + " of fragment " + getPath() + " is not an integer");
      }
      result.add(worker.intValue());
    }
    return result;
  }

  /** Operators of this fragment in document order, computed from the current document. */
  public List<PlanOperator> getOperators() {
    return PlanQuery.operators(match).map(PlanOperator::new).collect(Collectors.toList());
  }

  PlanMatch getMatch() {
    return match;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PlanFragment && ((PlanFragment) o).getNode() == getNode();
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(getNode());
  }

  @Override
  public String toString() {
    return "PlanFragment{path='" + getPath() + "', node=" + getNode() + '}';
  }
}
