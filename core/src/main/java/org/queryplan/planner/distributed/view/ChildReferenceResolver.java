/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.view;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides which properties of an operator are references to child operators. A child reference
 * is a data-flow edge: the operator consumes the output of the referenced operator.
 */
public interface ChildReferenceResolver {

  /**
   * Returns the names of the properties of this operator that may hold child references.
   *
   * @param operator operator object
   * @return child reference property names
   */
  Set<String> childFields(ObjectNode operator);

  /**
   * Returns the operator ids this operator references as children. Only integer values count.
   *
   * @param operator operator object
   * @return referenced ids, in property order
   */
  default Set<Integer> childIds(ObjectNode operator) {
    Set<Integer> ids = new LinkedHashSet<>();
    for (String field : childFields(operator)) {
      JsonNode value = operator.get(field);
      if (value != null && value.isIntegralNumber() && value.canConvertToInt()) {
        ids.add(value.intValue());
      }
    }
    return ids;
  }
}
