/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import org.queryplan.planner.distributed.document.PlanJsonCodec;

/**
 * One unit of import work: the worker that reads a data source.
 *
 * @param workerId worker the fragment is pinned to
 * @param source opaque data source descriptor copied into the scan operator
 */
public record ImportAssignment(int workerId, JsonNode source) {

  public ImportAssignment {
    Preconditions.checkNotNull(source, "data source of worker %s", workerId);
  }

  /** Assignment whose source is a plain Java value (map, list, scalar). */
  public static ImportAssignment of(int workerId, Object source) {
    Preconditions.checkNotNull(source, "data source of worker %s", workerId);
    return new ImportAssignment(workerId, PlanJsonCodec.mapper().valueToTree(source));
  }
}
