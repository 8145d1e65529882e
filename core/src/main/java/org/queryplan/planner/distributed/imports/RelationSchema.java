/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import java.util.Map;

/** Schema of the relation being imported, as the scan operator describes it to the engine. */
public interface RelationSchema {

  /**
   * Serializes the schema into the structured form embedded in the scan operator.
   *
   * @return schema properties, values may be scalars, lists or nested maps
   */
  Map<String, Object> toProperties();
}
