/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Inputs of a parallel-import plan. */
@Getter
@Builder
@ToString
public class ImportPlanRequest {

  /** Schema of the imported relation. */
  private final RelationSchema schema;

  /** Relation the inserts write into. */
  private final RelationKey relationKey;

  /** One fragment is built per assignment, in this order. */
  @Builder.Default private final List<ImportAssignment> work = List.of();

  /** Description, written as both the raw query and the logical plan text. */
  @Builder.Default private final String text = "";

  /** Properties overlaid on every scan operator. */
  @Builder.Default private final Map<String, Object> scanParameters = Map.of();

  /** Properties overlaid on every insert operator. */
  @Builder.Default private final Map<String, Object> insertParameters = Map.of();

  /** Scan operator type, null to use the configured default. */
  private final String scanType;

  /** Insert operator type, null to use the configured default. */
  private final String insertType;
}
