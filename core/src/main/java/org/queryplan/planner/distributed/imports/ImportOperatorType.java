/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

/** Kinds of operators an import fragment is made of. */
public enum ImportOperatorType {

  /** Reads one data source on one worker. */
  SCAN,

  /** Writes the scanned tuples into the target relation. */
  INSERT
}
