/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.document;

import com.fasterxml.jackson.core.JsonPointer;

/**
 * Field names of the plan document exchanged with the execution engine.
 *
 * <pre>
 * { rawQuery, logicalRa, language, profilingMode,
 *   plan: { type, fragments: [ { overrideWorkers: [int], operators: [ { opId, opName, opType, ... } ] } ] } }
 * </pre>
 */
public final class PlanDocumentFields {

  public static final String RAW_QUERY = "rawQuery";
  public static final String LOGICAL_RA = "logicalRa";
  public static final String LANGUAGE = "language";
  public static final String PROFILING_MODE = "profilingMode";
  public static final String PLAN = "plan";
  public static final String PLAN_TYPE = "type";
  public static final String FRAGMENTS = "fragments";

  public static final String OVERRIDE_WORKERS = "overrideWorkers";
  public static final String OPERATORS = "operators";

  public static final String OP_ID = "opId";
  public static final String OP_NAME = "opName";
  public static final String OP_TYPE = "opType";

  /** Scan operator payload. */
  public static final String SCHEMA = "schema";
  public static final String SOURCE = "source";

  /** Insert operator payload. */
  public static final String ARG_CHILD = "argChild";
  public static final String ARG_OVERWRITE_TABLE = "argOverwriteTable";
  public static final String RELATION_KEY = "relationKey";

  /** Location of the fragment array inside the document. */
  public static final JsonPointer FRAGMENTS_POINTER =
      JsonPointer.compile("/" + PLAN + "/" + FRAGMENTS);

  private PlanDocumentFields() {}
}
