/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

/**
 * Operator of an import fragment before it is rendered into the plan document. Known properties
 * are typed fields; caller overrides are kept as extra properties and rendered after them.
 */
public interface ImportOperatorNode {

  ImportOperatorType getOperatorType();

  /** Plan-wide unique id. */
  int getId();

  /** Engine operator type, e.g. {@code FileScan}. */
  String getOpType();

  /** Caller supplied properties overlaid on the typed ones. */
  Map<String, JsonNode> getExtraProperties();

  /** Renders the operator as a new document node. */
  ObjectNode toNode();

  /** Returns a string representation of this operator's configuration. */
  String describe();
}
