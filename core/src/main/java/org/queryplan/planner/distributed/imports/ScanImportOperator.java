/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_ID;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_TYPE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.SCHEMA;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.SOURCE;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.queryplan.planner.distributed.document.PlanJsonCodec;

/** Scan of one data source with the relation schema. */
@Getter
@RequiredArgsConstructor
public class ScanImportOperator implements ImportOperatorNode {

  private final int id;

  private final String opType;

  /** Serialized relation schema. */
  private final JsonNode schema;

  /** Data source descriptor. */
  private final JsonNode source;

  private final Map<String, JsonNode> extraProperties;

  @Override
  public ImportOperatorType getOperatorType() {
    return ImportOperatorType.SCAN;
  }

  @Override
  public ObjectNode toNode() {
    ObjectNode node = PlanJsonCodec.mapper().createObjectNode();
    node.put(OP_ID, id);
    node.put(OP_TYPE, opType);
    node.set(SCHEMA, schema.deepCopy());
    node.set(SOURCE, source.deepCopy());
    extraProperties.forEach((key, value) -> node.set(key, value.deepCopy()));
    return node;
  }

  @Override
  public String describe() {
    return String.format("%s(id=%d, source=%s)", opType, id, source);
  }
}
