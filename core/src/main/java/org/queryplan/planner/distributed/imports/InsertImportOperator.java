/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.ARG_CHILD;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.ARG_OVERWRITE_TABLE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_ID;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_TYPE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.RELATION_KEY;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.queryplan.planner.distributed.document.PlanJsonCodec;

/** Insert of the output of a child operator into the target relation. */
@Getter
@RequiredArgsConstructor
public class InsertImportOperator implements ImportOperatorNode {

  private final int id;

  private final String opType;

  /** Id of the operator whose output is inserted. */
  private final int childId;

  /** Whether the insert replaces the relation contents. */
  private final boolean overwriteTable;

  private final RelationKey relationKey;

  private final Map<String, JsonNode> extraProperties;

  @Override
  public ImportOperatorType getOperatorType() {
    return ImportOperatorType.INSERT;
  }

  @Override
  public ObjectNode toNode() {
    ObjectNode node = PlanJsonCodec.mapper().createObjectNode();
    node.put(OP_ID, id);
    node.put(OP_TYPE, opType);
    node.put(ARG_CHILD, childId);
    node.put(ARG_OVERWRITE_TABLE, overwriteTable);
    node.set(RELATION_KEY, PlanJsonCodec.mapper().valueToTree(relationKey.toProperties()));
    extraProperties.forEach((key, value) -> node.set(key, value.deepCopy()));
    return node;
  }

  @Override
  public String describe() {
    return String.format("%s(id=%d, child=%d, relation=%s)", opType, id, childId, relationKey);
  }
}
