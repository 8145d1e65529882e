/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.imports;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.FRAGMENTS;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.LANGUAGE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.LOGICAL_RA;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OPERATORS;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_ID;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OP_TYPE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.OVERRIDE_WORKERS;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.PLAN;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.PLAN_TYPE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.PROFILING_MODE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.RAW_QUERY;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.queryplan.common.setting.Settings.Key;
import org.queryplan.exception.InvalidOverrideException;
import org.queryplan.planner.distributed.document.PlanJsonCodec;
import org.queryplan.planner.distributed.view.NamingConventionChildReferenceResolver;
import org.queryplan.planner.distributed.view.QueryPlan;
import org.queryplan.setting.PlanSettings;

/**
 * Builds plans that import data in parallel: one fragment per {@link ImportAssignment}, each
 * pinned to the assignment's worker and holding a scan of the assignment's source followed by an
 * insert of the scanned tuples into the target relation.
 *
 * <pre>
 * work = [(1, srcA), (2, srcB)]
 *
 * fragments[0] workers=[1]: FileScan(opId=0, source=srcA) &lt;- DbInsert(opId=1, argChild=0)
 * fragments[1] workers=[2]: FileScan(opId=2, source=srcB) &lt;- DbInsert(opId=3, argChild=2)
 * </pre>
 *
 * <p>Operator ids are unique across the plan and form the range {@code 0 .. 2N-1} for N
 * assignments. Caller parameters are overlaid on every generated operator, except for the
 * operator id and child reference keys, which the builder owns.
 */
@Log4j2
public class ParallelImportPlanBuilder {

  private static final int OPERATORS_PER_FRAGMENT = 2;

  private final PlanSettings settings;

  private final ObjectMapper mapper = PlanJsonCodec.mapper();

  public ParallelImportPlanBuilder() {
    this(PlanSettings.defaults());
  }

  public ParallelImportPlanBuilder(PlanSettings settings) {
    this.settings = Preconditions.checkNotNull(settings, "plan settings");
  }

  /**
   * Builds the plan document.
   *
   * @param request import inputs
   * @return new plan document
   * @throws InvalidOverrideException if scan or insert parameters set a builder owned key
   */
  public ObjectNode build(ImportPlanRequest request) {
    Preconditions.checkNotNull(request, "import plan request");
    Preconditions.checkNotNull(request.getSchema(), "relation schema");
    Preconditions.checkNotNull(request.getRelationKey(), "relation key");
    Preconditions.checkNotNull(request.getWork(), "import work");

    FragmentTemplate template = template(request);

    ArrayNode fragments = mapper.createArrayNode();
    OperatorIdAllocator allocator = OperatorIdAllocator.fromZero();
    for (ImportAssignment assignment : request.getWork()) {
      OperatorIdAllocator.Allocation allocation = allocator.allocate(OPERATORS_PER_FRAGMENT);
      allocator = allocation.next();
      fragments.add(fragment(assignment.workerId(), template.operators(assignment, allocation)));
    }

    ObjectNode document = mapper.createObjectNode();
    String text = Strings.nullToEmpty(request.getText());
    document.put(RAW_QUERY, text);
    document.put(LOGICAL_RA, text);
    document.put(LANGUAGE, settings.getString(Key.IMPORT_LANGUAGE));
    document.put(PROFILING_MODE, settings.getBoolean(Key.IMPORT_PROFILING));
    ObjectNode plan = document.putObject(PLAN);
    plan.put(PLAN_TYPE, settings.getString(Key.IMPORT_PLAN_KIND));
    plan.set(FRAGMENTS, fragments);

    log.info(
        "Built import plan into {} with {} fragments and {} operators",
        request.getRelationKey(),
        fragments.size(),
        allocator.peek());
    return document;
  }

  /** Builds the plan document and wraps it in a view configured from the same settings. */
  public QueryPlan buildPlan(ImportPlanRequest request) {
    return QueryPlan.of(build(request), settings);
  }

  /**
   * Resolves what every fragment of the request shares: operator types, caller overrides, the
   * serialized schema and the insert target.
   *
   * @throws InvalidOverrideException if scan or insert parameters set a builder owned key
   */
  FragmentTemplate template(ImportPlanRequest request) {
    Map<String, JsonNode> scanOverrides =
        overrides(request.getScanParameters(), ImportOperatorType.SCAN);
    Map<String, JsonNode> insertOverrides =
        overrides(request.getInsertParameters(), ImportOperatorType.INSERT);
    return new FragmentTemplate(
        operatorType(scanOverrides, request.getScanType(), Key.IMPORT_SCAN_TYPE),
        scanOverrides,
        mapper.valueToTree(request.getSchema().toProperties()),
        operatorType(insertOverrides, request.getInsertType(), Key.IMPORT_INSERT_TYPE),
        insertOverrides,
        settings.getBoolean(Key.IMPORT_OVERWRITE),
        request.getRelationKey());
  }

  private ObjectNode fragment(int workerId, List<ImportOperatorNode> operators) {
    ObjectNode fragment = mapper.createObjectNode();
    fragment.putArray(OVERRIDE_WORKERS).add(workerId);
    ArrayNode operatorArray = fragment.putArray(OPERATORS);
    for (ImportOperatorNode operator : operators) {
      operatorArray.add(operator.toNode());
      log.debug(
          "Worker {} {} operator {}: {}",
          workerId,
          operator.getOperatorType(),
          operator.getId(),
          operator.describe());
    }
    return fragment;
  }

  /** Converts caller parameters to document nodes, rejecting keys the builder owns. */
  private Map<String, JsonNode> overrides(Map<String, Object> parameters, ImportOperatorType kind) {
    Map<String, JsonNode> overrides = new LinkedHashMap<>();
    if (parameters == null) {
      return overrides;
    }
    parameters.forEach(
        (key, value) -> {
          if (OP_ID.equals(key) || NamingConventionChildReferenceResolver.isChildReferenceKey(key)) {
            throw new InvalidOverrideException(key, kind.name());
          }
          overrides.put(key, mapper.valueToTree(value));
        });
    return overrides;
  }

  /**
   * Resolves the operator type. An {@code opType} parameter wins over the request field, which
   * wins over the configured default. The parameter is moved out of the overrides so the typed
   * field carries it.
   */
  private String operatorType(Map<String, JsonNode> overrides, String requested, Key defaultKey) {
    JsonNode parameter = overrides.remove(OP_TYPE);
    if (parameter != null && !parameter.isNull()) {
      return parameter.asText();
    }
    if (!Strings.isNullOrEmpty(requested)) {
      return requested;
    }
    return settings.getString(defaultKey);
  }

  /**
   * Operator settings shared by every fragment of one plan.
   *
   * @param scanType engine type of the scans
   * @param scanOverrides caller properties overlaid on every scan
   * @param schema serialized relation schema
   * @param insertType engine type of the inserts
   * @param insertOverrides caller properties overlaid on every insert
   * @param overwrite whether inserts replace the relation contents
   * @param relationKey relation the inserts write into
   */
  record FragmentTemplate(
      String scanType,
      Map<String, JsonNode> scanOverrides,
      JsonNode schema,
      String insertType,
      Map<String, JsonNode> insertOverrides,
      boolean overwrite,
      RelationKey relationKey) {

    /** Scan of the assignment's source followed by the insert consuming it. */
    List<ImportOperatorNode> operators(
        ImportAssignment assignment, OperatorIdAllocator.Allocation allocation) {
      ScanImportOperator scan =
          new ScanImportOperator(
              allocation.get(0), scanType, schema, assignment.source(), scanOverrides);
      InsertImportOperator insert =
          new InsertImportOperator(
              allocation.get(1), insertType, scan.getId(), overwrite, relationKey, insertOverrides);
      return List.of(scan, insert);
    }
  }
}
