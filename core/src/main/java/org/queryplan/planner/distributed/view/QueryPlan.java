/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.view;

import static org.queryplan.planner.distributed.document.PlanDocumentFields.LANGUAGE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.LOGICAL_RA;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.PLAN;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.PLAN_TYPE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.PROFILING_MODE;
import static org.queryplan.planner.distributed.document.PlanDocumentFields.RAW_QUERY;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.queryplan.exception.MissingFieldException;
import org.queryplan.exception.PlanModelException;
import org.queryplan.planner.distributed.document.PlanJsonCodec;
import org.queryplan.planner.distributed.document.PlanQuery;
import org.queryplan.planner.distributed.index.PlanIndex;
import org.queryplan.planner.distributed.validation.PlanValidator;
import org.queryplan.setting.PlanSettings;

/**
 * Read/write view over a plan document.
 *
 * <p>The view holds no state of its own besides the document. Fragment and operator views are
 * computed from the document on every call, so a change made through any view, or directly to the
 * document, is visible immediately:
 *
 * <pre>
 * QueryPlan
 *   fragments[0] (workers=[1]): scan(opId=0) &lt;- insert(opId=1, argChild=0)
 *   fragments[1] (workers=[2]): scan(opId=2) &lt;- insert(opId=3, argChild=2)
 * </pre>
 *
 * <p>Views are not synchronized. Concurrent mutation of one document must be serialized by the
 * caller.
 */
@Getter
public class QueryPlan {

  /** Backing document. */
  private final ObjectNode document;

  /** Child edge discovery used by operator views of this plan. */
  private final ChildReferenceResolver childReferenceResolver;

  /** Parent lookup policy used by operator views of this plan. */
  private final ParentResolution parentResolution;

  public QueryPlan(
      ObjectNode document,
      ChildReferenceResolver childReferenceResolver,
      ParentResolution parentResolution) {
    this.document = Preconditions.checkNotNull(document, "plan document");
    this.childReferenceResolver =
        Preconditions.checkNotNull(childReferenceResolver, "child reference resolver");
    this.parentResolution = Preconditions.checkNotNull(parentResolution, "parent resolution");
  }

  /** View with naming-convention child discovery and strict parent resolution. */
  public static QueryPlan of(ObjectNode document) {
    return new QueryPlan(
        document, NamingConventionChildReferenceResolver.getInstance(), ParentResolution.STRICT);
  }

  /** View configured from settings. */
  public static QueryPlan of(ObjectNode document, PlanSettings settings) {
    return new QueryPlan(
        document,
        NamingConventionChildReferenceResolver.getInstance(),
        settings.getParentResolution());
  }

  /** Parses a JSON document and wraps it in a default view. */
  public static QueryPlan parse(String json) {
    return of(PlanJsonCodec.read(json));
  }

  /** Execution strategy of the plan, e.g. {@code SubQuery}. */
  public String getKind() {
    JsonNode plan = document.get(PLAN);
    if (plan == null || !plan.isObject()) {
      throw new MissingFieldException(PLAN, "");
    }
    return requiredText(plan, PLAN_TYPE, "/" + PLAN);
  }

  /** Source language tag the plan was compiled from. */
  public String getLanguage() {
    return requiredText(document, LANGUAGE, "");
  }

  /** Whether the engine should profile this plan. */
  public boolean isProfilingMode() {
    JsonNode value = required(document, PROFILING_MODE, "");
    if (!value.isBoolean()) {
      throw new PlanModelException(
          "Field [" + PROFILING_MODE + "] must be a boolean but was " + value.getNodeType());
    }
    return value.booleanValue();
  }

  /** Free-form description or raw query text. */
  public String getText() {
    return requiredText(document, RAW_QUERY, "");
  }

  /** Textual logical plan. */
  public String getLogicalRa() {
    return requiredText(document, LOGICAL_RA, "");
  }

  /** Fragments in document order, computed from the current document. */
  public List<PlanFragment> getFragments() {
    return PlanQuery.fragments(this).map(PlanFragment::new).collect(Collectors.toList());
  }

  /** Every operator of every fragment in document order, computed from the current document. */
  public List<PlanOperator> getOperators() {
    return PlanQuery.operators(this).map(PlanOperator::new).collect(Collectors.toList());
  }

  /**
   * Finds the first operator, in plan order, with the given id.
   *
   * @param operatorId operator id
   * @return operator view or empty if no operator carries the id
   */
  public Optional<PlanOperator> getOperator(int operatorId) {
    return PlanQuery.operators(this)
        .map(PlanOperator::new)
        .filter(op -> op.findId().filter(id -> id == operatorId).isPresent())
        .findFirst();
  }

  /**
   * Builds an id and edge index over the current document. The index is a snapshot and has to be
   * rebuilt after structural changes.
   */
  public PlanIndex index() {
    return PlanIndex.build(this);
  }

  /** Returns the validation errors of the current document, empty if it is valid. */
  public List<String> validate() {
    return new PlanValidator().validate(this);
  }

  public String toJson() {
    return PlanJsonCodec.write(document);
  }

  @Override
  public String toString() {
    JsonNode text = document.get(RAW_QUERY);
    String description =
        text != null && text.isTextual()
            ? StringUtils.defaultIfEmpty(text.asText(), toJson())
            : toJson();
    return "QueryPlan(" + description + ")";
  }

  static JsonNode required(JsonNode node, String field, String path) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new MissingFieldException(field, path);
    }
    return value;
  }

  static String requiredText(JsonNode node, String field, String path) {
    return required(node, field, path).asText();
  }
}
