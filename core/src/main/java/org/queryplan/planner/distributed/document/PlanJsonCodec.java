/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reads and writes plan documents as JSON. */
public final class PlanJsonCodec {

  private static final Logger LOG = LogManager.getLogger();

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

  private PlanJsonCodec() {}

  /** Shared mapper used to convert plain Java values into document nodes. */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Parses a plan document.
   *
   * @param json document text
   * @return document root
   */
  public static ObjectNode read(String json) {
    try {
      return asObject(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      LOG.error("Plan document is malformed: {}", e.getOriginalMessage());
      throw new IllegalArgumentException("Malformed plan document json: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a plan document from a stream. The stream is not closed.
   *
   * @param inputStream document bytes
   * @return document root
   */
  public static ObjectNode read(InputStream inputStream) {
    try {
      return asObject(MAPPER.readTree(inputStream));
    } catch (IOException e) {
      LOG.error("Plan document is malformed: {}", e.getMessage());
      throw new IllegalArgumentException("Malformed plan document json: " + e.getMessage(), e);
    }
  }

  /** Writes a document as compact JSON. */
  public static String write(JsonNode document) {
    try {
      return MAPPER.writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize plan document", e);
    }
  }

  /** Writes a document as indented JSON. */
  public static String writePretty(JsonNode document) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize plan document", e);
    }
  }

  private static ObjectNode asObject(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException(
          "Plan document must be a json object but was "
              + (node == null ? "empty" : node.getNodeType()));
    }
    return (ObjectNode) node;
  }
}
