/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.planner.distributed.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.queryplan.planner.distributed.PlanFixtures;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanJsonCodecTest {

  @Test
  void should_write_and_read_back_the_same_document() {
    ObjectNode document = PlanFixtures.document(PlanFixtures.SHUFFLE_JOIN);

    assertEquals(document, PlanJsonCodec.read(PlanJsonCodec.write(document)));
    assertEquals(document, PlanJsonCodec.read(PlanJsonCodec.writePretty(document)));
  }

  @Test
  void should_read_from_stream() {
    ObjectNode document =
        PlanJsonCodec.read(
            new ByteArrayInputStream("{\"rawQuery\": \"q\"}".getBytes(StandardCharsets.UTF_8)));

    assertEquals("q", document.get("rawQuery").asText());
  }

  @Test
  void should_reject_malformed_json_with_cause() {
    IllegalArgumentException exception =
        assertThrows(IllegalArgumentException.class, () -> PlanJsonCodec.read("{\"plan\": "));

    assertNotNull(exception.getCause());
    assertTrue(exception.getCause() instanceof JsonProcessingException);
  }

  @Test
  void should_reject_documents_that_are_not_objects() {
    assertThrows(IllegalArgumentException.class, () -> PlanJsonCodec.read("[1, 2]"));
    assertThrows(IllegalArgumentException.class, () -> PlanJsonCodec.read(""));
  }
}
