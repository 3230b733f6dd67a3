/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.bdcholdings.extractor.standardize;

import org.bdcholdings.extractor.ExtractionException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link VocabularyTable}.
 */
@Tag("unit")
class VocabularyTableTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static VocabularyTable table(String json) throws IOException {
    return VocabularyTable.fromJson("test", MAPPER.readTree(json));
  }

  @Test
  void testSearchMode() throws IOException {
    VocabularyTable table = table("{\"mode\": \"search\", \"rules\": ["
        + "{\"pattern\": \"lien\", \"value\": \"Lien\"}]}");
    assertEquals("Lien", table.map("Senior First Lien Loan"));
  }

  @Test
  void testPrefixMode() throws IOException {
    VocabularyTable table = table("{\"mode\": \"prefix\", \"rules\": ["
        + "{\"pattern\": \"software\", \"value\": \"Software\"}]}");
    assertEquals("Software", table.map("Software and Stuff"));
    assertEquals("Enterprise Software", table.map("Enterprise Software"));
  }

  @Test
  void testFullMode() throws IOException {
    VocabularyTable table = table("{\"mode\": \"full\", \"uppercase\": true, \"rules\": ["
        + "{\"pattern\": \"SOFR\", \"value\": \"SOFR\"}]}");
    assertEquals("SOFR", table.map("sofr"));
    assertEquals("SOFR PLUS", table.map("sofr plus"));
  }

  @Test
  void testFirstRuleWins() throws IOException {
    VocabularyTable table = table("{\"rules\": ["
        + "{\"pattern\": \"revolver\", \"value\": \"Revolver\"},"
        + "{\"pattern\": \"first lien\", \"value\": \"First Lien\"}]}");
    assertEquals("Revolver", table.map("First Lien Revolver"));
  }

  @Test
  void testAliasBeforeRules() throws IOException {
    VocabularyTable table = table("{\"aliases\": {\"tech\": \"High Tech\"}, \"rules\": ["
        + "{\"pattern\": \"tech\", \"value\": \"Technology\"}]}");
    assertEquals("High Tech", table.map(" TECH "));
    assertEquals("Technology", table.map("Tech Stuff"));
  }

  @Test
  void testRewritesAndFootnotes() throws IOException {
    VocabularyTable table = table("{\"residual\": \"Unknown\", \"rewrites\": ["
        + "{\"pattern\": \"^Type:\\\\s*\", \"replacement\": \"\"}]}");
    assertEquals("Term Loan", table.map("Type: Term Loan (4)"));
    assertEquals("Unknown", table.map("Type:"));
    assertEquals("Unknown", table.map(null));
    assertEquals("Unknown", table.getResidual());
  }

  @Test
  void testNoResidual() throws IOException {
    assertNull(table("{}").map(""));
  }

  @Test
  void testInvalidTables() {
    assertThrows(ExtractionException.class,
        () -> VocabularyTable.fromJson("missing", MissingNode.getInstance()));
    assertThrows(ExtractionException.class, () -> table("{\"mode\": \"sideways\"}"));
    assertThrows(ExtractionException.class,
        () -> table("{\"rules\": [{\"pattern\": \"(unclosed\", \"value\": \"x\"}]}"));
    assertThrows(ExtractionException.class,
        () -> table("{\"rules\": [{\"pattern\": \"x\"}]}"));
    assertThrows(ExtractionException.class,
        () -> table("{\"rules\": [{\"pattern\": \"\", \"value\": \"x\"}]}"));
  }

  @Test
  void testJsonNodeIsAccepted() throws IOException {
    JsonNode node = MAPPER.readTree("{\"aliases\": {\"a  b\": \"AB\"}}");
    assertEquals("AB", VocabularyTable.fromJson("test", node).map("A B"));
  }
}
