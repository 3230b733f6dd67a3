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
package org.bdcholdings.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ExtractionConfig}.
 */
@Tag("unit")
class ExtractionConfigTest {

  private static final String MINIMAL_YAML = "identifierDimensions:\n"
      + "  - InvestmentIdentifierAxis\n"
      + "factWindowChars: 500\n"
      + "referenceRateAliases:\n"
      + "  sf: SOFR\n"
      + "standardization:\n"
      + "  investmentType: &table\n"
      + "    residual: Unknown\n"
      + "  industry: *table\n"
      + "  referenceRate:\n"
      + "    mode: full\n";

  @TempDir
  Path tempDir;

  @Test
  void testDefaults() {
    ExtractionConfig config = ExtractionConfig.defaults();
    assertTrue(config.getIdentifierDimensions().contains("InvestmentIdentifierAxis"));
    assertTrue(config.getIndustryDimensions().contains("EquitySecuritiesByIndustryAxis"));
    assertEquals(3000, config.getFactWindowChars());
    assertEquals(0.8, config.getFuzzyMatchThreshold(), 1e-9);
    assertEquals("SOFR", config.getReferenceRateAliases().get("SF"));
    assertEquals("PRIME", config.getReferenceRateAliases().get("P"));
    assertFalse(config.getAnchorKeywords().isEmpty());
    assertFalse(config.getInvestmentTypeKeywords().isEmpty());
    assertTrue(config.getIndustryKeywords().contains("Software"));
  }

  @Test
  void testDefaultsAreShared() {
    assertSame(ExtractionConfig.defaults(), ExtractionConfig.defaults());
  }

  @Test
  void testLoadYamlFile() throws IOException {
    Path file = tempDir.resolve("filer.yaml");
    Files.write(file, MINIMAL_YAML.getBytes(StandardCharsets.UTF_8));
    ExtractionConfig config = ExtractionConfig.load(file);
    assertEquals(500, config.getFactWindowChars());
    assertEquals(0.8, config.getFuzzyMatchThreshold(), 1e-9);
    assertTrue(config.getIndustryDimensions().isEmpty());
    assertEquals("SOFR", config.getReferenceRateAliases().get("SF"));
    // The industry table is an alias of the investment-type table
    assertEquals("Unknown", config.newStandardizationMapper().standardizeIndustry(null));
  }

  @Test
  void testLoadJsonFile() throws IOException {
    Path file = tempDir.resolve("filer.json");
    String json = "{\"identifierDimensions\": [\"CustomAxis\"],"
        + " \"standardization\": {\"investmentType\": {}, \"industry\": {},"
        + " \"referenceRate\": {}}}";
    Files.write(file, json.getBytes(StandardCharsets.UTF_8));
    ExtractionConfig config = ExtractionConfig.load(file);
    assertEquals("CustomAxis", config.getIdentifierDimensions().get(0));
    assertEquals(3000, config.getFactWindowChars());
  }

  @Test
  void testMissingResource() {
    assertThrows(ExtractionException.class,
        () -> ExtractionConfig.fromResource("no-such-config.yaml"));
  }

  @Test
  void testMissingFile() {
    assertThrows(ExtractionException.class,
        () -> ExtractionConfig.load(tempDir.resolve("absent.yaml")));
  }

  @Test
  void testInvalidYaml() throws IOException {
    Path file = tempDir.resolve("broken.yaml");
    Files.write(file, "identifierDimensions: [unclosed\n".getBytes(StandardCharsets.UTF_8));
    assertThrows(ExtractionException.class, () -> ExtractionConfig.load(file));
  }

  @Test
  void testInvalidValues() throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    JsonNode badThreshold = mapper.readTree("{\"identifierDimensions\": [\"A\"],"
        + " \"fuzzyMatchThreshold\": 1.5}");
    assertThrows(ExtractionException.class, () -> ExtractionConfig.fromJson(badThreshold));

    JsonNode noTables = mapper.readTree("{\"identifierDimensions\": [\"A\"]}");
    assertThrows(ExtractionException.class, () -> ExtractionConfig.fromJson(noTables));

    JsonNode noDimensions = mapper.readTree("{\"standardization\": {\"investmentType\": {},"
        + " \"industry\": {}, \"referenceRate\": {}}}");
    assertThrows(ExtractionException.class, () -> ExtractionConfig.fromJson(noDimensions));

    JsonNode badPattern = mapper.readTree("{\"identifierDimensions\": [\"A\"],"
        + " \"anchorKeywords\": [\"(open\"]}");
    assertThrows(ExtractionException.class, () -> ExtractionConfig.fromJson(badPattern));

    assertThrows(ExtractionException.class,
        () -> ExtractionConfig.fromJson(mapper.readTree("[1, 2]")));
  }
}
