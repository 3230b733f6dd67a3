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

import org.bdcholdings.extractor.standardize.StandardizationMapper;
import org.bdcholdings.extractor.standardize.VocabularyTable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tunable vocabulary for extraction: reference-rate aliases, dimension names,
 * keyword lists and the standardization tables.
 *
 * <p>The configuration is a YAML (or JSON) document; see
 * {@code bdc-extraction.yaml} on the classpath for the defaults. YAML is read
 * with SnakeYAML so that anchors and aliases resolve, then converted to a
 * Jackson tree.
 *
 * <p>Instances are immutable and safe to share between extractions.
 */
public final class ExtractionConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionConfig.class);
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  /** Classpath resource holding the default configuration. */
  public static final String DEFAULT_RESOURCE = "bdc-extraction.yaml";

  private static volatile ExtractionConfig defaults;

  private final List<String> identifierDimensions;
  private final List<String> industryDimensions;
  private final int factWindowChars;
  private final double fuzzyMatchThreshold;
  private final Map<String, String> referenceRateAliases;
  private final List<Pattern> classificationPrefixes;
  private final List<Pattern> anchorKeywords;
  private final List<Pattern> investmentTypeKeywords;
  private final List<String> industryKeywords;
  private final VocabularyTable investmentTypeTable;
  private final VocabularyTable industryTable;
  private final VocabularyTable referenceRateTable;

  private ExtractionConfig(JsonNode root) {
    this.identifierDimensions = strings(root, "identifierDimensions");
    this.industryDimensions = strings(root, "industryDimensions");
    this.factWindowChars = root.path("factWindowChars").asInt(3000);
    this.fuzzyMatchThreshold = root.path("fuzzyMatchThreshold").asDouble(0.8);
    if (factWindowChars < 0) {
      throw new ExtractionException("factWindowChars must not be negative: " + factWindowChars);
    }
    if (fuzzyMatchThreshold <= 0 || fuzzyMatchThreshold > 1) {
      throw new ExtractionException("fuzzyMatchThreshold must be in (0, 1]: "
          + fuzzyMatchThreshold);
    }

    ImmutableMap.Builder<String, String> aliases = ImmutableMap.builder();
    Iterator<Map.Entry<String, JsonNode>> fields = root.path("referenceRateAliases").fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      aliases.put(entry.getKey().trim().toUpperCase(Locale.ROOT), entry.getValue().asText());
    }
    this.referenceRateAliases = aliases.buildKeepingLast();

    this.classificationPrefixes = patterns(root, "classificationPrefixes");
    this.anchorKeywords = patterns(root, "anchorKeywords");
    this.investmentTypeKeywords = patterns(root, "investmentTypeKeywords");
    this.industryKeywords = strings(root, "industryKeywords");

    JsonNode standardization = root.path("standardization");
    this.investmentTypeTable =
        VocabularyTable.fromJson("investmentType", standardization.path("investmentType"));
    this.industryTable = VocabularyTable.fromJson("industry", standardization.path("industry"));
    this.referenceRateTable =
        VocabularyTable.fromJson("referenceRate", standardization.path("referenceRate"));

    if (identifierDimensions.isEmpty()) {
      throw new ExtractionException("No identifierDimensions configured");
    }
  }

  /** Returns the configuration bundled with the extractor. */
  public static ExtractionConfig defaults() {
    ExtractionConfig config = defaults;
    if (config == null) {
      synchronized (ExtractionConfig.class) {
        config = defaults;
        if (config == null) {
          config = fromResource(DEFAULT_RESOURCE);
          defaults = config;
        }
      }
    }
    return config;
  }

  /** Loads a configuration from a classpath resource. */
  public static ExtractionConfig fromResource(String resourceName) {
    try (InputStream is = ExtractionConfig.class.getClassLoader()
        .getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new ExtractionException("Extraction config resource not found: " + resourceName);
      }
      LOGGER.debug("Loading extraction config from classpath resource {}", resourceName);
      return fromJson(parseYamlOrJson(is, resourceName));
    } catch (IOException e) {
      throw new ExtractionException("Failed to read extraction config " + resourceName, e);
    }
  }

  /** Loads a configuration from a file, e.g. a filer-specific vocabulary. */
  public static ExtractionConfig load(Path path) {
    try (InputStream is = Files.newInputStream(path)) {
      LOGGER.debug("Loading extraction config from {}", path);
      return fromJson(parseYamlOrJson(is, path.getFileName().toString()));
    } catch (IOException e) {
      throw new ExtractionException("Failed to read extraction config " + path, e);
    }
  }

  public static ExtractionConfig fromJson(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new ExtractionException("Extraction config must be a mapping");
    }
    return new ExtractionConfig(root);
  }

  /**
   * Parses YAML or JSON, chosen by the resource's extension.
   *
   * <p>SnakeYAML resolves anchors and aliases that Jackson's YAML support
   * leaves unresolved for scalars and collections.
   */
  static JsonNode parseYamlOrJson(InputStream stream, String resourceName) throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(500);
      Yaml yaml = new Yaml(loaderOptions);
      Object parsed;
      try {
        parsed = yaml.load(stream);
      } catch (RuntimeException e) {
        throw new IOException("Invalid YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      return JSON_MAPPER.convertValue(parsed, JsonNode.class);
    }
    return JSON_MAPPER.readTree(stream);
  }

  private static List<String> strings(JsonNode root, String field) {
    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (JsonNode node : root.path(field)) {
      String value = node.asText().trim();
      if (!value.isEmpty()) {
        values.add(value);
      }
    }
    return values.build();
  }

  private static List<Pattern> patterns(JsonNode root, String field) {
    ImmutableList.Builder<Pattern> values = ImmutableList.builder();
    for (String regex : strings(root, field)) {
      try {
        values.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
      } catch (PatternSyntaxException e) {
        throw new ExtractionException("Invalid pattern in " + field + ": " + regex, e);
      }
    }
    return values.build();
  }

  /** Creates the standardization mapper over this configuration's tables. */
  public StandardizationMapper newStandardizationMapper() {
    return new StandardizationMapper(investmentTypeTable, industryTable, referenceRateTable);
  }

  public List<String> getIdentifierDimensions() {
    return identifierDimensions;
  }

  public List<String> getIndustryDimensions() {
    return industryDimensions;
  }

  public int getFactWindowChars() {
    return factWindowChars;
  }

  public double getFuzzyMatchThreshold() {
    return fuzzyMatchThreshold;
  }

  /** Upper-cased token → canonical reference-rate name. */
  public Map<String, String> getReferenceRateAliases() {
    return referenceRateAliases;
  }

  public List<Pattern> getClassificationPrefixes() {
    return classificationPrefixes;
  }

  public List<Pattern> getAnchorKeywords() {
    return anchorKeywords;
  }

  public List<Pattern> getInvestmentTypeKeywords() {
    return investmentTypeKeywords;
  }

  public List<String> getIndustryKeywords() {
    return industryKeywords;
  }
}
