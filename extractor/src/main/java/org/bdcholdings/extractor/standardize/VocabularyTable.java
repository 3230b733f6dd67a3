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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A closed vocabulary for one categorical field.
 *
 * <p>Lookup runs in this order:
 * <ol>
 *   <li>blank input yields the residual value (which may be null);</li>
 *   <li>footnote markers such as {@code (3)} are removed and whitespace is collapsed;</li>
 *   <li>configured rewrites are applied (typo fixes, boilerplate removal);</li>
 *   <li>an exact, case-insensitive alias lookup;</li>
 *   <li>ordered pattern rules, applied by {@link MatchMode};</li>
 *   <li>otherwise the cleaned input is returned unchanged.</li>
 * </ol>
 */
public final class VocabularyTable {
  private static final Pattern FOOTNOTE = Pattern.compile("\\s*\\(\\s*\\d{1,3}\\s*\\)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** How a rule pattern is applied to the cleaned value. */
  public enum MatchMode {
    /** Anywhere in the value. */
    SEARCH,
    /** At the start of the value. */
    PREFIX,
    /** The whole value. */
    FULL
  }

  private final @Nullable String residual;
  private final MatchMode mode;
  private final boolean uppercase;
  private final List<Rule> rewrites;
  private final Map<String, String> aliases;
  private final List<Rule> rules;

  VocabularyTable(@Nullable String residual, MatchMode mode, boolean uppercase,
      List<Rule> rewrites, Map<String, String> aliases, List<Rule> rules) {
    this.residual = residual;
    this.mode = mode;
    this.uppercase = uppercase;
    this.rewrites = ImmutableList.copyOf(rewrites);
    this.aliases = ImmutableMap.copyOf(aliases);
    this.rules = ImmutableList.copyOf(rules);
  }

  /**
   * Builds a table from its configuration node.
   *
   * <pre>{@code
   * residual: Unknown
   * mode: search          # search | prefix | full
   * uppercase: false
   * rewrites: [{pattern: '...', replacement: '...'}]
   * aliases: {raw value: Canonical}
   * rules: [{pattern: '...', value: Canonical}]
   * }</pre>
   */
  public static VocabularyTable fromJson(String name, JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      throw new ExtractionException("Missing standardization table '" + name + "'");
    }
    String residual = node.hasNonNull("residual") ? node.get("residual").asText() : null;
    MatchMode mode;
    try {
      mode = MatchMode.valueOf(node.path("mode").asText("search").toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ExtractionException("Unknown match mode for table '" + name + "': "
          + node.path("mode").asText(), e);
    }
    boolean uppercase = node.path("uppercase").asBoolean(false);

    ImmutableList.Builder<Rule> rewrites = ImmutableList.builder();
    for (JsonNode rewrite : node.path("rewrites")) {
      rewrites.add(
          new Rule(compile(name, rewrite.path("pattern").asText()),
          rewrite.path("replacement").asText("")));
    }

    ImmutableMap.Builder<String, String> aliases = ImmutableMap.builder();
    Iterator<Map.Entry<String, JsonNode>> fields = node.path("aliases").fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      aliases.put(aliasKey(entry.getKey()), entry.getValue().asText());
    }

    ImmutableList.Builder<Rule> rules = ImmutableList.builder();
    for (JsonNode rule : node.path("rules")) {
      if (!rule.hasNonNull("value")) {
        throw new ExtractionException("Rule without value in table '" + name + "'");
      }
      rules.add(new Rule(compile(name, rule.path("pattern").asText()), rule.get("value").asText()));
    }
    return new VocabularyTable(residual, mode, uppercase, rewrites.build(),
        aliases.buildKeepingLast(), rules.build());
  }

  private static Pattern compile(String table, String regex) {
    if (regex.isEmpty()) {
      throw new ExtractionException("Empty pattern in table '" + table + "'");
    }
    try {
      return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    } catch (PatternSyntaxException e) {
      throw new ExtractionException("Invalid pattern in table '" + table + "': " + regex, e);
    }
  }

  private static String aliasKey(String value) {
    return WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }

  /**
   * Maps a raw value onto the vocabulary.
   *
   * @return the canonical value, the cleaned input when nothing matches, or
   *     the residual value for blank input
   */
  public @Nullable String map(@Nullable String raw) {
    if (raw == null || raw.trim().isEmpty()) {
      return residual;
    }
    String text = FOOTNOTE.matcher(raw).replaceAll("");
    text = WHITESPACE.matcher(text).replaceAll(" ").trim();
    if (uppercase) {
      text = text.toUpperCase(Locale.ROOT);
    }
    for (Rule rewrite : rewrites) {
      text = rewrite.pattern.matcher(text).replaceAll(Matcher.quoteReplacement(rewrite.value))
          .trim();
    }
    if (text.isEmpty()) {
      return residual;
    }

    String alias = aliases.get(aliasKey(text));
    if (alias != null) {
      return alias;
    }
    for (Rule rule : rules) {
      Matcher m = rule.pattern.matcher(text);
      boolean hit;
      switch (mode) {
      case PREFIX:
        hit = m.lookingAt();
        break;
      case FULL:
        hit = m.matches();
        break;
      default:
        hit = m.find();
        break;
      }
      if (hit) {
        return rule.value;
      }
    }
    return text;
  }

  public @Nullable String getResidual() {
    return residual;
  }

  /** A pattern with the value it produces. */
  static final class Rule {
    final Pattern pattern;
    final String value;

    Rule(Pattern pattern, String value) {
      this.pattern = pattern;
      this.value = value;
    }
  }
}
