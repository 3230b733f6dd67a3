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
package org.bdcholdings.extractor.identifier;

import org.bdcholdings.extractor.ExtractionConfig;
import org.bdcholdings.extractor.model.ParsedIdentifier;
import org.bdcholdings.extractor.rate.RateNormalizer;

import com.google.common.collect.ImmutableList;

import org.apache.commons.text.StringEscapeUtils;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decomposes a context's free-text identifier into company, industry,
 * investment type, rates and dates.
 *
 * <p>The identifier is first prepared (HTML entities decoded, footnote markers
 * such as {@code (3)} removed, whitespace collapsed), then the strategies are
 * tried in order:
 * <ol>
 *   <li>{@link DelimitedIdentifierStrategy} for pipe-separated rows;</li>
 *   <li>{@link AnchoredIdentifierStrategy} for prefix + company + anchor layouts;</li>
 *   <li>{@link KeywordIdentifierStrategy} as the fallback.</li>
 * </ol>
 * The first strategy whose company name survives {@link CompanyNameCleaner}
 * wins. Labelled rate and date fields are then read from the whole identifier
 * by {@link IdentifierTokenExtractor}, whichever strategy matched.
 *
 * <p>If no strategy finds a company, the result has no company name and the
 * holding is later discarded.
 */
public class IdentifierParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(IdentifierParser.class);

  private static final Pattern FOOTNOTE = Pattern.compile("\\s*\\(\\s*\\d{1,3}\\s*\\)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final List<IdentifierStrategy> strategies;
  private final IdentifierTokenExtractor tokens;

  public IdentifierParser(ExtractionConfig config, RateNormalizer rates) {
    this(defaultStrategies(new IdentifierVocabulary(config), rates),
        new IdentifierTokenExtractor(rates));
  }

  public IdentifierParser(List<IdentifierStrategy> strategies, IdentifierTokenExtractor tokens) {
    this.strategies = ImmutableList.copyOf(strategies);
    this.tokens = tokens;
  }

  public static List<IdentifierStrategy> defaultStrategies(IdentifierVocabulary vocabulary,
      RateNormalizer rates) {
    return ImmutableList.of(
        new DelimitedIdentifierStrategy(vocabulary, rates),
        new AnchoredIdentifierStrategy(vocabulary),
        new KeywordIdentifierStrategy(vocabulary));
  }

  public ParsedIdentifier parse(String rawIdentifier) {
    return parse(rawIdentifier, null);
  }

  /**
   * Parses an identifier.
   *
   * @param rawIdentifier the identifier as found in the filing
   * @param defaultIndustry industry to use when the identifier names none
   */
  public ParsedIdentifier parse(String rawIdentifier, @Nullable String defaultIndustry) {
    String identifier = prepare(rawIdentifier);
    ParsedIdentifier result = null;
    for (IdentifierStrategy strategy : strategies) {
      ParsedIdentifier candidate = strategy.parse(identifier);
      if (candidate == null) {
        continue;
      }
      candidate.setCompanyName(CompanyNameCleaner.clean(candidate.getCompanyName()));
      if (candidate.hasCompanyName()) {
        LOGGER.debug("Identifier '{}' parsed by {} strategy: company '{}'",
            identifier, strategy.name(), candidate.getCompanyName());
        result = candidate;
        break;
      }
    }
    if (result == null) {
      LOGGER.debug("No company name found in identifier '{}'", identifier);
      result = new ParsedIdentifier();
    }

    tokens.fill(identifier, result);
    if (isBlank(result.getIndustry())) {
      result.setIndustry(defaultIndustry);
    }
    if (isBlank(result.getInvestmentType())) {
      result.setInvestmentType(null);
    }
    return result;
  }

  static String prepare(String rawIdentifier) {
    String text = StringEscapeUtils.unescapeHtml4(rawIdentifier).replace('\u00a0', ' ');
    text = FOOTNOTE.matcher(text).replaceAll("");
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  private static boolean isBlank(@Nullable String value) {
    return value == null || value.trim().isEmpty();
  }
}
