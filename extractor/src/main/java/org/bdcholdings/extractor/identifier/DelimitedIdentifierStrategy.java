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

import org.bdcholdings.extractor.model.ParsedIdentifier;
import org.bdcholdings.extractor.model.RateComponents;
import org.bdcholdings.extractor.rate.RateNormalizer;
import org.bdcholdings.extractor.util.FilingDates;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.regex.Pattern;

/**
 * Reads identifiers that pack a table row into one string with pipes:
 *
 * <pre>{@code
 * Debt | First Lien Term Loan | Acme Buyer, LLC | Software | S+525 | 0.75% | 9.85% | 01/05/2023 | 01/05/2029
 * }</pre>
 *
 * <p>Positions are category, subtype, company, industry, spread, floor,
 * coupon, acquisition date and maturity date. Trailing positions may be
 * missing. When the company position is empty, the first token carrying a
 * legal-entity word is used instead.
 */
public class DelimitedIdentifierStrategy implements IdentifierStrategy {
  private static final Pattern PIPE = Pattern.compile("\\|");
  private static final Pattern DIGIT = Pattern.compile("\\d");

  private static final int CATEGORY = 0;
  private static final int SUBTYPE = 1;
  private static final int COMPANY = 2;
  private static final int INDUSTRY = 3;
  private static final int SPREAD = 4;
  private static final int FLOOR = 5;
  private static final int COUPON = 6;
  private static final int ACQUISITION = 7;
  private static final int MATURITY = 8;

  private final IdentifierVocabulary vocabulary;
  private final RateNormalizer rates;

  public DelimitedIdentifierStrategy(IdentifierVocabulary vocabulary, RateNormalizer rates) {
    this.vocabulary = vocabulary;
    this.rates = rates;
  }

  @Override public String name() {
    return "delimited";
  }

  @Override public @Nullable ParsedIdentifier parse(String identifier) {
    if (countPipes(identifier) < 2) {
      return null;
    }
    String[] tokens = PIPE.split(identifier, -1);
    for (int i = 0; i < tokens.length; i++) {
      tokens[i] = tokens[i].trim();
    }

    String company = token(tokens, COMPANY);
    if (company == null || (!vocabulary.hasLegalSuffix(company) && looksLikeCategory(company))) {
      company = null;
      for (String token : tokens) {
        if (vocabulary.hasLegalSuffix(token)) {
          company = token;
          break;
        }
      }
    }
    if (company == null) {
      return null;
    }

    ParsedIdentifier result = new ParsedIdentifier();
    result.setCompanyName(company);
    String subtype = token(tokens, SUBTYPE);
    result.setInvestmentType(subtype != null ? subtype : token(tokens, CATEGORY));
    result.setIndustry(token(tokens, INDUSTRY));

    String spread = token(tokens, SPREAD);
    if (spread != null) {
      RateComponents components = rates.decompose(spread);
      result.setReferenceRate(components.getReferenceRate());
      result.setSpread(components.getSpread());
    }
    result.setFloorRate(percent(token(tokens, FLOOR)));
    result.setInterestRate(percent(token(tokens, COUPON)));
    result.setAcquisitionDate(date(token(tokens, ACQUISITION)));
    result.setMaturityDate(date(token(tokens, MATURITY)));
    return result;
  }

  private static int countPipes(String text) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '|') {
        count++;
      }
    }
    return count;
  }

  private static @Nullable String token(String[] tokens, int position) {
    if (position >= tokens.length || tokens[position].isEmpty()) {
      return null;
    }
    return tokens[position];
  }

  /** Category words that sometimes land in the company position. */
  private boolean looksLikeCategory(String token) {
    return vocabulary.earliestInvestmentType(token) != null
        || vocabulary.earliestAnchor(token) != null;
  }

  /** Positional rate columns are percentages even when the sign is omitted. */
  private @Nullable String percent(@Nullable String token) {
    if (token == null || !DIGIT.matcher(token).find()) {
      return null;
    }
    return rates.normalizePercent(token.indexOf('%') >= 0 ? token : token + "%");
  }

  private static @Nullable String date(@Nullable String token) {
    if (token == null || !DIGIT.matcher(token).find()) {
      return null;
    }
    return FilingDates.normalize(token);
  }
}
