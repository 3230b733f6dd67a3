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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword lists the identifier strategies share: boilerplate prefixes, anchor
 * keywords, investment-type phrases and industry phrases.
 */
public class IdentifierVocabulary {
  private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s,;:|\\-\\u2013\\u2014]+");
  private static final Pattern DIGIT = Pattern.compile("\\d");
  /**
   * Where an investment description gives way to rate, date or amount fields.
   * Digits inside a class or series label ("Series C-1", "Tranche 2") stay in
   * the description; percents, decimals, dates and grouped amounts end it.
   */
  private static final Pattern DESCRIPTION_END = Pattern.compile(
      "\\s*(?:[,;|(]|\\b(?:SOFR|LIBOR|PRIME|EURIBOR|SONIA|CDOR|Reference|Spread|Interest|Floor"
      + "|PIK|Maturity|Initial|Acquisition|Cash|Coupon|Rate|Due|Par|Principal|Shares)\\b"
      + "|(?<![A-Za-z])[A-Z]{1,2}\\s*\\+"
      + "|(?<![A-Za-z0-9\\-])(?:\\d+(?:\\.\\d+)?\\s*%|\\d+\\.\\d+|\\d{1,2}/\\d{1,2}/\\d{2,4}"
      + "|\\d{1,2}/\\d{4}|\\d{4}-\\d{2}-\\d{2}|\\d{1,3}(?:,\\d{3})+|\\d{3,}\\b)"
      + "|\\$)", Pattern.CASE_INSENSITIVE);
  private static final Pattern INVESTMENT_TYPE_LABEL =
      Pattern.compile("^Investment\\s+Type\\s*:?\\s*", Pattern.CASE_INSENSITIVE);
  private static final Pattern LEGAL_SUFFIX = Pattern.compile(
      "\\b(?:Inc|Incorporated|Corp|Corporation|Co|Company|Ltd|Limited|LLC|L\\.L\\.C|LP|L\\.P|LLP"
      + "|PLC|GmbH|S\\.?A|B\\.?V|Holdings?|Partners|Buyer|Parent|Intermediate|Borrower)\\b\\.?",
      Pattern.CASE_INSENSITIVE);

  private final List<Pattern> prefixes;
  private final List<Pattern> anchors;
  private final List<Pattern> investmentTypes;
  private final @Nullable Pattern leadingIndustry;
  private final @Nullable Pattern trailingIndustry;

  public IdentifierVocabulary(ExtractionConfig config) {
    this(config.getClassificationPrefixes(), config.getAnchorKeywords(),
        config.getInvestmentTypeKeywords(), config.getIndustryKeywords());
  }

  IdentifierVocabulary(List<Pattern> prefixes, List<Pattern> anchors,
      List<Pattern> investmentTypes, List<String> industryKeywords) {
    this.prefixes = ImmutableList.copyOf(prefixes);
    this.anchors = ImmutableList.copyOf(anchors);
    this.investmentTypes = ImmutableList.copyOf(investmentTypes);
    if (industryKeywords.isEmpty()) {
      this.leadingIndustry = null;
      this.trailingIndustry = null;
    } else {
      String alternation = industryAlternation(industryKeywords);
      this.leadingIndustry = Pattern.compile("^(" + alternation + ")(?=$|[\\s,;:\\-])",
          Pattern.CASE_INSENSITIVE);
      this.trailingIndustry = Pattern.compile("(?:^|[\\s,])(" + alternation + ")[\\s,]*$",
          Pattern.CASE_INSENSITIVE);
    }
  }

  /** Longest phrases first so "Software &amp; Services" wins over "Software". */
  private static String industryAlternation(List<String> keywords) {
    List<String> sorted = new ArrayList<String>(keywords);
    sorted.sort(Comparator.comparingInt(String::length).reversed());
    StringBuilder sb = new StringBuilder();
    for (String keyword : sorted) {
      if (sb.length() > 0) {
        sb.append('|');
      }
      sb.append(phrasePattern(keyword));
    }
    return sb.toString();
  }

  /** Literal phrase with flexible whitespace; "&amp;" also accepts "and". */
  static String phrasePattern(String phrase) {
    StringBuilder sb = new StringBuilder();
    for (String word : phrase.trim().split("\\s+")) {
      if (sb.length() > 0) {
        sb.append("\\s*");
      }
      if (word.equals("&")) {
        sb.append("(?:&|and)");
      } else {
        sb.append(Pattern.quote(word));
      }
    }
    return sb.toString();
  }

  /** Removes any number of leading classification phrases. */
  public String stripPrefixes(String text) {
    String result = text.trim();
    boolean stripped = true;
    while (stripped && !result.isEmpty()) {
      stripped = false;
      for (Pattern prefix : prefixes) {
        Matcher m = prefix.matcher(result);
        if (m.lookingAt() && m.end() > 0) {
          result = LEADING_SEPARATORS.matcher(result.substring(m.end())).replaceFirst("");
          stripped = true;
          break;
        }
      }
    }
    return result;
  }

  public @Nullable KeywordMatch earliestAnchor(String text) {
    return earliest(anchors, text);
  }

  public @Nullable KeywordMatch earliestInvestmentType(String text) {
    return earliest(investmentTypes, text);
  }

  private static @Nullable KeywordMatch earliest(List<Pattern> patterns, String text) {
    KeywordMatch best = null;
    for (Pattern pattern : patterns) {
      Matcher m = pattern.matcher(text);
      while (m.find()) {
        if (isWordBounded(text, m.start(), m.end())) {
          KeywordMatch candidate = new KeywordMatch(m.start(), m.end(), m.group());
          if (best == null || candidate.precedes(best)) {
            best = candidate;
          }
          break;
        }
      }
    }
    return best;
  }

  private static boolean isWordBounded(String text, int start, int end) {
    boolean before = start == 0 || !Character.isLetterOrDigit(text.charAt(start - 1));
    boolean after = end >= text.length() || !Character.isLetterOrDigit(text.charAt(end))
        || !Character.isLetterOrDigit(text.charAt(end - 1));
    return before && after;
  }

  /**
   * Reads the investment description that starts {@code text}, stopping at
   * the first rate, date or amount field. A leading "Investment Type" label
   * is dropped.
   *
   * @return the description, or null if there is none
   */
  public @Nullable String descriptionAt(String text) {
    String rest = INVESTMENT_TYPE_LABEL.matcher(text).replaceFirst("");
    Matcher end = DESCRIPTION_END.matcher(rest);
    // Skip a stop at position 0 so that e.g. "1st Lien" is not cut empty
    int cut = rest.length();
    while (end.find()) {
      if (end.start() > 0) {
        cut = end.start();
        break;
      }
    }
    String description = rest.substring(0, cut).trim();
    return description.isEmpty() ? null : description;
  }

  /** An industry phrase at the very start of {@code text}. */
  public @Nullable KeywordMatch leadingIndustry(String text) {
    if (leadingIndustry == null) {
      return null;
    }
    Matcher m = leadingIndustry.matcher(text);
    return m.lookingAt() ? new KeywordMatch(m.start(1), m.end(1), m.group(1)) : null;
  }

  /** An industry phrase closing {@code text}, optionally followed by commas. */
  public @Nullable KeywordMatch trailingIndustry(String text) {
    if (trailingIndustry == null) {
      return null;
    }
    Matcher m = trailingIndustry.matcher(text);
    return m.find() ? new KeywordMatch(m.start(1), m.end(1), m.group(1)) : null;
  }

  /**
   * Whether a comma segment reads like an industry rather than part of a
   * company name: at most six words, no digits and no legal-entity suffix.
   */
  public boolean isIndustryLike(String segment) {
    String text = segment.trim();
    if (text.isEmpty() || DIGIT.matcher(text).find() || LEGAL_SUFFIX.matcher(text).find()) {
      return false;
    }
    return text.split("\\s+").length <= 6;
  }

  /** Whether a token contains a legal-entity word such as LLC or Holdings. */
  public boolean hasLegalSuffix(String token) {
    return LEGAL_SUFFIX.matcher(token).find();
  }
}
