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
package org.bdcholdings.extractor.xbrl;

import org.bdcholdings.extractor.ExtractionConfig;
import org.bdcholdings.extractor.model.DateConfidence;
import org.bdcholdings.extractor.model.Fact;
import org.bdcholdings.extractor.util.FilingDates;
import org.bdcholdings.extractor.util.FilingNumbers;

import org.apache.commons.text.StringEscapeUtils;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the facts of a filing, grouped by context id.
 *
 * <p>Two encodings are read:
 * <ul>
 *   <li>standard instance tags, {@code <us-gaap:InvestmentOwnedAtFairValue
 *       contextRef="c-1" unitRef="usd">1000</us-gaap:InvestmentOwnedAtFairValue>};</li>
 *   <li>inline XBRL, {@code <ix:nonFraction name="us-gaap:..." contextRef="c-1">1,000</ix:nonFraction>}
 *       and {@code ix:nonNumeric}.</li>
 * </ul>
 *
 * <p>Around every inline fact a window of text is also searched for rate and
 * date tokens that the filer wrote as prose next to the tagged number. They
 * are emitted as {@code derived:} facts: {@code ReferenceRateToken},
 * {@code Spread}, {@code FloorRate}, {@code PIKRate}, {@code AcquisitionDate}
 * and {@code MaturityDate}.
 *
 * <p>Facts are kept in document order and never deduplicated, except that a
 * derived fact is emitted once per context.
 */
public class FactAggregator {
  private static final Logger LOGGER = LoggerFactory.getLogger(FactAggregator.class);

  private static final Pattern STANDARD_FACT = Pattern.compile(
      "<([A-Za-z_][\\w.\\-]*:[A-Za-z_][\\w.\\-]*)(\\s[^>]*?\\bcontextRef\\s*=\\s*\"[^\"]*\"[^>]*)>"
      + "([^<]*)</\\1\\s*>");
  private static final Pattern INLINE_FACT = Pattern.compile(
      "<ix:(nonFraction|nonNumeric)\\b([^>]*)>(.*?)</ix:\\1\\s*>",
      Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern ATTRIBUTE =
      Pattern.compile("([\\w:\\-]+)\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  /** Inline formats whose decimal separator is a comma, e.g. {@code ixt:num-comma-decimal}. */
  private static final Pattern COMMA_DECIMAL_FORMAT =
      Pattern.compile("comma-?decimal|num(?:dot|space)?comma$", Pattern.CASE_INSENSITIVE);

  private static final Pattern REFERENCE_PLUS_SPREAD = Pattern.compile(
      "\\b(SOFR|PRIME|LIBOR|BASE\\s+RATE|EURIBOR|SONIA)\\s*\\+\\s*(\\d+(?:\\.\\d+)?\\s*(?:%|bps?\\b)?)?",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern FLOOR = Pattern.compile(
      "\\bfloor\\b[^\\d%<]{0,20}?(\\d+(?:\\.\\d+)?)\\s*%?", Pattern.CASE_INSENSITIVE);
  private static final Pattern PIK = Pattern.compile(
      "\\bPIK\\b[^\\d%<]{0,20}?(\\d+(?:\\.\\d+)?)\\s*%?", Pattern.CASE_INSENSITIVE);
  private static final Pattern ACQUISITION_WORDS = Pattern.compile(
      "acquisition|origination|investment|purchase|initial", Pattern.CASE_INSENSITIVE);

  /** Distance either side of a lone date searched for an acquisition keyword. */
  static final int KEYWORD_RADIUS = 50;

  private final int windowChars;

  public FactAggregator(ExtractionConfig config) {
    this(config.getFactWindowChars());
  }

  public FactAggregator(int windowChars) {
    this.windowChars = windowChars;
  }

  /**
   * Scans {@code markup} and returns its facts keyed by context id. Facts
   * for contexts that are not holdings are included; callers look up the
   * contexts they resolved and ignore the rest.
   */
  public Map<String, List<Fact>> aggregate(String markup) {
    Map<String, List<Fact>> facts = new LinkedHashMap<String, List<Fact>>();
    int standard = scanStandard(markup, facts);
    int inline = scanInline(markup, facts);
    LOGGER.debug("Collected {} standard and {} inline facts over {} contexts",
        standard, inline, facts.size());
    return facts;
  }

  private static int scanStandard(String markup, Map<String, List<Fact>> facts) {
    int count = 0;
    Matcher m = STANDARD_FACT.matcher(markup);
    while (m.find()) {
      String concept = m.group(1);
      if (concept.regionMatches(true, 0, "ix:", 0, 3)) {
        continue;
      }
      Map<String, String> attributes = attributes(m.group(2));
      String contextRef = attributes.get("contextref");
      String value = StringEscapeUtils.unescapeXml(m.group(3)).trim();
      if (contextRef == null || contextRef.isEmpty() || value.isEmpty()) {
        continue;
      }
      add(facts, new Fact(concept, contextRef, value, attributes.get("unitref")));
      count++;
    }
    return count;
  }

  private int scanInline(String markup, Map<String, List<Fact>> facts) {
    int count = 0;
    Set<Fact> derived = new HashSet<Fact>();
    Matcher m = INLINE_FACT.matcher(markup);
    while (m.find()) {
      Map<String, String> attributes = attributes(m.group(2));
      String concept = attributes.get("name");
      String contextRef = attributes.get("contextref");
      if (concept == null || contextRef == null || contextRef.isEmpty()) {
        continue;
      }
      String value = "nonfraction".equalsIgnoreCase(m.group(1))
          ? numericValue(m.group(3), attributes)
          : text(m.group(3));
      if (!value.isEmpty()) {
        add(facts, new Fact(concept, contextRef, value, attributes.get("unitref")));
        count++;
      }

      int from = Math.max(0, m.start() - windowChars);
      int to = Math.min(markup.length(), m.end() + windowChars);
      for (Fact fact : deriveFromWindow(contextRef, markup.substring(from, to))) {
        if (derived.add(fact)) {
          add(facts, fact);
        }
      }
    }
    return count;
  }

  /**
   * Applies {@code format}, {@code scale} and {@code sign} to the displayed
   * number. A value that does not parse is returned as displayed.
   */
  static String numericValue(String inner, Map<String, String> attributes) {
    String displayed = text(inner);
    String format = attributes.get("format");
    if (format != null && format.toLowerCase(Locale.ROOT).contains("zero")) {
      return "0";
    }
    String digits = displayed;
    if (format != null && COMMA_DECIMAL_FORMAT.matcher(format).find()) {
      digits = displayed.replace(".", "").replace(',', '.');
    }
    BigDecimal number = FilingNumbers.parseDecimal(digits);
    if (number == null) {
      return displayed;
    }
    String scale = attributes.get("scale");
    if (scale != null && !scale.trim().isEmpty()) {
      try {
        number = number.movePointRight(Integer.parseInt(scale.trim()));
      } catch (NumberFormatException e) {
        LOGGER.warn("Ignoring invalid scale '{}' on value '{}'", scale, displayed);
      }
    }
    if ("-".equals(attributes.get("sign"))) {
      number = number.negate();
    }
    return number.toPlainString();
  }

  /** Finds rate and date tokens in the prose of one window. */
  List<Fact> deriveFromWindow(String contextRef, String window) {
    String text = text(window);
    List<Fact> derived = new ArrayList<Fact>();

    Matcher m = REFERENCE_PLUS_SPREAD.matcher(text);
    if (m.find()) {
      derived.add(Fact.derived("ReferenceRateToken", contextRef,
          WHITESPACE.matcher(m.group(1)).replaceAll(" ").toUpperCase(Locale.ROOT)));
      if (m.group(2) != null) {
        derived.add(Fact.derived("Spread", contextRef, m.group(2).trim()));
      }
    }
    m = FLOOR.matcher(text);
    if (m.find()) {
      derived.add(Fact.derived("FloorRate", contextRef, m.group(1) + "%"));
    }
    m = PIK.matcher(text);
    if (m.find()) {
      derived.add(Fact.derived("PIKRate", contextRef, m.group(1) + "%"));
    }

    List<WindowDate> dates = new ArrayList<WindowDate>();
    for (FilingDates.DateMatch match : FilingDates.findAll(text)) {
      String normalized = FilingDates.normalize(match.getText());
      if (normalized != null) {
        dates.add(new WindowDate(match, normalized));
      }
    }
    if (dates.size() == 1) {
      WindowDate date = dates.get(0);
      String around = text.substring(Math.max(0, date.match.getStart() - KEYWORD_RADIUS),
          Math.min(text.length(), date.match.getEnd() + KEYWORD_RADIUS));
      if (ACQUISITION_WORDS.matcher(around).find()) {
        derived.add(Fact.derivedDate("AcquisitionDate", contextRef, date.normalized,
            DateConfidence.INFERRED));
      } else {
        derived.add(Fact.derivedDate("MaturityDate", contextRef, date.normalized,
            DateConfidence.GUESSED));
      }
    } else if (dates.size() > 1) {
      WindowDate earliest = dates.get(0);
      WindowDate latest = dates.get(0);
      for (WindowDate date : dates) {
        if (date.day.isBefore(earliest.day)) {
          earliest = date;
        }
        if (date.day.isAfter(latest.day)) {
          latest = date;
        }
      }
      if (earliest != latest) {
        derived.add(Fact.derivedDate("AcquisitionDate", contextRef, earliest.normalized,
            DateConfidence.INFERRED));
        derived.add(Fact.derivedDate("MaturityDate", contextRef, latest.normalized,
            DateConfidence.INFERRED));
      }
    }
    return derived;
  }

  private static void add(Map<String, List<Fact>> facts, Fact fact) {
    List<Fact> list = facts.get(fact.getContextId());
    if (list == null) {
      list = new ArrayList<Fact>();
      facts.put(fact.getContextId(), list);
    }
    list.add(fact);
  }

  /** Attribute names are lower-cased. */
  static Map<String, String> attributes(String tagBody) {
    Map<String, String> attributes = new LinkedHashMap<String, String>();
    Matcher m = ATTRIBUTE.matcher(tagBody);
    while (m.find()) {
      String value = m.group(2) != null ? m.group(2) : m.group(3);
      attributes.put(m.group(1).toLowerCase(Locale.ROOT), value);
    }
    return attributes;
  }

  private static String text(String markup) {
    String text = markup.indexOf('<') >= 0
        ? Jsoup.parseBodyFragment(markup).text()
        : StringEscapeUtils.unescapeHtml4(markup);
    return WHITESPACE.matcher(text.replace('\u00a0', ' ')).replaceAll(" ").trim();
  }

  /** A date found in a window, with its calendar day for ordering. */
  private static final class WindowDate {
    final FilingDates.DateMatch match;
    final String normalized;
    final LocalDate day;

    WindowDate(FilingDates.DateMatch match, String normalized) {
      this.match = match;
      this.normalized = normalized;
      LocalDate parsed = FilingDates.parse(normalized);
      // MM/YYYY sorts as the first of its month
      this.day = parsed != null ? parsed
          : LocalDate.of(Integer.parseInt(normalized.substring(3)),
              Integer.parseInt(normalized.substring(0, 2)), 1);
    }
  }
}
