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
package org.bdcholdings.extractor.rate;

import org.bdcholdings.extractor.model.RateComponents;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes percentage fragments to {@code "N.NN%"} and splits compound rate
 * expressions into reference rate, spread, floor and PIK parts.
 *
 * <h2>Percent rules</h2>
 * <ul>
 *   <li>{@code "6.5%"}, {@code "6.50"} and {@code "0.065"} all give {@code "6.50%"}:
 *       a bare number of magnitude at most 1 is a fraction;</li>
 *   <li>a {@code bp}/{@code bps} suffix divides by 100 ({@code "525 bps"} → {@code "5.25%"});</li>
 *   <li>for spreads, a bare magnitude above 1000 is also read as basis points;</li>
 *   <li>{@code ""}, dashes and {@code "N/A"} give null.</li>
 * </ul>
 *
 * <h2>Compound expressions</h2>
 * <pre>{@code
 * "SOFR (3-month) + 5.25%, 1.00% Floor, 2.00% PIK"
 *   → reference "SOFR (3-month)", spread "5.25%", floor "1.00%", PIK "2.00%"
 * "S+525"             → reference "SOFR", spread "5.25%" (shorthand spreads are in bps)
 * "P - 0.25%"         → reference "PRIME", spread "-0.25%"
 * }</pre>
 */
public class RateNormalizer {
  private static final Set<String> EMPTY_VALUES =
      ImmutableSet.of("", "-", "\u2013", "\u2014", "N/A", "NA", "NM", "NONE");

  private static final Pattern NUMBER = Pattern.compile("-?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");
  private static final Pattern BASIS_POINTS = Pattern.compile("\\d\\s*bps?\\b",
      Pattern.CASE_INSENSITIVE);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

  /** A named benchmark, optionally preceded or followed by its tenor. */
  private static final Pattern REFERENCE = Pattern.compile(
      "(?:\\b(\\d+)\\s*-?\\s*(?:month|mo)\\.?\\s+)?"
      + "\\b(SOFR|Term\\s+SOFR|LIBOR|PRIME|EURIBOR|SONIA|FED\\s+FUNDS|FEDERAL\\s+FUNDS|CDOR"
      + "|BASE\\s+RATE)\\b"
      + "(?:\\s*\\(\\s*(\\d+)\\s*-?\\s*(?:month|mo)s?\\.?\\s*\\))?",
      Pattern.CASE_INSENSITIVE);
  /**
   * Formula shorthand such as {@code S+525}, {@code SF + 5.75%} or
   * {@code P - 0.25%}: a plus sign or a spaced minus, then a spread carrying a
   * unit or a basis-point figure of three or more digits. "Series C-1" is not
   * a formula.
   */
  private static final Pattern REFERENCE_SHORTHAND = Pattern.compile(
      "(?<![A-Za-z\\-])([A-Z]{1,2})(?=(?:\\s*\\+\\s*|\\s+-\\s+)"
      + "(?:\\d+(?:\\.\\d+)?\\s*(?:%|(?i:bps?)\\b)|\\d{3,}(?![\\d.])))");
  /** A class or series label; a letter after it names the class, not a benchmark. */
  private static final Pattern CLASS_LABEL =
      Pattern.compile("\\b(?:Series|Class|Tranche)\\s*$", Pattern.CASE_INSENSITIVE);
  private static final Pattern SPREAD_AFTER_REFERENCE = Pattern.compile(
      "^\\s*(?:spread\\s*(?:of|:)?\\s*|([+\\-])\\s*)(\\d+(?:\\.\\d+)?)\\s*(%|bps?\\b)?",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern SPREAD_LABELLED = Pattern.compile(
      "\\b(?:spread|margin)\\s*(?:of|:)?\\s*(\\d+(?:\\.\\d+)?)\\s*(%|bps?\\b)",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern FLOOR = Pattern.compile(
      "\\bfloor(?:\\s+rate)?(?:\\s*(?:of|[:=]))?\\s*(-?\\d+(?:\\.\\d+)?)\\s*%",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern FLOOR_TRAILING = Pattern.compile(
      "(-?\\d+(?:\\.\\d+)?)\\s*%\\s*floor\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern PIK = Pattern.compile(
      "\\bPIK(?:\\s+interest|\\s+rate)?(?:\\s*(?:of|[:=]))?\\s*(\\d+(?:\\.\\d+)?)\\s*%",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern PIK_TRAILING = Pattern.compile(
      "(\\d+(?:\\.\\d+)?)\\s*%\\s*PIK\\b", Pattern.CASE_INSENSITIVE);

  private final Map<String, String> referenceAliases;

  /**
   * @param referenceAliases upper-cased token → canonical reference-rate name,
   *     e.g. {@code SF → SOFR}
   */
  public RateNormalizer(Map<String, String> referenceAliases) {
    this.referenceAliases = ImmutableMap.copyOf(referenceAliases);
  }

  /** Normalizes a rate, coupon, floor or PIK value. */
  public @Nullable String normalizePercent(@Nullable String raw) {
    return normalize(raw, false);
  }

  /** Normalizes a spread, where large bare magnitudes are basis points. */
  public @Nullable String normalizeSpread(@Nullable String raw) {
    return normalize(raw, true);
  }

  private @Nullable String normalize(@Nullable String raw, boolean spread) {
    if (raw == null) {
      return null;
    }
    String text = raw.trim().replace(",", "");
    if (EMPTY_VALUES.contains(text.toUpperCase(Locale.ROOT))) {
      return null;
    }
    Matcher m = NUMBER.matcher(text);
    if (!m.find()) {
      return null;
    }
    BigDecimal value;
    try {
      value = new BigDecimal(m.group());
    } catch (NumberFormatException e) {
      return null;
    }
    if (BASIS_POINTS.matcher(text).find()) {
      value = value.divide(HUNDRED);
    } else if (spread && value.abs().compareTo(THOUSAND) > 0) {
      value = value.divide(HUNDRED);
    } else if (text.indexOf('%') < 0 && value.abs().compareTo(BigDecimal.ONE) <= 0) {
      value = value.multiply(HUNDRED);
    }
    return format(value);
  }

  static String format(BigDecimal percent) {
    return percent.setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
  }

  /**
   * Resolves a reference-rate token to its canonical name.
   *
   * <p>Shorthand tokens go through the alias table ({@code "SF"} → {@code "SOFR"}).
   * URL-valued tokens (taxonomy enumeration members) are not names and give null.
   * Unknown tokens are returned upper-cased.
   */
  public @Nullable String resolveReferenceRate(@Nullable String token) {
    if (token == null) {
      return null;
    }
    String text = token.trim();
    if (text.isEmpty() || text.regionMatches(true, 0, "http", 0, 4)) {
      return null;
    }
    text = text.replaceAll("[+\\s]+$", "").replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    if (text.isEmpty()) {
      return null;
    }
    if (text.startsWith("TERM ")) {
      text = text.substring(5);
    }
    if (text.equals("FEDERAL FUNDS")) {
      text = "FED FUNDS";
    }
    String alias = referenceAliases.get(text);
    return alias != null ? alias : text;
  }

  /**
   * Splits a compound rate expression. Parts that are absent are null; the
   * result is {@link RateComponents#empty()} when nothing is recognized.
   */
  public RateComponents decompose(@Nullable String text) {
    if (text == null || text.trim().isEmpty()) {
      return RateComponents.empty();
    }
    String reference = null;
    String spread = null;
    int referenceEnd = -1;
    boolean shorthand = false;

    Matcher m = REFERENCE.matcher(text);
    if (m.find()) {
      reference = resolveReferenceRate(m.group(2));
      String term = m.group(1) != null ? m.group(1) : m.group(3);
      if (reference != null && term != null) {
        reference = reference + " (" + term + "-month)";
      }
      referenceEnd = m.end();
    } else {
      Matcher token = REFERENCE_SHORTHAND.matcher(text);
      while (token.find()) {
        String alias = referenceAliases.get(token.group(1));
        if (alias != null
            && !CLASS_LABEL.matcher(text.substring(0, token.start())).find()) {
          reference = alias;
          referenceEnd = token.end();
          shorthand = true;
          break;
        }
      }
    }

    if (referenceEnd >= 0) {
      Matcher s = SPREAD_AFTER_REFERENCE.matcher(text.substring(referenceEnd));
      if (s.find()) {
        String sign = "-".equals(s.group(1)) ? "-" : "";
        String unit = s.group(3) != null ? s.group(3) : "";
        if (shorthand && unit.isEmpty() && s.group(2).indexOf('.') < 0
            && s.group(2).length() >= 3) {
          // "S+525" quotes the margin in basis points
          unit = "bps";
        }
        spread = normalizeSpread(sign + s.group(2) + unit);
      }
    }
    if (spread == null) {
      Matcher s = SPREAD_LABELLED.matcher(text);
      if (s.find()) {
        spread = normalizeSpread(s.group(1) + s.group(2));
      }
    }

    String floor = firstPercent(text, FLOOR, FLOOR_TRAILING);
    String pik = firstPercent(text, PIK, PIK_TRAILING);
    if (reference == null && spread == null && floor == null && pik == null) {
      return RateComponents.empty();
    }
    return new RateComponents(reference, spread, floor, pik);
  }

  private @Nullable String firstPercent(String text, Pattern leading, Pattern trailing) {
    Matcher m = leading.matcher(text);
    if (m.find()) {
      return normalizePercent(m.group(1) + "%");
    }
    m = trailing.matcher(text);
    if (m.find()) {
      return normalizePercent(m.group(1) + "%");
    }
    return null;
  }
}
