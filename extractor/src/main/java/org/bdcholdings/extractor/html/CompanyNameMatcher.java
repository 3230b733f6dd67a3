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
package org.bdcholdings.extractor.html;

import org.apache.commons.text.StringEscapeUtils;
import org.apache.commons.text.similarity.LongestCommonSubsequence;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Compares company names spelled differently in tagged data and in the
 * rendered schedule: {@code "Brandner Design LLC"} against
 * {@code "Brandner Design, LLC (7)"}.
 */
public class CompanyNameMatcher {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TRAILING_NOTE = Pattern.compile("\\s+[\\-\\u2013\\u2014]\\s+.*$");
  private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)?");
  private static final Pattern PUNCTUATION = Pattern.compile("[.,;:'\"]");
  private static final Pattern LEGAL_SUFFIX = Pattern.compile(
      "\\s+(?:inc|incorporated|corp|corporation|co|company|ltd|limited|llc|l l c|lp|l p|llp"
      + "|plc|gmbh|sa|bv)$");
  private static final Pattern LEADING_THE = Pattern.compile("^the\\s+");

  /** Shortest stripped key that may match a longer name by containment. */
  static final int MIN_CONTAINED_LENGTH = 4;

  private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

  private final double threshold;

  /** @param threshold minimum similarity ratio for a fuzzy match, in (0, 1] */
  public CompanyNameMatcher(double threshold) {
    this.threshold = threshold;
  }

  /** Case-folded, entity-decoded, whitespace-collapsed name. */
  public static String basicKey(@Nullable String name) {
    if (name == null) {
      return "";
    }
    String key = StringEscapeUtils.unescapeHtml4(name).replace('\u00a0', ' ');
    return WHITESPACE.matcher(key.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
  }

  /**
   * The basic key without trailing notes, parentheticals, punctuation,
   * legal-entity suffixes or a leading "the".
   */
  public static String strippedKey(@Nullable String name) {
    String key = basicKey(name);
    key = TRAILING_NOTE.matcher(key).replaceFirst("");
    key = PARENTHETICAL.matcher(key).replaceAll(" ");
    key = PUNCTUATION.matcher(key).replaceAll(" ");
    key = WHITESPACE.matcher(key).replaceAll(" ").trim();
    String previous;
    do {
      previous = key;
      key = LEGAL_SUFFIX.matcher(key).replaceFirst("").trim();
    } while (!key.equals(previous));
    return LEADING_THE.matcher(key).replaceFirst("");
  }

  /**
   * Similarity of two strings as {@code 2 * lcs / (len1 + len2)}, where
   * {@code lcs} is the length of their longest common subsequence.
   */
  public static double similarity(String left, String right) {
    int total = left.length() + right.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * LCS.apply(left, right) / total;
  }

  /**
   * Whether two names designate the same company: their stripped keys are
   * equal, one contains the other and the shorter key has at least
   * {@value #MIN_CONTAINED_LENGTH} characters, or their similarity reaches the
   * threshold.
   */
  public boolean fuzzyMatches(@Nullable String left, @Nullable String right) {
    String a = strippedKey(left);
    String b = strippedKey(right);
    if (a.isEmpty() || b.isEmpty()) {
      return false;
    }
    if (a.equals(b)) {
      return true;
    }
    String shorter = a.length() <= b.length() ? a : b;
    String longer = shorter == a ? b : a;
    if (shorter.length() >= MIN_CONTAINED_LENGTH && longer.contains(shorter)) {
      return true;
    }
    return similarity(a, b) >= threshold;
  }

  public double getThreshold() {
    return threshold;
  }
}
