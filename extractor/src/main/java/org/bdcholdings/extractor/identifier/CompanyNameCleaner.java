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

import org.apache.commons.text.StringEscapeUtils;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.regex.Pattern;

/**
 * Tidies a company name cut out of an identifier.
 *
 * <p>Splitting heuristics leave debris at the edges: separators, a connective
 * word from the previous field, or an equity-class fragment such as
 * "Common Stock" that belongs to the investment type.
 */
public final class CompanyNameCleaner {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TRAILING_SEPARATORS =
      Pattern.compile("[\\s,;:|/\\-\\u2013\\u2014]+$");
  private static final Pattern LEADING_SEPARATORS =
      Pattern.compile("^[\\s,;:|/\\-\\u2013\\u2014]+");
  private static final Pattern LEADING_CONNECTIVE =
      Pattern.compile("^(?:and|&|of|or|in|at)\\s+", Pattern.CASE_INSENSITIVE);
  private static final Pattern TRAILING_EQUITY_CLASS = Pattern.compile(
      "(?:[\\s,]+(?:Series\\s+[A-Z0-9\\-]+\\s+)?(?:Class\\s+[A-Z0-9\\-]+\\s+)?"
      + "(?:Common|Preferred)\\s+(?:Stock|Equity|Units|Shares|Interests?))+$",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

  private CompanyNameCleaner() {
  }

  /**
   * Cleans a candidate company name.
   *
   * @return the cleaned name, or null if nothing name-like remains
   */
  public static @Nullable String clean(@Nullable String raw) {
    if (raw == null) {
      return null;
    }
    String name = StringEscapeUtils.unescapeHtml4(raw).replace('\u00a0', ' ');
    name = WHITESPACE.matcher(name).replaceAll(" ").trim();
    name = LEADING_SEPARATORS.matcher(name).replaceFirst("");
    name = LEADING_CONNECTIVE.matcher(name).replaceFirst("");
    name = TRAILING_EQUITY_CLASS.matcher(name).replaceFirst("");
    name = TRAILING_SEPARATORS.matcher(name).replaceFirst("").trim();
    if (name.isEmpty() || !HAS_LETTER.matcher(name).find()) {
      return null;
    }
    return name;
  }
}
