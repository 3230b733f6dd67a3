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
package org.bdcholdings.extractor.util;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date handling for filing text.
 *
 * <p>Filers write dates as ISO {@code 2028-03-15}, US {@code 03/15/2028} or
 * {@code 3/15/28}, or long form {@code March 15, 2028}. Everything is emitted as
 * {@code MM/DD/YYYY}. A month-year {@code 03/2028} (common for maturities) is
 * kept as {@code MM/YYYY} since no day can be recovered.
 */
public final class FilingDates {

  private static final String MONTH_NAMES =
      "Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?"
      + "|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?";

  private static final Pattern ISO_DATE =
      Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})(?:T.*)?$");
  private static final Pattern US_DATE =
      Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4}|\\d{2})$");
  private static final Pattern LONG_DATE =
      Pattern.compile("^(" + MONTH_NAMES + ")\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})$",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern MONTH_YEAR = Pattern.compile("^(\\d{1,2})/(\\d{4})$");

  /** Finds date-like substrings in running text. */
  private static final Pattern DATE_TOKEN = Pattern.compile(
      "\\b\\d{1,2}/\\d{1,2}/(?:\\d{4}|\\d{2})\\b"
      + "|\\b\\d{4}-\\d{2}-\\d{2}\\b"
      + "|\\b(?:" + MONTH_NAMES + ")\\.?\\s+\\d{1,2},\\s+\\d{4}\\b"
      + "|\\b\\d{1,2}/\\d{4}\\b",
      Pattern.CASE_INSENSITIVE);

  private static final Map<String, Integer> MONTHS = ImmutableMap.<String, Integer>builder()
      .put("jan", 1).put("feb", 2).put("mar", 3).put("apr", 4).put("may", 5).put("jun", 6)
      .put("jul", 7).put("aug", 8).put("sep", 9).put("oct", 10).put("nov", 11).put("dec", 12)
      .build();

  private FilingDates() {
  }

  /**
   * Parses a full date in any supported shape.
   *
   * @return the date, or null if the text is not a complete, valid calendar date
   */
  public static @Nullable LocalDate parse(@Nullable String raw) {
    if (raw == null) {
      return null;
    }
    String text = raw.trim();
    try {
      Matcher m = ISO_DATE.matcher(text);
      if (m.matches()) {
        return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
            Integer.parseInt(m.group(3)));
      }
      m = US_DATE.matcher(text);
      if (m.matches()) {
        return LocalDate.of(expandYear(m.group(3)), Integer.parseInt(m.group(1)),
            Integer.parseInt(m.group(2)));
      }
      m = LONG_DATE.matcher(text);
      if (m.matches()) {
        Integer month = MONTHS.get(m.group(1).substring(0, 3).toLowerCase(Locale.ROOT));
        if (month == null) {
          return null;
        }
        return LocalDate.of(Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(2)));
      }
    } catch (DateTimeException e) {
      // e.g. 02/30/2028
      return null;
    }
    return null;
  }

  /**
   * Normalizes a date to {@code MM/DD/YYYY}, or a month-year to {@code MM/YYYY}.
   *
   * @return the normalized text, or null when the input is not a recognizable date
   */
  public static @Nullable String normalize(@Nullable String raw) {
    LocalDate date = parse(raw);
    if (date != null) {
      return format(date);
    }
    if (raw == null) {
      return null;
    }
    Matcher m = MONTH_YEAR.matcher(raw.trim());
    if (m.matches()) {
      int month = Integer.parseInt(m.group(1));
      if (month >= 1 && month <= 12) {
        return String.format(Locale.ROOT, "%02d/%s", month, m.group(2));
      }
    }
    return null;
  }

  public static String format(LocalDate date) {
    return String.format(Locale.ROOT, "%02d/%02d/%04d",
        date.getMonthValue(), date.getDayOfMonth(), date.getYear());
  }

  /** Returns the distinct date-like substrings of {@code text} in order of appearance. */
  public static List<DateMatch> findAll(String text) {
    Set<String> seen = new LinkedHashSet<>();
    List<DateMatch> matches = new ArrayList<>();
    Matcher m = DATE_TOKEN.matcher(text);
    while (m.find()) {
      if (seen.add(m.group())) {
        matches.add(new DateMatch(m.group(), m.start(), m.end()));
      }
    }
    return matches;
  }

  /** Two-digit years below 50 are this century, the rest the previous one. */
  static int expandYear(String year) {
    int value = Integer.parseInt(year);
    if (year.length() == 2) {
      return value < 50 ? 2000 + value : 1900 + value;
    }
    return value;
  }

  /** A date-like substring and its position in the scanned text. */
  public static final class DateMatch {
    private final String text;
    private final int start;
    private final int end;

    DateMatch(String text, int start, int end) {
      this.text = text;
      this.start = start;
      this.end = end;
    }

    public String getText() {
      return text;
    }

    public int getStart() {
      return start;
    }

    public int getEnd() {
      return end;
    }
  }
}
