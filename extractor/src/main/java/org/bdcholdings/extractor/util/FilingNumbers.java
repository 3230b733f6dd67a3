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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Parses monetary and count values as filers print them:
 * {@code "1,250,000"}, {@code "$ 990"}, {@code "(1,234)"} for negatives and
 * dashes for nil.
 */
public final class FilingNumbers {

  private static final Pattern NOISE = Pattern.compile("[,$€£\\s\\u00a0]");
  private static final Pattern DASHES = Pattern.compile("^[-\\u2013\\u2014\\u2212]+$");

  private FilingNumbers() {
  }

  /**
   * Parses a decimal.
   *
   * @return the value, or null if the text is empty, a dash or not numeric
   */
  public static @Nullable BigDecimal parseDecimal(@Nullable String raw) {
    if (raw == null) {
      return null;
    }
    String text = NOISE.matcher(raw).replaceAll("");
    if (text.isEmpty() || DASHES.matcher(text).matches()) {
      return null;
    }
    boolean negative = false;
    if (text.startsWith("(") && text.endsWith(")")) {
      negative = true;
      text = text.substring(1, text.length() - 1);
    }
    text = text.replace('\u2212', '-');
    try {
      BigDecimal value = new BigDecimal(text);
      return negative ? value.negate() : value;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Strips trailing zeros so that {@code 1000000.00} and {@code 1000000} compare equal as keys. */
  public static BigDecimal canonical(@Nullable BigDecimal value) {
    if (value == null || value.signum() == 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal stripped = value.stripTrailingZeros();
    return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
  }
}
