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

import org.bdcholdings.extractor.model.DateConfidence;
import org.bdcholdings.extractor.model.Investment;
import org.bdcholdings.extractor.model.ScheduleRow;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills dates and interest rates that tagged data left empty from the rows
 * of the rendered schedule.
 *
 * <p>Each record is matched to a row by, in order:
 * <ol>
 *   <li>company name and investment type;</li>
 *   <li>company name;</li>
 *   <li>company name without punctuation, parentheticals and legal suffix;</li>
 *   <li>{@link CompanyNameMatcher#fuzzyMatches fuzzy match} against every row.</li>
 * </ol>
 * When several rows fit, the first in document order is used. Only
 * {@code acquisitionDate}, {@code maturityDate} and {@code interestRate} are
 * filled, and only when null.
 */
public class HtmlFallbackMerger {
  private static final Logger LOGGER = LoggerFactory.getLogger(HtmlFallbackMerger.class);

  private final CompanyNameMatcher matcher;

  public HtmlFallbackMerger(CompanyNameMatcher matcher) {
    this.matcher = matcher;
  }

  /**
   * Merges {@code rows} into {@code investments} in place.
   *
   * @return the number of records that received at least one value
   */
  public int merge(List<Investment> investments, List<ScheduleRow> rows) {
    if (rows.isEmpty() || investments.isEmpty()) {
      return 0;
    }
    Map<String, ScheduleRow> byNameAndType = new HashMap<String, ScheduleRow>();
    Map<String, ScheduleRow> byName = new HashMap<String, ScheduleRow>();
    Map<String, ScheduleRow> byStrippedName = new HashMap<String, ScheduleRow>();
    for (ScheduleRow row : rows) {
      String name = CompanyNameMatcher.basicKey(row.getCompanyName());
      putIfAbsent(byNameAndType, nameAndType(name, row.getInvestmentType()), row);
      putIfAbsent(byName, name, row);
      putIfAbsent(byStrippedName, CompanyNameMatcher.strippedKey(row.getCompanyName()), row);
    }

    int merged = 0;
    for (Investment investment : investments) {
      if (investment.getAcquisitionDate() != null && investment.getMaturityDate() != null
          && investment.getInterestRate() != null) {
        continue;
      }
      ScheduleRow row = find(investment, rows, byNameAndType, byName, byStrippedName);
      if (row != null && fill(investment, row)) {
        merged++;
      }
    }
    if (merged > 0) {
      LOGGER.debug("Filled gaps of {} records from the rendered schedule", merged);
    }
    return merged;
  }

  private @Nullable ScheduleRow find(Investment investment, List<ScheduleRow> rows,
      Map<String, ScheduleRow> byNameAndType, Map<String, ScheduleRow> byName,
      Map<String, ScheduleRow> byStrippedName) {
    String name = CompanyNameMatcher.basicKey(investment.getCompanyName());
    if (name.isEmpty()) {
      return null;
    }
    ScheduleRow row = byNameAndType.get(nameAndType(name, investment.getInvestmentType()));
    if (row == null) {
      row = byName.get(name);
    }
    if (row == null) {
      String stripped = CompanyNameMatcher.strippedKey(investment.getCompanyName());
      if (!stripped.isEmpty()) {
        row = byStrippedName.get(stripped);
      }
    }
    if (row == null) {
      for (ScheduleRow candidate : rows) {
        if (matcher.fuzzyMatches(investment.getCompanyName(), candidate.getCompanyName())) {
          row = candidate;
          break;
        }
      }
    }
    return row;
  }

  private static boolean fill(Investment investment, ScheduleRow row) {
    boolean filled = false;
    if (investment.getAcquisitionDate() == null && row.getAcquisitionDate() != null) {
      investment.setAcquisitionDate(row.getAcquisitionDate());
      investment.noteDateSource(DateConfidence.EXPLICIT);
      filled = true;
    }
    if (investment.getMaturityDate() == null && row.getMaturityDate() != null) {
      investment.setMaturityDate(row.getMaturityDate());
      investment.noteDateSource(DateConfidence.EXPLICIT);
      filled = true;
    }
    if (investment.getInterestRate() == null && row.getInterestRate() != null) {
      investment.setInterestRate(row.getInterestRate());
      filled = true;
    }
    return filled;
  }

  private static String nameAndType(String name, @Nullable String type) {
    return name + '\u0001' + CompanyNameMatcher.basicKey(type);
  }

  private static void putIfAbsent(Map<String, ScheduleRow> index, String key, ScheduleRow row) {
    if (!key.isEmpty() && !index.containsKey(key)) {
      index.put(key, row);
    }
  }
}
