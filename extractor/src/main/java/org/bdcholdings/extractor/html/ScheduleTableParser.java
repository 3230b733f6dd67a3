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

import org.bdcholdings.extractor.ExtractionConfig;
import org.bdcholdings.extractor.identifier.CompanyNameCleaner;
import org.bdcholdings.extractor.identifier.IdentifierVocabulary;
import org.bdcholdings.extractor.model.ScheduleRow;
import org.bdcholdings.extractor.rate.RateNormalizer;
import org.bdcholdings.extractor.util.FilingDates;
import org.bdcholdings.extractor.util.FilingNumbers;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the rendered schedule of investments into {@link ScheduleRow}s.
 *
 * <p>A table is a schedule when one of its rows is a header: at least
 * {@value #MIN_HEADER_CELLS} non-empty cells, {@value #MIN_HEADER_KEYWORDS}
 * of which name schedule columns. Columns are mapped by header text. Below the
 * header:
 * <ul>
 *   <li>a row holding a single label names the industry of the rows that
 *       follow, or their company when the label carries a legal suffix;</li>
 *   <li>a row with an empty company cell belongs to the last named company;</li>
 *   <li>"Total" and "Subtotal" rows are skipped.</li>
 * </ul>
 */
public class ScheduleTableParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleTableParser.class);

  static final int MIN_HEADER_CELLS = 5;
  static final int MIN_HEADER_KEYWORDS = 3;

  private static final String[] HEADER_KEYWORDS = {
      "company", "investment", "maturity", "principal", "cost", "fair value",
      "acquisition", "type", "portfolio"
  };
  private static final Pattern FOOTNOTE = Pattern.compile("\\s*\\(\\s*\\d{1,3}\\s*\\)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern PERCENT = Pattern.compile("(-?\\d+(?:\\.\\d+)?)\\s*%");
  private static final Pattern TOTAL = Pattern.compile("^(?:sub)?total\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern DIGIT = Pattern.compile("\\d");
  private static final Pattern DIGIT_ONLY = Pattern.compile("\\d{1,3}");

  /** Schedule columns. */
  enum Column {
    COMPANY, INVESTMENT_TYPE, INDUSTRY, INTEREST_RATE, ACQUISITION_DATE, MATURITY_DATE,
    PRINCIPAL, COST, FAIR_VALUE
  }

  private final IdentifierVocabulary vocabulary;
  private final RateNormalizer rates;

  public ScheduleTableParser(ExtractionConfig config) {
    this(new IdentifierVocabulary(config), new RateNormalizer(config.getReferenceRateAliases()));
  }

  public ScheduleTableParser(IdentifierVocabulary vocabulary, RateNormalizer rates) {
    this.vocabulary = vocabulary;
    this.rates = rates;
  }

  /** Parses every schedule table of a rendered document, in document order. */
  public List<ScheduleRow> parse(String html) {
    Document doc = Jsoup.parse(html);
    List<ScheduleRow> rows = new ArrayList<ScheduleRow>();
    int tables = 0;
    for (Element table : doc.select("table")) {
      int before = rows.size();
      parseTable(table, rows);
      if (rows.size() > before) {
        tables++;
      }
    }
    LOGGER.debug("Read {} schedule rows from {} tables", rows.size(), tables);
    return ImmutableList.copyOf(rows);
  }

  private void parseTable(Element table, List<ScheduleRow> out) {
    Map<Column, Integer> columns = null;
    String industry = null;
    String company = null;
    for (Element tr : table.select("tr")) {
      // nested tables are read on their own
      if (tr.closest("table") != table) {
        continue;
      }
      List<String> cells = cells(tr);
      if (isHeader(cells)) {
        columns = mapColumns(cells);
        continue;
      }
      if (columns == null || !columns.containsKey(Column.COMPANY)) {
        continue;
      }

      List<String> filled = new ArrayList<String>();
      for (String cell : cells) {
        if (!cell.isEmpty() && !"$".equals(cell) && !"%".equals(cell)) {
          filled.add(cell);
        }
      }
      if (filled.isEmpty() || TOTAL.matcher(filled.get(0)).find()) {
        continue;
      }
      if (filled.size() == 1 && !DIGIT.matcher(filled.get(0)).find()) {
        String label = filled.get(0);
        if (vocabulary.hasLegalSuffix(label) || columns.containsKey(Column.INDUSTRY)) {
          company = companyName(label);
        } else {
          industry = label;
          company = null;
        }
        continue;
      }

      String companyCell = cell(cells, columns.get(Column.COMPANY));
      if (companyCell != null && TOTAL.matcher(companyCell).find()) {
        continue;
      }
      if (companyCell != null) {
        String name = companyName(companyCell);
        if (name != null) {
          company = name;
        }
      }
      if (company == null) {
        continue;
      }
      ScheduleRow row = toRow(company, industry, cells, columns);
      if (row != null) {
        out.add(row);
      }
    }
  }

  private @Nullable ScheduleRow toRow(String company, @Nullable String industry,
      List<String> cells, Map<Column, Integer> columns) {
    String rowIndustry = cell(cells, columns.get(Column.INDUSTRY));
    String type = cell(cells, columns.get(Column.INVESTMENT_TYPE));
    String rate = interestRate(cell(cells, columns.get(Column.INTEREST_RATE)));
    String acquired = FilingDates.normalize(cell(cells, columns.get(Column.ACQUISITION_DATE)));
    String maturity = FilingDates.normalize(cell(cells, columns.get(Column.MATURITY_DATE)));
    BigDecimal principal = amount(cells, columns.get(Column.PRINCIPAL));
    BigDecimal cost = amount(cells, columns.get(Column.COST));
    BigDecimal fairValue = amount(cells, columns.get(Column.FAIR_VALUE));
    if (type == null && rate == null && acquired == null && maturity == null
        && principal == null && cost == null && fairValue == null) {
      return null;
    }
    return ScheduleRow.builder(company)
        .industry(rowIndustry != null ? rowIndustry : industry)
        .investmentType(type != null ? FOOTNOTE.matcher(type).replaceAll("").trim() : null)
        .interestRate(rate)
        .acquisitionDate(acquired)
        .maturityDate(maturity)
        .principalAmount(principal)
        .cost(cost)
        .fairValue(fairValue)
        .build();
  }

  /** Cell texts with {@code colspan} expanded, so that positions line up with the header. */
  static List<String> cells(Element tr) {
    List<String> cells = new ArrayList<String>();
    for (Element cell : tr.children()) {
      if (!"td".equals(cell.tagName()) && !"th".equals(cell.tagName())) {
        continue;
      }
      String text = WHITESPACE.matcher(cell.text().replace('\u00a0', ' ')).replaceAll(" ").trim();
      cells.add(text);
      int span = 1;
      String colspan = cell.attr("colspan").trim();
      if (!colspan.isEmpty() && DIGIT_ONLY.matcher(colspan).matches()) {
        span = Integer.parseInt(colspan);
      }
      for (int i = 1; i < span && i < 50; i++) {
        cells.add("");
      }
    }
    return cells;
  }

  static boolean isHeader(List<String> cells) {
    int nonEmpty = 0;
    int keywords = 0;
    for (String cell : cells) {
      if (cell.isEmpty()) {
        continue;
      }
      nonEmpty++;
      String lower = cell.toLowerCase(Locale.ROOT);
      for (String keyword : HEADER_KEYWORDS) {
        if (lower.contains(keyword)) {
          keywords++;
          break;
        }
      }
    }
    return nonEmpty >= MIN_HEADER_CELLS && keywords >= MIN_HEADER_KEYWORDS;
  }

  /** Maps header text to columns; the first column for each kind wins. */
  static Map<Column, Integer> mapColumns(List<String> header) {
    Map<Column, Integer> columns = new EnumMap<Column, Integer>(Column.class);
    for (int i = 0; i < header.size(); i++) {
      Column column = classify(header.get(i).toLowerCase(Locale.ROOT));
      if (column != null && !columns.containsKey(column)) {
        columns.put(column, i);
      }
    }
    return columns;
  }

  private static @Nullable Column classify(String h) {
    if (h.isEmpty()) {
      return null;
    }
    if (h.contains("acquisition") || h.contains("origination") || h.contains("investment date")) {
      return Column.ACQUISITION_DATE;
    }
    if (h.contains("maturity")) {
      return Column.MATURITY_DATE;
    }
    if (h.contains("principal") || h.contains("par amount") || h.equals("par")) {
      return Column.PRINCIPAL;
    }
    if (h.contains("cost")) {
      return Column.COST;
    }
    if (h.contains("fair value") || h.equals("fair")) {
      return Column.FAIR_VALUE;
    }
    if (h.contains("industry")) {
      return Column.INDUSTRY;
    }
    if ((h.contains("interest") || h.contains("rate") || h.contains("coupon"))
        && !h.contains("spread") && !h.contains("reference")) {
      return Column.INTEREST_RATE;
    }
    if (h.contains("company") || h.contains("portfolio") || h.contains("issuer")
        || h.contains("borrower")) {
      return Column.COMPANY;
    }
    if (h.contains("type") || h.contains("investment") || h.contains("security")
        || h.contains("instrument")) {
      return Column.INVESTMENT_TYPE;
    }
    return null;
  }

  private static @Nullable String cell(List<String> cells, @Nullable Integer index) {
    if (index == null || index >= cells.size()) {
      return null;
    }
    String text = cells.get(index);
    return text.isEmpty() ? null : text;
  }

  /**
   * Reads an amount at the column or, when the figure sits in a cell after a
   * separate {@code $} cell, in one of the next two cells.
   */
  private static @Nullable BigDecimal amount(List<String> cells, @Nullable Integer index) {
    if (index == null) {
      return null;
    }
    for (int i = index; i < Math.min(cells.size(), index + 3); i++) {
      BigDecimal value = FilingNumbers.parseDecimal(cells.get(i));
      if (value != null) {
        return value;
      }
      if (!cells.get(i).isEmpty() && !"$".equals(cells.get(i))) {
        return null;
      }
    }
    return null;
  }

  /** The all-in rate of a cell such as {@code "S + 5.25% (9.58%)"} is its last percentage. */
  private @Nullable String interestRate(@Nullable String text) {
    if (text == null) {
      return null;
    }
    Matcher m = PERCENT.matcher(text);
    String last = null;
    while (m.find()) {
      last = m.group(1);
    }
    return last != null ? rates.normalizePercent(last + "%") : null;
  }

  private static @Nullable String companyName(String cell) {
    return CompanyNameCleaner.clean(FOOTNOTE.matcher(cell).replaceAll(""));
  }
}
