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
package org.bdcholdings.extractor;

import org.bdcholdings.extractor.model.Investment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of extracting one filing: the investment records and statistics
 * about how they were obtained.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * ExtractionResult result = extractor.extract(markup, renderedHtml);
 * for (Investment investment : result.getInvestments()) {
 *   ...
 * }
 * if (result.getCoverageRatio() < 0.9) {
 *   LOGGER.warn("Low coverage: {}", result);
 * }
 * }</pre>
 *
 * @see InvestmentExtractor
 */
public class ExtractionResult {

  private final @Nullable String reportingInstant;
  private final List<Investment> investments;
  private final int contextsResolved;
  private final int contextsInPeriod;
  private final int contextsDiscarded;
  private final int duplicatesRemoved;
  private final int htmlMerges;

  private ExtractionResult(Builder builder) {
    this.reportingInstant = builder.reportingInstant;
    this.investments = builder.investments != null
        ? ImmutableList.copyOf(builder.investments)
        : ImmutableList.<Investment>of();
    this.contextsResolved = builder.contextsResolved;
    this.contextsInPeriod = builder.contextsInPeriod;
    this.contextsDiscarded = builder.contextsDiscarded;
    this.duplicatesRemoved = builder.duplicatesRemoved;
    this.htmlMerges = builder.htmlMerges;
  }

  /**
   * Returns the instant treated as the current reporting date, in
   * {@code YYYY-MM-DD} form, or null when the filing has no instant contexts.
   */
  public @Nullable String getReportingInstant() {
    return reportingInstant;
  }

  /**
   * Returns the extracted records, in document order.
   */
  public List<Investment> getInvestments() {
    return investments;
  }

  /**
   * Returns the number of holding contexts found in the markup.
   */
  public int getContextsResolved() {
    return contextsResolved;
  }

  /**
   * Returns the number of holding contexts at the reporting instant.
   */
  public int getContextsInPeriod() {
    return contextsInPeriod;
  }

  /**
   * Returns the number of in-period contexts that produced no record.
   */
  public int getContextsDiscarded() {
    return contextsDiscarded;
  }

  public int getDuplicatesRemoved() {
    return duplicatesRemoved;
  }

  /**
   * Returns the number of records that received a value from the rendered
   * schedule.
   */
  public int getHtmlMerges() {
    return htmlMerges;
  }

  /**
   * Returns records produced over in-period contexts; 0 when there were none.
   */
  public double getCoverageRatio() {
    if (contextsInPeriod == 0) {
      return 0;
    }
    return (double) investments.size() / contextsInPeriod;
  }

  public BigDecimal getTotalPrincipal() {
    BigDecimal total = BigDecimal.ZERO;
    for (Investment investment : investments) {
      if (investment.getPrincipalAmount() != null) {
        total = total.add(investment.getPrincipalAmount());
      }
    }
    return total;
  }

  public BigDecimal getTotalCost() {
    BigDecimal total = BigDecimal.ZERO;
    for (Investment investment : investments) {
      if (investment.getCost() != null) {
        total = total.add(investment.getCost());
      }
    }
    return total;
  }

  public BigDecimal getTotalFairValue() {
    BigDecimal total = BigDecimal.ZERO;
    for (Investment investment : investments) {
      if (investment.getFairValue() != null) {
        total = total.add(investment.getFairValue());
      }
    }
    return total;
  }

  /**
   * Returns record counts per industry, sorted by industry. Records without
   * an industry are counted under {@code "Unknown"}.
   */
  public Map<String, Integer> getCountsByIndustry() {
    Map<String, Integer> counts = new TreeMap<String, Integer>();
    for (Investment investment : investments) {
      increment(counts, investment.getIndustry());
    }
    return ImmutableMap.copyOf(counts);
  }

  /**
   * Returns record counts per investment type, sorted by type.
   */
  public Map<String, Integer> getCountsByInvestmentType() {
    Map<String, Integer> counts = new TreeMap<String, Integer>();
    for (Investment investment : investments) {
      increment(counts, investment.getInvestmentType());
    }
    return ImmutableMap.copyOf(counts);
  }

  private static void increment(Map<String, Integer> counts, @Nullable String key) {
    String k = key == null ? "Unknown" : key;
    Integer count = counts.get(k);
    counts.put(k, count == null ? 1 : count + 1);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("ExtractionResult{instant=").append(reportingInstant);
    sb.append(", investments=").append(investments.size());
    sb.append(", contexts=").append(contextsInPeriod).append("/").append(contextsResolved);
    if (contextsDiscarded > 0) {
      sb.append(" (").append(contextsDiscarded).append(" discarded)");
    }
    if (duplicatesRemoved > 0) {
      sb.append(", duplicates=").append(duplicatesRemoved);
    }
    if (htmlMerges > 0) {
      sb.append(", htmlMerges=").append(htmlMerges);
    }
    sb.append(", coverage=")
        .append(String.format(Locale.ROOT, "%.1f%%", getCoverageRatio() * 100));
    sb.append("}");
    return sb.toString();
  }

  /**
   * Creates a new builder for ExtractionResult.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for ExtractionResult.
   */
  public static class Builder {
    private @Nullable String reportingInstant;
    private @Nullable List<Investment> investments;
    private int contextsResolved;
    private int contextsInPeriod;
    private int contextsDiscarded;
    private int duplicatesRemoved;
    private int htmlMerges;

    public Builder reportingInstant(@Nullable String reportingInstant) {
      this.reportingInstant = reportingInstant;
      return this;
    }

    public Builder investments(List<Investment> investments) {
      this.investments = investments;
      return this;
    }

    public Builder contextsResolved(int contextsResolved) {
      this.contextsResolved = contextsResolved;
      return this;
    }

    public Builder contextsInPeriod(int contextsInPeriod) {
      this.contextsInPeriod = contextsInPeriod;
      return this;
    }

    public Builder contextsDiscarded(int contextsDiscarded) {
      this.contextsDiscarded = contextsDiscarded;
      return this;
    }

    public Builder duplicatesRemoved(int duplicatesRemoved) {
      this.duplicatesRemoved = duplicatesRemoved;
      return this;
    }

    public Builder htmlMerges(int htmlMerges) {
      this.htmlMerges = htmlMerges;
      return this;
    }

    public ExtractionResult build() {
      return new ExtractionResult(this);
    }
  }
}
