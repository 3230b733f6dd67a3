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
package org.bdcholdings.extractor.model;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One row of a rendered schedule-of-investments table.
 */
public final class ScheduleRow {
  private final String companyName;
  private final @Nullable String investmentType;
  private final @Nullable String industry;
  private final @Nullable String interestRate;
  private final @Nullable String acquisitionDate;
  private final @Nullable String maturityDate;
  private final @Nullable BigDecimal principalAmount;
  private final @Nullable BigDecimal cost;
  private final @Nullable BigDecimal fairValue;

  private ScheduleRow(Builder builder) {
    this.companyName = Objects.requireNonNull(builder.companyName, "companyName");
    this.investmentType = builder.investmentType;
    this.industry = builder.industry;
    this.interestRate = builder.interestRate;
    this.acquisitionDate = builder.acquisitionDate;
    this.maturityDate = builder.maturityDate;
    this.principalAmount = builder.principalAmount;
    this.cost = builder.cost;
    this.fairValue = builder.fairValue;
  }

  public static Builder builder(String companyName) {
    return new Builder(companyName);
  }

  public String getCompanyName() {
    return companyName;
  }

  public @Nullable String getInvestmentType() {
    return investmentType;
  }

  public @Nullable String getIndustry() {
    return industry;
  }

  public @Nullable String getInterestRate() {
    return interestRate;
  }

  public @Nullable String getAcquisitionDate() {
    return acquisitionDate;
  }

  public @Nullable String getMaturityDate() {
    return maturityDate;
  }

  public @Nullable BigDecimal getPrincipalAmount() {
    return principalAmount;
  }

  public @Nullable BigDecimal getCost() {
    return cost;
  }

  public @Nullable BigDecimal getFairValue() {
    return fairValue;
  }

  @Override public String toString() {
    return "ScheduleRow{company='" + companyName + '\''
        + ", type='" + investmentType + '\''
        + ", rate=" + interestRate
        + ", acquired=" + acquisitionDate
        + ", maturity=" + maturityDate
        + '}';
  }

  /** Builder for {@link ScheduleRow}. */
  public static final class Builder {
    private final String companyName;
    private @Nullable String investmentType;
    private @Nullable String industry;
    private @Nullable String interestRate;
    private @Nullable String acquisitionDate;
    private @Nullable String maturityDate;
    private @Nullable BigDecimal principalAmount;
    private @Nullable BigDecimal cost;
    private @Nullable BigDecimal fairValue;

    private Builder(String companyName) {
      this.companyName = companyName;
    }

    public Builder investmentType(@Nullable String investmentType) {
      this.investmentType = investmentType;
      return this;
    }

    public Builder industry(@Nullable String industry) {
      this.industry = industry;
      return this;
    }

    public Builder interestRate(@Nullable String interestRate) {
      this.interestRate = interestRate;
      return this;
    }

    public Builder acquisitionDate(@Nullable String acquisitionDate) {
      this.acquisitionDate = acquisitionDate;
      return this;
    }

    public Builder maturityDate(@Nullable String maturityDate) {
      this.maturityDate = maturityDate;
      return this;
    }

    public Builder principalAmount(@Nullable BigDecimal principalAmount) {
      this.principalAmount = principalAmount;
      return this;
    }

    public Builder cost(@Nullable BigDecimal cost) {
      this.cost = cost;
      return this;
    }

    public Builder fairValue(@Nullable BigDecimal fairValue) {
      this.fairValue = fairValue;
      return this;
    }

    public ScheduleRow build() {
      return new ScheduleRow(this);
    }
  }
}
