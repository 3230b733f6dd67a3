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
 * One holding of a business development company for one reporting period.
 *
 * <p>Created by the investment builder from a context and its facts, gap-filled
 * by the rendered-table merge, then finalized by standardization. Monetary
 * amounts are plain decimals, rates are "N.NN%" strings and dates are
 * "MM/DD/YYYY" strings.
 *
 * <p>A record is only emitted when {@link #hasFinancialMagnitude()} holds.
 */
public class Investment {
  private @Nullable String companyName;
  private @Nullable String industry;
  private @Nullable String investmentType;
  private @Nullable String referenceRate;
  private @Nullable String spread;
  private @Nullable String floorRate;
  private @Nullable String pikRate;
  private @Nullable String interestRate;
  private @Nullable String acquisitionDate;
  private @Nullable String maturityDate;
  private @Nullable BigDecimal principalAmount;
  private @Nullable BigDecimal cost;
  private @Nullable BigDecimal fairValue;
  private @Nullable BigDecimal sharesUnits;
  private @Nullable String percentNetAssets;
  private @Nullable String currency;
  private @Nullable BigDecimal commitmentLimit;
  private @Nullable BigDecimal undrawnCommitment;
  private @Nullable String contextRef;
  private @Nullable DateConfidence dateConfidence;

  public Investment() {
  }

  /** Starts a record from the fields an identifier parse produced. */
  public static Investment fromIdentifier(ParsedIdentifier parsed, String contextRef) {
    Investment investment = new Investment();
    investment.companyName = parsed.getCompanyName();
    investment.industry = parsed.getIndustry();
    investment.investmentType = parsed.getInvestmentType();
    investment.referenceRate = parsed.getReferenceRate();
    investment.spread = parsed.getSpread();
    investment.floorRate = parsed.getFloorRate();
    investment.pikRate = parsed.getPikRate();
    investment.interestRate = parsed.getInterestRate();
    investment.acquisitionDate = parsed.getAcquisitionDate();
    investment.maturityDate = parsed.getMaturityDate();
    investment.contextRef = contextRef;
    if (investment.acquisitionDate != null || investment.maturityDate != null) {
      investment.dateConfidence = DateConfidence.EXPLICIT;
    }
    return investment;
  }

  /** Whether at least one of principal, cost and fair value is present. */
  public boolean hasFinancialMagnitude() {
    return principalAmount != null || cost != null || fairValue != null;
  }

  /** Records that a date was taken from a source of the given reliability. */
  public void noteDateSource(DateConfidence confidence) {
    dateConfidence = dateConfidence == null ? confidence : dateConfidence.weakest(confidence);
  }

  public @Nullable String getCompanyName() {
    return companyName;
  }

  public void setCompanyName(@Nullable String companyName) {
    this.companyName = companyName;
  }

  public @Nullable String getIndustry() {
    return industry;
  }

  public void setIndustry(@Nullable String industry) {
    this.industry = industry;
  }

  public @Nullable String getInvestmentType() {
    return investmentType;
  }

  public void setInvestmentType(@Nullable String investmentType) {
    this.investmentType = investmentType;
  }

  public @Nullable String getReferenceRate() {
    return referenceRate;
  }

  public void setReferenceRate(@Nullable String referenceRate) {
    this.referenceRate = referenceRate;
  }

  public @Nullable String getSpread() {
    return spread;
  }

  public void setSpread(@Nullable String spread) {
    this.spread = spread;
  }

  public @Nullable String getFloorRate() {
    return floorRate;
  }

  public void setFloorRate(@Nullable String floorRate) {
    this.floorRate = floorRate;
  }

  public @Nullable String getPikRate() {
    return pikRate;
  }

  public void setPikRate(@Nullable String pikRate) {
    this.pikRate = pikRate;
  }

  public @Nullable String getInterestRate() {
    return interestRate;
  }

  public void setInterestRate(@Nullable String interestRate) {
    this.interestRate = interestRate;
  }

  public @Nullable String getAcquisitionDate() {
    return acquisitionDate;
  }

  public void setAcquisitionDate(@Nullable String acquisitionDate) {
    this.acquisitionDate = acquisitionDate;
  }

  public @Nullable String getMaturityDate() {
    return maturityDate;
  }

  public void setMaturityDate(@Nullable String maturityDate) {
    this.maturityDate = maturityDate;
  }

  public @Nullable BigDecimal getPrincipalAmount() {
    return principalAmount;
  }

  public void setPrincipalAmount(@Nullable BigDecimal principalAmount) {
    this.principalAmount = principalAmount;
  }

  public @Nullable BigDecimal getCost() {
    return cost;
  }

  public void setCost(@Nullable BigDecimal cost) {
    this.cost = cost;
  }

  public @Nullable BigDecimal getFairValue() {
    return fairValue;
  }

  public void setFairValue(@Nullable BigDecimal fairValue) {
    this.fairValue = fairValue;
  }

  public @Nullable BigDecimal getSharesUnits() {
    return sharesUnits;
  }

  public void setSharesUnits(@Nullable BigDecimal sharesUnits) {
    this.sharesUnits = sharesUnits;
  }

  public @Nullable String getPercentNetAssets() {
    return percentNetAssets;
  }

  public void setPercentNetAssets(@Nullable String percentNetAssets) {
    this.percentNetAssets = percentNetAssets;
  }

  public @Nullable String getCurrency() {
    return currency;
  }

  public void setCurrency(@Nullable String currency) {
    this.currency = currency;
  }

  public @Nullable BigDecimal getCommitmentLimit() {
    return commitmentLimit;
  }

  public void setCommitmentLimit(@Nullable BigDecimal commitmentLimit) {
    this.commitmentLimit = commitmentLimit;
  }

  public @Nullable BigDecimal getUndrawnCommitment() {
    return undrawnCommitment;
  }

  public void setUndrawnCommitment(@Nullable BigDecimal undrawnCommitment) {
    this.undrawnCommitment = undrawnCommitment;
  }

  public @Nullable String getContextRef() {
    return contextRef;
  }

  public void setContextRef(@Nullable String contextRef) {
    this.contextRef = contextRef;
  }

  public @Nullable DateConfidence getDateConfidence() {
    return dateConfidence;
  }

  public void setDateConfidence(@Nullable DateConfidence dateConfidence) {
    this.dateConfidence = dateConfidence;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Investment)) {
      return false;
    }
    Investment that = (Investment) o;
    return Objects.equals(companyName, that.companyName)
        && Objects.equals(industry, that.industry)
        && Objects.equals(investmentType, that.investmentType)
        && Objects.equals(referenceRate, that.referenceRate)
        && Objects.equals(spread, that.spread)
        && Objects.equals(floorRate, that.floorRate)
        && Objects.equals(pikRate, that.pikRate)
        && Objects.equals(interestRate, that.interestRate)
        && Objects.equals(acquisitionDate, that.acquisitionDate)
        && Objects.equals(maturityDate, that.maturityDate)
        && Objects.equals(principalAmount, that.principalAmount)
        && Objects.equals(cost, that.cost)
        && Objects.equals(fairValue, that.fairValue)
        && Objects.equals(sharesUnits, that.sharesUnits)
        && Objects.equals(percentNetAssets, that.percentNetAssets)
        && Objects.equals(currency, that.currency)
        && Objects.equals(commitmentLimit, that.commitmentLimit)
        && Objects.equals(undrawnCommitment, that.undrawnCommitment)
        && Objects.equals(contextRef, that.contextRef)
        && dateConfidence == that.dateConfidence;
  }

  @Override public int hashCode() {
    return Objects.hash(companyName, industry, investmentType, referenceRate, spread,
        floorRate, pikRate, interestRate, acquisitionDate, maturityDate, principalAmount,
        cost, fairValue, sharesUnits, percentNetAssets, currency, commitmentLimit,
        undrawnCommitment, contextRef, dateConfidence);
  }

  @Override public String toString() {
    return "Investment{company='" + companyName + '\''
        + ", type='" + investmentType + '\''
        + ", industry='" + industry + '\''
        + ", rate=" + interestRate
        + ", maturity=" + maturityDate
        + ", principal=" + principalAmount
        + ", cost=" + cost
        + ", fairValue=" + fairValue
        + ", context=" + contextRef
        + '}';
  }
}
