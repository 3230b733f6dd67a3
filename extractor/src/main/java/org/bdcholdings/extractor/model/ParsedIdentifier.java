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

/**
 * Fields recovered from a context's free-text identifier.
 *
 * <p>Every field is optional. A null field means the identifier alone does not
 * determine it, and the value is left to tagged facts or the rendered table.
 * Rates are canonical "N.NN%" strings and dates are "MM/DD/YYYY".
 */
public class ParsedIdentifier {
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

  public @Nullable String getCompanyName() {
    return companyName;
  }

  public void setCompanyName(@Nullable String companyName) {
    this.companyName = companyName;
  }

  public boolean hasCompanyName() {
    return companyName != null && !companyName.trim().isEmpty();
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

  @Override public String toString() {
    return "ParsedIdentifier{company='" + companyName + '\''
        + ", industry='" + industry + '\''
        + ", type='" + investmentType + '\''
        + ", reference=" + referenceRate
        + ", spread=" + spread
        + ", floor=" + floorRate
        + ", pik=" + pikRate
        + ", rate=" + interestRate
        + ", acquired=" + acquisitionDate
        + ", maturity=" + maturityDate
        + '}';
  }
}
