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
package org.bdcholdings.extractor.standardize;

import org.bdcholdings.extractor.model.Investment;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the categorical fields of an investment onto canonical vocabularies.
 *
 * <p>Three tables are consulted:
 * <ul>
 *   <li>investment type, e.g. "First Lien Senior Secured Loan" → "First Lien Debt";</li>
 *   <li>industry, e.g. "Software &amp; Services" → "Software";</li>
 *   <li>reference rate, e.g. "SF" → "SOFR". A parenthetical term survives:
 *       "sofr (3-month)" → "SOFR (3-month)".</li>
 * </ul>
 *
 * <p>Runs last, after every other field has been filled, so consumers see a
 * single vocabulary regardless of the filer.
 */
public class StandardizationMapper {
  private static final Pattern RATE_TERM =
      Pattern.compile("^(.*?)\\s*\\(\\s*(\\d+)\\s*-?\\s*(month|mo|day|week|year)s?\\s*\\)\\s*$",
          Pattern.CASE_INSENSITIVE);

  private final VocabularyTable investmentTypes;
  private final VocabularyTable industries;
  private final VocabularyTable referenceRates;

  public StandardizationMapper(VocabularyTable investmentTypes, VocabularyTable industries,
      VocabularyTable referenceRates) {
    this.investmentTypes = Objects.requireNonNull(investmentTypes, "investmentTypes");
    this.industries = Objects.requireNonNull(industries, "industries");
    this.referenceRates = Objects.requireNonNull(referenceRates, "referenceRates");
  }

  public @Nullable String standardizeInvestmentType(@Nullable String raw) {
    return investmentTypes.map(raw);
  }

  public @Nullable String standardizeIndustry(@Nullable String raw) {
    return industries.map(raw);
  }

  public @Nullable String standardizeReferenceRate(@Nullable String raw) {
    if (raw == null || raw.trim().isEmpty()) {
      return referenceRates.map(raw);
    }
    Matcher m = RATE_TERM.matcher(raw.trim());
    if (m.matches() && !m.group(1).isEmpty()) {
      String base = referenceRates.map(m.group(1));
      String unit = m.group(3).toLowerCase(Locale.ROOT);
      return base + " (" + m.group(2) + "-" + ("mo".equals(unit) ? "month" : unit) + ")";
    }
    return referenceRates.map(raw);
  }

  /** Rewrites the categorical fields of {@code investment} in place. */
  public void standardize(Investment investment) {
    investment.setInvestmentType(standardizeInvestmentType(investment.getInvestmentType()));
    investment.setIndustry(standardizeIndustry(investment.getIndustry()));
    investment.setReferenceRate(standardizeReferenceRate(investment.getReferenceRate()));
  }
}
