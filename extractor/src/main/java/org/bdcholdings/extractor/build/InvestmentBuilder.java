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
package org.bdcholdings.extractor.build;

import org.bdcholdings.extractor.identifier.IdentifierParser;
import org.bdcholdings.extractor.model.DateConfidence;
import org.bdcholdings.extractor.model.Fact;
import org.bdcholdings.extractor.model.Investment;
import org.bdcholdings.extractor.model.InvestmentContext;
import org.bdcholdings.extractor.model.ParsedIdentifier;
import org.bdcholdings.extractor.rate.RateNormalizer;
import org.bdcholdings.extractor.util.FilingDates;
import org.bdcholdings.extractor.util.FilingNumbers;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one holding context and its facts into an {@link Investment}.
 *
 * <p>The record starts from the parsed identifier. Tagged facts are then
 * classified by concept name; a later fact for the same field replaces an
 * earlier one, except that a date already known is kept. Derived facts come
 * last and only fill fields that are still empty.
 *
 * <p>A record without company name, or without any of principal, cost and
 * fair value, is not a holding (header rows, subtotals) and gives null.
 */
public class InvestmentBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(InvestmentBuilder.class);

  private static final Pattern CURRENCY_CODE = Pattern.compile("(?<![A-Z])([A-Z]{3})(?![A-Z])");

  /** Benchmarks recognized inside enumeration values such as {@code us-gaap:PrimeRateMember}. */
  private static final Map<String, String> REFERENCE_MARKERS = ImmutableMap.<String, String>builder()
      .put("sofr", "SOFR")
      .put("securedovernightfinancingrate", "SOFR")
      .put("libor", "LIBOR")
      .put("londoninterbank", "LIBOR")
      .put("euribor", "EURIBOR")
      .put("sonia", "SONIA")
      .put("prime", "PRIME")
      .put("cdor", "CDOR")
      .put("fedfunds", "FED FUNDS")
      .put("federalfunds", "FED FUNDS")
      .build();

  /** Semantic field a concept name maps to. */
  enum Field {
    PERCENT_NET_ASSETS, PRINCIPAL, COST, FAIR_VALUE, MATURITY_DATE, ACQUISITION_DATE,
    PIK_RATE, FLOOR_RATE, SPREAD, REFERENCE_RATE, INTEREST_RATE, SHARES_UNITS,
    UNDRAWN_COMMITMENT
  }

  private final IdentifierParser identifiers;
  private final RateNormalizer rates;

  public InvestmentBuilder(IdentifierParser identifiers, RateNormalizer rates) {
    this.identifiers = identifiers;
    this.rates = rates;
  }

  /**
   * Builds the record of one context.
   *
   * @param context a holding context
   * @param facts the facts tagged against it, in document order
   * @return the record, or null if the context is not a reportable holding
   */
  public @Nullable Investment build(InvestmentContext context, List<Fact> facts) {
    ParsedIdentifier parsed =
        identifiers.parse(context.getRawIdentifier(), context.getIndustryHint());
    if (!parsed.hasCompanyName()) {
      LOGGER.debug("Context {} skipped: no company in identifier '{}'",
          context.getContextId(), context.getRawIdentifier());
      return null;
    }

    Investment investment = Investment.fromIdentifier(parsed, context.getContextId());
    for (Fact fact : facts) {
      if (!fact.isDerived()) {
        applyTagged(investment, fact);
      }
    }
    for (Fact fact : facts) {
      if (fact.isDerived()) {
        applyDerived(investment, fact);
      }
    }
    if (investment.getAcquisitionDate() == null && context.getStartDate() != null) {
      String start = FilingDates.normalize(context.getStartDate());
      if (start != null) {
        investment.setAcquisitionDate(start);
        investment.noteDateSource(DateConfidence.EXPLICIT);
      }
    }
    estimateCommitment(investment);

    if (!investment.hasFinancialMagnitude()) {
      LOGGER.debug("Context {} ({}) skipped: no principal, cost or fair value",
          context.getContextId(), investment.getCompanyName());
      return null;
    }
    return investment;
  }

  /**
   * Classifies a concept by keywords in its lower-cased name. The order of
   * the checks matters: {@code InvestmentInterestRateFloor} is a floor, not an
   * interest rate.
   */
  static @Nullable Field classify(String conceptName) {
    String c = conceptName.toLowerCase(Locale.ROOT);
    if (c.contains("percentofnetassets") || c.contains("percentnetassets")) {
      return Field.PERCENT_NET_ASSETS;
    }
    if (c.contains("principalamount") || c.contains("outstandingprincipal")
        || c.contains("ownedbalanceprincipal")) {
      return Field.PRINCIPAL;
    }
    if ((c.contains("cost") && (c.contains("amortized") || c.contains("basis")))
        || c.contains("ownedatcost")) {
      return Field.COST;
    }
    if (c.contains("fairvalue") || (c.contains("fair") && c.contains("value"))) {
      return Field.FAIR_VALUE;
    }
    if (c.contains("maturitydate") || (c.contains("maturity") && c.contains("date"))) {
      return Field.MATURITY_DATE;
    }
    if (c.contains("acquisitiondate") || c.contains("investmentdate")
        || c.contains("originationdate")) {
      return Field.ACQUISITION_DATE;
    }
    if (c.contains("paidinkind") || c.contains("pikrate") || c.contains("interestratepik")) {
      return Field.PIK_RATE;
    }
    if (c.contains("floor")) {
      return Field.FLOOR_RATE;
    }
    if (c.contains("spread")) {
      return Field.SPREAD;
    }
    if (c.contains("variableinterestratetype")
        || (c.contains("reference") && c.contains("rate"))) {
      return Field.REFERENCE_RATE;
    }
    if (c.contains("interestrate")) {
      return Field.INTEREST_RATE;
    }
    if (c.contains("balanceshares") || c.contains("sharesoutstanding")
        || c.contains("unitsoutstanding") || c.contains("numberofshares")) {
      return Field.SHARES_UNITS;
    }
    if (c.contains("unfundedcommitment") || c.contains("undrawncommitment")) {
      return Field.UNDRAWN_COMMITMENT;
    }
    return null;
  }

  private void applyTagged(Investment investment, Fact fact) {
    String currency = currency(fact.getUnitHint());
    if (currency != null) {
      investment.setCurrency(currency);
    }
    Field field = classify(fact.getConceptName());
    if (field == null) {
      return;
    }
    String value = fact.getRawValue();
    switch (field) {
    case PERCENT_NET_ASSETS:
      setIfPresent(investment, field, rates.normalizePercent(value));
      break;
    case PRINCIPAL:
    case COST:
    case FAIR_VALUE:
    case SHARES_UNITS:
    case UNDRAWN_COMMITMENT:
      setAmount(investment, field, FilingNumbers.parseDecimal(value));
      break;
    case MATURITY_DATE:
      if (investment.getMaturityDate() == null) {
        String date = FilingDates.normalize(value);
        if (date != null) {
          investment.setMaturityDate(date);
          investment.noteDateSource(DateConfidence.EXPLICIT);
        }
      }
      break;
    case ACQUISITION_DATE:
      if (investment.getAcquisitionDate() == null) {
        String date = FilingDates.normalize(value);
        if (date != null) {
          investment.setAcquisitionDate(date);
          investment.noteDateSource(DateConfidence.EXPLICIT);
        }
      }
      break;
    case PIK_RATE:
    case FLOOR_RATE:
    case INTEREST_RATE:
      setIfPresent(investment, field, rates.normalizePercent(value));
      break;
    case SPREAD:
      setIfPresent(investment, field, rates.normalizeSpread(value));
      break;
    case REFERENCE_RATE:
      setIfPresent(investment, field, referenceRate(value));
      break;
    default:
      break;
    }
  }

  private void applyDerived(Investment investment, Fact fact) {
    String name = fact.getConceptName().substring(Fact.DERIVED_PREFIX.length());
    String value = fact.getRawValue();
    switch (name) {
    case "ReferenceRateToken":
      if (investment.getReferenceRate() == null) {
        investment.setReferenceRate(rates.resolveReferenceRate(value));
      }
      break;
    case "Spread":
      if (investment.getSpread() == null) {
        investment.setSpread(rates.normalizeSpread(value));
      }
      break;
    case "FloorRate":
      if (investment.getFloorRate() == null) {
        investment.setFloorRate(rates.normalizePercent(value));
      }
      break;
    case "PIKRate":
      if (investment.getPikRate() == null) {
        investment.setPikRate(rates.normalizePercent(value));
      }
      break;
    case "AcquisitionDate":
      if (investment.getAcquisitionDate() == null) {
        investment.setAcquisitionDate(FilingDates.normalize(value));
        noteDerivedDate(investment, fact);
      }
      break;
    case "MaturityDate":
      if (investment.getMaturityDate() == null) {
        investment.setMaturityDate(FilingDates.normalize(value));
        noteDerivedDate(investment, fact);
      }
      break;
    default:
      LOGGER.debug("Ignoring unknown derived fact {}", fact);
      break;
    }
  }

  private static void noteDerivedDate(Investment investment, Fact fact) {
    DateConfidence confidence = fact.getDateConfidence();
    investment.noteDateSource(confidence != null ? confidence : DateConfidence.INFERRED);
  }

  private static void setIfPresent(Investment investment, Field field, @Nullable String value) {
    if (value == null) {
      return;
    }
    switch (field) {
    case PERCENT_NET_ASSETS:
      investment.setPercentNetAssets(value);
      break;
    case PIK_RATE:
      investment.setPikRate(value);
      break;
    case FLOOR_RATE:
      investment.setFloorRate(value);
      break;
    case INTEREST_RATE:
      investment.setInterestRate(value);
      break;
    case SPREAD:
      investment.setSpread(value);
      break;
    case REFERENCE_RATE:
      investment.setReferenceRate(value);
      break;
    default:
      throw new AssertionError("not a text field: " + field);
    }
  }

  private static void setAmount(Investment investment, Field field, @Nullable BigDecimal value) {
    if (value == null) {
      return;
    }
    switch (field) {
    case PRINCIPAL:
      investment.setPrincipalAmount(value);
      break;
    case COST:
      investment.setCost(value);
      break;
    case FAIR_VALUE:
      investment.setFairValue(value);
      break;
    case SHARES_UNITS:
      investment.setSharesUnits(value);
      break;
    case UNDRAWN_COMMITMENT:
      investment.setUndrawnCommitment(value);
      break;
    default:
      throw new AssertionError("not an amount field: " + field);
    }
  }

  /**
   * Reads a reference-rate fact. Values may be a name ({@code "SOFR"}), a
   * shorthand ({@code "SF"}) or an enumeration QName
   * ({@code us-gaap:SecuredOvernightFinancingRateSofrMember}); URL-valued
   * facts give null.
   */
  @Nullable String referenceRate(String value) {
    String text = value.trim();
    if (text.regionMatches(true, 0, "http", 0, 4)) {
      return null;
    }
    String compact = text.toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]", "");
    for (Map.Entry<String, String> marker : REFERENCE_MARKERS.entrySet()) {
      if (compact.contains(marker.getKey())) {
        return marker.getValue();
      }
    }
    return rates.resolveReferenceRate(text);
  }

  /** Extracts an ISO 4217 code from a unit such as {@code usd} or {@code iso4217_EUR}. */
  static @Nullable String currency(@Nullable String unitHint) {
    if (unitHint == null) {
      return null;
    }
    Matcher m = CURRENCY_CODE.matcher(unitHint.toUpperCase(Locale.ROOT));
    while (m.find()) {
      try {
        return Currency.getInstance(m.group(1)).getCurrencyCode();
      } catch (IllegalArgumentException e) {
        LOGGER.trace("'{}' in unit '{}' is not a currency", m.group(1), unitHint);
      }
    }
    return null;
  }

  /**
   * Estimates the commitment of a revolving facility: when fair value exceeds
   * the drawn principal, the excess is taken as undrawn.
   */
  static void estimateCommitment(Investment investment) {
    String type = investment.getInvestmentType();
    BigDecimal fairValue = investment.getFairValue();
    if (type == null || fairValue == null
        || !type.toLowerCase(Locale.ROOT).contains("revolv")) {
      return;
    }
    BigDecimal principal = investment.getPrincipalAmount();
    if (principal == null) {
      if (investment.getCommitmentLimit() == null) {
        investment.setCommitmentLimit(fairValue);
      }
    } else if (fairValue.compareTo(principal) > 0) {
      if (investment.getCommitmentLimit() == null) {
        investment.setCommitmentLimit(fairValue);
      }
      if (investment.getUndrawnCommitment() == null) {
        investment.setUndrawnCommitment(fairValue.subtract(principal));
      }
    }
  }
}
