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

import org.bdcholdings.extractor.ExtractionConfig;
import org.bdcholdings.extractor.identifier.IdentifierParser;
import org.bdcholdings.extractor.model.DateConfidence;
import org.bdcholdings.extractor.model.Fact;
import org.bdcholdings.extractor.model.Investment;
import org.bdcholdings.extractor.model.InvestmentContext;
import org.bdcholdings.extractor.rate.RateNormalizer;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link InvestmentBuilder}.
 */
@Tag("unit")
class InvestmentBuilderTest {

  private static final String ACME = "Acme Holdings, LLC, Business Services, "
      + "Investment Type First Lien Term Loan, SOFR+6.50%, Floor 1.00%, Maturity 06/30/2029";
  private static final String BRANDNER = "Non-controlled/Non-Affiliated Investments "
      + "Brandner Design LLC, Business Services, Investment Type First Lien Term Loan";

  private InvestmentBuilder builder;

  @BeforeEach
  void setUp() {
    ExtractionConfig config = ExtractionConfig.defaults();
    RateNormalizer rates = new RateNormalizer(config.getReferenceRateAliases());
    builder = new InvestmentBuilder(new IdentifierParser(config, rates), rates);
  }

  private static InvestmentContext context(String identifier) {
    return new InvestmentContext("c-1", identifier, "2024-09-30", null, null, null);
  }

  @Test
  void testBuildFromIdentifierAndFacts() {
    Investment investment = builder.build(context(ACME), ImmutableList.of(
        new Fact("us-gaap:InvestmentOwnedBalancePrincipalAmount", "c-1", "1000000", "usd"),
        new Fact("us-gaap:InvestmentOwnedAtCost", "c-1", "990000", "usd"),
        new Fact("us-gaap:InvestmentOwnedAtFairValue", "c-1", "995000", "usd"),
        new Fact("us-gaap:InvestmentOwnedPercentOfNetAssets", "c-1", "0.012", "pure"),
        new Fact("us-gaap:InvestmentInterestRate", "c-1", "0.1175", "pure"),
        Fact.derived("Spread", "c-1", "7.00%"),
        Fact.derivedDate("AcquisitionDate", "c-1", "01/15/2022", DateConfidence.INFERRED),
        Fact.derivedDate("MaturityDate", "c-1", "12/31/2030", DateConfidence.GUESSED)));

    assertNotNull(investment);
    assertEquals("Acme Holdings, LLC", investment.getCompanyName());
    assertEquals("Business Services", investment.getIndustry());
    assertEquals("First Lien Term Loan", investment.getInvestmentType());
    assertEquals("SOFR", investment.getReferenceRate());
    assertEquals("6.50%", investment.getSpread());
    assertEquals("1.00%", investment.getFloorRate());
    assertEquals("11.75%", investment.getInterestRate());
    assertEquals("1.20%", investment.getPercentNetAssets());
    assertEquals(new BigDecimal("1000000"), investment.getPrincipalAmount());
    assertEquals(new BigDecimal("990000"), investment.getCost());
    assertEquals(new BigDecimal("995000"), investment.getFairValue());
    assertEquals("USD", investment.getCurrency());
    assertEquals("06/30/2029", investment.getMaturityDate());
    assertEquals("01/15/2022", investment.getAcquisitionDate());
    assertEquals(DateConfidence.INFERRED, investment.getDateConfidence());
    assertEquals("c-1", investment.getContextRef());
  }

  @Test
  void testTaggedDatesAndLaterAmounts() {
    Investment investment = builder.build(context(BRANDNER), ImmutableList.of(
        new Fact("us-gaap:InvestmentMaturityDate", "c-1", "2027-06-30", null),
        new Fact("us-gaap:InvestmentMaturityDate", "c-1", "2028-06-30", null),
        new Fact("us-gaap:InvestmentOwnedAtFairValue", "c-1", "480,000", "iso4217_EUR"),
        new Fact("us-gaap:InvestmentOwnedAtFairValue", "c-1", "490,000", "iso4217_EUR"),
        Fact.derivedDate("MaturityDate", "c-1", "12/31/2030", DateConfidence.GUESSED)));

    assertNotNull(investment);
    assertEquals("Brandner Design LLC", investment.getCompanyName());
    assertEquals("06/30/2027", investment.getMaturityDate());
    assertEquals(new BigDecimal("490000"), investment.getFairValue());
    assertEquals("EUR", investment.getCurrency());
    assertEquals(DateConfidence.EXPLICIT, investment.getDateConfidence());
  }

  @Test
  void testDurationStartIsAcquisitionDate() {
    InvestmentContext duration =
        new InvestmentContext("c-2", BRANDNER, null, "2023-01-15", "2024-09-30", null);
    Investment investment = builder.build(duration, ImmutableList.of(
        new Fact("us-gaap:InvestmentOwnedAtFairValue", "c-2", "490000", "usd")));

    assertNotNull(investment);
    assertEquals("01/15/2023", investment.getAcquisitionDate());
    assertNull(investment.getMaturityDate());
    assertEquals(DateConfidence.EXPLICIT, investment.getDateConfidence());
  }

  @Test
  void testNoMagnitudeGivesNull() {
    assertNull(builder.build(context(BRANDNER), ImmutableList.of(
        new Fact("us-gaap:InvestmentOwnedPercentOfNetAssets", "c-1", "0.004", "pure"))));
    assertNull(builder.build(context(BRANDNER), ImmutableList.<Fact>of()));
  }

  @Test
  void testNoCompanyGivesNull() {
    assertNull(builder.build(context("Equity Investments Common Stock"), ImmutableList.of(
        new Fact("us-gaap:InvestmentOwnedAtFairValue", "c-1", "1000", "usd"))));
  }

  @Test
  void testClassify() {
    assertEquals(InvestmentBuilder.Field.PRINCIPAL,
        InvestmentBuilder.classify("us-gaap:InvestmentOwnedBalancePrincipalAmount"));
    assertEquals(InvestmentBuilder.Field.COST,
        InvestmentBuilder.classify("us-gaap:InvestmentOwnedAtCost"));
    assertEquals(InvestmentBuilder.Field.FAIR_VALUE,
        InvestmentBuilder.classify("us-gaap:InvestmentOwnedAtFairValue"));
    assertEquals(InvestmentBuilder.Field.PERCENT_NET_ASSETS,
        InvestmentBuilder.classify("us-gaap:InvestmentOwnedPercentOfNetAssets"));
    assertEquals(InvestmentBuilder.Field.FLOOR_RATE,
        InvestmentBuilder.classify("us-gaap:InvestmentInterestRateFloor"));
    assertEquals(InvestmentBuilder.Field.PIK_RATE,
        InvestmentBuilder.classify("us-gaap:InvestmentInterestRatePaidInKind"));
    assertEquals(InvestmentBuilder.Field.SPREAD,
        InvestmentBuilder.classify("us-gaap:InvestmentBasisSpreadVariableRate"));
    assertEquals(InvestmentBuilder.Field.REFERENCE_RATE,
        InvestmentBuilder.classify("us-gaap:InvestmentVariableInterestRateTypeExtensibleEnumeration"));
    assertEquals(InvestmentBuilder.Field.INTEREST_RATE,
        InvestmentBuilder.classify("us-gaap:InvestmentInterestRate"));
    assertEquals(InvestmentBuilder.Field.MATURITY_DATE,
        InvestmentBuilder.classify("us-gaap:InvestmentMaturityDate"));
    assertEquals(InvestmentBuilder.Field.ACQUISITION_DATE,
        InvestmentBuilder.classify("bdc:InvestmentAcquisitionDate"));
    assertEquals(InvestmentBuilder.Field.SHARES_UNITS,
        InvestmentBuilder.classify("us-gaap:InvestmentOwnedBalanceShares"));
    assertEquals(InvestmentBuilder.Field.UNDRAWN_COMMITMENT,
        InvestmentBuilder.classify("bdc:UnfundedCommitment"));
    assertNull(InvestmentBuilder.classify("dei:EntityRegistrantName"));
  }

  @Test
  void testCurrency() {
    assertEquals("USD", InvestmentBuilder.currency("usd"));
    assertEquals("EUR", InvestmentBuilder.currency("iso4217_EUR"));
    assertNull(InvestmentBuilder.currency("pure"));
    assertNull(InvestmentBuilder.currency("shares"));
    assertNull(InvestmentBuilder.currency(null));
  }

  @Test
  void testReferenceRate() {
    assertEquals("PRIME", builder.referenceRate("us-gaap:PrimeRateMember"));
    assertEquals("SOFR", builder.referenceRate("us-gaap:SecuredOvernightFinancingRateSofrMember"));
    assertEquals("SOFR", builder.referenceRate("SF"));
    assertEquals("EURIBOR", builder.referenceRate("Euribor"));
    assertNull(builder.referenceRate("http://fasb.org/us-gaap/2024#PrimeRateMember"));
  }

  @Test
  void testEstimateCommitment() {
    Investment revolver = new Investment();
    revolver.setInvestmentType("First Lien Debt - Revolver");
    revolver.setPrincipalAmount(new BigDecimal("100000"));
    revolver.setFairValue(new BigDecimal("300000"));
    InvestmentBuilder.estimateCommitment(revolver);
    assertEquals(new BigDecimal("300000"), revolver.getCommitmentLimit());
    assertEquals(new BigDecimal("200000"), revolver.getUndrawnCommitment());

    Investment undrawn = new Investment();
    undrawn.setInvestmentType("Revolving Credit Facility");
    undrawn.setFairValue(new BigDecimal("50000"));
    InvestmentBuilder.estimateCommitment(undrawn);
    assertEquals(new BigDecimal("50000"), undrawn.getCommitmentLimit());
    assertNull(undrawn.getUndrawnCommitment());

    Investment term = new Investment();
    term.setInvestmentType("First Lien Term Loan");
    term.setPrincipalAmount(new BigDecimal("100000"));
    term.setFairValue(new BigDecimal("300000"));
    InvestmentBuilder.estimateCommitment(term);
    assertNull(term.getCommitmentLimit());
    assertNull(term.getUndrawnCommitment());

    Investment belowPar = new Investment();
    belowPar.setInvestmentType("Revolver");
    belowPar.setPrincipalAmount(new BigDecimal("100000"));
    belowPar.setFairValue(new BigDecimal("99000"));
    InvestmentBuilder.estimateCommitment(belowPar);
    assertNull(belowPar.getCommitmentLimit());
  }
}
