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
package org.bdcholdings.extractor.rate;

import org.bdcholdings.extractor.ExtractionConfig;
import org.bdcholdings.extractor.model.RateComponents;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RateNormalizer}.
 */
@Tag("unit")
class RateNormalizerTest {

  private RateNormalizer rates;

  @BeforeEach
  void setUp() {
    rates = new RateNormalizer(ExtractionConfig.defaults().getReferenceRateAliases());
  }

  // ========== Percent Normalization ==========

  @Test
  void testEquivalentSpellingsNormalizeAlike() {
    assertEquals("6.50%", rates.normalizePercent("0.065"));
    assertEquals("6.50%", rates.normalizePercent("6.50"));
    assertEquals("6.50%", rates.normalizePercent("6.5%"));
    assertEquals("6.50%", rates.normalizePercent(" 6.5 % "));
  }

  @Test
  void testExplicitPercentIsNeverScaled() {
    assertEquals("0.50%", rates.normalizePercent("0.5%"));
    assertEquals("50.00%", rates.normalizePercent("0.5"));
  }

  @Test
  void testBasisPoints() {
    assertEquals("5.25%", rates.normalizePercent("525 bps"));
    assertEquals("0.75%", rates.normalizePercent("75bp"));
  }

  @Test
  void testEmptyValues() {
    assertNull(rates.normalizePercent(null));
    assertNull(rates.normalizePercent(""));
    assertNull(rates.normalizePercent("—"));
    assertNull(rates.normalizePercent("N/A"));
    assertNull(rates.normalizePercent("none"));
    assertNull(rates.normalizePercent("Fixed"));
  }

  @Test
  void testSpreadReadsLargeBareValuesAsBasisPoints() {
    assertEquals("5.75%", rates.normalizeSpread("5.75"));
    assertEquals("15.00%", rates.normalizeSpread("1500"));
    assertEquals("5.75%", rates.normalizeSpread("575 bps"));
  }

  // ========== Reference Rates ==========

  @Test
  void testReferenceRateAliases() {
    assertEquals("SOFR", rates.resolveReferenceRate("SF"));
    assertEquals("SOFR", rates.resolveReferenceRate("s"));
    assertEquals("PRIME", rates.resolveReferenceRate("P"));
    assertEquals("EURIBOR", rates.resolveReferenceRate("E"));
  }

  @Test
  void testReferenceRateSpellings() {
    assertEquals("SOFR", rates.resolveReferenceRate("Term SOFR"));
    assertEquals("FED FUNDS", rates.resolveReferenceRate("Federal Funds"));
    assertEquals("SOFR", rates.resolveReferenceRate("SOFR +"));
    assertEquals("XYZ", rates.resolveReferenceRate("xyz"));
  }

  @Test
  void testUrlReferenceRateIsDropped() {
    assertNull(rates.resolveReferenceRate("http://fasb.org/us-gaap/2024#PrimeRateMember"));
    assertNull(rates.resolveReferenceRate(" "));
    assertNull(rates.resolveReferenceRate(null));
  }

  // ========== Compound Expressions ==========

  @Test
  void testDecomposeFullExpression() {
    RateComponents components =
        rates.decompose("SOFR (3-month) + 5.25%, 1.00% Floor, 2.00% PIK");
    assertEquals("SOFR (3-month)", components.getReferenceRate());
    assertEquals("5.25%", components.getSpread());
    assertEquals("1.00%", components.getFloorRate());
    assertEquals("2.00%", components.getPikRate());
  }

  @Test
  void testDecomposeLeadingTenor() {
    RateComponents components = rates.decompose("3-month SOFR + 6.00%");
    assertEquals("SOFR (3-month)", components.getReferenceRate());
    assertEquals("6.00%", components.getSpread());
  }

  @Test
  void testDecomposeShorthandInBasisPoints() {
    RateComponents components = rates.decompose("S+525");
    assertEquals("SOFR", components.getReferenceRate());
    assertEquals("5.25%", components.getSpread());
  }

  @Test
  void testDecomposeShorthandWithPercent() {
    RateComponents components = rates.decompose("SF + 6.00%");
    assertEquals("SOFR", components.getReferenceRate());
    assertEquals("6.00%", components.getSpread());
  }

  @Test
  void testDecomposeNegativeSpread() {
    RateComponents components = rates.decompose("P - 0.25%");
    assertEquals("PRIME", components.getReferenceRate());
    assertEquals("-0.25%", components.getSpread());
  }

  @Test
  void testDecomposeLabelledFields() {
    RateComponents components = rates.decompose("Spread 4.75%, Floor 0.50%, PIK 1.50%");
    assertNull(components.getReferenceRate());
    assertEquals("4.75%", components.getSpread());
    assertEquals("0.50%", components.getFloorRate());
    assertEquals("1.50%", components.getPikRate());
  }

  @Test
  void testSeriesAndClassLettersAreNotReferenceRates() {
    assertTrue(rates.decompose("Acme Therapeutics, Inc., Preferred Stock Series C-1").isEmpty());
    assertTrue(rates.decompose("Series E-2 Preferred Stock").isEmpty());
    assertTrue(rates.decompose("Acme Holdings LLC Class F-1 Units").isEmpty());
    assertTrue(rates.decompose("Warrants Series P-3").isEmpty());
  }

  @Test
  void testDecomposeShorthandNeedsSpreadUnit() {
    assertNull(rates.decompose("Tranche S+2").getReferenceRate());
    assertEquals("SOFR", rates.decompose("S + 4.50%").getReferenceRate());
    assertEquals("2.50%", rates.decompose("E+250").getSpread());
  }

  @Test
  void testDecomposeNothing() {
    assertTrue(rates.decompose("Fixed 12.00%").isEmpty());
    assertTrue(rates.decompose("").isEmpty());
    assertTrue(rates.decompose(null).isEmpty());
  }
}
