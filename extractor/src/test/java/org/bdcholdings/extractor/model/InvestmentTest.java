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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Investment} and the small value types around it.
 */
@Tag("unit")
class InvestmentTest {

  @Test
  void testFromIdentifierCopiesParsedFields() {
    ParsedIdentifier parsed = new ParsedIdentifier();
    parsed.setCompanyName("Acme LLC");
    parsed.setInvestmentType("First Lien Term Loan");
    parsed.setMaturityDate("03/15/2028");
    Investment investment = Investment.fromIdentifier(parsed, "c-1");
    assertEquals("Acme LLC", investment.getCompanyName());
    assertEquals("First Lien Term Loan", investment.getInvestmentType());
    assertEquals("03/15/2028", investment.getMaturityDate());
    assertEquals("c-1", investment.getContextRef());
    assertEquals(DateConfidence.EXPLICIT, investment.getDateConfidence());
  }

  @Test
  void testNoDateMeansNoConfidence() {
    ParsedIdentifier parsed = new ParsedIdentifier();
    parsed.setCompanyName("Acme LLC");
    assertNull(Investment.fromIdentifier(parsed, "c-1").getDateConfidence());
  }

  @Test
  void testFinancialMagnitude() {
    Investment investment = new Investment();
    assertFalse(investment.hasFinancialMagnitude());
    investment.setCost(BigDecimal.ZERO);
    assertTrue(investment.hasFinancialMagnitude());
  }

  @Test
  void testDateConfidenceKeepsTheWeakest() {
    Investment investment = new Investment();
    investment.noteDateSource(DateConfidence.EXPLICIT);
    investment.noteDateSource(DateConfidence.GUESSED);
    investment.noteDateSource(DateConfidence.INFERRED);
    assertEquals(DateConfidence.GUESSED, investment.getDateConfidence());
  }

  @Test
  void testContextDropsDurationForInstant() {
    InvestmentContext context =
        new InvestmentContext("c-1", "Acme LLC", "2024-09-30", "2024-01-01", "2024-09-30", null);
    assertEquals("2024-09-30", context.getInstant());
    assertNull(context.getStartDate());
    assertNull(context.getEndDate());
  }

  @Test
  void testContextRequiresIdentifier() {
    assertThrows(IllegalArgumentException.class,
        () -> new InvestmentContext("c-1", "  ", "2024-09-30", null, null, null));
  }

  @Test
  void testDerivedFacts() {
    Fact tagged = new Fact("us-gaap:InvestmentInterestRate", "c-1", "0.091", "pure");
    Fact derived = Fact.derived("FloorRate", "c-1", "1.00%");
    assertFalse(tagged.isDerived());
    assertTrue(derived.isDerived());
    assertEquals("derived:FloorRate", derived.getConceptName());
    assertEquals(Fact.derived("FloorRate", "c-1", "1.00%"), derived);
    assertEquals(DateConfidence.GUESSED,
        Fact.derivedDate("MaturityDate", "c-1", "03/15/2028", DateConfidence.GUESSED)
            .getDateConfidence());
  }
}
