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
package org.bdcholdings.extractor.xbrl;

import org.bdcholdings.extractor.ExtractionConfig;
import org.bdcholdings.extractor.model.InvestmentContext;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ContextResolver}.
 */
@Tag("unit")
class ContextResolverTest {

  private static final String INSTANCE = "<xbrli:xbrl>\n"
      + "<xbrli:context id=\"c-1\">\n"
      + "  <xbrli:entity>\n"
      + "    <xbrli:identifier scheme=\"http://www.sec.gov/CIK\">0001234567</xbrli:identifier>\n"
      + "    <xbrli:segment>\n"
      + "      <xbrldi:typedMember dimension=\"us-gaap:InvestmentIdentifierAxis\">"
      + "<us-gaap:InvestmentIdentifierAxis.domain>Acme &amp; Co LLC,\n   First Lien"
      + "</us-gaap:InvestmentIdentifierAxis.domain></xbrldi:typedMember>\n"
      + "      <xbrldi:explicitMember dimension=\"us-gaap:EquitySecuritiesByIndustryAxis\">"
      + " bdc:HealthCareEquipmentAndServicesSectorMember </xbrldi:explicitMember>\n"
      + "    </xbrli:segment>\n"
      + "  </xbrli:entity>\n"
      + "  <xbrli:period><xbrli:instant>2024-09-30</xbrli:instant></xbrli:period>\n"
      + "</xbrli:context>\n"
      + "<xbrli:context id=\"c-2\">\n"
      + "  <xbrli:entity><xbrli:segment>\n"
      + "    <xbrldi:typedMember dimension=\"us-gaap:InvestmentIdentifierAxis\">"
      + "<us-gaap:InvestmentIdentifierAxis.domain>Beta Corp Term Loan"
      + "</us-gaap:InvestmentIdentifierAxis.domain></xbrldi:typedMember>\n"
      + "  </xbrli:segment></xbrli:entity>\n"
      + "  <xbrli:period><xbrli:startDate>2023-01-15</xbrli:startDate>"
      + "<xbrli:endDate>2024-09-30</xbrli:endDate></xbrli:period>\n"
      + "</xbrli:context>\n"
      + "<xbrli:context id=\"c-entity\">\n"
      + "  <xbrli:entity><xbrli:identifier scheme=\"http://www.sec.gov/CIK\">0001234567"
      + "</xbrli:identifier></xbrli:entity>\n"
      + "  <xbrli:period><xbrli:instant>2024-09-30</xbrli:instant></xbrli:period>\n"
      + "</xbrli:context>\n"
      + "<xbrli:context id=\"c-other\">\n"
      + "  <xbrli:entity><xbrli:segment>\n"
      + "    <xbrldi:typedMember dimension=\"us-gaap:LoanIdentifierAxis\">"
      + "<x:domain>Ignored LLC</x:domain></xbrldi:typedMember>\n"
      + "  </xbrli:segment></xbrli:entity>\n"
      + "  <xbrli:period><xbrli:instant>2024-09-30</xbrli:instant></xbrli:period>\n"
      + "</xbrli:context>\n"
      + "<context id='c-1'><entity><segment><typedMember dimension='InvestmentIdentifierAxis'>"
      + "Repeated LLC</typedMember></segment></entity>"
      + "<period><instant>2024-09-30</instant></period></context>\n"
      + "</xbrli:xbrl>\n";

  private ContextResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new ContextResolver(ExtractionConfig.defaults());
  }

  @Test
  void testResolvesHoldingContextsOnly() {
    List<InvestmentContext> contexts = resolver.resolve(INSTANCE);
    assertEquals(2, contexts.size());
    assertEquals("c-1", contexts.get(0).getContextId());
    assertEquals("c-2", contexts.get(1).getContextId());
  }

  @Test
  void testIdentifierTextAndIndustry() {
    InvestmentContext context = resolver.resolve(INSTANCE).get(0);
    assertEquals("Acme & Co LLC, First Lien", context.getRawIdentifier());
    assertEquals("Health Care Equipment and Services", context.getIndustryHint());
    assertEquals("2024-09-30", context.getInstant());
    assertNull(context.getStartDate());
  }

  @Test
  void testDurationContext() {
    InvestmentContext context = resolver.resolve(INSTANCE).get(1);
    assertNull(context.getInstant());
    assertEquals("2023-01-15", context.getStartDate());
    assertEquals("2024-09-30", context.getEndDate());
    assertNull(context.getIndustryHint());
  }

  @Test
  void testCustomDimensions() {
    ContextResolver custom = new ContextResolver(
        ImmutableList.of("LoanIdentifierAxis"), ImmutableList.<String>of());
    List<InvestmentContext> contexts = custom.resolve(INSTANCE);
    assertEquals(1, contexts.size());
    assertEquals("Ignored LLC", contexts.get(0).getRawIdentifier());
  }

  @Test
  void testNoContexts() {
    assertTrue(resolver.resolve("<html><body>No XBRL here</body></html>").isEmpty());
  }

  @Test
  void testMemberLabel() {
    assertEquals("Health Care Equipment and Services",
        ContextResolver.memberLabel("bdc:HealthCareEquipmentAndServicesSectorMember"));
    assertEquals("IT Services", ContextResolver.memberLabel("us-gaap:ITServicesMember"));
    assertEquals("Software", ContextResolver.memberLabel("SoftwareMember"));
    assertEquals("Food and Beverage", ContextResolver.memberLabel("bdc:Food_and_BeverageMember"));
    assertNull(ContextResolver.memberLabel("bdc:Member"));
    assertNull(ContextResolver.memberLabel(null));
  }

  @Test
  void testLocalName() {
    assertEquals("InvestmentIdentifierAxis",
        ContextResolver.localName(" us-gaap:InvestmentIdentifierAxis "));
    assertEquals("Axis", ContextResolver.localName("Axis"));
  }
}
