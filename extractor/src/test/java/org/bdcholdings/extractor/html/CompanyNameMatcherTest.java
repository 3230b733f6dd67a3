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
package org.bdcholdings.extractor.html;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CompanyNameMatcher}.
 */
@Tag("unit")
class CompanyNameMatcherTest {

  private CompanyNameMatcher matcher;

  @BeforeEach
  void setUp() {
    matcher = new CompanyNameMatcher(0.8);
  }

  @Test
  void testBasicKey() {
    assertEquals("acme&co llc", CompanyNameMatcher.basicKey("  Acme&amp;Co  LLC "));
    assertEquals("", CompanyNameMatcher.basicKey(null));
  }

  @Test
  void testStrippedKey() {
    assertEquals("acme",
        CompanyNameMatcher.strippedKey("The Acme Company, Inc. (7) - Revolver"));
    assertEquals("brandner design", CompanyNameMatcher.strippedKey("Brandner Design, LLC (7)"));
    assertEquals("brandner design", CompanyNameMatcher.strippedKey("Brandner Design LLC"));
  }

  @Test
  void testSimilarity() {
    assertEquals(1.0, CompanyNameMatcher.similarity("abc", "abc"), 1e-9);
    assertEquals(1.0, CompanyNameMatcher.similarity("", ""), 1e-9);
    assertEquals(0.75, CompanyNameMatcher.similarity("abcd", "abce"), 1e-9);
    assertEquals(0.0, CompanyNameMatcher.similarity("abc", ""), 1e-9);
  }

  @Test
  void testFuzzyMatches() {
    assertTrue(matcher.fuzzyMatches("Brandner Design LLC", "Brandner Design, LLC (7)"));
    assertTrue(matcher.fuzzyMatches("Zenith Software Incorporated", "Zenith Sofware Inc"));
    assertTrue(matcher.fuzzyMatches("Acme", "Acme Technologies LLC"));
    assertFalse(matcher.fuzzyMatches("Alpha Corp", "Beta Corp"));
    assertFalse(matcher.fuzzyMatches(null, "Acme LLC"));
    assertFalse(matcher.fuzzyMatches("LLC", "Acme LLC"));
  }

  @Test
  void testShortKeyNeedsMoreThanContainment() {
    assertFalse(matcher.fuzzyMatches("AB", "Abbott Laboratories"));
    assertFalse(matcher.fuzzyMatches("Abbott Laboratories", "AB Inc"));
    assertTrue(matcher.fuzzyMatches("AB Inc", "AB, LLC"));
  }

  @Test
  void testThreshold() {
    CompanyNameMatcher strict = new CompanyNameMatcher(0.99);
    assertFalse(strict.fuzzyMatches("Zenith Software Incorporated", "Zenith Sofware Inc"));
    assertEquals(0.99, strict.getThreshold(), 1e-9);
  }
}
