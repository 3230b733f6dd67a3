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
package org.bdcholdings.extractor.identifier;

import org.bdcholdings.extractor.model.ParsedIdentifier;
import org.bdcholdings.extractor.model.RateComponents;
import org.bdcholdings.extractor.rate.RateNormalizer;
import org.bdcholdings.extractor.util.FilingDates;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds labelled rate and date fields anywhere in an identifier, whatever its
 * layout: {@code SOFR+6.50%}, {@code SOFR Spread 5.25%}, {@code Floor 1.00%},
 * {@code 2.00% PIK}, {@code Interest Rate 9.10%}, {@code Maturity Date 03/15/2028},
 * {@code Initial Acquisition Date 3/1/21}.
 *
 * <p>Only fields still null are filled.
 */
public class IdentifierTokenExtractor {
  private static final String DATE =
      "(\\d{1,2}/\\d{1,2}/\\d{2,4}|\\d{4}-\\d{2}-\\d{2}|[A-Za-z]{3,9}\\.?\\s+\\d{1,2},?\\s+\\d{4}"
      + "|\\d{1,2}/\\d{4})";

  private static final Pattern INTEREST_RATE = Pattern.compile(
      "\\b(?:Interest\\s+Rate|Coupon|All[-\\s]in\\s+(?:Rate|Yield)|Current\\s+Rate)\\s*:?\\s*"
      + "(\\d+(?:\\.\\d+)?)\\s*%", Pattern.CASE_INSENSITIVE);
  private static final Pattern MATURITY = Pattern.compile(
      "\\b(?:Maturity(?:\\s+Date)?|Due)\\s*:?\\s*" + DATE, Pattern.CASE_INSENSITIVE);
  private static final Pattern ACQUISITION = Pattern.compile(
      "\\b(?:Initial\\s+)?(?:Acquisition|Investment|Origination)\\s+Date\\s*:?\\s*" + DATE,
      Pattern.CASE_INSENSITIVE);

  private final RateNormalizer rates;

  public IdentifierTokenExtractor(RateNormalizer rates) {
    this.rates = rates;
  }

  /** Fills the null rate and date fields of {@code result} from {@code identifier}. */
  public void fill(String identifier, ParsedIdentifier result) {
    RateComponents components = rates.decompose(identifier);
    if (result.getReferenceRate() == null) {
      result.setReferenceRate(components.getReferenceRate());
    }
    if (result.getSpread() == null) {
      result.setSpread(components.getSpread());
    }
    if (result.getFloorRate() == null) {
      result.setFloorRate(components.getFloorRate());
    }
    if (result.getPikRate() == null) {
      result.setPikRate(components.getPikRate());
    }
    if (result.getInterestRate() == null) {
      Matcher m = INTEREST_RATE.matcher(identifier);
      if (m.find()) {
        result.setInterestRate(rates.normalizePercent(m.group(1) + "%"));
      }
    }
    if (result.getMaturityDate() == null) {
      result.setMaturityDate(date(MATURITY, identifier));
    }
    if (result.getAcquisitionDate() == null) {
      result.setAcquisitionDate(date(ACQUISITION, identifier));
    }
  }

  private static @Nullable String date(Pattern pattern, String text) {
    Matcher m = pattern.matcher(text);
    while (m.find()) {
      String normalized = FilingDates.normalize(m.group(1));
      if (normalized != null) {
        return normalized;
      }
    }
    return null;
  }
}
