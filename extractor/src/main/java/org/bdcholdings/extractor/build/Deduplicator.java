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

import org.bdcholdings.extractor.model.Investment;
import org.bdcholdings.extractor.util.FilingNumbers;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops records that repeat an earlier record.
 *
 * <p>Two records are the same holding when company, investment type, maturity
 * date, principal, cost and fair value all agree; the first is kept. Tranches
 * of one company that differ in date or amount are all kept. Amounts compare
 * by value, so {@code 1000000} and {@code 1000000.00} are equal, and a missing
 * amount counts as zero.
 */
public final class Deduplicator {
  private static final Logger LOGGER = LoggerFactory.getLogger(Deduplicator.class);

  private Deduplicator() {
  }

  public static List<Investment> deduplicate(List<Investment> investments) {
    Set<String> seen = new HashSet<String>();
    ImmutableList.Builder<Investment> kept = ImmutableList.builder();
    int dropped = 0;
    for (Investment investment : investments) {
      if (seen.add(key(investment))) {
        kept.add(investment);
      } else {
        LOGGER.debug("Dropping duplicate of {} ({})", investment.getCompanyName(),
            investment.getContextRef());
        dropped++;
      }
    }
    if (dropped > 0) {
      LOGGER.debug("Removed {} duplicate records", dropped);
    }
    return kept.build();
  }

  static String key(Investment investment) {
    return Strings.nullToEmpty(investment.getCompanyName())
        + '\u0001' + Strings.nullToEmpty(investment.getInvestmentType())
        + '\u0001' + Strings.nullToEmpty(investment.getMaturityDate())
        + '\u0001' + FilingNumbers.canonical(investment.getPrincipalAmount()).toPlainString()
        + '\u0001' + FilingNumbers.canonical(investment.getCost()).toPlainString()
        + '\u0001' + FilingNumbers.canonical(investment.getFairValue()).toPlainString();
  }
}
