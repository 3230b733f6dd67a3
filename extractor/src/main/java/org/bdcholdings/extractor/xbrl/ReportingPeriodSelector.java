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

import org.bdcholdings.extractor.model.InvestmentContext;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks the reporting date of a schedule of investments.
 *
 * <p>A periodic report also carries the prior period's schedule for
 * comparison. Only holdings at the latest instant are current, so contexts at
 * any other instant, and duration contexts, are filtered out unless the filing
 * has no instant at all.
 */
public final class ReportingPeriodSelector {
  private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

  private ReportingPeriodSelector() {
  }

  /**
   * Returns the latest instant among {@code contexts}. Instants that are not
   * plain {@code YYYY-MM-DD} dates are ignored.
   *
   * @return the instant, or null when no context has a usable instant
   */
  public static @Nullable String selectInstant(Collection<InvestmentContext> contexts) {
    String latest = null;
    for (InvestmentContext context : contexts) {
      String instant = context.getInstant();
      if (instant == null || !ISO_DATE.matcher(instant).matches()) {
        continue;
      }
      // ISO dates order lexically
      if (latest == null || instant.compareTo(latest) > 0) {
        latest = instant;
      }
    }
    return latest;
  }

  /**
   * Returns the contexts whose instant equals {@code instant}. A null instant
   * (a filing of duration contexts only) keeps every context.
   */
  public static List<InvestmentContext> filter(Collection<InvestmentContext> contexts,
      @Nullable String instant) {
    if (instant == null) {
      return ImmutableList.copyOf(contexts);
    }
    ImmutableList.Builder<InvestmentContext> kept = ImmutableList.builder();
    for (InvestmentContext context : contexts) {
      if (instant.equals(context.getInstant())) {
        kept.add(context);
      }
    }
    return kept.build();
  }
}
