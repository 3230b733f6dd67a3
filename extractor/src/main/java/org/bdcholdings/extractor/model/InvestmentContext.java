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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One holding identity discovered in a filing: the free-text identifier a filer
 * attached to an XBRL context, together with the context's period and an
 * optional industry label.
 *
 * <p>Instances are immutable. A context carries either an {@code instant} or a
 * {@code startDate}/{@code endDate} pair, never both.
 */
public final class InvestmentContext {
  private final String contextId;
  private final String rawIdentifier;
  private final @Nullable String instant;
  private final @Nullable String startDate;
  private final @Nullable String endDate;
  private final @Nullable String industryHint;

  public InvestmentContext(String contextId, String rawIdentifier,
      @Nullable String instant, @Nullable String startDate, @Nullable String endDate,
      @Nullable String industryHint) {
    this.contextId = Objects.requireNonNull(contextId, "contextId");
    this.rawIdentifier = Objects.requireNonNull(rawIdentifier, "rawIdentifier");
    if (rawIdentifier.trim().isEmpty()) {
      throw new IllegalArgumentException("Empty identifier for context " + contextId);
    }
    this.instant = instant;
    // An instant context has no meaningful duration bounds
    this.startDate = instant == null ? startDate : null;
    this.endDate = instant == null ? endDate : null;
    this.industryHint = industryHint;
  }

  public String getContextId() {
    return contextId;
  }

  public String getRawIdentifier() {
    return rawIdentifier;
  }

  public @Nullable String getInstant() {
    return instant;
  }

  public @Nullable String getStartDate() {
    return startDate;
  }

  public @Nullable String getEndDate() {
    return endDate;
  }

  public @Nullable String getIndustryHint() {
    return industryHint;
  }

  @Override public String toString() {
    return "InvestmentContext{id=" + contextId
        + ", identifier='" + rawIdentifier + '\''
        + (instant != null ? ", instant=" + instant : ", period=" + startDate + ".." + endDate)
        + (industryHint != null ? ", industry=" + industryHint : "")
        + '}';
  }
}
