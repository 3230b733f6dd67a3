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

/**
 * The parts of a compound rate expression such as
 * {@code "SOFR (3-month) + 5.25%, 1.00% Floor, 2.00% PIK"}.
 *
 * <p>The reference rate keeps its term, e.g. {@code "SOFR (3-month)"}; the
 * spread is signed ({@code "-0.25%"} for a negative margin).
 */
public final class RateComponents {
  private static final RateComponents EMPTY = new RateComponents(null, null, null, null);

  private final @Nullable String referenceRate;
  private final @Nullable String spread;
  private final @Nullable String floorRate;
  private final @Nullable String pikRate;

  public RateComponents(@Nullable String referenceRate, @Nullable String spread,
      @Nullable String floorRate, @Nullable String pikRate) {
    this.referenceRate = referenceRate;
    this.spread = spread;
    this.floorRate = floorRate;
    this.pikRate = pikRate;
  }

  public static RateComponents empty() {
    return EMPTY;
  }

  public @Nullable String getReferenceRate() {
    return referenceRate;
  }

  public @Nullable String getSpread() {
    return spread;
  }

  public @Nullable String getFloorRate() {
    return floorRate;
  }

  public @Nullable String getPikRate() {
    return pikRate;
  }

  public boolean isEmpty() {
    return referenceRate == null && spread == null && floorRate == null && pikRate == null;
  }

  /**
   * Composes {@code "<reference> + <spread>, Floor <floor>, PIK <pik>"} from the
   * present parts, or returns null when there is nothing to say.
   */
  public @Nullable String summary() {
    StringBuilder sb = new StringBuilder();
    if (referenceRate != null) {
      sb.append(referenceRate);
    }
    if (spread != null) {
      if (sb.length() > 0) {
        if (spread.startsWith("-")) {
          sb.append(" - ").append(spread.substring(1));
        } else {
          sb.append(" + ").append(spread);
        }
      } else {
        sb.append(spread);
      }
    }
    if (floorRate != null) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("Floor ").append(floorRate);
    }
    if (pikRate != null) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("PIK ").append(pikRate);
    }
    return sb.length() == 0 ? null : sb.toString();
  }

  @Override public String toString() {
    return "RateComponents{" + summary() + '}';
  }
}
