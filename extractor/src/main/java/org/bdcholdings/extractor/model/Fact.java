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
 * A single tagged value scoped to a context.
 *
 * <p>Facts whose concept starts with {@value #DERIVED_PREFIX} are synthetic:
 * they were recovered from prose around a tagged value rather than tagged by
 * the filer.
 */
public final class Fact {
  public static final String DERIVED_PREFIX = "derived:";

  private final String conceptName;
  private final String contextId;
  private final String rawValue;
  private final @Nullable String unitHint;
  private final @Nullable DateConfidence dateConfidence;

  public Fact(String conceptName, String contextId, String rawValue, @Nullable String unitHint) {
    this(conceptName, contextId, rawValue, unitHint, null);
  }

  private Fact(String conceptName, String contextId, String rawValue, @Nullable String unitHint,
      @Nullable DateConfidence dateConfidence) {
    this.conceptName = Objects.requireNonNull(conceptName, "conceptName");
    this.contextId = Objects.requireNonNull(contextId, "contextId");
    this.rawValue = Objects.requireNonNull(rawValue, "rawValue");
    this.unitHint = unitHint;
    this.dateConfidence = dateConfidence;
  }

  /** Creates a synthetic fact, e.g. {@code derived("FloorRate", "c-12", "1.00%")}. */
  public static Fact derived(String localName, String contextId, String rawValue) {
    return new Fact(DERIVED_PREFIX + localName, contextId, rawValue, null, null);
  }

  /** Creates a synthetic date fact recording how the date was classified. */
  public static Fact derivedDate(String localName, String contextId, String rawValue,
      DateConfidence confidence) {
    return new Fact(DERIVED_PREFIX + localName, contextId, rawValue, null, confidence);
  }

  public String getConceptName() {
    return conceptName;
  }

  public String getContextId() {
    return contextId;
  }

  public String getRawValue() {
    return rawValue;
  }

  public @Nullable String getUnitHint() {
    return unitHint;
  }

  public @Nullable DateConfidence getDateConfidence() {
    return dateConfidence;
  }

  public boolean isDerived() {
    return conceptName.startsWith(DERIVED_PREFIX);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Fact)) {
      return false;
    }
    Fact fact = (Fact) o;
    return conceptName.equals(fact.conceptName)
        && contextId.equals(fact.contextId)
        && rawValue.equals(fact.rawValue)
        && Objects.equals(unitHint, fact.unitHint)
        && dateConfidence == fact.dateConfidence;
  }

  @Override public int hashCode() {
    return Objects.hash(conceptName, contextId, rawValue, unitHint, dateConfidence);
  }

  @Override public String toString() {
    return conceptName + "[" + contextId + "]=" + rawValue
        + (unitHint != null ? " " + unitHint : "");
  }
}
