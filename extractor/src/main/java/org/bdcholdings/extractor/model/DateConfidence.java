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

/**
 * How an investment's acquisition and maturity dates were obtained.
 *
 * <p>Ordered from most to least reliable; when a record's dates come from
 * several sources the weakest one is reported.
 */
public enum DateConfidence {
  /** Labelled in the identifier, tagged as its own fact or taken from the rendered table. */
  EXPLICIT,
  /** Found in prose next to a tagged value and classified by a nearby keyword or by ordering. */
  INFERRED,
  /** A lone date near a tagged value with no keyword; assumed to be the maturity date. */
  GUESSED;

  /** Returns the weaker of the two confidences. */
  public DateConfidence weakest(DateConfidence other) {
    return other.ordinal() > ordinal() ? other : this;
  }
}
