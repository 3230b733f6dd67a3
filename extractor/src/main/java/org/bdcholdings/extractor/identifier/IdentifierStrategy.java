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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One way of reading a filer's identifier layout.
 *
 * <p>Strategies are tried in order by {@link IdentifierParser}; the first one
 * that yields a company name wins. Support for a new filer convention is added
 * as a new strategy rather than by changing an existing one.
 */
public interface IdentifierStrategy {

  /** Short name used in logs. */
  String name();

  /**
   * Reads the structural fields (company, industry, investment type and any
   * positional rate or date fields) from a prepared identifier.
   *
   * @param identifier identifier with entities decoded, footnote markers
   *     removed and whitespace collapsed
   * @return the fields found, or null when the identifier does not have this
   *     strategy's layout
   */
  @Nullable ParsedIdentifier parse(String identifier);
}
