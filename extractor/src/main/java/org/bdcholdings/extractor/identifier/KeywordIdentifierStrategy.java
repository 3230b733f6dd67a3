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
 * Last-resort reading: an optional industry phrase at the start, then the
 * company up to the first investment-type phrase found anywhere in the rest.
 *
 * <p>Without an investment-type phrase the company runs up to the first
 * comma, rate or date field.
 */
public class KeywordIdentifierStrategy implements IdentifierStrategy {
  private final IdentifierVocabulary vocabulary;

  public KeywordIdentifierStrategy(IdentifierVocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  @Override public String name() {
    return "keyword";
  }

  @Override public @Nullable ParsedIdentifier parse(String identifier) {
    String text = vocabulary.stripPrefixes(identifier);
    ParsedIdentifier result = new ParsedIdentifier();

    KeywordMatch industry = vocabulary.leadingIndustry(text);
    if (industry != null && industry.end < text.length()) {
      result.setIndustry(industry.text);
      text = text.substring(industry.end).trim();
    }

    KeywordMatch type = vocabulary.earliestInvestmentType(text);
    if (type == null) {
      result.setCompanyName(vocabulary.descriptionAt(text));
    } else if (type.start > 0) {
      result.setCompanyName(text.substring(0, type.start).trim());
      result.setInvestmentType(type.text);
    }
    // An identifier that opens with its investment type names no company
    return result.hasCompanyName() ? result : null;
  }
}
