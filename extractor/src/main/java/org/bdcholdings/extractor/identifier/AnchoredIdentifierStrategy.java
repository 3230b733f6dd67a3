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
 * Reads identifiers of the form
 * {@code [classification prefix] company[, industry,] <anchor> ...}, where the
 * anchor is "Investment Type" or a lien, equity or warrant keyword:
 *
 * <pre>{@code
 * Non-controlled/Non-Affiliated Investments Software Acme Technologies LLC First Lien Senior Secured Loan ...
 * Acme Holdings, LLC, Business Services, Investment Type First Lien Term Loan ...
 * }</pre>
 *
 * <p>The text before the anchor holds the company and, optionally, the
 * industry. When it ends with a comma, the second-to-last comma segment is the
 * industry if it reads like one; otherwise a known industry phrase at the start
 * or end of the block is split off.
 */
public class AnchoredIdentifierStrategy implements IdentifierStrategy {
  private final IdentifierVocabulary vocabulary;

  public AnchoredIdentifierStrategy(IdentifierVocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  @Override public String name() {
    return "anchored";
  }

  @Override public @Nullable ParsedIdentifier parse(String identifier) {
    String text = vocabulary.stripPrefixes(identifier);
    KeywordMatch anchor = vocabulary.earliestAnchor(text);
    if (anchor == null || anchor.start == 0) {
      return null;
    }
    String block = text.substring(0, anchor.start);

    ParsedIdentifier result = new ParsedIdentifier();
    splitCompanyAndIndustry(block, result);
    if (!result.hasCompanyName()) {
      return null;
    }
    result.setInvestmentType(vocabulary.descriptionAt(text.substring(anchor.start)));
    return result;
  }

  private void splitCompanyAndIndustry(String block, ParsedIdentifier result) {
    String[] segments = block.split(",", -1);
    int n = segments.length;
    if (n >= 3 && segments[n - 1].trim().isEmpty()
        && vocabulary.isIndustryLike(segments[n - 2])) {
      result.setIndustry(segments[n - 2].trim());
      result.setCompanyName(join(segments, n - 2));
      return;
    }

    String trimmed = block.trim();
    KeywordMatch leading = vocabulary.leadingIndustry(trimmed);
    if (leading != null && leading.end < trimmed.length()) {
      result.setIndustry(leading.text);
      result.setCompanyName(trimmed.substring(leading.end).trim());
      return;
    }
    KeywordMatch trailing = vocabulary.trailingIndustry(trimmed);
    if (trailing != null && trailing.start > 0) {
      result.setIndustry(trailing.text);
      result.setCompanyName(trimmed.substring(0, trailing.start).trim());
      return;
    }
    result.setCompanyName(trimmed);
  }

  private static String join(String[] segments, int count) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(segments[i]);
    }
    return sb.toString().trim();
  }
}
