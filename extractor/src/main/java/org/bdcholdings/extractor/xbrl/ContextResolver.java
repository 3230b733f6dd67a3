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

import org.bdcholdings.extractor.ExtractionConfig;
import org.bdcholdings.extractor.model.InvestmentContext;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.apache.commons.text.StringEscapeUtils;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the XBRL contexts that describe individual holdings.
 *
 * <p>A holding context carries a typed member on an investment-identifier
 * dimension whose text is the filer's description of the holding:
 *
 * <pre>{@code
 * <xbrli:context id="c-42">
 *   <xbrli:entity>
 *     <xbrli:identifier scheme="http://www.sec.gov/CIK">0001234567</xbrli:identifier>
 *     <xbrli:segment>
 *       <xbrldi:typedMember dimension="us-gaap:InvestmentIdentifierAxis">
 *         <us-gaap:InvestmentIdentifierAxis.domain>Acme LLC, First Lien Term Loan</us-gaap:InvestmentIdentifierAxis.domain>
 *       </xbrldi:typedMember>
 *       <xbrldi:explicitMember dimension="us-gaap:EquitySecuritiesByIndustryAxis">bdc:SoftwareSectorMember</xbrldi:explicitMember>
 *     </xbrli:segment>
 *   </xbrli:entity>
 *   <xbrli:period><xbrli:instant>2024-09-30</xbrli:instant></xbrli:period>
 * </xbrli:context>
 * }</pre>
 *
 * <p>Contexts without such a member (most contexts in a filing describe the
 * company itself) are skipped. Namespace prefixes are ignored, so the same
 * scan reads standalone instance documents and inline XBRL headers.
 */
public class ContextResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(ContextResolver.class);

  private static final Pattern CONTEXT = Pattern.compile(
      "<(?:[\\w.\\-]+:)?context\\b[^>]*?\\bid\\s*=\\s*[\"']([^\"']+)[\"'][^>]*>(.*?)"
      + "</(?:[\\w.\\-]+:)?context\\s*>",
      Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern TYPED_MEMBER = Pattern.compile(
      "<(?:[\\w.\\-]+:)?typedMember\\b[^>]*?\\bdimension\\s*=\\s*[\"']([^\"']+)[\"'][^>]*>(.*?)"
      + "</(?:[\\w.\\-]+:)?typedMember\\s*>",
      Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern EXPLICIT_MEMBER = Pattern.compile(
      "<(?:[\\w.\\-]+:)?explicitMember\\b[^>]*?\\bdimension\\s*=\\s*[\"']([^\"']+)[\"'][^>]*>"
      + "\\s*([^<]*?)\\s*</(?:[\\w.\\-]+:)?explicitMember\\s*>",
      Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern INSTANT = periodPattern("instant");
  private static final Pattern START_DATE = periodPattern("startDate");
  private static final Pattern END_DATE = periodPattern("endDate");
  private static final Pattern TAG = Pattern.compile("<[^>]*>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern CAMEL_BOUNDARY =
      Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");
  private static final Set<String> LOWER_CASE_WORDS =
      ImmutableSet.of("and", "of", "the", "for", "in", "or");

  private final Set<String> identifierDimensions;
  private final Set<String> industryDimensions;

  public ContextResolver(ExtractionConfig config) {
    this(config.getIdentifierDimensions(), config.getIndustryDimensions());
  }

  /**
   * @param identifierDimensions local names of identifier dimensions,
   *     e.g. {@code InvestmentIdentifierAxis}
   * @param industryDimensions local names of industry dimensions,
   *     e.g. {@code EquitySecuritiesByIndustryAxis}
   */
  public ContextResolver(Collection<String> identifierDimensions,
      Collection<String> industryDimensions) {
    this.identifierDimensions = ImmutableSet.copyOf(identifierDimensions);
    this.industryDimensions = ImmutableSet.copyOf(industryDimensions);
  }

  private static Pattern periodPattern(String element) {
    return Pattern.compile("<(?:[\\w.\\-]+:)?" + element + "\\s*>\\s*([^<]*?)\\s*</",
        Pattern.CASE_INSENSITIVE);
  }

  /**
   * Scans {@code markup} for holding contexts, in document order. A context id
   * seen twice (a submission that repeats its instance document) is kept once.
   */
  public List<InvestmentContext> resolve(String markup) {
    List<InvestmentContext> contexts = new ArrayList<InvestmentContext>();
    Set<String> seen = new HashSet<String>();
    int scanned = 0;
    Matcher m = CONTEXT.matcher(markup);
    while (m.find()) {
      scanned++;
      String contextId = m.group(1).trim();
      if (!seen.add(contextId)) {
        continue;
      }
      InvestmentContext context = toContext(contextId, m.group(2));
      if (context != null) {
        contexts.add(context);
      }
    }
    LOGGER.debug("Scanned {} contexts, {} describe holdings", scanned, contexts.size());
    return ImmutableList.copyOf(contexts);
  }

  private @Nullable InvestmentContext toContext(String contextId, String body) {
    String identifier = null;
    Matcher typed = TYPED_MEMBER.matcher(body);
    while (typed.find()) {
      if (identifierDimensions.contains(localName(typed.group(1)))) {
        identifier = text(typed.group(2));
        if (!identifier.isEmpty()) {
          break;
        }
      }
    }
    if (identifier == null || identifier.isEmpty()) {
      return null;
    }

    String industry = null;
    Matcher explicit = EXPLICIT_MEMBER.matcher(body);
    while (explicit.find()) {
      if (industryDimensions.contains(localName(explicit.group(1)))) {
        industry = memberLabel(explicit.group(2));
        break;
      }
    }

    return new InvestmentContext(contextId, identifier,
        first(INSTANT, body), first(START_DATE, body), first(END_DATE, body), industry);
  }

  private static @Nullable String first(Pattern pattern, String body) {
    Matcher m = pattern.matcher(body);
    if (m.find() && !m.group(1).isEmpty()) {
      return m.group(1);
    }
    return null;
  }

  private static String text(String markup) {
    String text = TAG.matcher(markup).replaceAll(" ");
    text = StringEscapeUtils.unescapeHtml4(text).replace('\u00a0', ' ');
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  static String localName(String qname) {
    String name = qname.trim();
    int colon = name.lastIndexOf(':');
    return colon >= 0 ? name.substring(colon + 1) : name;
  }

  /**
   * Turns a member QName into a label:
   * {@code bdc:HealthCareEquipmentAndServicesSectorMember} becomes
   * {@code "Health Care Equipment and Services"}.
   *
   * @return the label, or null if nothing is left
   */
  public static @Nullable String memberLabel(@Nullable String qname) {
    if (qname == null) {
      return null;
    }
    String name = localName(qname);
    if (name.endsWith("Member")) {
      name = name.substring(0, name.length() - "Member".length());
    }
    if (name.endsWith("Sector")) {
      name = name.substring(0, name.length() - "Sector".length());
    }
    String[] words = CAMEL_BOUNDARY.split(name.replace('_', ' '));
    StringBuilder sb = new StringBuilder();
    for (String part : words) {
      for (String word : WHITESPACE.split(part.trim())) {
        if (word.isEmpty()) {
          continue;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (sb.length() > 0) {
          sb.append(' ');
        }
        if (sb.length() > 0 && LOWER_CASE_WORDS.contains(lower)) {
          sb.append(lower);
        } else {
          sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
      }
    }
    return sb.length() == 0 ? null : sb.toString();
  }
}
