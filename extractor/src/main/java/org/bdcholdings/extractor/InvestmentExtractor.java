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
package org.bdcholdings.extractor;

import org.bdcholdings.extractor.build.Deduplicator;
import org.bdcholdings.extractor.build.InvestmentBuilder;
import org.bdcholdings.extractor.html.CompanyNameMatcher;
import org.bdcholdings.extractor.html.HtmlFallbackMerger;
import org.bdcholdings.extractor.html.ScheduleTableParser;
import org.bdcholdings.extractor.identifier.IdentifierParser;
import org.bdcholdings.extractor.model.Fact;
import org.bdcholdings.extractor.model.Investment;
import org.bdcholdings.extractor.model.InvestmentContext;
import org.bdcholdings.extractor.model.RateComponents;
import org.bdcholdings.extractor.model.ScheduleRow;
import org.bdcholdings.extractor.rate.RateNormalizer;
import org.bdcholdings.extractor.standardize.StandardizationMapper;
import org.bdcholdings.extractor.xbrl.ContextResolver;
import org.bdcholdings.extractor.xbrl.FactAggregator;
import org.bdcholdings.extractor.xbrl.ReportingPeriodSelector;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Extracts the schedule of investments of one filing.
 *
 * <p>The pipeline runs these steps in order:
 * <ol>
 *   <li>resolve holding contexts ({@link ContextResolver}) and collect facts
 *       ({@link FactAggregator}) from the markup;</li>
 *   <li>keep the contexts at the latest instant ({@link ReportingPeriodSelector});</li>
 *   <li>build one record per context ({@link InvestmentBuilder});</li>
 *   <li>drop repeated records ({@link Deduplicator});</li>
 *   <li>fill missing dates and rates from the rendered schedule, when one is
 *       given ({@link HtmlFallbackMerger});</li>
 *   <li>map categorical fields onto the canonical vocabularies
 *       ({@link StandardizationMapper}), then compose an interest-rate summary
 *       for records that still have none.</li>
 * </ol>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * InvestmentExtractor extractor = new InvestmentExtractor(ExtractionConfig.defaults());
 * ExtractionResult result = extractor.extract(markup, renderedHtml);
 * }</pre>
 *
 * <p>Malformed data never aborts an extraction: a context that cannot be
 * turned into a record is logged and counted in
 * {@link ExtractionResult#getContextsDiscarded()}. An instance holds no state
 * between calls and may be shared.
 */
public class InvestmentExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(InvestmentExtractor.class);

  private final ContextResolver contextResolver;
  private final FactAggregator factAggregator;
  private final InvestmentBuilder investmentBuilder;
  private final ScheduleTableParser scheduleTableParser;
  private final HtmlFallbackMerger htmlFallbackMerger;
  private final StandardizationMapper standardizationMapper;

  /**
   * Creates an extractor.
   *
   * @param config Vocabularies, dimensions and tunables
   */
  public InvestmentExtractor(ExtractionConfig config) {
    RateNormalizer rates = new RateNormalizer(config.getReferenceRateAliases());
    this.contextResolver = new ContextResolver(config);
    this.factAggregator = new FactAggregator(config);
    this.investmentBuilder = new InvestmentBuilder(new IdentifierParser(config, rates), rates);
    this.scheduleTableParser = new ScheduleTableParser(config);
    this.htmlFallbackMerger =
        new HtmlFallbackMerger(new CompanyNameMatcher(config.getFuzzyMatchThreshold()));
    this.standardizationMapper = config.newStandardizationMapper();
  }

  /** Extracts a filing without a rendered schedule. */
  public ExtractionResult extract(String markup) {
    return extract(markup, ImmutableList.<ScheduleRow>of());
  }

  /**
   * Extracts a filing, using its rendered schedule of investments to fill
   * gaps.
   *
   * @param markup Filing markup (inline XBRL document or XBRL instance)
   * @param renderedHtml Rendered schedule, or null
   */
  public ExtractionResult extract(String markup, @Nullable String renderedHtml) {
    List<ScheduleRow> rows = renderedHtml == null
        ? ImmutableList.<ScheduleRow>of()
        : scheduleTableParser.parse(renderedHtml);
    return extract(markup, rows);
  }

  /**
   * Extracts a filing, using already-parsed schedule rows to fill gaps.
   *
   * @param markup Filing markup
   * @param scheduleRows Rows of the rendered schedule; may be empty
   */
  public ExtractionResult extract(String markup, List<ScheduleRow> scheduleRows) {
    if (markup == null) {
      throw new ExtractionException("Filing markup must not be null");
    }
    long startTime = System.currentTimeMillis();

    List<InvestmentContext> contexts = contextResolver.resolve(markup);
    Map<String, List<Fact>> facts = factAggregator.aggregate(markup);
    String instant = ReportingPeriodSelector.selectInstant(contexts);
    List<InvestmentContext> current = ReportingPeriodSelector.filter(contexts, instant);
    LOGGER.debug("{} of {} holding contexts at instant {}", current.size(), contexts.size(),
        instant);

    List<Investment> built = new ArrayList<Investment>();
    for (InvestmentContext context : current) {
      List<Fact> contextFacts = facts.get(context.getContextId());
      try {
        Investment investment = investmentBuilder.build(context,
            contextFacts != null ? contextFacts : ImmutableList.<Fact>of());
        if (investment != null) {
          built.add(investment);
        }
      } catch (RuntimeException e) {
        LOGGER.warn("Skipping context {} ('{}'): {}", context.getContextId(),
            context.getRawIdentifier(), e.getMessage(), e);
      }
    }

    List<Investment> investments = new ArrayList<Investment>(Deduplicator.deduplicate(built));
    int merges = htmlFallbackMerger.merge(investments, scheduleRows);
    for (Investment investment : investments) {
      standardizationMapper.standardize(investment);
      if (investment.getInterestRate() == null) {
        investment.setInterestRate(new RateComponents(investment.getReferenceRate(),
            investment.getSpread(), investment.getFloorRate(), investment.getPikRate())
            .summary());
      }
    }

    ExtractionResult result = ExtractionResult.builder()
        .reportingInstant(instant)
        .investments(investments)
        .contextsResolved(contexts.size())
        .contextsInPeriod(current.size())
        .contextsDiscarded(current.size() - built.size())
        .duplicatesRemoved(built.size() - investments.size())
        .htmlMerges(merges)
        .build();
    LOGGER.info("Extracted {} investments at {} from {} contexts in {}ms: {}",
        investments.size(), instant, current.size(), System.currentTimeMillis() - startTime,
        result);
    return result;
  }
}
