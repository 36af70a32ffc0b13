// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.ossert.common.collect;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

import com.ossert.common.stats.IntervalClosure;
import com.ossert.common.stats.QuarterStore;
import com.ossert.common.stats.SimpleMetrics;
import com.ossert.common.util.Clock;
import com.ossert.common.util.Quarters;

/**
 * Fills question statistics into per-quarter and all-time metrics from a
 * {@link QuestionCountSource}.
 *
 * <p>Failures of the source propagate; nothing is retried and quarters already written keep their
 * values.
 */
public class QuestionStatsCollector {

  private static final Logger LOG = Logger.getLogger(QuestionStatsCollector.class.getName());

  public static final String QUESTIONS_COUNT = "questions_count";
  public static final String ANSWERED_QUESTIONS_PERCENT = "answered_questions_percent";

  /**
   * A schema holding exactly the metrics this collector writes.
   */
  public static final SimpleMetrics.Schema SCHEMA = SimpleMetrics.schemaBuilder()
      .summed(QUESTIONS_COUNT)
      .averaged(ANSWERED_QUESTIONS_PERCENT)
      .build();

  private static final ImmutableList<String> COLLECTED_METRICS =
      ImmutableList.of(QUESTIONS_COUNT, ANSWERED_QUESTIONS_PERCENT);

  private static final int TOTAL_YEARS = 10;
  private static final int PERCENT_SCALE = 2;

  private final QuestionCountSource source;
  private final Clock clock;

  @Inject
  public QuestionStatsCollector(QuestionCountSource source, Clock clock) {
    this.source = Preconditions.checkNotNull(source);
    this.clock = Preconditions.checkNotNull(clock);
  }

  /**
   * Collects statistics for every period yielded by
   * {@link QuarterStore#withQuartersIntervals(IntervalClosure)}, writing into the quarter where
   * each period begins.
   *
   * @param store Quarters whose schema includes {@link #QUESTIONS_COUNT} and
   *     {@link #ANSWERED_QUESTIONS_PERCENT}.
   * @throws IllegalArgumentException if the store's schema lacks either metric.
   * @throws IOException if the source fails.
   */
  public void collectQuarters(final QuarterStore<SimpleMetrics> store) throws IOException {
    Preconditions.checkNotNull(store);
    Preconditions.checkArgument(store.getSchema().getMetrics().containsAll(COLLECTED_METRICS),
        "Quarters must carry %s, found %s", COLLECTED_METRICS, store.getSchema().getMetrics());
    store.withQuartersIntervals(new IntervalClosure<IOException>() {
      @Override public void execute(long start, long finish) throws IOException {
        record(store.findOrCreate(start), start, finish);
      }
    });
    LOG.info("Collected question statistics for " + store.size() + " quarters");
  }

  /**
   * Collects statistics over the last ten years, up to the start of the current day.
   *
   * @param total Metrics including {@link #QUESTIONS_COUNT} and
   *     {@link #ANSWERED_QUESTIONS_PERCENT}.
   * @throws IOException if the source fails.
   */
  public void collectTotals(SimpleMetrics total) throws IOException {
    Preconditions.checkNotNull(total);
    long now = Quarters.toUnixTime(clock.nowMillis());
    record(total, Quarters.yearsBefore(now, TOTAL_YEARS), Quarters.startOfDay(now));
    LOG.info("Collected all-time question statistics: " + total);
  }

  private void record(SimpleMetrics metrics, long from, long to) throws IOException {
    long questions = source.questionsCount(from, to);
    metrics.set(QUESTIONS_COUNT, questions);
    // Without questions there is no meaningful percentage; keep the default.
    if (questions > 0) {
      metrics.set(ANSWERED_QUESTIONS_PERCENT,
          answeredPercent(questions, source.unansweredQuestionsCount(from, to)));
    }
  }

  @VisibleForTesting
  static double answeredPercent(long questions, long unanswered) {
    Preconditions.checkArgument(questions > 0, "No questions to take a percentage of");
    return BigDecimal.valueOf((questions - unanswered) * 100)
        .divide(BigDecimal.valueOf(questions), PERCENT_SCALE, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
