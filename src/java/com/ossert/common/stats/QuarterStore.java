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

package com.ossert.common.stats;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.math.LongMath;
import com.google.gson.Gson;
import com.google.gson.JsonObject;

import com.ossert.common.base.MorePreconditions;
import com.ossert.common.util.Clock;
import com.ossert.common.util.QuarterInterval;
import com.ossert.common.util.QuarterIntervals;
import com.ossert.common.util.Quarters;

/**
 * Metrics divided by calendar quarters.  Each quarter holds one {@link MetricsContainer} created
 * from the store's {@link MetricsSchema}, keyed by the UNIX timestamp of the quarter's start.
 *
 * <p>Quarters are created on demand by collectors via {@link #findOrCreate(long)}.  Once all data
 * is gathered {@link #fillGaps()} materializes the quarters that received no data, after which the
 * store is ready for aggregation and presentation.
 *
 * <p>This class is not thread safe; writers must be serialized by the caller.
 *
 * @param <T> The metrics container type held for each quarter.
 */
public class QuarterStore<T extends MetricsContainer> {

  private static final Logger LOG = Logger.getLogger(QuarterStore.class.getName());

  /**
   * Number of quarters aggregated by the "last year" views.
   */
  public static final int QUARTERS_PER_YEAR = 4;

  @VisibleForTesting
  static final long FILL_STEP = TimeUnit.DAYS.toSeconds(93);

  private static final int DEFAULT_OFFSET = 1;
  private static final Gson GSON = new Gson();

  private final MetricsSchema<T> schema;
  private final Clock clock;
  private final NavigableMap<Long, T> quarters = Maps.newTreeMap();

  private long startDateMillis;
  private long endDateMillis;

  public QuarterStore(MetricsSchema<T> schema) {
    this(schema, Clock.SYSTEM_CLOCK);
  }

  /**
   * Creates an empty store.
   *
   * @param schema Describes and creates the per-quarter containers.
   * @param clock Source of "now" for bounds and default collection windows.
   */
  public QuarterStore(MetricsSchema<T> schema, Clock clock) {
    this.schema = Preconditions.checkNotNull(schema);
    this.clock = Preconditions.checkNotNull(clock);
    startDateMillis = clock.nowMillis();
    endDateMillis = startDateMillis;
  }

  public MetricsSchema<T> getSchema() {
    return schema;
  }

  /**
   * The start of the earliest quarter, as fixed by the last {@link #fillGaps()}; the store's
   * creation time before that.
   */
  public Date getStartDate() {
    return new Date(startDateMillis);
  }

  /**
   * The start of the latest quarter, as fixed by the last {@link #fillGaps()}; the store's
   * creation time before that.
   */
  public Date getEndDate() {
    return new Date(endDateMillis);
  }

  public int size() {
    return quarters.size();
  }

  public boolean isEmpty() {
    return quarters.isEmpty();
  }

  /**
   * @return The quarter keys in ascending order.
   */
  public Set<Long> getQuarterStarts() {
    return ImmutableSortedSet.copyOf(quarters.keySet());
  }

  /**
   * Strict lookup of the quarter containing a calendar date.
   *
   * @param date A date formatted as {@code YYYY-MM-DD}.
   * @return The existing quarter.
   * @throws QuarterNotFoundException if no data exists for the quarter.
   */
  public T fetch(String date) {
    return fetchQuarter(Quarters.startOf(date));
  }

  /**
   * Strict lookup of the quarter containing a UNIX timestamp.
   *
   * @throws QuarterNotFoundException if no data exists for the quarter.
   */
  public T fetch(long unixTime) {
    return fetchQuarter(Quarters.startOf(unixTime));
  }

  /**
   * Strict lookup of the quarter containing a date.
   *
   * @throws QuarterNotFoundException if no data exists for the quarter.
   */
  public T fetch(Date date) {
    return fetchQuarter(Quarters.startOf(date));
  }

  /**
   * Finds the quarter containing a calendar date, creating it with default values if absent.
   *
   * @param date A date formatted as {@code YYYY-MM-DD}.
   * @return The quarter, never {@code null}.
   */
  public T findOrCreate(String date) {
    return findOrCreateQuarter(Quarters.startOf(date));
  }

  /**
   * Finds the quarter containing a UNIX timestamp, creating it with default values if absent.
   */
  public T findOrCreate(long unixTime) {
    return findOrCreateQuarter(Quarters.startOf(unixTime));
  }

  /**
   * Finds the quarter containing a date, creating it with default values if absent.
   */
  public T findOrCreate(Date date) {
    return findOrCreateQuarter(Quarters.startOf(date));
  }

  /**
   * Same as {@link #findOrCreate(String)}.
   */
  public T get(String date) {
    return findOrCreate(date);
  }

  /**
   * Same as {@link #findOrCreate(long)}.
   */
  public T get(long unixTime) {
    return findOrCreate(unixTime);
  }

  /**
   * Adds a previously built quarter, eg: one restored from its serialized form.
   *
   * @param quarterStart The exact start of the quarter.
   * @param quarter The quarter's metrics.
   * @throws IllegalArgumentException if {@code quarterStart} is not the start of a quarter.
   * @throws IllegalStateException if the quarter already exists.
   */
  public void insert(long quarterStart, T quarter) {
    Preconditions.checkNotNull(quarter);
    Preconditions.checkArgument(Quarters.startOf(quarterStart) == quarterStart,
        "%s is not the start of a quarter", quarterStart);
    Preconditions.checkState(!quarters.containsKey(quarterStart),
        "Quarter %s already exists", quarterStart);
    quarters.put(quarterStart, quarter);
  }

  /**
   * Creates the missing quarters between the earliest and the latest existing ones and fixes
   * {@link #getStartDate()} and {@link #getEndDate()} to those quarters.  Should be called once
   * all data is gathered.  Does nothing on an empty store.
   */
  public void fillGaps() {
    if (quarters.isEmpty()) {
      return;
    }

    long first = quarters.firstKey();
    long last = quarters.lastKey();
    int before = quarters.size();
    // From a quarter start, one step always lands in the next quarter; re-anchoring avoids drift.
    for (long period = first; period <= last; period = Quarters.startOf(period + FILL_STEP)) {
      findOrCreateQuarter(period);
    }

    startDateMillis = TimeUnit.SECONDS.toMillis(first);
    endDateMillis = TimeUnit.SECONDS.toMillis(last);
    LOG.fine(String.format("Filled %d empty quarters between %d and %d",
        quarters.size() - before, first, last));
  }

  /**
   * Checks whether {@link #lastYearAsMap(int)} would see a full year of quarters.
   *
   * @param offset Quarters skipped back from the latest one.
   * @return {@code true} if at least {@code 4 + offset} quarters exist.
   */
  public boolean hasFullYear(int offset) {
    MorePreconditions.checkNonNegative(offset, "Offset");
    return quarters.size() >= QUARTERS_PER_YEAR + offset;
  }

  /**
   * Equivalent to {@code lastYearAsMap(1)}, a year ending one quarter before the latest.
   */
  public ImmutableMap<String, Number> lastYearAsMap() {
    return lastYearAsMap(DEFAULT_OFFSET);
  }

  /**
   * Aggregates the metrics of the four quarters ending {@code offset} quarters before the latest
   * one.  Metrics are summed across the quarters; {@link MetricsSchema#getAggregatedMetrics()
   * aggregated} metrics are divided by four afterwards.
   *
   * <p>With fewer than {@code 4 + offset} quarters the earliest (up to four) quarters are used, so
   * the result under-counts.  Use {@link #hasFullYear(int)} to detect that.
   *
   * @param offset Quarters skipped back from the latest one.
   * @return The aggregated values keyed by metric name, in schema order.
   */
  public ImmutableMap<String, Number> lastYearAsMap(int offset) {
    List<T> window = lastYearWindow(MorePreconditions.checkNonNegative(offset, "Offset"));
    if (!hasFullYear(offset)) {
      LOG.warning(String.format("Aggregating a year from %d quarters with offset %d, "
          + "result covers %d of %d quarters", quarters.size(), offset, window.size(),
          QUARTERS_PER_YEAR));
    }

    List<String> metrics = schema.getMetrics();
    List<List<Number>> rows = Lists.newArrayListWithCapacity(window.size());
    for (T quarter : window) {
      List<Number> values = quarter.getMetricValues();
      Preconditions.checkState(values.size() == metrics.size(),
          "Quarter has %s values for %s metrics", values.size(), metrics.size());
      rows.add(values);
    }

    Set<String> aggregated = schema.getAggregatedMetrics();
    ImmutableMap.Builder<String, Number> result = ImmutableMap.builder();
    for (int i = 0; i < metrics.size(); i++) {
      String metric = metrics.get(i);
      Number sum = sum(metric, rows, i);
      if (aggregated.contains(metric)) {
        result.put(metric, sum.doubleValue() / QUARTERS_PER_YEAR);
      } else {
        result.put(metric, sum);
      }
    }
    return result.build();
  }

  /**
   * Equivalent to {@code lastYearData(1)}.
   */
  public ImmutableList<Number> lastYearData() {
    return lastYearData(DEFAULT_OFFSET);
  }

  /**
   * The values of {@link #lastYearAsMap(int)}, in schema order.
   */
  public ImmutableList<Number> lastYearData(int offset) {
    return lastYearAsMap(offset).values().asList();
  }

  /**
   * @return The quarters keyed by their start, ascending.
   */
  public ImmutableSortedMap<Date, T> preview() {
    ImmutableSortedMap.Builder<Date, T> preview = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Long, T> entry : quarters.entrySet()) {
      preview.put(Quarters.toDate(entry.getKey()), entry.getValue());
    }
    return preview.build();
  }

  /**
   * Applies a function to every quarter in ascending order.
   *
   * @return The function results, in the same order.  The list is unmodifiable and may hold
   *     {@code null} results.
   */
  public <R> List<R> eachSorted(QuarterFunction<T, R> function) {
    return applyAll(quarters, function);
  }

  /**
   * Applies a function to every quarter in descending order.
   *
   * @return The function results, in the same order.  The list is unmodifiable and may hold
   *     {@code null} results.
   */
  public <R> List<R> reverseEachSorted(QuarterFunction<T, R> function) {
    return applyAll(quarters.descendingMap(), function);
  }

  /**
   * Yields the periods collectors should gather data for.  With existing quarters these are the
   * spans between consecutive quarter starts, the last one running to the end of the current
   * quarter.  An empty store yields the quarters of the last year instead.
   *
   * <p>The closure may create quarters; the periods are computed up front.
   *
   * @param closure Receives each period's start and finish timestamps.
   * @throws E if the closure fails; remaining periods are skipped.
   */
  public <E extends Exception> void withQuartersIntervals(IntervalClosure<E> closure) throws E {
    Preconditions.checkNotNull(closure);

    if (quarters.isEmpty()) {
      for (QuarterInterval interval : QuarterIntervals.build(clock)) {
        closure.execute(interval.getStart(), interval.getEnd());
      }
      return;
    }

    List<Long> boundaries = Lists.newArrayList(quarters.keySet());
    boundaries.add(Quarters.endOf(Quarters.toUnixTime(clock.nowMillis())));
    for (int i = 0; i < boundaries.size() - 1; i++) {
      closure.execute(boundaries.get(i), boundaries.get(i + 1));
    }
  }

  /**
   * Renders the store as a JSON object keyed by quarter start, each value holding the quarter's
   * {@link MetricsContainer#toMap() metrics}.
   *
   * @throws IllegalStateException if a metric is NaN or infinite, which JSON can not represent.
   */
  public JsonObject toJsonTree() {
    JsonObject document = new JsonObject();
    for (Map.Entry<Long, T> entry : quarters.entrySet()) {
      JsonObject quarter = new JsonObject();
      for (Map.Entry<String, Number> metric : entry.getValue().toMap().entrySet()) {
        double value = metric.getValue().doubleValue();
        Preconditions.checkState(!Double.isNaN(value) && !Double.isInfinite(value),
            "Metric %s of quarter %s is not finite: %s", metric.getKey(), entry.getKey(), value);
        quarter.addProperty(metric.getKey(), metric.getValue());
      }
      document.add(String.valueOf(entry.getKey()), quarter);
    }
    return document;
  }

  /**
   * @return {@link #toJsonTree()} as a string.
   * @throws IllegalStateException if a metric is NaN or infinite.
   */
  public String toJson() {
    return GSON.toJson(toJsonTree());
  }

  @Override
  public String toString() {
    return "QuarterStore" + quarters;
  }

  private T fetchQuarter(long quarterStart) {
    T quarter = quarters.get(quarterStart);
    if (quarter == null) {
      throw new QuarterNotFoundException(quarterStart);
    }
    return quarter;
  }

  private T findOrCreateQuarter(long quarterStart) {
    T quarter = quarters.get(quarterStart);
    if (quarter == null) {
      quarter = Preconditions.checkNotNull(schema.create(), "Schema created a null quarter");
      quarters.put(quarterStart, quarter);
      LOG.fine("Created quarter " + quarterStart);
    }
    return quarter;
  }

  private List<T> lastYearWindow(int offset) {
    List<T> sorted = ImmutableList.copyOf(quarters.values());
    int from = Math.max(0, sorted.size() - (QUARTERS_PER_YEAR + offset));
    int to = Math.min(sorted.size(), from + QUARTERS_PER_YEAR);
    return sorted.subList(from, to);
  }

  // Integral values keep an exact sum until the first fractional value is met.  A long sum that
  // overflows continues as a BigInteger and narrows back to a Long when it fits again.
  private static Number sum(String metric, List<List<Number>> rows, int column) {
    boolean integral = true;
    long integralSum = 0;
    BigInteger bigSum = null;
    double sum = 0;
    for (List<Number> row : rows) {
      Number value = Preconditions.checkNotNull(row.get(column), "Null value for %s", metric);
      if (integral && isIntegral(value)) {
        if (bigSum == null && !(value instanceof BigInteger)) {
          try {
            integralSum = LongMath.checkedAdd(integralSum, value.longValue());
            continue;
          } catch (ArithmeticException e) {
            bigSum = BigInteger.valueOf(integralSum);
          }
        }
        if (bigSum == null) {
          bigSum = BigInteger.valueOf(integralSum);
        }
        bigSum = bigSum.add(toBigInteger(value));
      } else {
        if (integral) {
          integral = false;
          sum = bigSum == null ? integralSum : bigSum.doubleValue();
        }
        sum += value.doubleValue();
      }
    }
    if (!integral) {
      return Double.valueOf(sum);
    }
    if (bigSum == null) {
      return Long.valueOf(integralSum);
    }
    if (bigSum.bitLength() < Long.SIZE) {
      return Long.valueOf(bigSum.longValue());
    }
    return bigSum;
  }

  private static BigInteger toBigInteger(Number value) {
    if (value instanceof BigInteger) {
      return (BigInteger) value;
    }
    return BigInteger.valueOf(value.longValue());
  }

  private static boolean isIntegral(Number value) {
    return value instanceof Integer
        || value instanceof Long
        || value instanceof BigInteger
        || value instanceof Short
        || value instanceof Byte;
  }

  private static <T extends MetricsContainer, R> List<R> applyAll(Map<Long, T> quarters,
      QuarterFunction<T, R> function) {
    Preconditions.checkNotNull(function);
    List<R> results = Lists.newArrayListWithCapacity(quarters.size());
    for (Map.Entry<Long, T> entry : quarters.entrySet()) {
      results.add(function.apply(entry.getKey(), entry.getValue()));
    }
    return Collections.unmodifiableList(results);
  }
}
