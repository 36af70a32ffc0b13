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

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import com.ossert.common.base.MorePreconditions;

/**
 * A mutable, name-addressed {@link MetricsContainer}.  Every metric starts at {@code 0}.
 *
 * <p>Schemas are assembled with a builder:
 * <pre>
 *   SimpleMetrics.Schema schema = SimpleMetrics.schemaBuilder()
 *       .summed("questions_count")
 *       .averaged("answered_questions_percent")
 *       .build();
 *   SimpleMetrics quarter = schema.create();
 * </pre>
 *
 * <p>Instances are not thread safe.
 */
public final class SimpleMetrics implements MetricsContainer {

  private static final Integer DEFAULT_VALUE = 0;

  private final Schema schema;
  private final Map<String, Number> values;

  private SimpleMetrics(Schema schema) {
    this.schema = schema;
    values = Maps.newLinkedHashMap();
    for (String metric : schema.getMetrics()) {
      values.put(metric, DEFAULT_VALUE);
    }
  }

  public static SchemaBuilder schemaBuilder() {
    return new SchemaBuilder();
  }

  public Schema getSchema() {
    return schema;
  }

  /**
   * @param metric A metric name of this container's schema.
   * @return The metric's current value.
   * @throws IllegalArgumentException if the schema has no such metric.
   */
  public Number get(String metric) {
    checkKnown(metric);
    return values.get(metric);
  }

  /**
   * @param metric A metric name of this container's schema.
   * @param value The new value.
   * @return This container, for chaining.
   * @throws IllegalArgumentException if the schema has no such metric.
   */
  public SimpleMetrics set(String metric, Number value) {
    checkKnown(metric);
    values.put(metric, Preconditions.checkNotNull(value, "Null value for metric %s", metric));
    return this;
  }

  @Override
  public List<Number> getMetricValues() {
    return ImmutableList.copyOf(values.values());
  }

  @Override
  public Map<String, Number> toMap() {
    return ImmutableMap.copyOf(values);
  }

  @Override
  public String toString() {
    return values.toString();
  }

  private void checkKnown(String metric) {
    Preconditions.checkArgument(values.containsKey(metric), "Unknown metric %s", metric);
  }

  /**
   * The metric layout shared by a family of {@link SimpleMetrics}.
   */
  public static final class Schema implements MetricsSchema<SimpleMetrics> {
    private final ImmutableList<String> metrics;
    private final ImmutableSet<String> aggregatedMetrics;

    private Schema(ImmutableList<String> metrics, ImmutableSet<String> aggregatedMetrics) {
      this.metrics = metrics;
      this.aggregatedMetrics = aggregatedMetrics;
    }

    @Override
    public List<String> getMetrics() {
      return metrics;
    }

    @Override
    public Set<String> getAggregatedMetrics() {
      return aggregatedMetrics;
    }

    @Override
    public SimpleMetrics create() {
      return new SimpleMetrics(this);
    }

    @Override
    public SimpleMetrics restore(Map<String, ? extends Number> snapshot) {
      Preconditions.checkNotNull(snapshot);
      SimpleMetrics restored = create();
      for (Map.Entry<String, ? extends Number> entry : snapshot.entrySet()) {
        restored.set(entry.getKey(), entry.getValue());
      }
      return restored;
    }
  }

  /**
   * Collects metric names in declaration order.
   */
  public static final class SchemaBuilder {
    private final ImmutableList.Builder<String> metrics = ImmutableList.builder();
    private final ImmutableSet.Builder<String> aggregatedMetrics = ImmutableSet.builder();

    private SchemaBuilder() {
    }

    /**
     * Adds metrics combined across quarters by summing.
     */
    public SchemaBuilder summed(String... names) {
      for (String name : names) {
        metrics.add(MorePreconditions.checkNotBlank(name));
      }
      return this;
    }

    /**
     * Adds metrics combined across quarters by averaging.
     */
    public SchemaBuilder averaged(String... names) {
      for (String name : names) {
        metrics.add(MorePreconditions.checkNotBlank(name));
        aggregatedMetrics.add(name);
      }
      return this;
    }

    /**
     * @throws IllegalArgumentException if no metric was added or a name was added twice.
     */
    public Schema build() {
      ImmutableList<String> names = metrics.build();
      MorePreconditions.checkNotBlank(names, "A schema needs at least one metric");
      Preconditions.checkArgument(ImmutableSet.copyOf(names).size() == names.size(),
          "Duplicate metric names in %s", names);
      return new Schema(names, aggregatedMetrics.build());
    }
  }
}
