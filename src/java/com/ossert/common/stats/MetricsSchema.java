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

/**
 * Type-level description of a {@link MetricsContainer}: the metric names every instance carries,
 * which of them are averaged rather than summed across quarters, and how instances are made.
 *
 * @param <T> The container type described.
 */
public interface MetricsSchema<T extends MetricsContainer> {

  /**
   * @return The ordered metric names, identical for every container of this schema.
   */
  List<String> getMetrics();

  /**
   * @return The subset of {@link #getMetrics()} averaged over a year instead of summed.
   */
  Set<String> getAggregatedMetrics();

  /**
   * @return A new container with every metric at its default (zero) value.
   */
  T create();

  /**
   * Rebuilds a container from a {@link MetricsContainer#toMap()} snapshot.
   *
   * @param values The metric values keyed by name.
   * @return A container holding {@code values}.
   * @throws IllegalArgumentException if {@code values} names a metric outside this schema.
   */
  T restore(Map<String, ? extends Number> values);
}
