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

/**
 * The metric values collected for one quarter.  The values line up positionally with the metric
 * names of the container's {@link MetricsSchema}.
 */
public interface MetricsContainer {

  /**
   * Current metric values, in the order of {@link MetricsSchema#getMetrics()}.
   *
   * @return The metric values.
   */
  List<Number> getMetricValues();

  /**
   * A snapshot of the metrics keyed by name, in schema order.
   *
   * @return The name to value mapping.
   */
  Map<String, Number> toMap();
}
