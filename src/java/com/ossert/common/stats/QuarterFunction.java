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

/**
 * A unit of work against one quarter of a {@link QuarterStore}.
 *
 * @param <T> The container type of the store.
 * @param <R> The result type.
 */
public interface QuarterFunction<T extends MetricsContainer, R> {

  /**
   * @param quarterStart UNIX timestamp of the start of the quarter.
   * @param quarter The quarter's metrics.
   * @return The result for this quarter.
   */
  R apply(long quarterStart, T quarter);
}
