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
 * Receives the {@code [start, finish]} boundaries of periods to collect data for.
 *
 * @param <E> The exception type that the closure throws.
 */
public interface IntervalClosure<E extends Exception> {

  /**
   * @param start UNIX timestamp the period begins at.
   * @param finish UNIX timestamp the period ends at.
   * @throws E if there was a problem handling the period.
   */
  void execute(long start, long finish) throws E;
}
