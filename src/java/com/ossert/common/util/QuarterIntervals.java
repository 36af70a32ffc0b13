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

package com.ossert.common.util;

import java.util.Date;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Builds the calendar quarters covering a period.  Period boundaries that do not fall on quarter
 * boundaries are widened to the enclosing quarters.
 */
public final class QuarterIntervals {

  private QuarterIntervals() {
    // utility
  }

  /**
   * Builds the quarters covering the year up to the clock's current time.
   *
   * @param clock Source of "now".
   * @return Quarters from the one containing the instant one calendar year ago through the
   *     current one.
   */
  public static ImmutableList<QuarterInterval> build(Clock clock) {
    Preconditions.checkNotNull(clock);
    long now = Quarters.toUnixTime(clock.nowMillis());
    return build(Quarters.yearsBefore(now, 1), now);
  }

  public static ImmutableList<QuarterInterval> build(Date from, Date to) {
    return build(Quarters.toUnixTime(from), Quarters.toUnixTime(to));
  }

  /**
   * Builds the quarters from the one containing {@code from} through the one containing
   * {@code to}.  An inverted period yields no quarters.
   *
   * @param from Period start, seconds since the epoch.
   * @param to Period finish, seconds since the epoch.
   * @return Ascending, contiguous quarter intervals.
   */
  public static ImmutableList<QuarterInterval> build(long from, long to) {
    long intervalStart = Quarters.startOf(from);
    long finish = Quarters.endOf(to);

    ImmutableList.Builder<QuarterInterval> intervals = ImmutableList.builder();
    while (intervalStart <= finish) {
      long intervalEnd = Quarters.endOf(intervalStart);
      intervals.add(new QuarterInterval(intervalStart, intervalEnd));
      intervalStart = intervalEnd + 1;
    }
    return intervals.build();
  }
}
