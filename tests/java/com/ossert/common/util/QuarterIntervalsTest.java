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

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import com.ossert.common.util.testing.FakeClock;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class QuarterIntervalsTest {

  @Test
  public void testQuartersAreExpandedToBoundaries() {
    ImmutableList<QuarterInterval> expected = ImmutableList.of(
        interval("2013-07-01", "2013-09-30"),
        interval("2013-10-01", "2013-12-31"),
        interval("2014-01-01", "2014-03-31"),
        interval("2014-04-01", "2014-06-30"),
        interval("2014-07-01", "2014-09-30"),
        interval("2014-10-01", "2014-12-31"),
        interval("2015-01-01", "2015-03-31"),
        interval("2015-04-01", "2015-06-30"),
        interval("2015-07-01", "2015-09-30"));

    List<QuarterInterval> intervals = QuarterIntervals.build(
        Quarters.parseDay("2013-09-01"), Quarters.parseDay("2015-09-01"));

    assertEquals(expected, intervals);
    assertEquals(1372636800L, intervals.get(0).getStart());
    assertEquals(1443657599L, intervals.get(8).getEnd());
  }

  @Test
  public void testInvertedPeriodIsEmpty() {
    assertEquals(ImmutableList.<QuarterInterval>of(), QuarterIntervals.build(
        Quarters.parseDay("2015-09-01"), Quarters.parseDay("2013-09-01")));
  }

  @Test
  public void testSameQuarterInvertedYieldsThatQuarter() {
    // Both ends widen to the same quarter, which is then non-empty.
    assertEquals(ImmutableList.of(interval("2015-07-01", "2015-09-30")), QuarterIntervals.build(
        Quarters.parseDay("2015-09-01"), Quarters.parseDay("2015-08-01")));
  }

  @Test
  public void testIntervalsAreContiguousAndCover() {
    long from = Quarters.parseDay("1999-11-17") + 12345;
    long to = Quarters.parseDay("2021-05-03") + 777;
    List<QuarterInterval> intervals = QuarterIntervals.build(from, to);

    assertEquals(87, intervals.size());
    assertTrue(intervals.get(0).contains(from));
    assertTrue(intervals.get(intervals.size() - 1).contains(to));
    for (int i = 0; i < intervals.size() - 1; i++) {
      assertEquals(intervals.get(i).getEnd() + 1, intervals.get(i + 1).getStart());
    }
    for (QuarterInterval interval : intervals) {
      assertEquals(interval, QuarterInterval.containing(interval.getStart()));
      assertEquals(interval, QuarterInterval.containing(interval.getEnd()));
    }
  }

  @Test
  public void testDefaultsToTrailingYear() {
    FakeClock clock = new FakeClock();
    clock.setNow("2024-10-18");

    assertEquals(ImmutableList.of(
        interval("2023-10-01", "2023-12-31"),
        interval("2024-01-01", "2024-03-31"),
        interval("2024-04-01", "2024-06-30"),
        interval("2024-07-01", "2024-09-30"),
        interval("2024-10-01", "2024-12-31")),
        QuarterIntervals.build(clock));
  }

  @Test
  public void testDatesAndTimestampsAgree() {
    assertEquals(
        QuarterIntervals.build(Quarters.parseDay("2013-09-01"), Quarters.parseDay("2015-09-01")),
        QuarterIntervals.build(Quarters.toDate(Quarters.parseDay("2013-09-01")),
            Quarters.toDate(Quarters.parseDay("2015-09-01"))));
  }

  private static QuarterInterval interval(String start, String lastDay) {
    return new QuarterInterval(Quarters.parseDay(start), Quarters.parseDay(lastDay) + 86399);
  }
}
