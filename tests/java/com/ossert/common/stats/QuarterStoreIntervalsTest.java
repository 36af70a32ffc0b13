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

import java.io.IOException;

import org.junit.Before;
import org.junit.Test;

import com.ossert.common.testing.easymock.EasyMockTest;
import com.ossert.common.util.Quarters;
import com.ossert.common.util.testing.FakeClock;

import static org.easymock.EasyMock.expectLastCall;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class QuarterStoreIntervalsTest extends EasyMockTest {

  private static final long END_OF_DAY = 86399L;

  private QuarterStore<SimpleMetrics> store;
  private IntervalClosure<IOException> closure;

  @Before
  public void setUp() {
    FakeClock clock = new FakeClock();
    clock.setNow("2024-10-18");
    store = new QuarterStore<SimpleMetrics>(
        SimpleMetrics.schemaBuilder().summed("count").build(), clock);
    control.checkOrder(true);
    closure = createMock(new Clazz<IntervalClosure<IOException>>() { });
  }

  @Test
  public void testEmptyStoreYieldsTrailingYear() throws IOException {
    expectInterval("2023-10-01", "2023-12-31");
    expectInterval("2024-01-01", "2024-03-31");
    expectInterval("2024-04-01", "2024-06-30");
    expectInterval("2024-07-01", "2024-09-30");
    expectInterval("2024-10-01", "2024-12-31");

    control.replay();

    store.withQuartersIntervals(closure);
  }

  @Test
  public void testExistingQuartersRunToCurrentQuarterEnd() throws IOException {
    store.findOrCreate("2024-08-08");
    store.findOrCreate("2024-02-02");

    closure.execute(day("2024-01-01"), day("2024-07-01"));
    closure.execute(day("2024-07-01"), day("2024-12-31") + END_OF_DAY);

    control.replay();

    store.withQuartersIntervals(closure);
  }

  @Test
  public void testClosureFailureStopsIteration() throws IOException {
    IOException failure = new IOException("Service unavailable");
    closure.execute(day("2023-10-01"), day("2023-12-31") + END_OF_DAY);
    expectLastCall().andThrow(failure);

    control.replay();

    try {
      store.withQuartersIntervals(closure);
      fail("Expected the closure failure to propagate");
    } catch (IOException e) {
      assertEquals(failure, e);
    }
  }

  private void expectInterval(String start, String lastDay) throws IOException {
    closure.execute(day(start), day(lastDay) + END_OF_DAY);
  }

  private static long day(String date) {
    return Quarters.parseDay(date);
  }
}
