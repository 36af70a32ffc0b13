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

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;

import org.junit.Test;

import com.ossert.common.util.Clock;
import com.ossert.common.util.Quarters;
import com.ossert.common.util.testing.FakeClock;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class QuarterStoreFactoryTest {

  @Test
  public void testModuleBindsSystemClock() {
    Injector injector = Guice.createInjector(new QuartersModule());

    assertSame(Clock.SYSTEM_CLOCK, injector.getInstance(Clock.class));
    assertSame(injector.getInstance(QuarterStoreFactory.class),
        injector.getInstance(QuarterStoreFactory.class));
  }

  @Test
  public void testStoresUseInjectedClock() {
    final FakeClock clock = new FakeClock();
    clock.setNow("2016-02-29");
    Injector injector = Guice.createInjector(Modules.override(new QuartersModule()).with(
        new AbstractModule() {
          @Override protected void configure() {
            bind(Clock.class).toInstance(clock);
          }
        }));

    QuarterStore<SimpleMetrics> store = injector.getInstance(QuarterStoreFactory.class)
        .create(SimpleMetrics.schemaBuilder().summed("count").build());

    assertEquals(Quarters.toDate(Quarters.parseDay("2016-02-29")), store.getStartDate());
  }
}
