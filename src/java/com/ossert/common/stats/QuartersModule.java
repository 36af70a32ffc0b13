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
import com.google.inject.Singleton;

import com.ossert.common.util.Clock;

/**
 * Binds the system clock and the {@link QuarterStoreFactory}.  Tests may override the clock
 * binding with a {@link com.ossert.common.util.testing.FakeClock}.
 */
public class QuartersModule extends AbstractModule {

  @Override
  protected void configure() {
    bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);
    bind(QuarterStoreFactory.class).in(Singleton.class);
  }
}
