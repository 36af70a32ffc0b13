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

import com.google.common.base.Preconditions;
import com.google.inject.Inject;

import com.ossert.common.util.Clock;

/**
 * Creates {@link QuarterStore}s sharing an injected {@link Clock}.
 */
public class QuarterStoreFactory {

  private final Clock clock;

  @Inject
  public QuarterStoreFactory(Clock clock) {
    this.clock = Preconditions.checkNotNull(clock);
  }

  /**
   * @param schema Describes the containers of the new store.
   * @return An empty store.
   */
  public <T extends MetricsContainer> QuarterStore<T> create(MetricsSchema<T> schema) {
    return new QuarterStore<T>(schema, clock);
  }
}
