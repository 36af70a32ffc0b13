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

import java.util.NoSuchElementException;

/**
 * Thrown by a strict lookup of a quarter that holds no data.
 */
public class QuarterNotFoundException extends NoSuchElementException {

  private final long quarterStart;

  public QuarterNotFoundException(long quarterStart) {
    super("No data for quarter starting at " + quarterStart);
    this.quarterStart = quarterStart;
  }

  public long getQuarterStart() {
    return quarterStart;
  }
}
