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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A closed interval of UNIX timestamps {@code [start, end]} spanning one calendar quarter.
 */
public final class QuarterInterval {

  private final long start;
  private final long end;

  public QuarterInterval(long start, long end) {
    Preconditions.checkArgument(start <= end, "Interval start %s is after its end %s", start, end);
    this.start = start;
    this.end = end;
  }

  /**
   * Creates the interval for the quarter containing {@code unixTime}.
   */
  public static QuarterInterval containing(long unixTime) {
    long start = Quarters.startOf(unixTime);
    return new QuarterInterval(start, Quarters.endOf(start));
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public boolean contains(long unixTime) {
    return start <= unixTime && unixTime <= end;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof QuarterInterval)) {
      return false;
    }
    QuarterInterval other = (QuarterInterval) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + "]";
  }
}
