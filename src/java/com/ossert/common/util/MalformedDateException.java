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

/**
 * Thrown when a textual date can not be resolved to a calendar day.
 */
public class MalformedDateException extends IllegalArgumentException {

  private final String date;

  public MalformedDateException(String date) {
    super("Malformed date: '" + date + "', expected YYYY[-MM[-DD]]");
    this.date = date;
  }

  public MalformedDateException(String date, Throwable cause) {
    super("Malformed date: '" + date + "', expected YYYY[-MM[-DD]]", cause);
    this.date = date;
  }

  /**
   * @return The offending input.
   */
  public String getDate() {
    return date;
  }
}
