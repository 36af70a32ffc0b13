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

import java.math.RoundingMode;
import java.util.Calendar;
import java.util.Date;
import java.util.GregorianCalendar;
import java.util.List;
import java.util.TimeZone;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.math.LongMath;

import com.ossert.common.base.MorePreconditions;

/**
 * Calendar quarter arithmetic over UNIX timestamps (whole seconds since the epoch).
 *
 * <p>Quarters are the groups of months Jan-Mar, Apr-Jun, Jul-Sep and Oct-Dec.  All computations
 * use the proleptic Gregorian calendar in UTC, independent of the default time zone and locale.
 * A quarter key is the timestamp of the first second of a quarter.
 */
public final class Quarters {

  private static final TimeZone UTC = TimeZone.getTimeZone("UTC");
  private static final Splitter DATE_SPLITTER = Splitter.on('-').trimResults();
  private static final int MONTHS_PER_QUARTER = 3;
  private static final int MAX_DATE_PARTS = 3;

  private Quarters() {
    // utility
  }

  /**
   * Finds the start of the quarter containing the given calendar date.
   *
   * @param date A calendar date formatted as {@code YYYY-MM-DD}; the day, or the month and the
   *     day, may be omitted and default to 1.
   * @return The quarter key for the date.
   * @throws MalformedDateException if {@code date} is not a calendar date.
   */
  public static long startOf(String date) {
    return startOf(parseDay(date));
  }

  /**
   * Parses a calendar date as 00:00:00 UTC of that day.  No time of day or zone is accepted.
   *
   * @param date A calendar date formatted as {@code YYYY-MM-DD}; the day, or the month and the
   *     day, may be omitted and default to 1.
   * @return Seconds since the epoch at the start of the day.
   * @throws MalformedDateException if {@code date} is not a calendar date.
   */
  public static long parseDay(String date) {
    Preconditions.checkNotNull(date);

    List<String> parts = DATE_SPLITTER.splitToList(date);
    if (parts.size() > MAX_DATE_PARTS) {
      throw new MalformedDateException(date);
    }

    int[] fields = {0, 1, 1};
    for (int i = 0; i < parts.size(); i++) {
      try {
        fields[i] = Integer.parseInt(parts.get(i));
      } catch (NumberFormatException e) {
        throw new MalformedDateException(date, e);
      }
    }

    Calendar calendar = utcCalendar();
    calendar.setLenient(false);
    calendar.set(fields[0], fields[1] - 1, fields[2]);
    try {
      return toUnixTime(calendar.getTimeInMillis());
    } catch (IllegalArgumentException e) {
      throw new MalformedDateException(date, e);
    }
  }

  /**
   * Finds the start of the quarter containing the UTC calendar day of a timestamp.
   *
   * @param unixTime Seconds since the epoch.
   * @return The quarter key for the timestamp.
   */
  public static long startOf(long unixTime) {
    Calendar calendar = at(unixTime);
    return quarterStart(calendar.get(Calendar.YEAR), calendar.get(Calendar.MONTH));
  }

  /**
   * Equivalent to {@code startOf(toUnixTime(date))}.
   */
  public static long startOf(Date date) {
    return startOf(toUnixTime(date));
  }

  /**
   * Finds the last second of the quarter containing a timestamp, ie: 23:59:59 on the last day of
   * the quarter.
   */
  public static long endOf(long unixTime) {
    return nextStart(unixTime) - 1;
  }

  /**
   * Finds the first second of the quarter following the one containing {@code unixTime}.
   */
  public static long nextStart(long unixTime) {
    Calendar calendar = at(unixTime);
    return quarterStart(calendar.get(Calendar.YEAR),
        calendar.get(Calendar.MONTH) + MONTHS_PER_QUARTER);
  }

  /**
   * Moves a timestamp back by whole calendar years, clamping to the end of February when the
   * source day is a leap day.
   */
  public static long yearsBefore(long unixTime, int years) {
    MorePreconditions.checkNonNegative(years, "Years");
    Calendar calendar = at(unixTime);
    calendar.add(Calendar.YEAR, -years);
    return toUnixTime(calendar.getTimeInMillis());
  }

  /**
   * Truncates a timestamp to 00:00:00 UTC of its calendar day.
   */
  public static long startOfDay(long unixTime) {
    Calendar calendar = at(unixTime);
    calendar.set(Calendar.HOUR_OF_DAY, 0);
    calendar.set(Calendar.MINUTE, 0);
    calendar.set(Calendar.SECOND, 0);
    calendar.set(Calendar.MILLISECOND, 0);
    return toUnixTime(calendar.getTimeInMillis());
  }

  public static long toUnixTime(Date date) {
    Preconditions.checkNotNull(date);
    return toUnixTime(date.getTime());
  }

  /**
   * Converts epoch milliseconds to epoch seconds, rounding toward negative infinity so that
   * instants before the epoch stay on their own calendar day.
   */
  public static long toUnixTime(long millisSinceEpoch) {
    return LongMath.divide(millisSinceEpoch, TimeUnit.SECONDS.toMillis(1), RoundingMode.FLOOR);
  }

  public static Date toDate(long unixTime) {
    return new Date(TimeUnit.SECONDS.toMillis(unixTime));
  }

  private static long quarterStart(int year, int month) {
    Calendar calendar = utcCalendar();
    // Lenient: a month past December rolls into the following year.
    calendar.set(year, month - (month % MONTHS_PER_QUARTER), 1);
    return toUnixTime(calendar.getTimeInMillis());
  }

  private static Calendar at(long unixTime) {
    Calendar calendar = utcCalendar();
    calendar.setTimeInMillis(TimeUnit.SECONDS.toMillis(unixTime));
    return calendar;
  }

  private static Calendar utcCalendar() {
    GregorianCalendar calendar = new GregorianCalendar(UTC);
    calendar.setGregorianChange(new Date(Long.MIN_VALUE));
    calendar.clear();
    return calendar;
  }
}
