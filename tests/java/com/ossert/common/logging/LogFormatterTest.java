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

package com.ossert.common.logging;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import com.google.common.base.Throwables;

import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class LogFormatterTest {

  private static final int THREAD_ID = 105;
  private static final long TIME_MILLIS = 1298065054839L;
  private static final String TIME_STRING = "0218 21:37:34.839";

  private LogFormatter formatter;

  @Before
  public void setUp() {
    formatter = new LogFormatter();
  }

  @Test
  public void testSimpleMessage() {
    String message = "Filled 2 empty quarters between 1356998400 and 1388534400";

    LogRecord record = makeRecord(Level.INFO, message);

    assertThat(formatter.format(record), is(
        String.format("I%s THREAD%d: %s\n", TIME_STRING, THREAD_ID, message)));
  }

  @Test
  public void testParameters() {
    LogRecord record = makeRecord(Level.FINE, "Created quarter {0}");
    record.setParameters(new Object[] {"1356998400"});

    assertThat(formatter.format(record), is(
        String.format("D%s THREAD%d: Created quarter 1356998400\n", TIME_STRING, THREAD_ID)));
  }

  @Test
  public void testException() {
    String message = "Aggregating a year from 2 quarters";
    Throwable exception = new IllegalStateException("Quarter has 1 values for 2 metrics");

    LogRecord record = makeRecord(Level.WARNING, message);
    record.setThrown(exception);

    assertThat(formatter.format(record), is(
        String.format("W%s THREAD%d: %s\n%s\n", TIME_STRING, THREAD_ID, message,
            Throwables.getStackTraceAsString(exception))));
  }

  private static LogRecord makeRecord(Level level, String message) {
    LogRecord record = new LogRecord(level, message);
    record.setMillis(TIME_MILLIS);
    record.setThreadID(THREAD_ID);
    return record;
  }
}
