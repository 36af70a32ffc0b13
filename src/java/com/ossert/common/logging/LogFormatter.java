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

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;

/**
 * Formats log records as single glog-style lines, timestamps in UTC:
 * <pre>
 *   I0218 21:37:34.839 THREAD105: Filled 3 empty quarters between 1356998400 and 1388534400
 * </pre>
 * A thrown exception follows on the next lines as a stack trace.
 */
public class LogFormatter extends Formatter {

  private static final ImmutableMap<Level, Character> LEVEL_LABELS =
      ImmutableMap.<Level, Character>builder()
          .put(Level.SEVERE, 'E')
          .put(Level.WARNING, 'W')
          .put(Level.INFO, 'I')
          .put(Level.CONFIG, 'C')
          .build();

  private static final char DEBUG_LABEL = 'D';

  @Override
  public String format(LogRecord record) {
    StringBuilder line = new StringBuilder()
        .append(label(record.getLevel()))
        .append(formatTime(record.getMillis()))
        .append(" THREAD")
        .append(record.getThreadID())
        .append(": ")
        .append(formatMessage(record))
        .append('\n');
    if (record.getThrown() != null) {
      line.append(Throwables.getStackTraceAsString(record.getThrown())).append('\n');
    }
    return line.toString();
  }

  private static char label(Level level) {
    Character label = LEVEL_LABELS.get(level);
    return label == null ? DEBUG_LABEL : label;
  }

  private static String formatTime(long millis) {
    // SimpleDateFormat is not thread safe.
    SimpleDateFormat format = new SimpleDateFormat("MMdd HH:mm:ss.SSS");
    format.setTimeZone(TimeZone.getTimeZone("UTC"));
    return format.format(new Date(millis));
  }
}
