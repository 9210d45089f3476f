// Copyright 2011 Google Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.enterprise.gitauthz.common;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

/**
 * A one-line log formatter: timestamp, a level code, the thread, the short
 * source class and method, then the message.
 */
public class LogFormatter extends Formatter {

  private static final DateTimeFormatter dateTimeFormatter =
      DateTimeFormat.forPattern("yyMMdd HH:mm:ss.SSS");

  private static final String MATCH_PREFIX = "com.google.enterprise.gitauthz.";
  private static final String REPLACE_PREFIX = ".";

  @Override
  public String format(LogRecord rec) {
    StringBuilder buffer = new StringBuilder();
    buffer.append(dateTimeFormatter.print(rec.getMillis()));
    buffer.append(' ');
    buffer.append(levelCode(rec.getLevel()));
    Throwable thrown = rec.getThrown();
    if (thrown != null) {
      buffer.append('T');
    }
    buffer.append(' ');
    buffer.append(rec.getThreadID());
    buffer.append(" [");
    buffer.append(shortenClassName(rec.getSourceClassName()));
    buffer.append('.');
    buffer.append(rec.getSourceMethodName());
    buffer.append("] ");
    buffer.append(formatMessage(rec));
    buffer.append('\n');
    if (thrown != null) {
      StringWriter sw = new StringWriter();
      PrintWriter pw = new PrintWriter(sw);
      thrown.printStackTrace(pw);
      pw.flush();
      buffer.append(sw.toString());
    }
    return buffer.toString();
  }

  /**
   * Gets a one-character code for a log level: D for debugging levels, W for
   * warnings, E for severe, I otherwise.
   */
  static char levelCode(Level level) {
    int value = level.intValue();
    if (value <= Level.FINE.intValue()) {
      return 'D';
    }
    if (value >= Level.SEVERE.intValue()) {
      return 'E';
    }
    if (value >= Level.WARNING.intValue()) {
      return 'W';
    }
    return 'I';
  }

  /**
   * Strips this project's package prefix from a class name.
   */
  public static String shortenClassName(String className) {
    if (className == null) {
      return "?";
    }
    return className.startsWith(MATCH_PREFIX)
        ? REPLACE_PREFIX + className.substring(MATCH_PREFIX.length())
        : className;
  }
}
