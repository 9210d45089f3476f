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

import com.google.enterprise.gitauthz.identity.Account;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import junit.framework.TestCase;

/**
 * Unit tests for {@link LogFormatter} and {@link LogMessages}.
 */
public class LogFormatterTest extends TestCase {

  public void testLevelCode() {
    assertEquals('D', LogFormatter.levelCode(Level.FINEST));
    assertEquals('D', LogFormatter.levelCode(Level.FINE));
    assertEquals('I', LogFormatter.levelCode(Level.CONFIG));
    assertEquals('I', LogFormatter.levelCode(Level.INFO));
    assertEquals('W', LogFormatter.levelCode(Level.WARNING));
    assertEquals('E', LogFormatter.levelCode(Level.SEVERE));
  }

  public void testShortenClassName() {
    assertEquals(".policy.OwnerPolicy",
        LogFormatter.shortenClassName("com.google.enterprise.gitauthz.policy.OwnerPolicy"));
    assertEquals("java.lang.String", LogFormatter.shortenClassName("java.lang.String"));
    assertEquals("?", LogFormatter.shortenClassName(null));
  }

  public void testFormat() {
    LogRecord rec = new LogRecord(Level.WARNING, "Denied %s");
    rec.setSourceClassName("com.google.enterprise.gitauthz.gate.Gate");
    rec.setSourceMethodName("decide");
    String line = new LogFormatter().format(rec);
    assertTrue(line, line.contains(" W "));
    assertTrue(line, line.contains("[.gate.Gate.decide] Denied %s\n"));
  }

  public void testFormatWithThrowable() {
    LogRecord rec = new LogRecord(Level.SEVERE, "Lookup failed");
    rec.setThrown(new IllegalStateException("boom"));
    String line = new LogFormatter().format(rec);
    assertTrue(line, line.contains(" ET "));
    assertTrue(line, line.contains("java.lang.IllegalStateException: boom"));
  }

  public void testLogMessage() {
    assertEquals("guest: denied /alice/tools",
        LogMessages.logMessage(null, "denied /%s", "alice/tools"));
    assertEquals("user bob: allowed",
        LogMessages.logMessage(Account.make("bob"), "allowed"));
    assertEquals("user bob: 100% sure",
        LogMessages.logMessage(Account.make("bob"), "100% sure"));
  }
}
