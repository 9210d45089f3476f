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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Log-message decoration.
 */
@ParametersAreNonnullByDefault
public final class LogMessages {

  // don't instantiate
  private LogMessages() {
  }

  /**
   * Decorates a log message with the acting user.
   *
   * @param actor The signed-in account, or null for a guest.
   * @param format A format string, as for {@link String#format}.
   * @param args The format arguments.
   * @return The decorated log message.
   */
  @Nonnull
  public static String logMessage(@Nullable Account actor, String format, Object... args) {
    String message = (args.length == 0) ? format : String.format(format, args);
    return (actor == null)
        ? "guest: " + message
        : "user " + actor.getUserName() + ": " + message;
  }
}
