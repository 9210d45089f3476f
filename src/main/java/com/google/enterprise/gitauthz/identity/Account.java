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

package com.google.enterprise.gitauthz.identity;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.io.Serializable;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * A snapshot of a signed-in account, as produced by the authentication
 * subsystem for a single request.
 *
 * Accounts are stored in the HTTP session, hence serializable.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class Account implements Serializable {
  private static final long serialVersionUID = 1L;

  @Nonnull private final String userName;
  private final boolean admin;

  private Account(String userName, boolean admin) {
    this.userName = userName;
    this.admin = admin;
  }

  /**
   * Makes an account.
   *
   * @param userName The account's unique user name.
   * @param admin True if the account is a site administrator.
   * @return An account with the given properties.
   */
  @Nonnull
  public static Account make(String userName, boolean admin) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(userName), "Empty user name");
    return new Account(userName, admin);
  }

  /**
   * Makes an ordinary (non-administrator) account.
   */
  @Nonnull
  public static Account make(String userName) {
    return make(userName, false);
  }

  @Nonnull
  public String getUserName() {
    return userName;
  }

  public boolean isAdmin() {
    return admin;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof Account)) { return false; }
    Account other = (Account) object;
    return userName.equals(other.userName) && admin == other.admin;
  }

  @Override
  public int hashCode() {
    return Objects.hash(userName, admin);
  }

  @Override
  public String toString() {
    return "{userName: " + userName + (admin ? ", admin" : "") + "}";
  }
}
