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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.inject.Singleton;
import com.google.inject.name.Named;

import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.inject.Inject;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpSession;

/**
 * An identity provider that finds the signed-in {@link Account} stored by the
 * sign-in servlet.  A request attribute of the same name takes precedence over
 * the session attribute, so filters can impersonate for a single request.
 */
@Singleton
@Immutable
@ParametersAreNonnullByDefault
public final class SessionIdentityProvider implements IdentityProvider {
  private static final Logger logger = Logger.getLogger(SessionIdentityProvider.class.getName());

  public static final String DEFAULT_ATTRIBUTE = "loginAccount";

  private final String attributeName;

  @Inject
  private SessionIdentityProvider(@Named("loginAccountAttribute") String attributeName) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(attributeName));
    this.attributeName = attributeName;
  }

  @VisibleForTesting
  public static SessionIdentityProvider make(String attributeName) {
    return new SessionIdentityProvider(attributeName);
  }

  @VisibleForTesting
  public static SessionIdentityProvider make() {
    return make(DEFAULT_ATTRIBUTE);
  }

  public String getAttributeName() {
    return attributeName;
  }

  @Override
  @Nullable
  public Account getCurrentIdentity(HttpServletRequest request) {
    Account account = asAccount(request.getAttribute(attributeName));
    if (account != null) {
      return account;
    }
    HttpSession session = request.getSession(false);
    if (session == null) {
      return null;
    }
    return asAccount(session.getAttribute(attributeName));
  }

  @Nullable
  private Account asAccount(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof Account)) {
      logger.warning("Attribute " + attributeName + " holds a "
          + value.getClass().getName() + ", treating request as a guest");
      return null;
    }
    return (Account) value;
  }
}
