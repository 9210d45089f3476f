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

package com.google.enterprise.gitauthz.policy;

import static com.google.enterprise.gitauthz.common.LogMessages.logMessage;

import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.model.RequestPath;

import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * Allows only the account named by the first path segment, and
 * administrators.  Guards "my account" pages; never looks anything up.
 */
@Immutable
@ParametersAreNonnullByDefault
final class OneselfPolicy implements AuthzPolicy {
  private static final Logger logger = Logger.getLogger(OneselfPolicy.class.getName());

  OneselfPolicy() {
  }

  @Override
  public PolicyKind getKind() {
    return PolicyKind.ONESELF;
  }

  @Override
  public Decision evaluate(@Nullable Account actor, RequestPath path) {
    if (actor != null) {
      if (actor.isAdmin()) {
        return Decision.allow();
      }
      // The path is only consulted for non-administrators.
      if (path.getOwner().equals(actor.getUserName())) {
        return Decision.allow();
      }
    }
    logger.info(logMessage(actor, "%s: /%s belongs to someone else", getKind(), path));
    return Decision.unauthorized();
  }
}
