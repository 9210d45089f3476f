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

import com.google.common.base.Preconditions;
import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.lookup.GroupResolver;
import com.google.enterprise.gitauthz.model.RequestPath;

import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * Allows only managers of the group named by the first path segment.
 * Administrators get no special treatment here.
 */
@Immutable
@ParametersAreNonnullByDefault
final class GroupManagerPolicy implements AuthzPolicy {
  private static final Logger logger = Logger.getLogger(GroupManagerPolicy.class.getName());

  private final GroupResolver groupResolver;

  GroupManagerPolicy(GroupResolver groupResolver) {
    this.groupResolver = Preconditions.checkNotNull(groupResolver);
  }

  @Override
  public PolicyKind getKind() {
    return PolicyKind.GROUP_MANAGER;
  }

  @Override
  public Decision evaluate(@Nullable Account actor, RequestPath path) {
    if (actor != null
        && AccessRules.isGroupManager(groupResolver, path.getOwner(), actor.getUserName())) {
      return Decision.allow();
    }
    logger.info(logMessage(actor, "%s: not a manager of group %s", getKind(),
        (path.size() > 0) ? path.getOwner() : "<none>"));
    return Decision.unauthorized();
  }
}
