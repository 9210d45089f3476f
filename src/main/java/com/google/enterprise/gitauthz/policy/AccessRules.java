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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.enterprise.gitauthz.lookup.CollaboratorResolver;
import com.google.enterprise.gitauthz.lookup.GroupResolver;
import com.google.enterprise.gitauthz.model.GroupMember;
import com.google.enterprise.gitauthz.model.Permission;
import com.google.enterprise.gitauthz.policy.PrecedenceChain.Rule;

import java.util.Set;

import javax.annotation.ParametersAreNonnullByDefault;

/**
 * The rules that repository-scoped policies are assembled from.
 */
@ParametersAreNonnullByDefault
final class AccessRules {

  // don't instantiate
  private AccessRules() {
  }

  static final Rule ADMIN = new Rule() {
    @Override
    public boolean matches(AccessQuery query) {
      return query.getActor().isAdmin();
    }
  };

  static final Rule PUBLIC_REPOSITORY = new Rule() {
    @Override
    public boolean matches(AccessQuery query) {
      return !query.getRepository().isPrivate();
    }
  };

  /** The first path segment is the actor's own namespace. */
  static final Rule PATH_OWNER = new Rule() {
    @Override
    public boolean matches(AccessQuery query) {
      return query.getPath().getOwner().equals(query.getActor().getUserName());
    }
  };

  /** The actor is the repository's recorded owner. */
  static final Rule REPOSITORY_OWNER = new Rule() {
    @Override
    public boolean matches(AccessQuery query) {
      return query.getRepository().getOwner().equals(query.getActor().getUserName());
    }
  };

  /**
   * Matches managers of the group that owns the repository.
   */
  static Rule groupManager(final GroupResolver groupResolver) {
    Preconditions.checkNotNull(groupResolver);
    return new Rule() {
      @Override
      public boolean matches(AccessQuery query) {
        return isGroupManager(groupResolver, query.getRepository().getOwner(),
            query.getActor().getUserName());
      }
    };
  }

  /**
   * Matches any member, manager or not, of the group that owns the repository.
   */
  static Rule groupMember(final GroupResolver groupResolver) {
    Preconditions.checkNotNull(groupResolver);
    return new Rule() {
      @Override
      public boolean matches(AccessQuery query) {
        return isGroupMember(groupResolver, query.getRepository().getOwner(),
            query.getActor().getUserName());
      }
    };
  }

  /**
   * Matches collaborators holding one of the given permissions.  Grants are
   * looked up by the request path's owner and repository segments.
   */
  static Rule collaborator(final CollaboratorResolver collaboratorResolver,
      Set<Permission> permissions) {
    Preconditions.checkNotNull(collaboratorResolver);
    final ImmutableSet<Permission> filter = ImmutableSet.copyOf(permissions);
    Preconditions.checkArgument(!filter.isEmpty());
    return new Rule() {
      @Override
      public boolean matches(AccessQuery query) {
        return collaboratorResolver
            .getCollaboratorUserNames(query.getPath().getOwner(),
                query.getPath().getRepositoryName(), filter)
            .contains(query.getActor().getUserName());
      }
    };
  }

  static boolean isGroupManager(GroupResolver groupResolver, String groupName, String userName) {
    for (GroupMember member : groupResolver.getGroupMembers(groupName)) {
      if (member.getUserName().equals(userName) && member.isManager()) {
        return true;
      }
    }
    return false;
  }

  static boolean isGroupMember(GroupResolver groupResolver, String groupName, String userName) {
    for (GroupMember member : groupResolver.getGroupMembers(groupName)) {
      if (member.getUserName().equals(userName)) {
        return true;
      }
    }
    return false;
  }
}
