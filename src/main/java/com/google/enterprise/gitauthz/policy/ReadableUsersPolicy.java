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

import com.google.enterprise.gitauthz.lookup.CollaboratorResolver;
import com.google.enterprise.gitauthz.lookup.GroupResolver;
import com.google.enterprise.gitauthz.lookup.RepositoryResolver;
import com.google.enterprise.gitauthz.model.Permission;

import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * Like {@link ReferrerPolicy}, but a signed-in account is always required,
 * even for public repositories.
 */
@Immutable
@ParametersAreNonnullByDefault
final class ReadableUsersPolicy extends RepositoryPolicy {

  ReadableUsersPolicy(RepositoryResolver repositoryResolver, GroupResolver groupResolver,
      CollaboratorResolver collaboratorResolver) {
    super(PolicyKind.READABLE_USERS, repositoryResolver,
        PrecedenceChain.builder()
        .add("admin", AccessRules.ADMIN)
        .add("public", AccessRules.PUBLIC_REPOSITORY)
        .add("namespace-owner", AccessRules.PATH_OWNER)
        .add("group-member", AccessRules.groupMember(groupResolver))
        .add("collaborator", AccessRules.collaborator(collaboratorResolver, Permission.ALL))
        .build());
  }
}
