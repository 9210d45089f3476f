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
 * Allows the repository owner, managers of the owning group, collaborators
 * with ADMIN permission, and administrators.  Guards repository settings.
 * Visibility is not considered.
 */
@Immutable
@ParametersAreNonnullByDefault
final class OwnerPolicy extends RepositoryPolicy {

  OwnerPolicy(RepositoryResolver repositoryResolver, GroupResolver groupResolver,
      CollaboratorResolver collaboratorResolver) {
    super(PolicyKind.OWNER, repositoryResolver,
        PrecedenceChain.builder()
        .add("admin", AccessRules.ADMIN)
        .add("owner", AccessRules.REPOSITORY_OWNER)
        .add("group-manager", AccessRules.groupManager(groupResolver))
        .add("admin-collaborator",
            AccessRules.collaborator(collaboratorResolver, Permission.ADMINISTRATIVE))
        .build());
  }
}
