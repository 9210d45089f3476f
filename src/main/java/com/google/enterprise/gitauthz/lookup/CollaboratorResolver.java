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

package com.google.enterprise.gitauthz.lookup;

import com.google.common.collect.ImmutableSet;
import com.google.enterprise.gitauthz.model.Permission;

import java.util.Set;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Resolves the collaborators of a repository.
 */
@ParametersAreNonnullByDefault
public interface CollaboratorResolver {
  /**
   * Gets the users holding a collaborator grant on a repository.
   *
   * @param owner The owning user or group name.
   * @param name The repository name.
   * @param permissions Only grants with one of these permission levels are
   *     considered.
   * @return The names of the matching collaborators.
   * @throws LookupException if the backing store can't be read.
   */
  @Nonnull
  public ImmutableSet<String> getCollaboratorUserNames(String owner, String name,
      Set<Permission> permissions);
}
