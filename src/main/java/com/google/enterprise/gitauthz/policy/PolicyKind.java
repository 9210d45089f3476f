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

/**
 * The fixed set of authorization policies.
 */
public enum PolicyKind {
  /** Only the account named by the path, and administrators. */
  ONESELF(false),
  /** Repository owners, managers of the owning group, admin collaborators. */
  OWNER(true),
  /** Any signed-in account. */
  USERS(false),
  /** Administrators only. */
  ADMIN(false),
  /** Accounts that may write to the repository. */
  COLLABORATORS(true),
  /** Anyone for public repositories, readers for private ones. */
  REFERRER(true),
  /** Signed-in accounts that may read the repository. */
  READABLE_USERS(true),
  /** Managers of the group named by the path. */
  GROUP_MANAGER(false);

  private final boolean repositoryScoped;

  private PolicyKind(boolean repositoryScoped) {
    this.repositoryScoped = repositoryScoped;
  }

  /**
   * @return True if this policy resolves a repository from the request path
   *     before deciding.
   */
  public boolean isRepositoryScoped() {
    return repositoryScoped;
  }
}
