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

package com.google.enterprise.gitauthz.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * An explicit per-repository permission granted to a user, independent of
 * ownership or group membership.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class CollaboratorGrant {
  @Nonnull private final String owner;
  @Nonnull private final String repositoryName;
  @Nonnull private final String userName;
  @Nonnull private final Permission permission;

  private CollaboratorGrant(String owner, String repositoryName, String userName,
      Permission permission) {
    this.owner = owner;
    this.repositoryName = repositoryName;
    this.userName = userName;
    this.permission = permission;
  }

  @Nonnull
  public static CollaboratorGrant make(String owner, String repositoryName, String userName,
      Permission permission) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(owner), "Empty owner");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(repositoryName), "Empty repository name");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(userName), "Empty user name");
    Preconditions.checkNotNull(permission);
    return new CollaboratorGrant(owner, repositoryName, userName, permission);
  }

  @Nonnull
  public String getOwner() {
    return owner;
  }

  @Nonnull
  public String getRepositoryName() {
    return repositoryName;
  }

  @Nonnull
  public String getUserName() {
    return userName;
  }

  @Nonnull
  public Permission getPermission() {
    return permission;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof CollaboratorGrant)) { return false; }
    CollaboratorGrant other = (CollaboratorGrant) object;
    return owner.equals(other.owner)
        && repositoryName.equals(other.repositoryName)
        && userName.equals(other.userName)
        && permission == other.permission;
  }

  @Override
  public int hashCode() {
    return Objects.hash(owner, repositoryName, userName, permission);
  }

  @Override
  public String toString() {
    return "{collaborator: " + userName + " on " + owner + "/" + repositoryName
        + ", permission: " + permission + "}";
  }
}
