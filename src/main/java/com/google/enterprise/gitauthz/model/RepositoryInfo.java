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
 * A resolved repository.  Instances are produced fresh by each lookup and
 * are only held for the duration of a single decision.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class RepositoryInfo {
  @Nonnull private final String owner;
  @Nonnull private final String name;
  private final boolean isPrivate;

  private RepositoryInfo(String owner, String name, boolean isPrivate) {
    this.owner = owner;
    this.name = name;
    this.isPrivate = isPrivate;
  }

  /**
   * Makes a repository description.
   *
   * @param owner The user or group name that owns the repository.
   * @param name The repository's name within the owner's namespace.
   * @param isPrivate True if the repository is hidden from guests.
   * @return A new repository description.
   */
  @Nonnull
  public static RepositoryInfo make(String owner, String name, boolean isPrivate) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(owner), "Empty owner");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Empty repository name");
    return new RepositoryInfo(owner, name, isPrivate);
  }

  @Nonnull
  public String getOwner() {
    return owner;
  }

  @Nonnull
  public String getName() {
    return name;
  }

  public boolean isPrivate() {
    return isPrivate;
  }

  /**
   * @return The repository's full name, "owner/name".
   */
  @Nonnull
  public String getFullName() {
    return owner + "/" + name;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof RepositoryInfo)) { return false; }
    RepositoryInfo other = (RepositoryInfo) object;
    return owner.equals(other.owner)
        && name.equals(other.name)
        && isPrivate == other.isPrivate;
  }

  @Override
  public int hashCode() {
    return Objects.hash(owner, name, isPrivate);
  }

  @Override
  public String toString() {
    return "{repository: " + getFullName() + (isPrivate ? ", private" : "") + "}";
  }
}
