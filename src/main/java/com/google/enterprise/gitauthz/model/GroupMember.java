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
 * A membership record linking an account to a group.  Managers have
 * administrative rights over the group and the repositories it owns.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class GroupMember {
  @Nonnull private final String groupName;
  @Nonnull private final String userName;
  private final boolean manager;

  private GroupMember(String groupName, String userName, boolean manager) {
    this.groupName = groupName;
    this.userName = userName;
    this.manager = manager;
  }

  @Nonnull
  public static GroupMember make(String groupName, String userName, boolean manager) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(groupName), "Empty group name");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(userName), "Empty user name");
    return new GroupMember(groupName, userName, manager);
  }

  @Nonnull
  public String getGroupName() {
    return groupName;
  }

  @Nonnull
  public String getUserName() {
    return userName;
  }

  public boolean isManager() {
    return manager;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof GroupMember)) { return false; }
    GroupMember other = (GroupMember) object;
    return groupName.equals(other.groupName)
        && userName.equals(other.userName)
        && manager == other.manager;
  }

  @Override
  public int hashCode() {
    return Objects.hash(groupName, userName, manager);
  }

  @Override
  public String toString() {
    return "{group: " + groupName + ", member: " + userName + (manager ? ", manager" : "") + "}";
  }
}
