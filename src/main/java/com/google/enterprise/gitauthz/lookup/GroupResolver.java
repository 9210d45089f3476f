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

import com.google.common.collect.ImmutableList;
import com.google.enterprise.gitauthz.model.GroupMember;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Resolves the members of a group.
 */
@ParametersAreNonnullByDefault
public interface GroupResolver {
  /**
   * Gets the members of a group.  A name that isn't a group (an ordinary
   * user, or nothing at all) has no members.
   *
   * @param groupName The group's name.
   * @return The group's members, possibly empty.
   * @throws LookupException if the backing store can't be read.
   */
  @Nonnull
  public ImmutableList<GroupMember> getGroupMembers(String groupName);
}
