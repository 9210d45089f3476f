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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Maps;
import com.google.enterprise.gitauthz.model.CollaboratorGrant;
import com.google.enterprise.gitauthz.model.GroupMember;
import com.google.enterprise.gitauthz.model.Permission;
import com.google.enterprise.gitauthz.model.RepositoryInfo;

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable in-memory store of repositories, group memberships and
 * collaborator grants.  Backs all three resolver interfaces, so it can stand
 * in for the persistence layer in small deployments and in tests.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class ResourceStore
    implements RepositoryResolver, GroupResolver, CollaboratorResolver {

  // Repositories and grants are indexed by (owner, repository name).
  @Nonnull private final ImmutableTable<String, String, RepositoryInfo> repositories;
  @Nonnull private final ImmutableListMultimap<String, GroupMember> members;
  @Nonnull private final ImmutableTable<String, String, ImmutableList<CollaboratorGrant>> grants;

  private ResourceStore(ImmutableTable<String, String, RepositoryInfo> repositories,
      ImmutableListMultimap<String, GroupMember> members,
      ImmutableTable<String, String, ImmutableList<CollaboratorGrant>> grants) {
    this.repositories = repositories;
    this.members = members;
    this.grants = grants;
  }

  /**
   * @return A store with no content.
   */
  @Nonnull
  public static ResourceStore empty() {
    return builder().build();
  }

  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  @Override
  @Nullable
  public RepositoryInfo getRepository(String owner, String name) {
    return repositories.get(owner, name);
  }

  @Override
  @Nonnull
  public ImmutableList<GroupMember> getGroupMembers(String groupName) {
    return members.get(groupName);
  }

  @Override
  @Nonnull
  public ImmutableSet<String> getCollaboratorUserNames(String owner, String name,
      Set<Permission> permissions) {
    ImmutableList<CollaboratorGrant> repositoryGrants = grants.get(owner, name);
    if (repositoryGrants == null) {
      return ImmutableSet.of();
    }
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (CollaboratorGrant grant : repositoryGrants) {
      if (permissions.contains(grant.getPermission())) {
        builder.add(grant.getUserName());
      }
    }
    return builder.build();
  }

  /**
   * @return All repositories in the store.
   */
  @Nonnull
  public ImmutableList<RepositoryInfo> getRepositories() {
    return repositories.values().asList();
  }

  /**
   * @return All collaborator grants in the store, grouped by repository.
   */
  @Nonnull
  public ImmutableList<CollaboratorGrant> getGrants() {
    ImmutableList.Builder<CollaboratorGrant> builder = ImmutableList.builder();
    for (ImmutableList<CollaboratorGrant> repositoryGrants : grants.values()) {
      builder.addAll(repositoryGrants);
    }
    return builder.build();
  }

  /**
   * @return The names of all groups with at least one member.
   */
  @Nonnull
  public ImmutableSet<String> getGroupNames() {
    return members.keySet();
  }

  @Override
  public String toString() {
    return "{repositories: " + repositories.size()
        + ", groups: " + members.keySet().size()
        + ", grants: " + getGrants().size() + "}";
  }

  /**
   * A builder for resource stores.  A grant that repeats an earlier
   * (repository, user) pair is dropped: the first grant wins.
   */
  @NotThreadSafe
  public static final class Builder {
    private final Map<List<String>, RepositoryInfo> repositories = Maps.newLinkedHashMap();
    private final ImmutableListMultimap.Builder<String, GroupMember> members =
        ImmutableListMultimap.builder();
    private final Map<List<String>, CollaboratorGrant> grants = Maps.newLinkedHashMap();

    private Builder() {
    }

    public Builder addRepository(RepositoryInfo repository) {
      List<String> key = ImmutableList.of(repository.getOwner(), repository.getName());
      Preconditions.checkArgument(!repositories.containsKey(key),
          "Duplicate repository: %s", repository.getFullName());
      repositories.put(key, repository);
      return this;
    }

    public Builder addRepository(String owner, String name, boolean isPrivate) {
      return addRepository(RepositoryInfo.make(owner, name, isPrivate));
    }

    public Builder addMember(GroupMember member) {
      members.put(member.getGroupName(), member);
      return this;
    }

    public Builder addMember(String groupName, String userName, boolean manager) {
      return addMember(GroupMember.make(groupName, userName, manager));
    }

    public Builder addGrant(CollaboratorGrant grant) {
      List<String> key = ImmutableList.of(grant.getOwner(), grant.getRepositoryName(),
          grant.getUserName());
      if (!grants.containsKey(key)) {
        grants.put(key, grant);
      }
      return this;
    }

    public Builder addGrant(String owner, String name, String userName, Permission permission) {
      return addGrant(CollaboratorGrant.make(owner, name, userName, permission));
    }

    public ResourceStore build() {
      ImmutableTable.Builder<String, String, RepositoryInfo> repositoriesBuilder =
          ImmutableTable.builder();
      for (RepositoryInfo repository : repositories.values()) {
        repositoriesBuilder.put(repository.getOwner(), repository.getName(), repository);
      }
      Map<List<String>, ImmutableList.Builder<CollaboratorGrant>> grouped =
          Maps.newLinkedHashMap();
      for (CollaboratorGrant grant : grants.values()) {
        List<String> key = ImmutableList.of(grant.getOwner(), grant.getRepositoryName());
        ImmutableList.Builder<CollaboratorGrant> group = grouped.get(key);
        if (group == null) {
          group = ImmutableList.builder();
          grouped.put(key, group);
        }
        group.add(grant);
      }
      ImmutableTable.Builder<String, String, ImmutableList<CollaboratorGrant>> grantsBuilder =
          ImmutableTable.builder();
      for (Map.Entry<List<String>, ImmutableList.Builder<CollaboratorGrant>> entry
               : grouped.entrySet()) {
        grantsBuilder.put(entry.getKey().get(0), entry.getKey().get(1), entry.getValue().build());
      }
      return new ResourceStore(repositoriesBuilder.build(), members.build(),
          grantsBuilder.build());
    }
  }
}
