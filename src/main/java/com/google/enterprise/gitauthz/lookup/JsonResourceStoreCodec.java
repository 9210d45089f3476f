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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import com.google.enterprise.gitauthz.model.CollaboratorGrant;
import com.google.enterprise.gitauthz.model.GroupMember;
import com.google.enterprise.gitauthz.model.Permission;
import com.google.enterprise.gitauthz.model.RepositoryInfo;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.google.inject.Singleton;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.inject.Inject;

/**
 * Reads and writes a {@link ResourceStore} as JSON.  The format is:
 *
 * <pre>
 * {
 *   "repositories": [ {"owner": "alice", "name": "tools", "private": true} ],
 *   "groups": { "devs": [ {"userName": "alice", "manager": true} ] },
 *   "collaborators": [
 *     {"owner": "alice", "repository": "tools", "userName": "bob", "permission": "WRITE"}
 *   ]
 * }
 * </pre>
 */
@Singleton
@Immutable
@ParametersAreNonnullByDefault
public final class JsonResourceStoreCodec {
  private static final Logger logger = Logger.getLogger(JsonResourceStoreCodec.class.getName());

  private final Gson gson;

  @Inject
  private JsonResourceStoreCodec() {
    gson = new GsonBuilder().setPrettyPrinting().create();
  }

  @VisibleForTesting
  public static JsonResourceStoreCodec make() {
    return new JsonResourceStoreCodec();
  }

  /**
   * Reads a store from a file.
   *
   * @param file The file to read.
   * @return The decoded store.
   * @throws IOException if the file can't be read or isn't a valid store.
   */
  @Nonnull
  public ResourceStore readStore(File file)
      throws IOException {
    logger.info("Reading resource store from " + file);
    Reader reader = Files.newReader(file, UTF_8);
    try {
      return readStore(reader);
    } finally {
      reader.close();
    }
  }

  /**
   * Reads a store from a character stream.
   *
   * @param reader The stream to read.
   * @return The decoded store.
   * @throws IOException if the stream can't be read or isn't a valid store.
   */
  @Nonnull
  public ResourceStore readStore(Reader reader)
      throws IOException {
    StoreProxy proxy;
    try {
      proxy = gson.fromJson(reader, StoreProxy.class);
    } catch (JsonParseException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      throw new IOException("Unable to parse resource store", e);
    }
    if (proxy == null) {
      throw new IOException("Empty resource store");
    }
    try {
      ResourceStore store = proxy.build();
      logger.info("Read resource store " + store);
      return store;
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid resource store: " + e.getMessage(), e);
    }
  }

  /**
   * Writes a store to a character stream.
   *
   * @param store The store to write.
   * @param writer The stream to write to.
   */
  public void writeStore(ResourceStore store, Writer writer) {
    gson.toJson(new StoreProxy(store), writer);
  }

  private static final class StoreProxy {
    List<RepositoryProxy> repositories;
    Map<String, List<MemberProxy>> groups;
    List<GrantProxy> collaborators;

    @SuppressWarnings("unused")
    StoreProxy() {
    }

    StoreProxy(ResourceStore store) {
      ImmutableList.Builder<RepositoryProxy> repositoriesBuilder = ImmutableList.builder();
      for (RepositoryInfo repository : store.getRepositories()) {
        repositoriesBuilder.add(new RepositoryProxy(repository.getOwner(), repository.getName(),
            repository.isPrivate()));
      }
      repositories = repositoriesBuilder.build();
      ImmutableMap.Builder<String, List<MemberProxy>> groupsBuilder = ImmutableMap.builder();
      for (String groupName : store.getGroupNames()) {
        ImmutableList.Builder<MemberProxy> membersBuilder = ImmutableList.builder();
        for (GroupMember member : store.getGroupMembers(groupName)) {
          membersBuilder.add(new MemberProxy(member.getUserName(), member.isManager()));
        }
        groupsBuilder.put(groupName, membersBuilder.build());
      }
      groups = groupsBuilder.build();
      ImmutableList.Builder<GrantProxy> grantsBuilder = ImmutableList.builder();
      for (CollaboratorGrant grant : store.getGrants()) {
        grantsBuilder.add(new GrantProxy(grant.getOwner(), grant.getRepositoryName(),
            grant.getUserName(), grant.getPermission().name()));
      }
      collaborators = grantsBuilder.build();
    }

    ResourceStore build() {
      ResourceStore.Builder builder = ResourceStore.builder();
      if (repositories != null) {
        for (RepositoryProxy repository : repositories) {
          Preconditions.checkArgument(repository != null, "Null repository entry");
          builder.addRepository(repository.owner, repository.name, repository.isPrivate);
        }
      }
      if (groups != null) {
        for (Map.Entry<String, List<MemberProxy>> entry : groups.entrySet()) {
          Preconditions.checkArgument(entry.getValue() != null,
              "Null member list for group %s", entry.getKey());
          for (MemberProxy member : entry.getValue()) {
            Preconditions.checkArgument(member != null,
                "Null member entry in group %s", entry.getKey());
            builder.addMember(entry.getKey(), member.userName, member.manager);
          }
        }
      }
      if (collaborators != null) {
        for (GrantProxy grant : collaborators) {
          Preconditions.checkArgument(grant != null, "Null collaborator entry");
          builder.addGrant(grant.owner, grant.repository, grant.userName,
              parsePermission(grant.permission));
        }
      }
      return builder.build();
    }
  }

  private static Permission parsePermission(String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Missing permission");
    }
    try {
      return Permission.valueOf(name.trim().toUpperCase(Locale.US));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown permission: " + name, e);
    }
  }

  private static final class RepositoryProxy {
    String owner;
    String name;
    @SerializedName("private") boolean isPrivate;

    @SuppressWarnings("unused")
    RepositoryProxy() {
    }

    RepositoryProxy(String owner, String name, boolean isPrivate) {
      this.owner = owner;
      this.name = name;
      this.isPrivate = isPrivate;
    }
  }

  private static final class MemberProxy {
    String userName;
    boolean manager;

    @SuppressWarnings("unused")
    MemberProxy() {
    }

    MemberProxy(String userName, boolean manager) {
      this.userName = userName;
      this.manager = manager;
    }
  }

  private static final class GrantProxy {
    String owner;
    String repository;
    String userName;
    String permission;

    @SuppressWarnings("unused")
    GrantProxy() {
    }

    GrantProxy(String owner, String repository, String userName, String permission) {
      this.owner = owner;
      this.repository = repository;
      this.userName = userName;
      this.permission = permission;
    }
  }
}
