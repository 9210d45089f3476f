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

import com.google.common.base.Preconditions;
import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.model.RepositoryInfo;
import com.google.enterprise.gitauthz.model.RequestPath;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * The inputs a precedence rule is matched against: a signed-in actor, the
 * request path, and the repository resolved from it.
 */
@Immutable
@ParametersAreNonnullByDefault
final class AccessQuery {
  @Nonnull private final Account actor;
  @Nonnull private final RequestPath path;
  @Nonnull private final RepositoryInfo repository;

  private AccessQuery(Account actor, RequestPath path, RepositoryInfo repository) {
    this.actor = actor;
    this.path = path;
    this.repository = repository;
  }

  static AccessQuery make(Account actor, RequestPath path, RepositoryInfo repository) {
    Preconditions.checkNotNull(actor);
    Preconditions.checkNotNull(path);
    Preconditions.checkNotNull(repository);
    return new AccessQuery(actor, path, repository);
  }

  Account getActor() {
    return actor;
  }

  RequestPath getPath() {
    return path;
  }

  RepositoryInfo getRepository() {
    return repository;
  }
}
