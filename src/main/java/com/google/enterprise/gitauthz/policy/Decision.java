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
import com.google.enterprise.gitauthz.model.RepositoryInfo;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.servlet.http.HttpServletResponse;

/**
 * The outcome of evaluating a policy: allow (possibly with the resolved
 * repository), unauthorized, or not found.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class Decision {

  /**
   * The three kinds of decision, each with the HTTP status it maps to.
   */
  public enum Kind {
    ALLOW(HttpServletResponse.SC_OK),
    UNAUTHORIZED(HttpServletResponse.SC_UNAUTHORIZED),
    NOT_FOUND(HttpServletResponse.SC_NOT_FOUND);

    private final int statusCode;

    private Kind(int statusCode) {
      this.statusCode = statusCode;
    }

    public int getStatusCode() {
      return statusCode;
    }
  }

  private static final Decision ALLOW = new Decision(Kind.ALLOW, null);
  private static final Decision UNAUTHORIZED = new Decision(Kind.UNAUTHORIZED, null);
  private static final Decision NOT_FOUND = new Decision(Kind.NOT_FOUND, null);

  @Nonnull private final Kind kind;
  @Nullable private final RepositoryInfo repository;

  private Decision(Kind kind, @Nullable RepositoryInfo repository) {
    this.kind = kind;
    this.repository = repository;
  }

  /**
   * @return An allow decision that carries no resource.
   */
  @Nonnull
  public static Decision allow() {
    return ALLOW;
  }

  /**
   * @param repository The repository resolved while deciding.
   * @return An allow decision carrying the given repository.
   */
  @Nonnull
  public static Decision allow(RepositoryInfo repository) {
    Preconditions.checkNotNull(repository);
    return new Decision(Kind.ALLOW, repository);
  }

  @Nonnull
  public static Decision unauthorized() {
    return UNAUTHORIZED;
  }

  @Nonnull
  public static Decision notFound() {
    return NOT_FOUND;
  }

  @Nonnull
  public Kind getKind() {
    return kind;
  }

  public boolean isAllowed() {
    return kind == Kind.ALLOW;
  }

  public int getStatusCode() {
    return kind.getStatusCode();
  }

  /**
   * @return The repository resolved by a repository-scoped policy, or null
   *     for a denial or a policy that doesn't resolve repositories.
   */
  @Nullable
  public RepositoryInfo getRepository() {
    return repository;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof Decision)) { return false; }
    Decision other = (Decision) object;
    return kind == other.kind && Objects.equals(repository, other.repository);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, repository);
  }

  @Override
  public String toString() {
    return (repository == null) ? kind.toString() : kind + " " + repository;
  }
}
