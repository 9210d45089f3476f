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
import com.google.enterprise.gitauthz.identity.IdentityProvider;
import com.google.enterprise.gitauthz.model.RequestPath;
import com.google.enterprise.gitauthz.model.RequestPaths;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.servlet.http.HttpServletRequest;

/**
 * The per-request inputs to a decision: who is asking and for which path.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class RequestContext {
  @Nullable private final Account actor;
  @Nonnull private final RequestPath path;

  private RequestContext(@Nullable Account actor, RequestPath path) {
    this.actor = actor;
    this.path = path;
  }

  /**
   * @param actor The signed-in account, or null for a guest.
   * @param path The request path.
   */
  @Nonnull
  public static RequestContext make(@Nullable Account actor, RequestPath path) {
    Preconditions.checkNotNull(path);
    return new RequestContext(actor, path);
  }

  /**
   * Makes a context for a servlet request.
   *
   * @param request The incoming request.
   * @param identityProvider The source of the signed-in account.
   */
  @Nonnull
  public static RequestContext fromRequest(HttpServletRequest request,
      IdentityProvider identityProvider) {
    return make(identityProvider.getCurrentIdentity(request), RequestPaths.split(request));
  }

  @Nullable
  public Account getActor() {
    return actor;
  }

  @Nonnull
  public RequestPath getPath() {
    return path;
  }

  @Override
  public String toString() {
    return "{actor: " + actor + ", path: /" + path + "}";
  }
}
