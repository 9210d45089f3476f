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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.identity.IdentityProvider;
import com.google.enterprise.gitauthz.lookup.CollaboratorResolver;
import com.google.enterprise.gitauthz.lookup.GroupResolver;
import com.google.enterprise.gitauthz.lookup.RepositoryResolver;
import com.google.enterprise.gitauthz.model.RequestPath;
import com.google.inject.Singleton;

import java.util.EnumMap;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.inject.Inject;
import javax.servlet.http.HttpServletRequest;

/**
 * Evaluates the authorization policies.  Holds one instance of each policy,
 * all sharing the injected resolvers.
 */
@Singleton
@Immutable
@ParametersAreNonnullByDefault
public final class PolicyEvaluator {
  private static final Logger logger = Logger.getLogger(PolicyEvaluator.class.getName());

  private final IdentityProvider identityProvider;
  private final ImmutableMap<PolicyKind, AuthzPolicy> policies;

  @Inject
  private PolicyEvaluator(IdentityProvider identityProvider,
      RepositoryResolver repositoryResolver, GroupResolver groupResolver,
      CollaboratorResolver collaboratorResolver) {
    this.identityProvider = identityProvider;
    EnumMap<PolicyKind, AuthzPolicy> map = Maps.newEnumMap(PolicyKind.class);
    put(map, new OneselfPolicy());
    put(map, new OwnerPolicy(repositoryResolver, groupResolver, collaboratorResolver));
    put(map, new UsersPolicy());
    put(map, new AdminPolicy());
    put(map, new CollaboratorsPolicy(repositoryResolver, groupResolver, collaboratorResolver));
    put(map, new ReferrerPolicy(repositoryResolver, groupResolver, collaboratorResolver));
    put(map, new ReadableUsersPolicy(repositoryResolver, groupResolver, collaboratorResolver));
    put(map, new GroupManagerPolicy(groupResolver));
    Preconditions.checkState(map.size() == PolicyKind.values().length);
    policies = Maps.immutableEnumMap(map);
    logger.info("Initialized " + policies.size() + " authorization policies");
  }

  private static void put(EnumMap<PolicyKind, AuthzPolicy> map, AuthzPolicy policy) {
    map.put(policy.getKind(), policy);
  }

  @VisibleForTesting
  public static PolicyEvaluator make(IdentityProvider identityProvider,
      RepositoryResolver repositoryResolver, GroupResolver groupResolver,
      CollaboratorResolver collaboratorResolver) {
    Preconditions.checkNotNull(identityProvider);
    Preconditions.checkNotNull(repositoryResolver);
    Preconditions.checkNotNull(groupResolver);
    Preconditions.checkNotNull(collaboratorResolver);
    return new PolicyEvaluator(identityProvider, repositoryResolver, groupResolver,
        collaboratorResolver);
  }

  /**
   * Gets the policy of a given kind.
   */
  @Nonnull
  public AuthzPolicy getPolicy(PolicyKind kind) {
    return policies.get(kind);
  }

  /**
   * Evaluates a policy.
   *
   * @param kind The policy to evaluate.
   * @param actor The signed-in account, or null for a guest.
   * @param path The request path.
   * @return The decision.
   */
  @Nonnull
  public Decision evaluate(PolicyKind kind, @Nullable Account actor, RequestPath path) {
    return getPolicy(kind).evaluate(actor, path);
  }

  @Nonnull
  public Decision evaluate(PolicyKind kind, RequestContext context) {
    return evaluate(kind, context.getActor(), context.getPath());
  }

  /**
   * Evaluates a policy for a servlet request.
   */
  @Nonnull
  public Decision evaluate(PolicyKind kind, HttpServletRequest request) {
    return evaluate(kind, makeContext(request));
  }

  /**
   * Gets the decision inputs for a servlet request.
   */
  @Nonnull
  public RequestContext makeContext(HttpServletRequest request) {
    return RequestContext.fromRequest(request, identityProvider);
  }
}
