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

import static com.google.enterprise.gitauthz.common.LogMessages.logMessage;

import com.google.common.base.Preconditions;
import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.lookup.RepositoryResolver;
import com.google.enterprise.gitauthz.model.RepositoryInfo;
import com.google.enterprise.gitauthz.model.RequestPath;

import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * Base class for policies that guard a repository named by the first two
 * path segments.
 *
 * <p>The repository is resolved before anything else: a missing repository
 * is NOT_FOUND whoever asks.  After that, repositories open to guests are
 * allowed, a guest is otherwise unauthorized, and a signed-in actor is run
 * through the policy's precedence chain.
 */
@Immutable
@ParametersAreNonnullByDefault
abstract class RepositoryPolicy implements AuthzPolicy {
  private static final Logger logger = Logger.getLogger(RepositoryPolicy.class.getName());

  private final PolicyKind kind;
  private final RepositoryResolver repositoryResolver;
  private final PrecedenceChain chain;

  RepositoryPolicy(PolicyKind kind, RepositoryResolver repositoryResolver,
      PrecedenceChain chain) {
    Preconditions.checkArgument(kind.isRepositoryScoped());
    this.kind = Preconditions.checkNotNull(kind);
    this.repositoryResolver = Preconditions.checkNotNull(repositoryResolver);
    this.chain = Preconditions.checkNotNull(chain);
  }

  @Override
  public final PolicyKind getKind() {
    return kind;
  }

  @Override
  public final Decision evaluate(@Nullable Account actor, RequestPath path) {
    RepositoryInfo repository
        = repositoryResolver.getRepository(path.getOwner(), path.getRepositoryName());
    if (repository == null) {
      logger.info(logMessage(actor, "%s: no repository at /%s", kind, path));
      return Decision.notFound();
    }
    if (isOpenToGuests(repository)) {
      logger.fine(logMessage(actor, "%s: %s is open to guests", kind, repository));
      return Decision.allow(repository);
    }
    if (actor == null) {
      logger.info(logMessage(actor, "%s: sign-in needed for %s", kind, repository));
      return Decision.unauthorized();
    }
    String rule = chain.findFirstMatch(AccessQuery.make(actor, path, repository));
    if (rule == null) {
      logger.info(logMessage(actor, "%s: no rule allows access to %s", kind, repository));
      return Decision.unauthorized();
    }
    logger.fine(logMessage(actor, "%s: rule %s allows access to %s", kind, rule, repository));
    return Decision.allow(repository);
  }

  /**
   * Decides whether a repository may be used without signing in.  Checked
   * after resolution and before the precedence chain.
   */
  boolean isOpenToGuests(RepositoryInfo repository) {
    return false;
  }

  @Override
  public String toString() {
    return kind + " " + chain.getRuleNames();
  }
}
