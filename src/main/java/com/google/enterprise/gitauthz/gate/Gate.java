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

package com.google.enterprise.gitauthz.gate;

import static com.google.enterprise.gitauthz.common.LogMessages.logMessage;

import com.google.common.base.Preconditions;
import com.google.enterprise.gitauthz.model.RepositoryInfo;
import com.google.enterprise.gitauthz.policy.Decision;
import com.google.enterprise.gitauthz.policy.PolicyEvaluator;
import com.google.enterprise.gitauthz.policy.PolicyKind;
import com.google.enterprise.gitauthz.policy.RequestContext;
import com.google.inject.Singleton;

import java.io.IOException;
import java.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.inject.Inject;

/**
 * Wraps protected actions so that they only run when a policy allows them.
 * A denied action is not run; its outcome carries the denial instead.
 *
 * <p>Actions guarded by a repository-scoped policy receive the repository
 * that the policy resolved.  Every wrapper has a second form that threads a
 * submitted form through to the action, ahead of the repository.
 */
@Singleton
@Immutable
@ParametersAreNonnullByDefault
public final class Gate {
  private static final Logger logger = Logger.getLogger(Gate.class.getName());

  private final PolicyEvaluator evaluator;

  @Inject
  private Gate(PolicyEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  @Nonnull
  public static Gate make(PolicyEvaluator evaluator) {
    Preconditions.checkNotNull(evaluator);
    return new Gate(evaluator);
  }

  @Nonnull
  public PolicyEvaluator getEvaluator() {
    return evaluator;
  }

  /** Allows only the account named by the path, and administrators. */
  public <R> GatedAction<R> oneselfOnly(Action<R> action) {
    return wrap(PolicyKind.ONESELF, action);
  }

  public <F, R> GatedFormAction<F, R> oneselfOnly(FormAction<F, R> action) {
    return wrap(PolicyKind.ONESELF, action);
  }

  /** Allows any signed-in account. */
  public <R> GatedAction<R> usersOnly(Action<R> action) {
    return wrap(PolicyKind.USERS, action);
  }

  public <F, R> GatedFormAction<F, R> usersOnly(FormAction<F, R> action) {
    return wrap(PolicyKind.USERS, action);
  }

  /** Allows only administrators. */
  public <R> GatedAction<R> adminOnly(Action<R> action) {
    return wrap(PolicyKind.ADMIN, action);
  }

  public <F, R> GatedFormAction<F, R> adminOnly(FormAction<F, R> action) {
    return wrap(PolicyKind.ADMIN, action);
  }

  /** Allows only managers of the group named by the path. */
  public <R> GatedAction<R> managersOnly(Action<R> action) {
    return wrap(PolicyKind.GROUP_MANAGER, action);
  }

  public <F, R> GatedFormAction<F, R> managersOnly(FormAction<F, R> action) {
    return wrap(PolicyKind.GROUP_MANAGER, action);
  }

  /** Allows the repository owner, group managers and admin collaborators. */
  public <R> GatedAction<R> ownerOnly(RepositoryAction<R> action) {
    return wrap(PolicyKind.OWNER, action);
  }

  public <F, R> GatedFormAction<F, R> ownerOnly(FormRepositoryAction<F, R> action) {
    return wrap(PolicyKind.OWNER, action);
  }

  /** Allows accounts that may write to the repository. */
  public <R> GatedAction<R> collaboratorsOnly(RepositoryAction<R> action) {
    return wrap(PolicyKind.COLLABORATORS, action);
  }

  public <F, R> GatedFormAction<F, R> collaboratorsOnly(FormRepositoryAction<F, R> action) {
    return wrap(PolicyKind.COLLABORATORS, action);
  }

  /** Allows anyone on public repositories, readers on private ones. */
  public <R> GatedAction<R> referrersOnly(RepositoryAction<R> action) {
    return wrap(PolicyKind.REFERRER, action);
  }

  public <F, R> GatedFormAction<F, R> referrersOnly(FormRepositoryAction<F, R> action) {
    return wrap(PolicyKind.REFERRER, action);
  }

  /** Allows signed-in accounts that may read the repository. */
  public <R> GatedAction<R> readableUsersOnly(RepositoryAction<R> action) {
    return wrap(PolicyKind.READABLE_USERS, action);
  }

  public <F, R> GatedFormAction<F, R> readableUsersOnly(FormRepositoryAction<F, R> action) {
    return wrap(PolicyKind.READABLE_USERS, action);
  }

  private <R> GatedAction<R> wrap(final PolicyKind kind, final Action<R> action) {
    Preconditions.checkArgument(!kind.isRepositoryScoped());
    Preconditions.checkNotNull(action);
    return new GatedAction<R>() {
      @Override
      public GateOutcome<R> invoke(RequestContext context) throws IOException {
        Decision decision = decide(kind, context);
        return decision.isAllowed()
            ? GateOutcome.ran(decision, action.run())
            : GateOutcome.<R>denied(decision);
      }
    };
  }

  private <F, R> GatedFormAction<F, R> wrap(final PolicyKind kind,
      final FormAction<F, R> action) {
    Preconditions.checkArgument(!kind.isRepositoryScoped());
    Preconditions.checkNotNull(action);
    return new GatedFormAction<F, R>() {
      @Override
      public GateOutcome<R> invoke(RequestContext context, F form) throws IOException {
        Decision decision = decide(kind, context);
        return decision.isAllowed()
            ? GateOutcome.ran(decision, action.run(form))
            : GateOutcome.<R>denied(decision);
      }
    };
  }

  private <R> GatedAction<R> wrap(final PolicyKind kind, final RepositoryAction<R> action) {
    Preconditions.checkArgument(kind.isRepositoryScoped());
    Preconditions.checkNotNull(action);
    return new GatedAction<R>() {
      @Override
      public GateOutcome<R> invoke(RequestContext context) throws IOException {
        Decision decision = decide(kind, context);
        return decision.isAllowed()
            ? GateOutcome.ran(decision, action.run(resolved(decision)))
            : GateOutcome.<R>denied(decision);
      }
    };
  }

  private <F, R> GatedFormAction<F, R> wrap(final PolicyKind kind,
      final FormRepositoryAction<F, R> action) {
    Preconditions.checkArgument(kind.isRepositoryScoped());
    Preconditions.checkNotNull(action);
    return new GatedFormAction<F, R>() {
      @Override
      public GateOutcome<R> invoke(RequestContext context, F form) throws IOException {
        Decision decision = decide(kind, context);
        return decision.isAllowed()
            ? GateOutcome.ran(decision, action.run(form, resolved(decision)))
            : GateOutcome.<R>denied(decision);
      }
    };
  }

  private Decision decide(PolicyKind kind, RequestContext context) {
    Decision decision = evaluator.evaluate(kind, context);
    logger.fine(logMessage(context.getActor(), "%s on /%s: %s", kind, context.getPath(),
        decision.getKind()));
    return decision;
  }

  private static RepositoryInfo resolved(Decision decision) {
    RepositoryInfo repository = decision.getRepository();
    Preconditions.checkState(repository != null, "Allowed without a repository: %s", decision);
    return repository;
  }
}
