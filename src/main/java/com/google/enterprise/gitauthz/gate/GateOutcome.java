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

import com.google.common.base.Preconditions;
import com.google.enterprise.gitauthz.policy.Decision;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * What a gated action produced: the action's result when allowed, otherwise
 * the denial that replaced it.
 *
 * @param <R> The action's result type.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class GateOutcome<R> {
  @Nonnull private final Decision decision;
  @Nullable private final R value;

  private GateOutcome(Decision decision, @Nullable R value) {
    this.decision = decision;
    this.value = value;
  }

  static <R> GateOutcome<R> ran(Decision decision, @Nullable R value) {
    Preconditions.checkArgument(decision.isAllowed());
    return new GateOutcome<R>(decision, value);
  }

  static <R> GateOutcome<R> denied(Decision decision) {
    Preconditions.checkArgument(!decision.isAllowed());
    return new GateOutcome<R>(decision, null);
  }

  @Nonnull
  public Decision getDecision() {
    return decision;
  }

  public boolean isAllowed() {
    return decision.isAllowed();
  }

  public int getStatusCode() {
    return decision.getStatusCode();
  }

  /**
   * @return The action's result.
   * @throws IllegalStateException if the action was denied.
   */
  @Nullable
  public R getValue() {
    Preconditions.checkState(isAllowed(), "Action was denied: %s", decision);
    return value;
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof GateOutcome)) { return false; }
    GateOutcome<?> other = (GateOutcome<?>) object;
    return decision.equals(other.decision) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(decision, value);
  }

  @Override
  public String toString() {
    return isAllowed() ? "{ran: " + value + "}" : "{denied: " + decision + "}";
  }
}
