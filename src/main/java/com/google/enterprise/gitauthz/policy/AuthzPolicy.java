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

import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.model.RequestPath;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * A compiled authorization procedure.  Implementations hold no mutable state,
 * so the same inputs always give the same decision.
 */
@ParametersAreNonnullByDefault
public interface AuthzPolicy {

  /**
   * @return Which policy this is.
   */
  @Nonnull
  public PolicyKind getKind();

  /**
   * Decides whether an actor may perform the guarded action.
   *
   * @param actor The signed-in account, or null for a guest.
   * @param path The request path.
   * @return The decision.
   * @throws IndexOutOfBoundsException if the path lacks a segment the policy
   *     needs.
   * @throws com.google.enterprise.gitauthz.lookup.LookupException if a
   *     resolver fails.
   */
  @Nonnull
  public Decision evaluate(@Nullable Account actor, RequestPath path);
}
