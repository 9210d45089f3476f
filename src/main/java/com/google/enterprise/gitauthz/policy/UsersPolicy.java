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

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * Allows any signed-in account.
 */
@Immutable
@ParametersAreNonnullByDefault
final class UsersPolicy implements AuthzPolicy {

  UsersPolicy() {
  }

  @Override
  public PolicyKind getKind() {
    return PolicyKind.USERS;
  }

  @Override
  public Decision evaluate(@Nullable Account actor, RequestPath path) {
    return (actor != null) ? Decision.allow() : Decision.unauthorized();
  }
}
