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

package com.google.enterprise.gitauthz.identity;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.servlet.http.HttpServletRequest;

/**
 * Answers "who is asking" for an incoming request.  Implemented by the
 * authentication subsystem.
 */
@ParametersAreNonnullByDefault
public interface IdentityProvider {
  /**
   * Gets the signed-in account for a request.
   *
   * @param request The incoming request.
   * @return The signed-in account, or null for a guest.
   */
  @Nullable
  public Account getCurrentIdentity(HttpServletRequest request);
}
