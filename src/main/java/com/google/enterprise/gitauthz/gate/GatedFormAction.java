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

import com.google.enterprise.gitauthz.policy.RequestContext;

import java.io.IOException;

/**
 * A form-taking action wrapped by a {@link Gate}.
 *
 * @param <F> The form type.
 * @param <R> The wrapped action's result type.
 */
public interface GatedFormAction<F, R> {
  /**
   * Decides, then runs the wrapped action with the form if allowed.
   *
   * @param context The request being handled.
   * @param form The submitted form.
   * @return The action's result, or the denial.
   * @throws IOException if the wrapped action does.
   */
  GateOutcome<R> invoke(RequestContext context, F form) throws IOException;
}
