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

import java.io.IOException;

/**
 * A protected action that takes a submitted form and needs no resource.
 *
 * @param <F> The form type.
 * @param <R> The action's result type.
 */
public interface FormAction<F, R> {
  R run(F form) throws IOException;
}
