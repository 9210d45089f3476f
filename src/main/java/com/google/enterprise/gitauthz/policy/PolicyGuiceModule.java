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

import com.google.enterprise.gitauthz.gate.Gate;
import com.google.inject.AbstractModule;

/**
 * Guice configuration for the policies and the gate.  The identity provider
 * and the three resolvers are bound elsewhere.
 */
public final class PolicyGuiceModule extends AbstractModule {

  @Override
  protected void configure() {
    bind(PolicyEvaluator.class);
    bind(Gate.class);
  }
}
