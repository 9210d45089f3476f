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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An ordered list of named allow rules.  Rules are tried in order and the
 * first that matches wins; rules after it are never consulted, so their
 * lookups never happen.
 */
@Immutable
@ParametersAreNonnullByDefault
final class PrecedenceChain {

  /**
   * A single allow rule.
   */
  interface Rule {
    boolean matches(AccessQuery query);
  }

  @Nonnull private final ImmutableList<String> names;
  @Nonnull private final ImmutableList<Rule> rules;

  private PrecedenceChain(ImmutableList<String> names, ImmutableList<Rule> rules) {
    this.names = names;
    this.rules = rules;
  }

  static Builder builder() {
    return new Builder();
  }

  /**
   * Finds the first rule that matches a query.
   *
   * @param query The query to match.
   * @return The name of the matching rule, or null if none matches.
   */
  @Nullable
  String findFirstMatch(AccessQuery query) {
    for (int i = 0; i < rules.size(); i++) {
      if (rules.get(i).matches(query)) {
        return names.get(i);
      }
    }
    return null;
  }

  @Nonnull
  ImmutableList<String> getRuleNames() {
    return names;
  }

  @NotThreadSafe
  static final class Builder {
    private final ImmutableList.Builder<String> names = ImmutableList.builder();
    private final ImmutableList.Builder<Rule> rules = ImmutableList.builder();

    private Builder() {
    }

    Builder add(String name, Rule rule) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(name));
      Preconditions.checkNotNull(rule);
      names.add(name);
      rules.add(rule);
      return this;
    }

    PrecedenceChain build() {
      return new PrecedenceChain(names.build(), rules.build());
    }
  }
}
