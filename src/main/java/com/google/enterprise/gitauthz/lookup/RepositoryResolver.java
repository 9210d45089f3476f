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

package com.google.enterprise.gitauthz.lookup;

import com.google.enterprise.gitauthz.model.RepositoryInfo;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Resolves a repository from its owner and name.
 */
@ParametersAreNonnullByDefault
public interface RepositoryResolver {
  /**
   * Looks up a repository.
   *
   * @param owner The owning user or group name.
   * @param name The repository name.
   * @return The repository, or null if there is no such repository.
   * @throws LookupException if the backing store can't be read.
   */
  @Nullable
  public RepositoryInfo getRepository(String owner, String name);
}
