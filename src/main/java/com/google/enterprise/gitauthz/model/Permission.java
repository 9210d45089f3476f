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

package com.google.enterprise.gitauthz.model;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * The permission level of a collaborator grant.
 */
public enum Permission {
  ADMIN,
  WRITE,
  READ;

  /** Every permission level; used when a lookup is not filtered. */
  public static final ImmutableSet<Permission> ALL = Sets.immutableEnumSet(
      ADMIN, WRITE, READ);

  /** Permission levels that may change repository content. */
  public static final ImmutableSet<Permission> WRITABLE = Sets.immutableEnumSet(
      ADMIN, WRITE);

  /** Permission levels that may change repository settings. */
  public static final ImmutableSet<Permission> ADMINISTRATIVE = Sets.immutableEnumSet(
      ADMIN);
}
