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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.annotation.concurrent.Immutable;

/**
 * The ordered segments of a request path.  Segment 0 names the owner (a user
 * or group), segment 1, when present, names a repository.
 *
 * <p>Routes guarded by a repository-scoped policy always have at least two
 * segments.  Asking for a segment that isn't there is a routing error and
 * throws {@link IndexOutOfBoundsException}.
 */
@Immutable
@ParametersAreNonnullByDefault
public final class RequestPath {
  private static final Joiner SLASH_JOINER = Joiner.on('/');

  @Nonnull private final ImmutableList<String> segments;

  private RequestPath(ImmutableList<String> segments) {
    this.segments = segments;
  }

  @Nonnull
  public static RequestPath make(Iterable<String> segments) {
    return new RequestPath(ImmutableList.copyOf(segments));
  }

  @Nonnull
  public static RequestPath of(String... segments) {
    return new RequestPath(ImmutableList.copyOf(segments));
  }

  @Nonnull
  public ImmutableList<String> getSegments() {
    return segments;
  }

  public int size() {
    return segments.size();
  }

  @Nonnull
  public String get(int index) {
    Preconditions.checkElementIndex(index, segments.size(),
        "Segment of request path /" + this);
    return segments.get(index);
  }

  /**
   * @return Segment 0, the owning user or group.
   */
  @Nonnull
  public String getOwner() {
    return get(0);
  }

  /**
   * @return Segment 1, the repository name.
   */
  @Nonnull
  public String getRepositoryName() {
    return get(1);
  }

  @Override
  public boolean equals(Object object) {
    if (object == this) { return true; }
    if (!(object instanceof RequestPath)) { return false; }
    return segments.equals(((RequestPath) object).segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return SLASH_JOINER.join(segments);
  }
}
