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

import com.google.common.base.Splitter;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import javax.servlet.http.HttpServletRequest;

/**
 * Splits incoming request URIs into {@link RequestPath}s.
 */
@ParametersAreNonnullByDefault
public final class RequestPaths {
  private static final Splitter SLASH_SPLITTER = Splitter.on('/').omitEmptyStrings();

  // don't instantiate
  private RequestPaths() {
  }

  /**
   * Gets the path segments of a request, relative to the servlet context.
   *
   * @param request The incoming request.
   * @return The request's path segments.
   */
  @Nonnull
  public static RequestPath split(HttpServletRequest request) {
    String uri = request.getRequestURI();
    if (uri == null) {
      return RequestPath.of();
    }
    String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      uri = uri.substring(contextPath.length());
    }
    return split(uri);
  }

  /**
   * Splits a path string on slashes, ignoring empty segments.
   *
   * @param path A path such as "/alice/tools/settings".
   * @return The path's segments.
   */
  @Nonnull
  public static RequestPath split(String path) {
    return RequestPath.make(SLASH_SPLITTER.split(path));
  }
}
