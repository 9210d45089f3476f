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

package com.google.enterprise.gitauthz.testing;

import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.identity.SessionIdentityProvider;

import javax.annotation.Nullable;

import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpSession;

/**
 * Builds mock servlet requests for the authorization tests.
 */
public final class ServletTestUtil {

  // don't instantiate
  private ServletTestUtil() {
  }

  public static MockHttpServletRequest makeMockHttpGet(String contextPath, String path) {
    return makeMockHttpRequest("GET", contextPath, path);
  }

  public static MockHttpServletRequest makeMockHttpPost(String contextPath, String path) {
    return makeMockHttpRequest("POST", contextPath, path);
  }

  private static MockHttpServletRequest makeMockHttpRequest(String method, String contextPath,
      String path) {
    MockHttpServletRequest request =
        new MockHttpServletRequest(null, method, contextPath + path);
    request.setContextPath(contextPath);
    request.setServerName("git.example.com");
    request.addHeader("Host", "git.example.com");
    return request;
  }

  /**
   * Stores an account in a new session on the request, the way the sign-in
   * servlet does.
   *
   * @param request The request to sign in.
   * @param account The account, or null to leave the request as a guest.
   * @return The request.
   */
  public static MockHttpServletRequest signIn(MockHttpServletRequest request,
      @Nullable Account account) {
    if (account != null) {
      MockHttpSession session = new MockHttpSession();
      session.setAttribute(SessionIdentityProvider.DEFAULT_ATTRIBUTE, account);
      request.setSession(session);
    }
    return request;
  }
}
