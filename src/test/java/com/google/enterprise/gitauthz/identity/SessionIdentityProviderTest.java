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

import com.google.enterprise.gitauthz.testing.GitAuthzTestCase;

import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpSession;

/**
 * Unit tests for {@link SessionIdentityProvider}.
 */
public class SessionIdentityProviderTest extends GitAuthzTestCase {

  private SessionIdentityProvider provider;
  private MockHttpServletRequest request;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    provider = SessionIdentityProvider.make();
    request = new MockHttpServletRequest("GET", "/alice/tools");
  }

  public void testNoSessionIsGuest() {
    assertNull(provider.getCurrentIdentity(request));
    assertNull("Lookup must not create a session", request.getSession(false));
  }

  public void testSessionAccount() {
    MockHttpSession session = new MockHttpSession();
    session.setAttribute(SessionIdentityProvider.DEFAULT_ATTRIBUTE, ALICE);
    request.setSession(session);
    assertEquals(ALICE, provider.getCurrentIdentity(request));
  }

  public void testSessionWithoutAccountIsGuest() {
    request.setSession(new MockHttpSession());
    assertNull(provider.getCurrentIdentity(request));
  }

  public void testRequestAttributeTakesPrecedence() {
    MockHttpSession session = new MockHttpSession();
    session.setAttribute(SessionIdentityProvider.DEFAULT_ATTRIBUTE, ALICE);
    request.setSession(session);
    request.setAttribute(SessionIdentityProvider.DEFAULT_ATTRIBUTE, ROOT);
    assertEquals(ROOT, provider.getCurrentIdentity(request));
  }

  public void testWrongTypeIsGuest() {
    request.setAttribute(SessionIdentityProvider.DEFAULT_ATTRIBUTE, "alice");
    assertNull(provider.getCurrentIdentity(request));
  }

  public void testCustomAttributeName() {
    SessionIdentityProvider custom = SessionIdentityProvider.make("currentUser");
    assertEquals("currentUser", custom.getAttributeName());
    request.setAttribute(SessionIdentityProvider.DEFAULT_ATTRIBUTE, ALICE);
    assertNull(custom.getCurrentIdentity(request));
    request.setAttribute("currentUser", BOB);
    assertEquals(BOB, custom.getCurrentIdentity(request));
  }

  public void testEmptyAttributeNameRejected() {
    try {
      SessionIdentityProvider.make("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // pass
    }
  }
}
