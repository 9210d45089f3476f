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

package com.google.enterprise.gitauthz.servlets;

import static com.google.enterprise.gitauthz.testing.ServletTestUtil.makeMockHttpGet;
import static com.google.enterprise.gitauthz.testing.ServletTestUtil.makeMockHttpPost;
import static com.google.enterprise.gitauthz.testing.ServletTestUtil.signIn;

import com.google.enterprise.gitauthz.gate.Action;
import com.google.enterprise.gitauthz.gate.FormRepositoryAction;
import com.google.enterprise.gitauthz.gate.Gate;
import com.google.enterprise.gitauthz.gate.GateOutcome;
import com.google.enterprise.gitauthz.gate.RepositoryAction;
import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.identity.SessionIdentityProvider;
import com.google.enterprise.gitauthz.lookup.LookupException;
import com.google.enterprise.gitauthz.lookup.RepositoryResolver;
import com.google.enterprise.gitauthz.lookup.ResourceStore;
import com.google.enterprise.gitauthz.model.RepositoryInfo;
import com.google.enterprise.gitauthz.policy.PolicyEvaluator;
import com.google.enterprise.gitauthz.testing.GitAuthzTestCase;

import org.joda.time.DateTimeUtils;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Unit tests for {@link GatedServlet}.
 */
public class GatedServletTest extends GitAuthzTestCase {

  private static final String CONTEXT_PATH = "/git";

  /** Shows a repository on GET, renames it on POST. */
  private static final class RepositoryServlet extends GatedServlet {
    GateOutcome<String> lastOutcome;

    RepositoryServlet(Gate gate) {
      super(gate);
    }

    @Override
    public void doGet(HttpServletRequest request, HttpServletResponse response)
        throws IOException {
      lastOutcome = runGated(
          getGate().readableUsersOnly(new RepositoryAction<String>() {
            @Override
            public String run(RepositoryInfo repository) {
              return repository.getFullName();
            }
          }),
          request, response);
      if (lastOutcome != null && lastOutcome.isAllowed()) {
        initResponse(response);
        response.setContentType("text/plain");
        response.getWriter().print(lastOutcome.getValue());
      }
    }

    @Override
    public void doPost(HttpServletRequest request, HttpServletResponse response)
        throws IOException {
      lastOutcome = runGated(
          getGate().ownerOnly(new FormRepositoryAction<String, String>() {
            @Override
            public String run(String form, RepositoryInfo repository) {
              return repository.getOwner() + "/" + form;
            }
          }),
          request.getParameter("name"), request, response);
      if (lastOutcome != null && lastOutcome.isAllowed()) {
        initResponse(response);
        response.getWriter().print(lastOutcome.getValue());
      }
    }
  }

  private RepositoryServlet servlet;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    ResourceStore store = makeStandardStore();
    servlet = new RepositoryServlet(Gate.make(
        PolicyEvaluator.make(SessionIdentityProvider.make(), store, store, store)));
  }

  private MockHttpServletResponse get(String path, Account account) throws IOException {
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(signIn(makeMockHttpGet(CONTEXT_PATH, path), account), response);
    return response;
  }

  public void testAllowedGetRuns() throws IOException {
    MockHttpServletResponse response = get("/alice/tools", DAVE);
    assertEquals(HttpServletResponse.SC_OK, response.getStatus());
    assertEquals("alice/tools", response.getContentAsString());
    assertNotNull(response.getHeader("Date"));
  }

  public void testContextPathIsStripped() throws IOException {
    get("/devs/engine/tree/main", CAROL);
    assertTrue(servlet.lastOutcome.isAllowed());
    assertEquals("devs", servlet.lastOutcome.getDecision().getRepository().getOwner());
  }

  public void testGuestIsUnauthorized() throws IOException {
    MockHttpServletResponse response = get("/alice/tools", null);
    assertEquals(HttpServletResponse.SC_UNAUTHORIZED, response.getStatus());
    assertEquals("", response.getContentAsString());
    assertNotNull(response.getHeader("Date"));
  }

  public void testStrangerIsUnauthorized() throws IOException {
    assertEquals(HttpServletResponse.SC_UNAUTHORIZED, get("/alice/tools", MALLORY).getStatus());
  }

  public void testMissingRepositoryIsNotFound() throws IOException {
    MockHttpServletResponse response = get("/alice/gone", ROOT);
    assertEquals(HttpServletResponse.SC_NOT_FOUND, response.getStatus());
    assertEquals(404, servlet.lastOutcome.getStatusCode());
  }

  public void testRequestAttributeOverridesSession() throws IOException {
    MockHttpServletRequest request = signIn(makeMockHttpGet(CONTEXT_PATH, "/alice/tools"), MALLORY);
    request.setAttribute(SessionIdentityProvider.DEFAULT_ATTRIBUTE, BOB);
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doGet(request, response);
    assertEquals(HttpServletResponse.SC_OK, response.getStatus());
  }

  public void testFormPost() throws IOException {
    MockHttpServletRequest request = signIn(makeMockHttpPost(CONTEXT_PATH, "/alice/tools"), BOB);
    request.addParameter("name", "toolbox");
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doPost(request, response);
    assertEquals(HttpServletResponse.SC_OK, response.getStatus());
    assertEquals("alice/toolbox", response.getContentAsString());
  }

  public void testFormPostDenied() throws IOException {
    MockHttpServletRequest request =
        signIn(makeMockHttpPost(CONTEXT_PATH, "/alice/tools"), CAROL);
    request.addParameter("name", "toolbox");
    MockHttpServletResponse response = new MockHttpServletResponse();
    servlet.doPost(request, response);
    assertEquals(HttpServletResponse.SC_UNAUTHORIZED, response.getStatus());
    assertEquals("", response.getContentAsString());
  }

  public void testLookupFailureIsServerError() throws IOException {
    ResourceStore store = makeStandardStore();
    RepositoryResolver broken = new RepositoryResolver() {
      @Override
      public RepositoryInfo getRepository(String owner, String name) {
        throw new LookupException("Repository table unavailable");
      }
    };
    servlet = new RepositoryServlet(Gate.make(
        PolicyEvaluator.make(SessionIdentityProvider.make(), broken, store, store)));
    MockHttpServletResponse response = get("/alice/tools", ALICE);
    assertEquals(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, response.getStatus());
    assertNull(servlet.lastOutcome);
  }

  public void testLookupFailureInsideActionIsServerError() throws IOException {
    MockHttpServletResponse response = new MockHttpServletResponse();
    GateOutcome<String> outcome = servlet.runGated(
        servlet.getGate().usersOnly(new Action<String>() {
          @Override
          public String run() {
            throw new LookupException("Issue table unavailable");
          }
        }),
        signIn(makeMockHttpGet(CONTEXT_PATH, "/alice/tools/issues"), BOB), response);
    assertNull(outcome);
    assertEquals(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, response.getStatus());
  }

  public void testHttpDateString() {
    DateTimeUtils.setCurrentMillisFixed(0L);
    addTearDown(new TearDown() {
      @Override
      public void tearDown() {
        DateTimeUtils.setCurrentMillisSystem();
      }
    });
    assertEquals("Thu, 01 Jan 1970 00:00:00 GMT", GatedServlet.httpDateString());
  }
}
