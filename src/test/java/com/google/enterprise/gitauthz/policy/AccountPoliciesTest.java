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

import com.google.enterprise.gitauthz.identity.Account;
import com.google.enterprise.gitauthz.identity.SessionIdentityProvider;
import com.google.enterprise.gitauthz.lookup.ResourceStore;
import com.google.enterprise.gitauthz.model.RequestPath;
import com.google.enterprise.gitauthz.testing.GitAuthzTestCase;

/**
 * Unit tests for the policies that resolve no repository: ONESELF, USERS,
 * ADMIN and GROUP_MANAGER.
 */
public class AccountPoliciesTest extends GitAuthzTestCase {

  private PolicyEvaluator evaluator;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    ResourceStore store = makeStandardStore();
    evaluator = PolicyEvaluator.make(SessionIdentityProvider.make(), store, store, store);
  }

  private Decision evaluate(PolicyKind kind, Account actor, String... segments) {
    return evaluator.evaluate(kind, actor, RequestPath.of(segments));
  }

  public void testOneselfAllowsSelf() {
    assertEquals(Decision.allow(), evaluate(PolicyKind.ONESELF, ALICE, "alice"));
    assertEquals(Decision.allow(), evaluate(PolicyKind.ONESELF, ALICE, "alice", "_edit"));
  }

  public void testOneselfAllowsAdmin() {
    assertEquals(Decision.allow(), evaluate(PolicyKind.ONESELF, ROOT, "alice"));
  }

  public void testOneselfAdminNeedsNoPath() {
    assertEquals(Decision.allow(), evaluate(PolicyKind.ONESELF, ROOT));
  }

  public void testOneselfDeniesOthers() {
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.ONESELF, BOB, "alice"));
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.ONESELF, null, "alice"));
  }

  public void testOneselfNeverNotFound() {
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.ONESELF, BOB, "nobody"));
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.ONESELF, null, "nobody"));
  }

  public void testOneselfGuestNeedsNoPath() {
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.ONESELF, null));
  }

  public void testOneselfEmptyPathFailsFast() {
    try {
      evaluate(PolicyKind.ONESELF, BOB);
      fail("Expected IndexOutOfBoundsException");
    } catch (IndexOutOfBoundsException e) {
      // pass
    }
  }

  public void testUsers() {
    assertEquals(Decision.allow(), evaluate(PolicyKind.USERS, MALLORY, "anything"));
    assertEquals(Decision.allow(), evaluate(PolicyKind.USERS, ROOT));
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.USERS, null, "anything"));
  }

  public void testAdmin() {
    assertEquals(Decision.allow(), evaluate(PolicyKind.ADMIN, ROOT, "admin", "users"));
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.ADMIN, ALICE, "admin", "users"));
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.ADMIN, null, "admin", "users"));
  }

  public void testGroupManagerAllowsManager() {
    assertEquals(Decision.allow(), evaluate(PolicyKind.GROUP_MANAGER, ERIN, "devs", "_edit"));
  }

  public void testGroupManagerDeniesPlainMember() {
    assertEquals(Decision.unauthorized(),
        evaluate(PolicyKind.GROUP_MANAGER, FRANK, "devs", "_edit"));
  }

  public void testGroupManagerDeniesOutsiders() {
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.GROUP_MANAGER, ALICE, "devs"));
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.GROUP_MANAGER, null, "devs"));
  }

  public void testGroupManagerHasNoAdminOverride() {
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.GROUP_MANAGER, ROOT, "devs"));
  }

  public void testGroupManagerOfAnotherGroup() {
    assertEquals(Decision.unauthorized(), evaluate(PolicyKind.GROUP_MANAGER, ERIN, "alice"));
  }

  public void testPolicyKinds() {
    for (PolicyKind kind : PolicyKind.values()) {
      assertEquals(kind, evaluator.getPolicy(kind).getKind());
    }
  }
}
