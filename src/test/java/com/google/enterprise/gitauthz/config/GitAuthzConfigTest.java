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

package com.google.enterprise.gitauthz.config;

import com.google.enterprise.gitauthz.gate.Gate;
import com.google.enterprise.gitauthz.identity.IdentityProvider;
import com.google.enterprise.gitauthz.identity.SessionIdentityProvider;
import com.google.enterprise.gitauthz.lookup.GroupResolver;
import com.google.enterprise.gitauthz.lookup.RepositoryResolver;
import com.google.enterprise.gitauthz.lookup.ResourceStore;
import com.google.enterprise.gitauthz.model.RepositoryInfo;
import com.google.enterprise.gitauthz.model.RequestPath;
import com.google.enterprise.gitauthz.policy.Decision;
import com.google.enterprise.gitauthz.policy.PolicyEvaluator;
import com.google.enterprise.gitauthz.policy.PolicyKind;
import com.google.enterprise.gitauthz.testing.GitAuthzTestCase;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;

import java.io.File;
import java.net.URISyntaxException;

/**
 * Tests for the Guice configuration.
 */
public class GitAuthzConfigTest extends GitAuthzTestCase {

  private String storeFile;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    storeFile = testStoreFile();
    final String saved = System.getProperty(GitAuthzConfig.STORE_FILE_PROPERTY);
    System.clearProperty(GitAuthzConfig.STORE_FILE_PROPERTY);
    addTearDown(new TearDown() {
      @Override
      public void tearDown() {
        if (saved == null) {
          System.clearProperty(GitAuthzConfig.STORE_FILE_PROPERTY);
        } else {
          System.setProperty(GitAuthzConfig.STORE_FILE_PROPERTY, saved);
        }
      }
    });
  }

  private String testStoreFile() throws URISyntaxException {
    return new File(getClass().getResource("/store.json").toURI()).getPath();
  }

  public void testInjectorWiresStore() {
    Injector injector = GitAuthzConfig.makeInjector(storeFile);
    PolicyEvaluator evaluator = injector.getInstance(PolicyEvaluator.class);
    assertEquals(Decision.allow(RepositoryInfo.make("alice", "tools", true)),
        evaluator.evaluate(PolicyKind.OWNER, BOB, RequestPath.of("alice", "tools")));
    assertEquals(Decision.notFound(),
        evaluator.evaluate(PolicyKind.OWNER, BOB, RequestPath.of("alice", "gone")));
  }

  public void testSingletons() {
    Injector injector = GitAuthzConfig.makeInjector(storeFile);
    assertSame(injector.getInstance(Gate.class), injector.getInstance(Gate.class));
    assertSame(injector.getInstance(PolicyEvaluator.class),
        injector.getInstance(Gate.class).getEvaluator());
    ResourceStore store = injector.getInstance(ResourceStore.class);
    assertSame(store, injector.getInstance(RepositoryResolver.class));
    assertSame(store, injector.getInstance(GroupResolver.class));
  }

  public void testIdentityProviderAttribute() {
    Injector injector = Guice.createInjector(new ConfigModule(storeFile, "currentUser"));
    IdentityProvider provider = injector.getInstance(IdentityProvider.class);
    assertEquals("currentUser", ((SessionIdentityProvider) provider).getAttributeName());
  }

  public void testPropertyOverridesDefault() {
    System.setProperty(GitAuthzConfig.STORE_FILE_PROPERTY, " " + storeFile + " ");
    assertEquals(storeFile, GitAuthzConfig.getStoreFile("/nonexistent/store.json"));
    assertNotNull(GitAuthzConfig.makeInjector("/nonexistent/store.json")
        .getInstance(ResourceStore.class).getRepository("devs", "docs"));
  }

  public void testDefaultUsedWithoutProperty() {
    assertEquals(storeFile, GitAuthzConfig.getStoreFile(storeFile));
  }

  public void testNoStoreFile() {
    try {
      GitAuthzConfig.getStoreFile(null);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) {
      // pass
    }
  }

  public void testMissingStoreFileFailsOnFirstUse() {
    Injector injector = GitAuthzConfig.makeInjector("/nonexistent/store.json");
    try {
      injector.getInstance(ResourceStore.class);
      fail("Expected ProvisionException");
    } catch (ProvisionException e) {
      // pass
    }
  }

  public void testEmptyStoreFileRejected() {
    try {
      new ConfigModule("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // pass
    }
  }
}
