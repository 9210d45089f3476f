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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.enterprise.gitauthz.identity.IdentityProvider;
import com.google.enterprise.gitauthz.identity.SessionIdentityProvider;
import com.google.enterprise.gitauthz.lookup.CollaboratorResolver;
import com.google.enterprise.gitauthz.lookup.GroupResolver;
import com.google.enterprise.gitauthz.lookup.JsonResourceStoreCodec;
import com.google.enterprise.gitauthz.lookup.LookupException;
import com.google.enterprise.gitauthz.lookup.RepositoryResolver;
import com.google.enterprise.gitauthz.lookup.ResourceStore;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.google.inject.name.Names;

import java.io.File;
import java.io.IOException;

/**
 * Guice configuration binding the identity provider and the JSON-backed
 * resource store.
 */
public final class ConfigModule extends AbstractModule {
  private final String storeFile;
  private final String loginAccountAttribute;

  public ConfigModule(String storeFile, String loginAccountAttribute) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(storeFile));
    Preconditions.checkArgument(!Strings.isNullOrEmpty(loginAccountAttribute));
    this.storeFile = storeFile;
    this.loginAccountAttribute = loginAccountAttribute;
  }

  public ConfigModule(String storeFile) {
    this(storeFile, SessionIdentityProvider.DEFAULT_ATTRIBUTE);
  }

  @Override
  protected void configure() {
    bind(String.class)
        .annotatedWith(Names.named("storeFile"))
        .toInstance(storeFile);
    bind(String.class)
        .annotatedWith(Names.named("loginAccountAttribute"))
        .toInstance(loginAccountAttribute);
    bind(IdentityProvider.class).to(SessionIdentityProvider.class);
    bind(RepositoryResolver.class).to(ResourceStore.class);
    bind(GroupResolver.class).to(ResourceStore.class);
    bind(CollaboratorResolver.class).to(ResourceStore.class);
  }

  @Provides
  @Singleton
  ResourceStore provideResourceStore(JsonResourceStoreCodec codec,
      @Named("storeFile") String storeFile) {
    try {
      return codec.readStore(new File(storeFile));
    } catch (IOException e) {
      throw new LookupException("Unable to read resource store " + storeFile, e);
    }
  }
}
