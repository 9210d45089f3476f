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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.enterprise.gitauthz.policy.PolicyGuiceModule;
import com.google.inject.Guice;
import com.google.inject.Injector;

import java.util.logging.Logger;

import javax.annotation.Nullable;

/**
 * The top-level configuration.  All the Guice injection starts here.
 */
public final class GitAuthzConfig {
  private static final Logger logger = Logger.getLogger(GitAuthzConfig.class.getName());

  /** System property naming the resource store file. */
  public static final String STORE_FILE_PROPERTY = "storeFile";

  // don't instantiate
  private GitAuthzConfig() {
  }

  /**
   * Makes an injector for a resource store file.  The {@code storeFile}
   * system property, when set, overrides the argument.
   *
   * @param defaultStoreFile The store file to use if the property isn't set.
   * @return A new injector.
   */
  public static Injector makeInjector(@Nullable String defaultStoreFile) {
    String storeFile = getStoreFile(defaultStoreFile);
    logger.info("Resource store file " + storeFile);
    return Guice.createInjector(new ConfigModule(storeFile), new PolicyGuiceModule());
  }

  @VisibleForTesting
  static String getStoreFile(@Nullable String defaultStoreFile) {
    String path = System.getProperty(STORE_FILE_PROPERTY);
    if (!Strings.isNullOrEmpty(path)) {
      return path.trim();
    }
    if (Strings.isNullOrEmpty(defaultStoreFile)) {
      throw new IllegalStateException("No resource store file; set -D" + STORE_FILE_PROPERTY);
    }
    return defaultStoreFile;
  }
}
