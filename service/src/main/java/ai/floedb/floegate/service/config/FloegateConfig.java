/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.floegate.service.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "floegate")
public interface FloegateConfig {

  DbConfig db();

  RepositoryConfig repository();

  KmsConfig kms();

  interface DbConfig {
    /** Attempts after the first one before a transaction gives up. */
    @WithDefault("20")
    int maxRetries();

    @WithDefault("PT0.005S")
    Duration backoffBase();

    /** Create the tables at startup. */
    @WithDefault("false")
    boolean initSchema();
  }

  interface RepositoryConfig {
    /** Row limit for list operations; negative means unlimited. */
    @WithDefault("10000")
    int defaultLimit();
  }

  interface KmsConfig {
    /** Base64 root key the per-scope keys are derived from. */
    Optional<String> rootKey();

    @WithDefault("10000")
    long wrapperCacheSize();

    @WithDefault("PT1H")
    Duration wrapperCacheExpiry();
  }
}
