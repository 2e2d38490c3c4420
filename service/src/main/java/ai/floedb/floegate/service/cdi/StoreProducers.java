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

package ai.floedb.floegate.service.cdi;

import ai.floedb.floegate.service.config.FloegateConfig;
import ai.floedb.floegate.service.db.Db;
import ai.floedb.floegate.service.db.ExpBackoff;
import ai.floedb.floegate.service.db.RetryPolicy;
import ai.floedb.floegate.service.kms.KeyManager;
import ai.floedb.floegate.service.kms.impl.DerivedKeyManager;
import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import java.util.Base64;

public class StoreProducers {

  @Produces
  @ApplicationScoped
  public Db produceDb(AgroalDataSource dataSource) {
    return new Db(dataSource);
  }

  @Produces
  @ApplicationScoped
  public RetryPolicy produceRetryPolicy(FloegateConfig config) {
    return new RetryPolicy(config.db().maxRetries(), new ExpBackoff(config.db().backoffBase()));
  }

  @Produces
  @ApplicationScoped
  public KeyManager produceKeyManager(FloegateConfig config) {
    String rootKey =
        config
            .kms()
            .rootKey()
            .filter(k -> !k.isBlank())
            .orElseThrow(
                () -> new IllegalStateException("floegate.kms.root-key is not configured"));
    return new DerivedKeyManager(
        Base64.getDecoder().decode(rootKey.trim()),
        config.kms().wrapperCacheSize(),
        config.kms().wrapperCacheExpiry());
  }
}
