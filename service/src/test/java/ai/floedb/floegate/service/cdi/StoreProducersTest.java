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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.floedb.floegate.service.config.FloegateConfig;
import ai.floedb.floegate.service.db.ExpBackoff;
import ai.floedb.floegate.service.db.RetryPolicy;
import ai.floedb.floegate.service.kms.KeyManager;
import ai.floedb.floegate.service.kms.KeyPurpose;
import ai.floedb.floegate.service.kms.Wrapper;
import ai.floedb.floegate.service.testsupport.TestStores;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StoreProducersTest {

  private final StoreProducers producers = new StoreProducers();

  private static FloegateConfig config(Map<String, String> props) {
    return new SmallRyeConfigBuilder()
        .withMapping(FloegateConfig.class)
        .withSources(new PropertiesConfigSource(props, "test", 100))
        .build()
        .getConfigMapping(FloegateConfig.class);
  }

  @Test
  void retryPolicyFollowsConfig() {
    RetryPolicy policy =
        producers.produceRetryPolicy(config(Map.of("floegate.db.max-retries", "4")));

    assertEquals(4, policy.maxRetries());
    assertThat(policy.backoff()).isInstanceOf(ExpBackoff.class);
  }

  @Test
  void keyManagerNeedsRootKey() {
    FloegateConfig blank = config(Map.of("floegate.kms.root-key", " "));

    assertThrows(IllegalStateException.class, () -> producers.produceKeyManager(config(Map.of())));
    assertThrows(IllegalStateException.class, () -> producers.produceKeyManager(blank));
  }

  @Test
  void keyManagerDerivesFromConfiguredRootKey() throws Exception {
    String rootKey = Base64.getEncoder().encodeToString(TestStores.ROOT_KEY);
    KeyManager kms = producers.produceKeyManager(config(Map.of("floegate.kms.root-key", rootKey)));

    Wrapper produced = kms.getWrapper("o_1234567890", KeyPurpose.OPLOG);
    Wrapper expected = TestStores.keyManager().getWrapper("o_1234567890", KeyPurpose.OPLOG);
    byte[] aad = "static_host".getBytes(StandardCharsets.UTF_8);
    byte[] plain = "payload".getBytes(StandardCharsets.UTF_8);

    assertEquals(expected.keyId(), produced.keyId());
    assertArrayEquals(plain, expected.decrypt(produced.encrypt(plain, aad), aad));
  }
}
