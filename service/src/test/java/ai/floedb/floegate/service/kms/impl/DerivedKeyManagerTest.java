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

package ai.floedb.floegate.service.kms.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.floedb.floegate.service.kms.KeyPurpose;
import ai.floedb.floegate.service.kms.Wrapper;
import ai.floedb.floegate.service.testsupport.TestStores;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class DerivedKeyManagerTest {

  private final DerivedKeyManager kms = new DerivedKeyManager(TestStores.ROOT_KEY);

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void wrappersAreCachedPerScopeAndPurpose() {
    Wrapper a = kms.getWrapper("o_1234567890", KeyPurpose.OPLOG);

    assertSame(a, kms.getWrapper("o_1234567890", KeyPurpose.OPLOG));
    assertTrue(a.keyId().startsWith("kdk_"));
    assertNotEquals(a.keyId(), kms.getWrapper("o_1234567890", KeyPurpose.DATABASE).keyId());
    assertNotEquals(a.keyId(), kms.getWrapper("o_0987654321", KeyPurpose.OPLOG).keyId());
  }

  @Test
  void wrapperCacheIsBounded() {
    var bounded = new DerivedKeyManager(TestStores.ROOT_KEY, 8, Duration.ofHours(1));

    for (int i = 0; i < 500; i++) {
      bounded.getWrapper(String.format("o_%010d", i), KeyPurpose.OPLOG);
    }

    assertThat(bounded.cachedWrappers()).isLessThanOrEqualTo(8);
  }

  @Test
  void expiredWrapperIsDerivedAgain() {
    var nanos = new AtomicLong();
    var expiring =
        new DerivedKeyManager(TestStores.ROOT_KEY, 8, Duration.ofMinutes(10), nanos::get);
    Wrapper first = expiring.getWrapper("o_1234567890", KeyPurpose.OPLOG);

    nanos.addAndGet(Duration.ofMinutes(5).toNanos());
    assertSame(first, expiring.getWrapper("o_1234567890", KeyPurpose.OPLOG));

    nanos.addAndGet(Duration.ofMinutes(6).toNanos());
    Wrapper second = expiring.getWrapper("o_1234567890", KeyPurpose.OPLOG);

    assertNotSame(first, second);
    assertEquals(first.keyId(), second.keyId());
  }

  @Test
  void derivationIsStableAcrossInstances() throws GeneralSecurityException {
    Wrapper first = kms.getWrapper("o_1234567890", KeyPurpose.OPLOG);
    Wrapper second =
        new DerivedKeyManager(TestStores.ROOT_KEY).getWrapper("o_1234567890", KeyPurpose.OPLOG);

    byte[] sealed = first.encrypt(bytes("payload"), bytes("aad"));

    assertArrayEquals(bytes("payload"), second.decrypt(sealed, bytes("aad")));
  }

  @Test
  void otherScopeCannotOpen() throws GeneralSecurityException {
    byte[] sealed =
        kms.getWrapper("o_1234567890", KeyPurpose.OPLOG).encrypt(bytes("payload"), bytes("aad"));

    Wrapper other = kms.getWrapper("o_0987654321", KeyPurpose.OPLOG);

    assertThrows(GeneralSecurityException.class, () -> other.decrypt(sealed, bytes("aad")));
  }

  @Test
  void additionalDataIsAuthenticated() throws GeneralSecurityException {
    Wrapper w = kms.getWrapper("o_1234567890", KeyPurpose.OPLOG);
    byte[] sealed = w.encrypt(bytes("payload"), bytes("static_host"));

    assertThrows(GeneralSecurityException.class, () -> w.decrypt(sealed, bytes("static_host_set")));
  }

  @Test
  void rejectsBadInput() {
    assertThrows(IllegalArgumentException.class, () -> kms.getWrapper(" ", KeyPurpose.OPLOG));
    assertThrows(IllegalArgumentException.class, () -> new DerivedKeyManager(new byte[8]));
    assertThrows(IllegalArgumentException.class, () -> new AeadWrapper("k", new byte[20]));
  }
}
