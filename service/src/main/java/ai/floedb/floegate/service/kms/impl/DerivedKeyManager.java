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

import ai.floedb.floegate.service.kms.KeyManager;
import ai.floedb.floegate.service.kms.KeyPurpose;
import ai.floedb.floegate.service.kms.Wrapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.jboss.logging.Logger;

/**
 * Derives one AES-256 key per (scope, purpose) from a root key using HMAC-SHA256. Derived
 * wrappers are kept in a bounded cache and re-derived after eviction; the root key never leaves
 * this class.
 */
public final class DerivedKeyManager implements KeyManager {
  private static final Logger LOG = Logger.getLogger(DerivedKeyManager.class);
  private static final String HMAC = "HmacSHA256";

  static final long DEFAULT_MAX_WRAPPERS = 10_000;
  static final Duration DEFAULT_WRAPPER_EXPIRY = Duration.ofHours(1);

  private final SecretKeySpec rootKey;
  private final Cache<String, Wrapper> wrappers;

  public DerivedKeyManager(byte[] rootKey) {
    this(rootKey, DEFAULT_MAX_WRAPPERS, DEFAULT_WRAPPER_EXPIRY);
  }

  public DerivedKeyManager(byte[] rootKey, long maxWrappers, Duration wrapperExpiry) {
    this(rootKey, maxWrappers, wrapperExpiry, Ticker.systemTicker());
  }

  DerivedKeyManager(byte[] rootKey, long maxWrappers, Duration wrapperExpiry, Ticker ticker) {
    Objects.requireNonNull(rootKey, "rootKey");
    Objects.requireNonNull(wrapperExpiry, "wrapperExpiry");
    if (rootKey.length < 16) {
      throw new IllegalArgumentException("root key must be at least 16 bytes");
    }
    this.rootKey = new SecretKeySpec(rootKey.clone(), HMAC);
    this.wrappers =
        Caffeine.newBuilder()
            .maximumSize(Math.max(1, maxWrappers))
            .expireAfterWrite(wrapperExpiry.isNegative() ? Duration.ZERO : wrapperExpiry)
            .ticker(ticker)
            .build();
  }

  @Override
  public Wrapper getWrapper(String scopeId, KeyPurpose purpose) {
    if (scopeId == null || scopeId.isBlank()) {
      throw new IllegalArgumentException("scopeId is required");
    }
    Objects.requireNonNull(purpose, "purpose");
    return wrappers.get(scopeId + "/" + purpose.label(), this::derive);
  }

  /** Wrappers currently cached, after pending evictions have run. */
  long cachedWrappers() {
    wrappers.cleanUp();
    return wrappers.estimatedSize();
  }

  private Wrapper derive(String label) {
    try {
      Mac mac = Mac.getInstance(HMAC);
      mac.init(rootKey);
      byte[] key = mac.doFinal(label.getBytes(StandardCharsets.UTF_8));
      mac.reset();
      byte[] fingerprint = mac.doFinal(key);
      String keyId = "kdk_" + HexFormat.of().formatHex(fingerprint, 0, 8);
      LOG.debugf("derived wrapper label=%s keyId=%s", label, keyId);
      return new AeadWrapper(keyId, key);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("unable to derive key for " + label, e);
    }
  }
}
