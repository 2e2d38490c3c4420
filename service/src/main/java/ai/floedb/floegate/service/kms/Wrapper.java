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

package ai.floedb.floegate.service.kms;

import java.security.GeneralSecurityException;

/** Seals and opens payloads with one scope key. */
public interface Wrapper {

  /** Identifier of the key, stored next to anything this wrapper seals. */
  String keyId();

  byte[] encrypt(byte[] plaintext, byte[] additionalData) throws GeneralSecurityException;

  byte[] decrypt(byte[] ciphertext, byte[] additionalData) throws GeneralSecurityException;
}
