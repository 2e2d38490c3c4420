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

package ai.floedb.floegate.service.db;

import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import java.security.SecureRandom;

/** Generates {@code <prefix>_<10 base62 chars>} identifiers. */
public final class PublicIds {
  private static final String BASE62 =
      "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
  private static final int RANDOM_LENGTH = 10;
  private static final SecureRandom RANDOM = new SecureRandom();

  private PublicIds() {}

  public static String newPublicId(String prefix) {
    if (prefix == null || prefix.isEmpty()) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "db.public-id", "missing prefix");
    }
    try {
      return prefix + "_" + random(RANDOM_LENGTH);
    } catch (RuntimeException e) {
      throw Errors.error(ErrorCode.GENERATE_ID, "db.public-id", "prefix: " + prefix, e);
    }
  }

  /** {@code length} random base62 characters. */
  public static String random(int length) {
    var sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(BASE62.charAt(RANDOM.nextInt(BASE62.length())));
    }
    return sb.toString();
  }

  public static boolean hasPrefix(String publicId, String prefix) {
    return publicId != null && publicId.startsWith(prefix + "_");
  }
}
