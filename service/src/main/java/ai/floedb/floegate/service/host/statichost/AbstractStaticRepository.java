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

package ai.floedb.floegate.service.host.statichost;

import ai.floedb.floegate.service.db.Db;
import ai.floedb.floegate.service.db.PublicIds;
import ai.floedb.floegate.service.db.RetryPolicy;
import ai.floedb.floegate.service.error.DomainException;
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import ai.floedb.floegate.service.kms.KeyManager;
import ai.floedb.floegate.service.kms.KeyPurpose;
import ai.floedb.floegate.service.kms.Wrapper;
import java.util.Objects;
import java.util.function.Supplier;

abstract class AbstractStaticRepository {
  static final int UNLIMITED = -1;

  protected final Db db;
  protected final KeyManager kms;
  protected final RetryPolicy retryPolicy;
  protected final int defaultLimit;

  protected AbstractStaticRepository(
      Db db, KeyManager kms, RetryPolicy retryPolicy, int defaultLimit) {
    this.db = Objects.requireNonNull(db, "db");
    this.kms = Objects.requireNonNull(kms, "kms");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.defaultLimit = defaultLimit;
  }

  /** Resolved inside the transaction body so a failure rolls back earlier writes. */
  protected Wrapper oplogWrapper(String scopeId, String id) {
    try {
      return kms.getWrapper(scopeId, KeyPurpose.OPLOG);
    } catch (RuntimeException e) {
      throw Errors.wrap(e, id, "unable to get oplog wrapper");
    }
  }

  protected int limit(RepositoryOptions opts) {
    return opts.limit() != 0 ? opts.limit() : defaultLimit;
  }

  protected static String assignPublicId(
      RepositoryOptions opts, String prefix, Supplier<String> generator, String id) {
    String requested = opts.publicId();
    if (requested == null || requested.isEmpty()) {
      return generator.get();
    }
    if (!PublicIds.hasPrefix(requested, prefix)) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER,
          id,
          String.format(
              "passed-in public ID \"%s\" has wrong prefix, should be \"%s\"", requested, prefix));
    }
    return requested;
  }

  /**
   * Domain errors raised by the transaction body pass through; store errors are classified, and
   * whatever stays unclassified becomes an Unknown error carrying {@code context}.
   */
  protected static DomainException storeFailure(Exception e, String id, String context) {
    if (e instanceof DomainException de) {
      return de;
    }
    return Errors.convert(e, id).orElseGet(() -> Errors.error(ErrorCode.UNKNOWN, id, context, e));
  }

  protected static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
