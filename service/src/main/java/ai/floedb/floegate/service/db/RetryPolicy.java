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

import java.util.Objects;

/**
 * How often {@link Db#doTx} may re-run a transaction body and how long it waits in between.
 * Only transient store failures are retried.
 */
public record RetryPolicy(int maxRetries, Backoff backoff) {
  public static final int STD_RETRY_COUNT = 20;

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
    Objects.requireNonNull(backoff, "backoff");
  }

  public static RetryPolicy standard() {
    return new RetryPolicy(STD_RETRY_COUNT, new ExpBackoff());
  }
}
