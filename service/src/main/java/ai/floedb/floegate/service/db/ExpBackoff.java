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

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/** {@code 2^attempt * base}, jittered by a factor in [0.5, 1.5). */
public final class ExpBackoff implements Backoff {
  public static final Duration DEFAULT_BASE = Duration.ofMillis(5);
  private static final int MAX_EXPONENT = 16;

  private final Duration base;

  public ExpBackoff() {
    this(DEFAULT_BASE);
  }

  public ExpBackoff(Duration base) {
    this.base = Objects.requireNonNull(base, "base");
    if (base.isNegative()) {
      throw new IllegalArgumentException("base must not be negative");
    }
  }

  @Override
  public Duration duration(int attempt) {
    int exp = Math.min(Math.max(attempt, 0), MAX_EXPONENT);
    double jitter = ThreadLocalRandom.current().nextDouble() + 0.5;
    long nanos = (long) ((1L << exp) * base.toNanos() * jitter);
    return Duration.ofNanos(nanos);
  }
}
