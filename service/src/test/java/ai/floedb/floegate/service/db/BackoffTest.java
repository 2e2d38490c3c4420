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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffTest {

  @Test
  void exponentialGrowsWithJitterBounds() {
    var backoff = new ExpBackoff(Duration.ofMillis(10));
    for (int attempt = 0; attempt < 6; attempt++) {
      long nominal = (1L << attempt) * 10_000_000L;
      Duration d = backoff.duration(attempt);
      assertThat(d.toNanos()).isBetween(nominal / 2, nominal * 3 / 2);
    }
  }

  @Test
  void exponentIsCapped() {
    var backoff = new ExpBackoff(Duration.ofNanos(1));
    assertThat(backoff.duration(1000).toNanos()).isLessThan(1L << 17);
  }

  @Test
  void constantIgnoresAttempt() {
    var backoff = new ConstBackoff(Duration.ofMillis(3));
    assertEquals(Duration.ofMillis(3), backoff.duration(1));
    assertEquals(Duration.ofMillis(3), backoff.duration(12));
  }

  @Test
  void standardPolicy() {
    RetryPolicy p = RetryPolicy.standard();
    assertEquals(RetryPolicy.STD_RETRY_COUNT, p.maxRetries());
    assertThat(p.backoff()).isInstanceOf(ExpBackoff.class);
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, p.backoff()));
  }
}
