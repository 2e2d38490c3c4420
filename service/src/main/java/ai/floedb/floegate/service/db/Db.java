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

import ai.floedb.floegate.service.db.impl.DataSourceReader;
import ai.floedb.floegate.service.db.impl.JdbcReadWriter;
import ai.floedb.floegate.service.db.impl.SqlStates;
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Status;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.jboss.logging.Logger;

/**
 * Entry point to the store. Reads outside a transaction go through {@link #reader()}; every
 * mutation runs inside {@link #doTx}.
 */
public final class Db {
  private static final Logger LOG = Logger.getLogger(Db.class);

  private final DataSource dataSource;
  private final Reader reader;

  public Db(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.reader = new DataSourceReader(dataSource);
  }

  public Reader reader() {
    return reader;
  }

  /**
   * Runs {@code handler} in one transaction and commits it. The body is re-run from scratch when
   * it fails with a transient store error, up to {@code policy.maxRetries()} times. The current
   * {@link Context} is honoured: once it is cancelled no further attempt starts and backoff waits
   * are cut short.
   *
   * @throws io.grpc.StatusRuntimeException {@code CANCELLED} or {@code DEADLINE_EXCEEDED} when the
   *     context is cancelled
   */
  public TxResult doTx(RetryPolicy policy, TxHandler handler) throws SQLException {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(handler, "handler");
    Context ctx = Context.current();
    Duration backedOff = Duration.ZERO;
    for (int attempt = 0; ; attempt++) {
      throwIfCancelled(ctx);
      try {
        runOnce(handler);
        return new TxResult(attempt, backedOff);
      } catch (SQLException | RuntimeException e) {
        if (!SqlStates.isRetryable(e)) {
          throw e;
        }
        if (attempt >= policy.maxRetries()) {
          throw Errors.error(
              ErrorCode.UNKNOWN,
              "db.tx",
              String.format("too many retries: %d of %d", attempt, policy.maxRetries()),
              e);
        }
        Duration wait = policy.backoff().duration(attempt + 1);
        LOG.debugf("tx retry attempt=%d wait=%s cause=%s", attempt + 1, wait, e.getMessage());
        await(ctx, wait);
        backedOff = backedOff.plus(wait);
      }
    }
  }

  private void runOnce(TxHandler handler) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try {
        var rw = new JdbcReadWriter(conn);
        handler.handle(rw, rw);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        try {
          conn.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        throw e;
      }
    }
  }

  private static void await(Context ctx, Duration wait) {
    if (wait.isZero() || wait.isNegative()) {
      throwIfCancelled(ctx);
      return;
    }
    var latch = new CountDownLatch(1);
    Context.CancellationListener listener = c -> latch.countDown();
    ctx.addListener(listener, Runnable::run);
    try {
      latch.await(wait.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw Status.CANCELLED
          .withDescription("interrupted while backing off")
          .withCause(e)
          .asRuntimeException();
    } finally {
      ctx.removeListener(listener);
    }
    throwIfCancelled(ctx);
  }

  private static void throwIfCancelled(Context ctx) {
    Status status = Contexts.statusFromCancelled(ctx);
    if (status != null) {
      throw status.asRuntimeException();
    }
  }
}
