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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.floedb.floegate.service.error.DomainException;
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import ai.floedb.floegate.service.host.statichost.HostCatalog;
import ai.floedb.floegate.service.oplog.Ticket;
import ai.floedb.floegate.service.oplog.TicketAlreadyRedeemedException;
import ai.floedb.floegate.service.testsupport.TestStores;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DbTest {

  private static final RetryPolicy FAST = new RetryPolicy(3, new ConstBackoff(Duration.ZERO));

  private DataSource ds;
  private Db db;

  @BeforeEach
  void setUp() throws SQLException {
    ds = TestStores.dataSource();
    db = new Db(ds);
  }

  private static HostCatalog catalog(String id, String name) {
    return HostCatalog.of("o_1234567890", name, null).withPublicId(id);
  }

  @Test
  void commitsOnSuccess() throws SQLException {
    TxResult result = db.doTx(FAST, (r, w) -> w.create(catalog("hcst_0000000001", "one")));

    assertEquals(0, result.retries());
    assertEquals(Duration.ZERO, result.backoff());
    assertEquals(1, TestStores.count(ds, "SELECT COUNT(*) FROM static_host_catalog"));
  }

  @Test
  void rollsBackWhenBodyFails() throws SQLException {
    var boom = new IllegalStateException("boom");

    var thrown =
        assertThrows(
            IllegalStateException.class,
            () ->
                db.doTx(
                    FAST,
                    (r, w) -> {
                      w.create(catalog("hcst_0000000001", "one"));
                      throw boom;
                    }));

    assertSame(boom, thrown);
    assertEquals(0, TestStores.count(ds, "SELECT COUNT(*) FROM static_host_catalog"));
  }

  @Test
  void retriesWhenTicketWasRedeemedConcurrently() throws SQLException {
    var attempts = new AtomicInteger();

    TxResult result =
        db.doTx(
            new RetryPolicy(3, new ConstBackoff(Duration.ofMillis(1))),
            (r, w) -> {
              w.create(catalog("hcst_0000000001", "one"));
              if (attempts.incrementAndGet() == 1) {
                throw new TicketAlreadyRedeemedException(new Ticket("static_host_catalog", 1));
              }
            });

    assertEquals(2, attempts.get());
    assertEquals(1, result.retries());
    assertEquals(Duration.ofMillis(1), result.backoff());
    assertEquals(1, TestStores.count(ds, "SELECT COUNT(*) FROM static_host_catalog"));
  }

  @Test
  void retriesSerializationFailures() throws SQLException {
    var attempts = new AtomicInteger();

    TxResult result =
        db.doTx(
            FAST,
            (r, w) -> {
              if (attempts.incrementAndGet() < 3) {
                throw new SQLException("could not serialize access", "40001");
              }
            });

    assertEquals(2, result.retries());
  }

  @Test
  void doesNotRetryConstraintViolations() {
    var attempts = new AtomicInteger();

    assertThrows(
        SQLException.class,
        () ->
            db.doTx(
                FAST,
                (r, w) -> {
                  attempts.incrementAndGet();
                  w.create(catalog("hcst_0000000001", "same"));
                  w.create(catalog("hcst_0000000002", "same"));
                }));

    assertEquals(1, attempts.get());
  }

  @Test
  void givesUpAfterRetryBudget() {
    var attempts = new AtomicInteger();

    var e =
        assertThrows(
            DomainException.class,
            () ->
                db.doTx(
                    FAST,
                    (r, w) -> {
                      attempts.incrementAndGet();
                      throw new SQLException("deadlock detected", "40P01");
                    }));

    assertEquals(4, attempts.get());
    assertEquals(ErrorCode.UNKNOWN, e.code());
    assertThat(e.msg()).isEqualTo("too many retries: 3 of 3");
    assertThat(Errors.find(e, SQLException.class).getSQLState()).isEqualTo("40P01");
  }

  @Test
  void cancelledContextStartsNoAttempt() {
    var attempts = new AtomicInteger();
    Context.CancellableContext ctx = Context.current().withCancellation();
    ctx.cancel(null);

    var e =
        assertThrows(
            StatusRuntimeException.class,
            () -> ctx.call(() -> db.doTx(FAST, (r, w) -> attempts.incrementAndGet())));

    assertEquals(Status.Code.CANCELLED, e.getStatus().getCode());
    assertEquals(0, attempts.get());
  }

  @Test
  void cancellationCutsBackoffShort() {
    var attempts = new AtomicInteger();
    Context.CancellableContext ctx = Context.current().withCancellation();
    var slow = new RetryPolicy(5, new ConstBackoff(Duration.ofMinutes(5)));

    var e =
        assertTimeout(
            Duration.ofSeconds(30),
            () ->
                assertThrows(
                    StatusRuntimeException.class,
                    () ->
                        ctx.call(
                            () ->
                                db.doTx(
                                    slow,
                                    (r, w) -> {
                                      attempts.incrementAndGet();
                                      ctx.cancel(null);
                                      throw new SQLException("serialization", "40001");
                                    }))));

    assertEquals(Status.Code.CANCELLED, e.getStatus().getCode());
    assertEquals(1, attempts.get());
  }

  @Test
  void readerSeesCommittedRows() throws SQLException {
    db.doTx(FAST, (r, w) -> w.create(catalog("hcst_0000000001", "one")));

    HostCatalog found = db.reader().lookupByPublicId(HostCatalog.TABLE, "hcst_0000000001");

    assertEquals("one", found.name());
    assertEquals(1, found.version());
    assertTrue(found.createTime() != null && found.updateTime() != null);
  }
}
