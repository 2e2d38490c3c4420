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

import static ai.floedb.floegate.service.host.statichost.StaticRepositoryFixture.SCOPE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.floedb.floegate.service.error.DomainException;
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import ai.floedb.floegate.service.error.impl.ApiErrorHandler;
import ai.floedb.floegate.service.kms.KeyPurpose;
import ai.floedb.floegate.service.oplog.OpType;
import ai.floedb.floegate.service.oplog.OplogCodec;
import ai.floedb.floegate.service.oplog.OplogMessage;
import ai.floedb.floegate.service.oplog.OplogMetadata;
import ai.floedb.floegate.service.testsupport.TestStores;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HostSetMemberRepositoryTest {

  private StaticRepositoryFixture fx;
  private HostSetMemberRepository repo;
  private HostCatalog catalog;
  private HostSet set;
  private Host h1;
  private Host h2;
  private Host h3;

  @BeforeEach
  void setUp() throws SQLException {
    fx = new StaticRepositoryFixture();
    repo = fx.members;
    catalog = fx.catalog("prod");
    set = fx.set(catalog, "frontends");
    h1 = fx.host(catalog, "h1", "10.0.0.1");
    h2 = fx.host(catalog, "h2", "10.0.0.2");
    h3 = fx.host(catalog, "h3", "10.0.0.3");
  }

  private int version() {
    return fx.sets.lookupSet(set.publicId()).orElseThrow().version();
  }

  private List<OplogMessage> lastEntryMessages() throws Exception {
    List<byte[]> data =
        fx.db
            .reader()
            .query(
                "SELECT data FROM oplog_entry ORDER BY id DESC",
                List.of(),
                rs -> rs.getBytes(1));
    return OplogCodec.open(
        fx.kms.getWrapper(SCOPE, KeyPurpose.OPLOG), "static_host_set", data.get(0));
  }

  @Test
  void addReturnsAllMembersAndBumpsVersion() throws SQLException {
    List<Host> hosts =
        repo.addSetMembers(SCOPE, set.publicId(), set.version(), List.of(h1.publicId()));
    assertThat(hosts).extracting(Host::publicId).containsExactly(h1.publicId());

    hosts = repo.addSetMembers(SCOPE, set.publicId(), version(), List.of(h2.publicId()));

    assertThat(hosts).extracting(Host::publicId).containsOnly(h1.publicId(), h2.publicId());
    assertEquals(set.version() + 2, version());
    assertThat(TestStores.lastEntryMetadata(fx.ds, OplogMetadata.RESOURCE_PUBLIC_ID))
        .containsExactly(set.publicId());
  }

  @Test
  void addAtStaleVersionRollsBack() throws SQLException {
    var e =
        assertThrows(
            DomainException.class,
            () ->
                repo.addSetMembers(
                    SCOPE, set.publicId(), set.version() + 1, List.of(h1.publicId())));

    assertEquals(ErrorCode.RECORD_NOT_FOUND, e.code());
    assertTrue(Errors.is(e, Errors.RECORD_NOT_FOUND));
    assertEquals(404, new ApiErrorHandler().toApiError(e).status());
    assertEquals(0, fx.rows("static_host_set_member"));
    assertEquals(set.version(), version());
  }

  @Test
  void addExistingMemberIsNotUnique() {
    repo.addSetMembers(SCOPE, set.publicId(), set.version(), List.of(h1.publicId()));

    var e =
        assertThrows(
            DomainException.class,
            () ->
                repo.addSetMembers(
                    SCOPE, set.publicId(), version(), List.of(h2.publicId(), h1.publicId())));

    assertEquals(ErrorCode.NOT_UNIQUE, e.code());
    assertThat(repo.listSetMembers(set.publicId()))
        .extracting(Host::publicId)
        .containsExactly(h1.publicId());
  }

  @Test
  void memberOperationsValidateInput() {
    String id = set.publicId();
    int v = set.version();
    List<String> ids = List.of(h1.publicId());

    assertEquals(
        ErrorCode.MISSING_SCOPE_ID,
        assertThrows(DomainException.class, () -> repo.addSetMembers("", id, v, ids)).code());
    assertEquals(
        ErrorCode.MISSING_SET_ID,
        assertThrows(DomainException.class, () -> repo.addSetMembers(SCOPE, "", v, ids)).code());
    assertEquals(
        ErrorCode.MISSING_VERSION,
        assertThrows(DomainException.class, () -> repo.deleteSetMembers(SCOPE, id, 0, ids))
            .code());
    assertEquals(
        ErrorCode.MISSING_HOST_IDS,
        assertThrows(DomainException.class, () -> repo.addSetMembers(SCOPE, id, v, List.of()))
            .code());
    assertEquals(
        ErrorCode.MISSING_HOST_IDS,
        assertThrows(DomainException.class, () -> repo.deleteSetMembers(SCOPE, id, v, null))
            .code());
    assertEquals(
        ErrorCode.MISSING_VERSION,
        assertThrows(DomainException.class, () -> repo.setSetMembers(SCOPE, id, 0, ids))
            .code());
  }

  @Test
  void deleteMembers() throws SQLException {
    repo.addSetMembers(
        SCOPE, set.publicId(), set.version(), List.of(h1.publicId(), h2.publicId()));

    int deleted = repo.deleteSetMembers(SCOPE, set.publicId(), version(), List.of(h1.publicId()));

    assertEquals(1, deleted);
    assertThat(repo.listSetMembers(set.publicId()))
        .extracting(Host::publicId)
        .containsExactly(h2.publicId());
    assertThat(TestStores.lastEntryMetadata(fx.ds, OplogMetadata.OP_TYPE))
        .containsExactly(OpType.OP_TYPE_DELETE.name());
  }

  @Test
  void deletingNonMemberFailsAndRollsBack() throws SQLException {
    repo.addSetMembers(SCOPE, set.publicId(), set.version(), List.of(h1.publicId()));
    int before = version();

    var e =
        assertThrows(
            DomainException.class,
            () ->
                repo.deleteSetMembers(
                    SCOPE, set.publicId(), before, List.of(h1.publicId(), h3.publicId())));

    assertEquals(ErrorCode.UNKNOWN, e.code());
    assertThat(e.msg()).contains("did not match request for 2");
    assertEquals(1, fx.rows("static_host_set_member"));
    assertEquals(before, version());
  }

  @Test
  void setMembersComputesDelta() throws Exception {
    repo.addSetMembers(
        SCOPE, set.publicId(), set.version(), List.of(h1.publicId(), h2.publicId()));
    long entries = fx.oplogEntries();

    SetMembersResult result =
        repo.setSetMembers(
            SCOPE, set.publicId(), version(), List.of(h2.publicId(), h3.publicId()));

    assertEquals(2, result.changed());
    assertThat(result.hosts())
        .extracting(Host::publicId)
        .containsOnly(h2.publicId(), h3.publicId());
    assertEquals(entries + 1, fx.oplogEntries());
    assertThat(TestStores.lastEntryMetadata(fx.ds, OplogMetadata.OP_TYPE))
        .containsExactly(
            OpType.OP_TYPE_UPDATE.name(),
            OpType.OP_TYPE_DELETE.name(),
            OpType.OP_TYPE_CREATE.name());

    List<OplogMessage> msgs = lastEntryMessages();
    assertThat(msgs)
        .extracting(OplogMessage::opType)
        .containsExactly(OpType.OP_TYPE_DELETE, OpType.OP_TYPE_CREATE, OpType.OP_TYPE_UPDATE);
    assertEquals(h1.publicId(), msgs.get(0).row().get("host_id"));
    assertEquals(h3.publicId(), msgs.get(1).row().get("host_id"));
    assertThat(msgs.get(2).fieldMask()).containsExactly("version");
  }

  @Test
  void changesAreComputedByTheStore() throws SQLException {
    repo.addSetMembers(SCOPE, set.publicId(), set.version(), List.of(h1.publicId()));
    Host foreign = fx.host(fx.catalog("staging"), "x", "10.1.0.1");

    List<HostSetMemberRepository.Change> changes =
        HostSetMemberRepository.changes(
            fx.db.reader(), set.publicId(), List.of(h2.publicId(), foreign.publicId()));

    assertThat(changes)
        .containsExactly(
            new HostSetMemberRepository.Change(
                HostSetMemberRepository.ACTION_DELETE, h1.publicId()),
            new HostSetMemberRepository.Change(HostSetMemberRepository.ACTION_ADD, h2.publicId()));
    assertThat(HostSetMemberRepository.changes(fx.db.reader(), set.publicId(), List.of()))
        .containsExactly(
            new HostSetMemberRepository.Change(
                HostSetMemberRepository.ACTION_DELETE, h1.publicId()));
    assertThat(
            HostSetMemberRepository.changes(
                fx.db.reader(), set.publicId(), List.of(h1.publicId(), h1.publicId())))
        .isEmpty();
  }

  @Test
  void setMembersIsIdempotent() throws SQLException {
    List<String> target = List.of(h1.publicId(), h2.publicId());
    SetMembersResult first = repo.setSetMembers(SCOPE, set.publicId(), set.version(), target);
    long entries = fx.oplogEntries();
    int v = version();

    SetMembersResult second = repo.setSetMembers(SCOPE, set.publicId(), v, target);

    assertEquals(2, first.changed());
    assertEquals(0, second.changed());
    assertThat(second.hosts()).extracting(Host::publicId).containsOnlyElementsOf(target);
    assertEquals(entries, fx.oplogEntries());
    assertEquals(v, version());
  }

  @Test
  void emptyTargetClearsSet() throws SQLException {
    repo.addSetMembers(
        SCOPE, set.publicId(), set.version(), List.of(h1.publicId(), h2.publicId()));

    SetMembersResult result = repo.setSetMembers(SCOPE, set.publicId(), version(), List.of());

    assertEquals(2, result.changed());
    assertThat(result.hosts()).isEmpty();
    assertEquals(0, fx.rows("static_host_set_member"));
  }

  @Test
  void setMembersIgnoresHostsOfOtherCatalogs() {
    HostCatalog other = fx.catalog("staging");
    Host foreign = fx.host(other, "x", "10.1.0.1");

    SetMembersResult result =
        repo.setSetMembers(
            SCOPE,
            set.publicId(),
            set.version(),
            List.of(h1.publicId(), foreign.publicId(), "hst_0000000000"));

    assertEquals(1, result.changed());
    assertThat(result.hosts()).extracting(Host::publicId).containsExactly(h1.publicId());
  }

  @Test
  void setMembersAtStaleVersionRollsBack() throws SQLException {
    var e =
        assertThrows(
            DomainException.class,
            () ->
                repo.setSetMembers(
                    SCOPE, set.publicId(), set.version() + 3, List.of(h1.publicId())));

    assertEquals(ErrorCode.RECORD_NOT_FOUND, e.code());
    assertEquals(0, fx.rows("static_host_set_member"));
  }

  @Test
  void listHonoursLimit() {
    repo.addSetMembers(
        SCOPE,
        set.publicId(),
        set.version(),
        List.of(h1.publicId(), h2.publicId(), h3.publicId()));

    assertThat(repo.listSetMembers(set.publicId())).hasSize(3);
    assertThat(repo.listSetMembers(set.publicId(), RepositoryOption.withLimit(2))).hasSize(2);
    assertEquals(
        ErrorCode.MISSING_SET_ID,
        assertThrows(DomainException.class, () -> repo.listSetMembers("")).code());
  }

  @Test
  void deletingSetRemovesMemberships() throws SQLException {
    repo.addSetMembers(SCOPE, set.publicId(), set.version(), List.of(h1.publicId()));

    fx.sets.deleteSet(SCOPE, set.publicId());

    assertEquals(0, fx.rows("static_host_set_member"));
    assertEquals(3, fx.rows("static_host"));
  }
}
