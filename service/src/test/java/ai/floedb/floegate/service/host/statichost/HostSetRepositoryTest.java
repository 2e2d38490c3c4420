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

import ai.floedb.floegate.service.error.DomainException;
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.oplog.OpType;
import ai.floedb.floegate.service.oplog.OplogMetadata;
import ai.floedb.floegate.service.testsupport.TestStores;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HostSetRepositoryTest {

  private StaticRepositoryFixture fx;
  private HostSetRepository repo;
  private HostCatalog catalog;

  @BeforeEach
  void setUp() throws SQLException {
    fx = new StaticRepositoryFixture();
    repo = fx.sets;
    catalog = fx.catalog("prod");
  }

  @Test
  void createAndLookup() {
    HostSet s = repo.createSet(SCOPE, HostSet.of(catalog.publicId(), "frontends", "web tier"));

    assertThat(s.publicId()).startsWith(StaticHostIds.HOST_SET_PREFIX + "_");
    assertEquals(1, s.version());
    assertEquals(s, repo.lookupSet(s.publicId()).orElseThrow());
  }

  @Test
  void createValidatesInput() {
    assertEquals(
        ErrorCode.MISSING_CATALOG_ID,
        assertThrows(
                DomainException.class, () -> repo.createSet(SCOPE, HostSet.of(null, "x", null)))
            .code());
    assertEquals(
        ErrorCode.MISSING_SCOPE_ID,
        assertThrows(
                DomainException.class,
                () -> repo.createSet(" ", HostSet.of(catalog.publicId(), "x", null)))
            .code());
    assertEquals(
        ErrorCode.INVALID_PARAMETER,
        assertThrows(DomainException.class, () -> repo.createSet(SCOPE, null)).code());
  }

  @Test
  void duplicateNameInCatalogIsNotUnique() {
    fx.set(catalog, "frontends");

    var e = assertThrows(DomainException.class, () -> fx.set(catalog, "frontends"));

    assertEquals(ErrorCode.NOT_UNIQUE, e.code());
  }

  @Test
  void updateName() throws SQLException {
    HostSet s = fx.set(catalog, "frontends");
    var change = new HostSet(s.publicId(), catalog.publicId(), "edge", null, 0, null, null);

    Updated<HostSet> updated = repo.updateSet(SCOPE, change, s.version(), List.of("name"));

    assertEquals(1, updated.rowsUpdated());
    assertEquals("edge", updated.item().name());
    assertThat(TestStores.lastEntryMetadata(fx.ds, OplogMetadata.OP_TYPE))
        .containsExactly(OpType.OP_TYPE_UPDATE.name());
  }

  @Test
  void updateAtStaleVersionChangesNothing() {
    HostSet s = fx.set(catalog, "frontends");
    var change = new HostSet(s.publicId(), catalog.publicId(), "edge", null, 0, null, null);

    Updated<HostSet> updated = repo.updateSet(SCOPE, change, s.version() + 1, List.of("name"));

    assertEquals(0, updated.rowsUpdated());
    assertEquals("frontends", repo.lookupSet(s.publicId()).orElseThrow().name());
  }

  @Test
  void updateRejectsBadMasks() {
    HostSet s = fx.set(catalog, "frontends");

    assertEquals(
        ErrorCode.INVALID_FIELD_MASK,
        assertThrows(
                DomainException.class,
                () -> repo.updateSet(SCOPE, s, s.version(), List.of("address")))
            .code());
    assertEquals(
        ErrorCode.EMPTY_FIELD_MASK,
        assertThrows(DomainException.class, () -> repo.updateSet(SCOPE, s, s.version(), null))
            .code());
  }

  @Test
  void listAndDelete() {
    HostSet a = fx.set(catalog, "a");
    fx.set(catalog, "b");

    assertThat(repo.listSets(catalog.publicId())).hasSize(2);
    assertThat(repo.listSets(catalog.publicId(), RepositoryOption.withLimit(1))).hasSize(1);

    assertEquals(1, repo.deleteSet(SCOPE, a.publicId()));
    assertEquals(0, repo.deleteSet(SCOPE, a.publicId()));
    assertThat(repo.listSets(catalog.publicId())).extracting(HostSet::name).containsExactly("b");
  }
}
