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

import ai.floedb.floegate.service.db.ResourceTable;
import ai.floedb.floegate.service.db.Storable;
import ai.floedb.floegate.service.oplog.OpType;
import ai.floedb.floegate.service.oplog.OplogMetadata;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scope-owned container of static hosts and host sets.
 *
 * @param publicId {@code hcst_} id, assigned on create
 * @param scopeId owning scope, immutable
 * @param name optional, unique within the scope
 * @param description optional
 * @param version optimistic concurrency token, starts at 1
 */
public record HostCatalog(
    String publicId,
    String scopeId,
    String name,
    String description,
    int version,
    Instant createTime,
    Instant updateTime)
    implements Storable<HostCatalog> {

  static final String RESOURCE_TYPE = "static host catalog";

  public static final ResourceTable<HostCatalog> TABLE =
      ResourceTable.<HostCatalog>builder(
              "static_host_catalog", HostCatalog::toRow, HostCatalog::fromRow)
          .key(ResourceTable.PUBLIC_ID)
          .immutable("scope_id")
          .updatable("name", "description")
          .versioned()
          .build();

  public static HostCatalog of(String scopeId, String name, String description) {
    return new HostCatalog(null, scopeId, name, description, 0, null, null);
  }

  public HostCatalog withPublicId(String id) {
    return new HostCatalog(id, scopeId, name, description, version, createTime, updateTime);
  }

  @Override
  public ResourceTable<HostCatalog> table() {
    return TABLE;
  }

  OplogMetadata oplog(OpType op) {
    return new OplogMetadata()
        .put(OplogMetadata.RESOURCE_PUBLIC_ID, publicId)
        .put(OplogMetadata.SCOPE_ID, scopeId)
        .put(OplogMetadata.RESOURCE_TYPE, RESOURCE_TYPE)
        .addOpType(op);
  }

  private Map<String, Object> toRow() {
    var row = new LinkedHashMap<String, Object>();
    row.put(ResourceTable.PUBLIC_ID, publicId);
    row.put("scope_id", scopeId);
    row.put("name", Columns.blankToNull(name));
    row.put("description", Columns.blankToNull(description));
    return row;
  }

  private static HostCatalog fromRow(ResultSet rs) throws SQLException {
    return new HostCatalog(
        rs.getString(ResourceTable.PUBLIC_ID),
        rs.getString("scope_id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getInt(ResourceTable.VERSION),
        Columns.instant(rs, ResourceTable.CREATE_TIME),
        Columns.instant(rs, ResourceTable.UPDATE_TIME));
  }
}
