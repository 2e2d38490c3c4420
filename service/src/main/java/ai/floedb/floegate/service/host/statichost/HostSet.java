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

/** A named group of hosts from one catalog. Membership lives in {@link HostSetMember} rows. */
public record HostSet(
    String publicId,
    String catalogId,
    String name,
    String description,
    int version,
    Instant createTime,
    Instant updateTime)
    implements Storable<HostSet> {

  static final String RESOURCE_TYPE = "static host set";

  public static final ResourceTable<HostSet> TABLE =
      ResourceTable.<HostSet>builder("static_host_set", HostSet::toRow, HostSet::fromRow)
          .key(ResourceTable.PUBLIC_ID)
          .immutable("catalog_id")
          .updatable("name", "description")
          .versioned()
          .build();

  public static HostSet of(String catalogId, String name, String description) {
    return new HostSet(null, catalogId, name, description, 0, null, null);
  }

  /** Key-only handle, enough to delete a set or bump its version. */
  static HostSet reference(String setId) {
    return new HostSet(setId, null, null, null, 0, null, null);
  }

  public HostSet withPublicId(String id) {
    return new HostSet(id, catalogId, name, description, version, createTime, updateTime);
  }

  @Override
  public ResourceTable<HostSet> table() {
    return TABLE;
  }

  OplogMetadata oplog(OpType op) {
    var md =
        new OplogMetadata()
            .put(OplogMetadata.RESOURCE_PUBLIC_ID, publicId)
            .put(OplogMetadata.RESOURCE_TYPE, RESOURCE_TYPE)
            .addOpType(op);
    if (catalogId != null && !catalogId.isEmpty()) {
      md.put(OplogMetadata.CATALOG_ID, catalogId);
    }
    return md;
  }

  private Map<String, Object> toRow() {
    var row = new LinkedHashMap<String, Object>();
    row.put(ResourceTable.PUBLIC_ID, publicId);
    row.put("catalog_id", catalogId);
    row.put("name", Columns.blankToNull(name));
    row.put("description", Columns.blankToNull(description));
    return row;
  }

  private static HostSet fromRow(ResultSet rs) throws SQLException {
    return new HostSet(
        rs.getString(ResourceTable.PUBLIC_ID),
        rs.getString("catalog_id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getInt(ResourceTable.VERSION),
        Columns.instant(rs, ResourceTable.CREATE_TIME),
        Columns.instant(rs, ResourceTable.UPDATE_TIME));
  }
}
