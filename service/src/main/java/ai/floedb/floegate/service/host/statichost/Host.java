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

/** A statically addressed host inside a {@link HostCatalog}. */
public record Host(
    String publicId,
    String catalogId,
    String name,
    String description,
    String address,
    int version,
    Instant createTime,
    Instant updateTime)
    implements Storable<Host> {

  public static final int MIN_ADDRESS_LENGTH = 3;
  public static final int MAX_ADDRESS_LENGTH = 255;

  static final String RESOURCE_TYPE = "static host";

  public static final ResourceTable<Host> TABLE =
      ResourceTable.<Host>builder("static_host", Host::toRow, Host::fromRow)
          .key(ResourceTable.PUBLIC_ID)
          .immutable("catalog_id")
          .updatable("name", "description", "address")
          .versioned()
          .build();

  public static Host of(String catalogId, String name, String description, String address) {
    return new Host(null, catalogId, name, description, address, 0, null, null);
  }

  public Host withPublicId(String id) {
    return new Host(id, catalogId, name, description, address, version, createTime, updateTime);
  }

  public Host withAddress(String value) {
    return new Host(publicId, catalogId, name, description, value, version, createTime, updateTime);
  }

  @Override
  public ResourceTable<Host> table() {
    return TABLE;
  }

  static boolean validAddress(String address) {
    return address != null
        && address.length() >= MIN_ADDRESS_LENGTH
        && address.length() <= MAX_ADDRESS_LENGTH;
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
    row.put("address", address);
    return row;
  }

  private static Host fromRow(ResultSet rs) throws SQLException {
    return new Host(
        rs.getString(ResourceTable.PUBLIC_ID),
        rs.getString("catalog_id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("address"),
        rs.getInt(ResourceTable.VERSION),
        Columns.instant(rs, ResourceTable.CREATE_TIME),
        Columns.instant(rs, ResourceTable.UPDATE_TIME));
  }
}
