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
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

public record HostSetMember(String setId, String hostId) implements Storable<HostSetMember> {

  public static final ResourceTable<HostSetMember> TABLE =
      ResourceTable.<HostSetMember>builder(
              "static_host_set_member", HostSetMember::toRow, HostSetMember::fromRow)
          .key("set_id", "host_id")
          .build();

  public HostSetMember {
    if (setId == null || setId.isBlank()) {
      throw Errors.error(ErrorCode.MISSING_SET_ID, "static.HostSetMember");
    }
    if (hostId == null || hostId.isBlank()) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "static.HostSetMember", "missing host id");
    }
  }

  @Override
  public ResourceTable<HostSetMember> table() {
    return TABLE;
  }

  private Map<String, Object> toRow() {
    var row = new LinkedHashMap<String, Object>();
    row.put("set_id", setId);
    row.put("host_id", hostId);
    return row;
  }

  private static HostSetMember fromRow(ResultSet rs) throws SQLException {
    return new HostSetMember(rs.getString("set_id"), rs.getString("host_id"));
  }
}
