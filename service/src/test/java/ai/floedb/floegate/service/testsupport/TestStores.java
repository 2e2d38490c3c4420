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

package ai.floedb.floegate.service.testsupport;

import ai.floedb.floegate.service.db.Schema;
import ai.floedb.floegate.service.kms.KeyManager;
import ai.floedb.floegate.service.kms.impl.DerivedKeyManager;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;

/** Fresh in-memory H2 stores for tests. */
public final class TestStores {
  public static final byte[] ROOT_KEY =
      "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

  private TestStores() {}

  public static JdbcDataSource emptyDataSource() {
    var ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    return ds;
  }

  public static DataSource dataSource() throws SQLException {
    JdbcDataSource ds = emptyDataSource();
    Schema.apply(ds);
    return ds;
  }

  public static KeyManager keyManager() {
    return new DerivedKeyManager(ROOT_KEY);
  }

  public static long count(DataSource ds, String sql, Object... params) throws SQLException {
    try (Connection conn = ds.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        ps.setObject(i + 1, params[i]);
      }
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }
    }
  }

  public static long oplogEntries(DataSource ds) throws SQLException {
    return count(ds, "SELECT COUNT(*) FROM oplog_entry");
  }

  /** Values of {@code key} on the most recent oplog entry, in insertion order. */
  public static List<String> lastEntryMetadata(DataSource ds, String key) throws SQLException {
    String sql =
        "SELECT md_value FROM oplog_metadata WHERE md_key = ? AND entry_id ="
            + " (SELECT MAX(id) FROM oplog_entry) ORDER BY id";
    try (Connection conn = ds.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, key);
      try (ResultSet rs = ps.executeQuery()) {
        var out = new ArrayList<String>();
        while (rs.next()) {
          out.add(rs.getString(1));
        }
        return out;
      }
    }
  }

  public static void execute(DataSource ds, String sql) throws SQLException {
    try (Connection conn = ds.getConnection()) {
      conn.createStatement().execute(sql);
    }
  }
}
