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

package ai.floedb.floegate.service.db.impl;

import ai.floedb.floegate.service.db.DbOption;
import ai.floedb.floegate.service.db.Reader;
import ai.floedb.floegate.service.db.ResourceTable;
import ai.floedb.floegate.service.db.RowMapper;
import ai.floedb.floegate.service.db.Storable;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;

/** Reader that borrows a connection per call and runs in auto-commit mode. */
public final class DataSourceReader implements Reader {
  private final DataSource dataSource;

  public DataSourceReader(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public <T extends Storable<T>> T lookupByPublicId(ResourceTable<T> table, String publicId)
      throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return new JdbcReadWriter(conn).lookupByPublicId(table, publicId);
    }
  }

  @Override
  public <T extends Storable<T>> List<T> searchWhere(
      ResourceTable<T> table, String where, List<?> params, DbOption... opts)
      throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return new JdbcReadWriter(conn).searchWhere(table, where, params, opts);
    }
  }

  @Override
  public <R> List<R> query(String sql, List<?> params, RowMapper<R> mapper) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return new JdbcReadWriter(conn).query(sql, params, mapper);
    }
  }
}
