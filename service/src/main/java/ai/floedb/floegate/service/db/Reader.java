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

import java.sql.SQLException;
import java.util.List;

/** Read capability over the store. */
public interface Reader {

  /**
   * Loads the row with {@code publicId}.
   *
   * @throws ai.floedb.floegate.service.error.DomainException with code {@code RECORD_NOT_FOUND}
   *     wrapping {@link ai.floedb.floegate.service.error.Errors#RECORD_NOT_FOUND} when absent
   */
  <T extends Storable<T>> T lookupByPublicId(ResourceTable<T> table, String publicId)
      throws SQLException;

  /** Rows of {@code table} matching {@code where}; honours {@link DbOption#withLimit}. */
  <T extends Storable<T>> List<T> searchWhere(
      ResourceTable<T> table, String where, List<?> params, DbOption... opts) throws SQLException;

  <R> List<R> query(String sql, List<?> params, RowMapper<R> mapper) throws SQLException;
}
