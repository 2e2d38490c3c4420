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

import ai.floedb.floegate.service.kms.Wrapper;
import ai.floedb.floegate.service.oplog.OplogMessage;
import ai.floedb.floegate.service.oplog.OplogMetadata;
import ai.floedb.floegate.service.oplog.Ticket;
import java.sql.SQLException;
import java.util.List;

/**
 * Write capability over the store. Every mutating call accepts either {@link
 * DbOption#withOplog} or {@link DbOption#newOplogMsgs}, never both.
 */
public interface Writer {

  /** Inserts {@code item} and returns it as stored. */
  <T extends Storable<T>> T create(T item, DbOption... opts) throws SQLException;

  /**
   * Writes the columns named by {@code fieldMask} and nulls those named by {@code nullFields}.
   * Versioned rows always get their version bumped.
   *
   * @return rows affected; zero when the row is gone or its version moved on
   */
  <T extends Storable<T>> int update(
      T item, List<String> fieldMask, List<String> nullFields, DbOption... opts)
      throws SQLException;

  <T extends Storable<T>> int delete(T item, DbOption... opts) throws SQLException;

  <T extends Storable<T>> void createItems(List<T> items, DbOption... opts) throws SQLException;

  <T extends Storable<T>> int deleteItems(List<T> items, DbOption... opts) throws SQLException;

  Ticket getTicket(Storable<?> item) throws SQLException;

  void writeOplogEntryWith(
      Wrapper wrapper, Ticket ticket, OplogMetadata metadata, List<OplogMessage> messages)
      throws SQLException;
}
