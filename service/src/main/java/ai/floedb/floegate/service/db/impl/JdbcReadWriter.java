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
import ai.floedb.floegate.service.db.DbOptions;
import ai.floedb.floegate.service.db.Reader;
import ai.floedb.floegate.service.db.ResourceTable;
import ai.floedb.floegate.service.db.RowMapper;
import ai.floedb.floegate.service.db.Storable;
import ai.floedb.floegate.service.db.Writer;
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import ai.floedb.floegate.service.kms.Wrapper;
import ai.floedb.floegate.service.oplog.OpType;
import ai.floedb.floegate.service.oplog.OplogCodec;
import ai.floedb.floegate.service.oplog.OplogMessage;
import ai.floedb.floegate.service.oplog.OplogMetadata;
import ai.floedb.floegate.service.oplog.Ticket;
import ai.floedb.floegate.service.oplog.TicketAlreadyRedeemedException;
import java.security.GeneralSecurityException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/** {@link Reader} and {@link Writer} bound to one JDBC connection, usually inside a transaction. */
public final class JdbcReadWriter implements Reader, Writer {
  private static final Logger LOG = Logger.getLogger(JdbcReadWriter.class);

  private static final String TICKET_SELECT =
      "SELECT name, version FROM oplog_ticket WHERE name = ?";
  private static final String TICKET_REDEEM =
      "UPDATE oplog_ticket SET version = version + 1 WHERE name = ? AND version = ?";
  private static final String ENTRY_INSERT =
      "INSERT INTO oplog_entry (aggregate_name, key_id, data) VALUES (?, ?, ?)";
  private static final String METADATA_INSERT =
      "INSERT INTO oplog_metadata (entry_id, md_key, md_value) VALUES (?, ?, ?)";

  private final Connection conn;

  public JdbcReadWriter(Connection conn) {
    this.conn = Objects.requireNonNull(conn, "conn");
  }

  // Reader

  @Override
  public <T extends Storable<T>> T lookupByPublicId(ResourceTable<T> table, String publicId)
      throws SQLException {
    if (publicId == null || publicId.isBlank()) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "db.LookupByPublicId", "missing public id");
    }
    if (!table.hasPublicId()) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER,
          "db.LookupByPublicId",
          table.name() + " is not keyed by public id");
    }
    List<T> found =
        searchWhere(
            table, ResourceTable.PUBLIC_ID + " = ?", List.of(publicId), DbOption.withLimit(1));
    if (found.isEmpty()) {
      throw Errors.error(
          ErrorCode.RECORD_NOT_FOUND,
          "db.LookupByPublicId",
          table.name() + " " + publicId,
          Errors.RECORD_NOT_FOUND);
    }
    return found.get(0);
  }

  @Override
  public <T extends Storable<T>> List<T> searchWhere(
      ResourceTable<T> table, String where, List<?> params, DbOption... opts)
      throws SQLException {
    DbOptions o = DbOptions.of(opts);
    var sql = new StringBuilder("SELECT ");
    sql.append(String.join(", ", table.selectColumns())).append(" FROM ").append(table.name());
    var args = new ArrayList<Object>();
    if (where != null && !where.isBlank()) {
      sql.append(" WHERE ").append(where);
      if (params != null) {
        args.addAll(params);
      }
    }
    sql.append(" ORDER BY ").append(String.join(", ", table.keyColumns()));
    if (o.limit() > 0) {
      sql.append(" LIMIT ?");
      args.add(o.limit());
    }
    return query(sql.toString(), args, table.mapper());
  }

  @Override
  public <R> List<R> query(String sql, List<?> params, RowMapper<R> mapper) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        var out = new ArrayList<R>();
        while (rs.next()) {
          out.add(mapper.map(rs));
        }
        return out;
      }
    }
  }

  // Writer

  @Override
  public <T extends Storable<T>> T create(T item, DbOption... opts) throws SQLException {
    Objects.requireNonNull(item, "item");
    DbOptions o = oplogOptions("db.Create", opts);
    ResourceTable<T> table = item.table();
    Map<String, Object> row = insertRow(table, item);
    try (PreparedStatement ps = conn.prepareStatement(insertSql(table, row))) {
      bind(ps, new ArrayList<>(row.values()));
      ps.executeUpdate();
    }
    T stored =
        table.hasPublicId()
            ? lookupByPublicId(table, (String) row.get(ResourceTable.PUBLIC_ID))
            : item;
    emitOplog(
        o,
        stored,
        List.of(
            new OplogMessage(
                table.name(), OpType.OP_TYPE_CREATE, null, null, oplogRow(table.row(stored)))));
    return stored;
  }

  @Override
  public <T extends Storable<T>> int update(
      T item, List<String> fieldMask, List<String> nullFields, DbOption... opts)
      throws SQLException {
    Objects.requireNonNull(item, "item");
    DbOptions o = oplogOptions("db.Update", opts);
    List<String> mask = fieldMask == null ? List.of() : fieldMask;
    List<String> nulls = nullFields == null ? List.of() : nullFields;
    if (mask.isEmpty() && nulls.isEmpty()) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER, "db.Update", "both fieldMask and nullFields are missing");
    }
    ResourceTable<T> table = item.table();
    var setCols = resolve(table, mask);
    var nullCols = resolve(table, nulls);
    for (String col : nullCols) {
      if (setCols.contains(col)) {
        throw Errors.error(
            ErrorCode.INVALID_PARAMETER,
            "db.Update",
            "field " + col + " is in both fieldMask and nullFields");
      }
    }
    if (o.version() != null && !table.versioned()) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER, "db.Update", table.name() + " is not versioned");
    }

    Map<String, Object> row = table.row(item);
    var sets = new ArrayList<String>();
    var args = new ArrayList<Object>();
    for (String col : setCols) {
      if (ResourceTable.VERSION.equals(col)) {
        continue;
      }
      sets.add(col + " = ?");
      args.add(row.get(col));
    }
    for (String col : nullCols) {
      if (ResourceTable.VERSION.equals(col)) {
        throw Errors.error(ErrorCode.INVALID_PARAMETER, "db.Update", "version cannot be null");
      }
      sets.add(col + " = NULL");
    }
    if (table.versioned()) {
      sets.add(ResourceTable.VERSION + " = " + ResourceTable.VERSION + " + 1");
      sets.add(ResourceTable.UPDATE_TIME + " = CURRENT_TIMESTAMP");
    }
    Map<String, Object> key = table.key(item);
    var sql =
        new StringBuilder("UPDATE ")
            .append(table.name())
            .append(" SET ")
            .append(String.join(", ", sets))
            .append(" WHERE ")
            .append(keyPredicate(key));
    args.addAll(key.values());
    if (o.version() != null) {
      sql.append(" AND ").append(ResourceTable.VERSION).append(" = ?");
      args.add(o.version());
    }

    int rows;
    try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
      bind(ps, args);
      rows = ps.executeUpdate();
    }
    if (rows > 0) {
      var changed = new LinkedHashMap<String, Object>(key);
      for (String col : setCols) {
        if (!ResourceTable.VERSION.equals(col)) {
          changed.put(col, row.get(col));
        }
      }
      for (String col : nullCols) {
        changed.put(col, null);
      }
      emitOplog(
          o,
          item,
          List.of(
              new OplogMessage(
                  table.name(),
                  OpType.OP_TYPE_UPDATE,
                  List.copyOf(setCols),
                  List.copyOf(nullCols),
                  oplogRow(changed))));
    }
    return rows;
  }

  @Override
  public <T extends Storable<T>> int delete(T item, DbOption... opts) throws SQLException {
    Objects.requireNonNull(item, "item");
    DbOptions o = oplogOptions("db.Delete", opts);
    ResourceTable<T> table = item.table();
    if (o.version() != null && !table.versioned()) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER, "db.Delete", table.name() + " is not versioned");
    }
    Map<String, Object> key = table.key(item);
    var sql = new StringBuilder("DELETE FROM ").append(table.name());
    sql.append(" WHERE ").append(keyPredicate(key));
    var args = new ArrayList<Object>(key.values());
    if (o.version() != null) {
      sql.append(" AND ").append(ResourceTable.VERSION).append(" = ?");
      args.add(o.version());
    }
    int rows;
    try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
      bind(ps, args);
      rows = ps.executeUpdate();
    }
    if (rows > 0) {
      emitOplog(
          o,
          item,
          List.of(
              new OplogMessage(table.name(), OpType.OP_TYPE_DELETE, null, null, oplogRow(key))));
    }
    return rows;
  }

  @Override
  public <T extends Storable<T>> void createItems(List<T> items, DbOption... opts)
      throws SQLException {
    DbOptions o = oplogOptions("db.CreateItems", opts);
    ResourceTable<T> table = sameTable("db.CreateItems", items);
    var rows = new ArrayList<Map<String, Object>>(items.size());
    for (T item : items) {
      rows.add(insertRow(table, item));
    }
    try (PreparedStatement ps = conn.prepareStatement(insertSql(table, rows.get(0)))) {
      for (Map<String, Object> row : rows) {
        bind(ps, new ArrayList<>(row.values()));
        ps.addBatch();
      }
      ps.executeBatch();
    }
    var msgs = new ArrayList<OplogMessage>(rows.size());
    for (Map<String, Object> row : rows) {
      msgs.add(new OplogMessage(table.name(), OpType.OP_TYPE_CREATE, null, null, oplogRow(row)));
    }
    emitOplog(o, items.get(0), msgs);
  }

  @Override
  public <T extends Storable<T>> int deleteItems(List<T> items, DbOption... opts)
      throws SQLException {
    DbOptions o = oplogOptions("db.DeleteItems", opts);
    ResourceTable<T> table = sameTable("db.DeleteItems", items);
    var keys = new ArrayList<Map<String, Object>>(items.size());
    for (T item : items) {
      keys.add(table.key(item));
    }
    String sql = "DELETE FROM " + table.name() + " WHERE " + keyPredicate(keys.get(0));
    int rows = 0;
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Map<String, Object> key : keys) {
        bind(ps, new ArrayList<>(key.values()));
        ps.addBatch();
      }
      for (int n : ps.executeBatch()) {
        if (n > 0) {
          rows += n;
        } else if (n == Statement.SUCCESS_NO_INFO) {
          rows++;
        }
      }
    }
    if (rows > 0) {
      var msgs = new ArrayList<OplogMessage>(keys.size());
      for (Map<String, Object> key : keys) {
        msgs.add(new OplogMessage(table.name(), OpType.OP_TYPE_DELETE, null, null, oplogRow(key)));
      }
      emitOplog(o, items.get(0), msgs);
    }
    return rows;
  }

  @Override
  public Ticket getTicket(Storable<?> item) throws SQLException {
    Objects.requireNonNull(item, "item");
    String name = item.table().name();
    List<Ticket> tickets =
        query(
            TICKET_SELECT,
            List.of(name),
            rs -> new Ticket(rs.getString("name"), rs.getLong("version")));
    if (tickets.isEmpty()) {
      throw Errors.error(
          ErrorCode.RECORD_NOT_FOUND,
          "db.GetTicket",
          "no ticket for " + name,
          Errors.RECORD_NOT_FOUND);
    }
    return tickets.get(0);
  }

  @Override
  public void writeOplogEntryWith(
      Wrapper wrapper, Ticket ticket, OplogMetadata metadata, List<OplogMessage> messages)
      throws SQLException {
    if (wrapper == null || ticket == null || metadata == null) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER,
          "db.WriteOplogEntryWith",
          "missing wrapper, ticket or metadata");
    }
    if (messages == null || messages.isEmpty()) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "db.WriteOplogEntryWith", "no messages");
    }
    byte[] sealed;
    try {
      sealed = OplogCodec.seal(wrapper, ticket, messages);
    } catch (GeneralSecurityException e) {
      throw Errors.wrap(e, "db.WriteOplogEntryWith", "unable to seal oplog entry");
    }

    try (PreparedStatement ps = conn.prepareStatement(TICKET_REDEEM)) {
      bind(ps, List.of(ticket.name(), ticket.version()));
      if (ps.executeUpdate() == 0) {
        throw new TicketAlreadyRedeemedException(ticket);
      }
    }

    long entryId;
    try (PreparedStatement ps =
        conn.prepareStatement(ENTRY_INSERT, Statement.RETURN_GENERATED_KEYS)) {
      ps.setString(1, ticket.name());
      ps.setString(2, wrapper.keyId());
      ps.setBytes(3, sealed);
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("oplog entry insert returned no id");
        }
        entryId = keys.getLong(1);
      }
    }

    Map<String, List<String>> md = metadata.asMap();
    if (!md.isEmpty()) {
      try (PreparedStatement ps = conn.prepareStatement(METADATA_INSERT)) {
        for (Map.Entry<String, List<String>> e : md.entrySet()) {
          for (String value : e.getValue()) {
            ps.setLong(1, entryId);
            ps.setString(2, e.getKey());
            ps.setString(3, value);
            ps.addBatch();
          }
        }
        ps.executeBatch();
      }
    }
    LOG.debugf(
        "oplog entry written id=%d aggregate=%s messages=%d",
        (Object) entryId, ticket.name(), messages.size());
  }

  private void emitOplog(DbOptions o, Storable<?> item, List<OplogMessage> msgs)
      throws SQLException {
    if (o.oplogSink() != null) {
      o.oplogSink().addAll(msgs);
    } else if (o.writeOplog()) {
      writeOplogEntryWith(o.oplogWrapper(), getTicket(item), o.oplogMetadata(), msgs);
    }
  }

  private static DbOptions oplogOptions(String op, DbOption... opts) {
    DbOptions o = DbOptions.of(opts);
    if (o.writeOplog() && o.oplogSink() != null) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER, op, "withOplog and newOplogMsgs are mutually exclusive");
    }
    return o;
  }

  private static <T extends Storable<T>> ResourceTable<T> sameTable(String op, List<T> items) {
    if (items == null || items.isEmpty()) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, op, "no items");
    }
    ResourceTable<T> table = items.get(0).table();
    for (T item : items) {
      if (!table.name().equals(item.table().name())) {
        throw Errors.error(ErrorCode.INVALID_PARAMETER, op, "items span more than one table");
      }
    }
    return table;
  }

  private static <T> Map<String, Object> insertRow(ResourceTable<T> table, T item) {
    Map<String, Object> all = table.row(item);
    var row = new LinkedHashMap<String, Object>();
    for (String col : table.columns()) {
      row.put(col, all.get(col));
    }
    return row;
  }

  private static String insertSql(ResourceTable<?> table, Map<String, Object> row) {
    var marks = new ArrayList<String>(row.size());
    for (int i = 0; i < row.size(); i++) {
      marks.add("?");
    }
    return "INSERT INTO "
        + table.name()
        + " ("
        + String.join(", ", row.keySet())
        + ") VALUES ("
        + String.join(", ", marks)
        + ")";
  }

  private static String keyPredicate(Map<String, Object> key) {
    var parts = new ArrayList<String>(key.size());
    for (String col : key.keySet()) {
      parts.add(col + " = ?");
    }
    return String.join(" AND ", parts);
  }

  private static List<String> resolve(ResourceTable<?> table, List<String> fields) {
    var cols = new LinkedHashSet<String>();
    for (String f : fields) {
      String col =
          table
              .resolveField(f)
              .orElseThrow(
                  () ->
                      Errors.error(
                          ErrorCode.INVALID_FIELD_MASK,
                          "db.Update",
                          "unknown field " + f,
                          Errors.INVALID_FIELD_MASK));
      cols.add(col);
    }
    return new ArrayList<>(cols);
  }

  private static Map<String, Object> oplogRow(Map<String, Object> row) {
    var out = new LinkedHashMap<String, Object>();
    row.forEach(
        (k, v) ->
            out.put(k, v instanceof Date || v instanceof TemporalAccessor ? v.toString() : v));
    return out;
  }

  private static void bind(PreparedStatement ps, List<?> params) throws SQLException {
    if (params == null) {
      return;
    }
    for (int i = 0; i < params.size(); i++) {
      ps.setObject(i + 1, params.get(i));
    }
  }
}
