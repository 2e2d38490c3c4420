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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Describes how a {@link Storable} maps onto a table: key columns, insertable columns, the
 * columns a field mask may name, and whether the row carries a version.
 */
public final class ResourceTable<T> {
  public static final String PUBLIC_ID = "public_id";
  public static final String VERSION = "version";
  public static final String CREATE_TIME = "create_time";
  public static final String UPDATE_TIME = "update_time";

  private final String name;
  private final List<String> keyColumns;
  private final List<String> columns;
  private final List<String> updatableColumns;
  private final boolean versioned;
  private final Function<T, Map<String, Object>> toRow;
  private final RowMapper<T> mapper;

  private ResourceTable(Builder<T> b) {
    this.name = Objects.requireNonNull(b.name, "name");
    this.keyColumns = List.copyOf(b.keyColumns);
    this.columns = List.copyOf(b.columns);
    this.updatableColumns = List.copyOf(b.updatableColumns);
    this.versioned = b.versioned;
    this.toRow = Objects.requireNonNull(b.toRow, "toRow");
    this.mapper = Objects.requireNonNull(b.mapper, "mapper");
    if (keyColumns.isEmpty()) {
      throw new IllegalArgumentException(name + ": at least one key column is required");
    }
  }

  public static <T> Builder<T> builder(
      String name, Function<T, Map<String, Object>> toRow, RowMapper<T> mapper) {
    return new Builder<>(name, toRow, mapper);
  }

  public String name() {
    return name;
  }

  public List<String> keyColumns() {
    return keyColumns;
  }

  /** Columns written on insert, key columns included. */
  public List<String> columns() {
    return columns;
  }

  public boolean versioned() {
    return versioned;
  }

  public boolean hasPublicId() {
    return keyColumns.size() == 1 && PUBLIC_ID.equals(keyColumns.get(0));
  }

  /** Columns read back by selects. */
  public List<String> selectColumns() {
    var cols = new ArrayList<>(columns);
    if (versioned) {
      cols.add(VERSION);
      cols.add(CREATE_TIME);
      cols.add(UPDATE_TIME);
    }
    return cols;
  }

  /** Resolves a field mask path to its column, ignoring case. Empty for unknown paths. */
  public Optional<String> resolveField(String field) {
    if (field == null) {
      return Optional.empty();
    }
    String wanted = field.trim().toLowerCase(Locale.ROOT);
    if (versioned && VERSION.equals(wanted)) {
      return Optional.of(VERSION);
    }
    return updatableColumns.stream().filter(wanted::equals).findFirst();
  }

  public Map<String, Object> row(T value) {
    return new LinkedHashMap<>(toRow.apply(value));
  }

  public Map<String, Object> key(T value) {
    Map<String, Object> row = toRow.apply(value);
    var key = new LinkedHashMap<String, Object>();
    for (String col : keyColumns) {
      Object v = row.get(col);
      if (v == null) {
        throw new IllegalArgumentException(name + ": missing key column " + col);
      }
      key.put(col, v);
    }
    return key;
  }

  public RowMapper<T> mapper() {
    return mapper;
  }

  public static final class Builder<T> {
    private final String name;
    private final Function<T, Map<String, Object>> toRow;
    private final RowMapper<T> mapper;
    private final List<String> keyColumns = new ArrayList<>();
    private final List<String> columns = new ArrayList<>();
    private final List<String> updatableColumns = new ArrayList<>();
    private boolean versioned;

    private Builder(String name, Function<T, Map<String, Object>> toRow, RowMapper<T> mapper) {
      this.name = name;
      this.toRow = toRow;
      this.mapper = mapper;
    }

    public Builder<T> key(String... cols) {
      for (String c : cols) {
        keyColumns.add(c);
        columns.add(c);
      }
      return this;
    }

    public Builder<T> immutable(String... cols) {
      columns.addAll(List.of(cols));
      return this;
    }

    public Builder<T> updatable(String... cols) {
      columns.addAll(List.of(cols));
      updatableColumns.addAll(List.of(cols));
      return this;
    }

    public Builder<T> versioned() {
      this.versioned = true;
      return this;
    }

    public ResourceTable<T> build() {
      return new ResourceTable<>(this);
    }
  }
}
