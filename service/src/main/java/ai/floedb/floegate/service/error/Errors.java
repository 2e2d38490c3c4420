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

package ai.floedb.floegate.service.error;

import java.sql.SQLException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Factories and chain inspection helpers for {@link DomainException}. */
public final class Errors {

  public static final DomainException INVALID_PARAMETER =
      sentinel(ErrorCode.INVALID_PARAMETER, "invalid parameter");
  public static final DomainException INVALID_FIELD_MASK =
      sentinel(ErrorCode.INVALID_FIELD_MASK, "invalid field mask");
  public static final DomainException EMPTY_FIELD_MASK =
      sentinel(ErrorCode.EMPTY_FIELD_MASK, "empty field mask");
  public static final DomainException NOT_UNIQUE =
      sentinel(ErrorCode.NOT_UNIQUE, "unique constraint violation");
  public static final DomainException NOT_NULL =
      sentinel(ErrorCode.NOT_NULL, "not null constraint violated");
  public static final DomainException CHECK_CONSTRAINT =
      sentinel(ErrorCode.CHECK_CONSTRAINT, "check constraint violated");
  public static final DomainException RECORD_NOT_FOUND =
      sentinel(ErrorCode.RECORD_NOT_FOUND, "record not found");
  public static final DomainException MULTIPLE_RECORDS =
      sentinel(ErrorCode.MULTIPLE_RECORDS, "multiple records");

  private static final String SQL_STATE_UNIQUE_VIOLATION = "23505";
  private static final String SQL_STATE_NOT_NULL_VIOLATION = "23502";
  private static final String SQL_STATE_CHECK_VIOLATION_POSTGRES = "23514";
  private static final String SQL_STATE_CHECK_VIOLATION_H2 = "23513";
  private static final String SQL_STATE_INTEGRITY_CLASS = "23";
  private static final Set<String> SQL_STATES_UNDEFINED_TABLE = Set.of("42P01", "42S02");

  private Errors() {}

  public static DomainException error(ErrorCode code, String id) {
    return new DomainException(code, id, null, null);
  }

  public static DomainException error(ErrorCode code, String id, String msg) {
    return new DomainException(code, id, msg, null);
  }

  public static DomainException error(ErrorCode code, String id, String msg, Throwable wrapped) {
    return new DomainException(code, id, msg, wrapped);
  }

  /**
   * Wraps {@code err}. A domain error keeps its code and becomes the cause; anything else becomes
   * the cause of an {@link ErrorCode#UNKNOWN} error.
   */
  public static DomainException wrap(Throwable err, String id) {
    return wrap(err, id, null);
  }

  public static DomainException wrap(Throwable err, String id, String msg) {
    Objects.requireNonNull(err, "err");
    if (err instanceof DomainException de) {
      return new DomainException(de.code(), id, msg, de);
    }
    return new DomainException(ErrorCode.UNKNOWN, id, msg, err);
  }

  /**
   * Classifies a store failure. Returns empty when {@code err} is null or carries no recognized
   * SQL state; callers then raise their own {@link ErrorCode#UNKNOWN} error.
   */
  public static Optional<DomainException> convert(Throwable err, String id) {
    if (err == null) {
      return Optional.empty();
    }
    SQLException sqlError = find(err, SQLException.class);
    if (sqlError == null || sqlError.getSQLState() == null) {
      return Optional.empty();
    }
    String state = sqlError.getSQLState();
    String detail = sqlError.getMessage();
    if (state.startsWith(SQL_STATE_INTEGRITY_CLASS)) {
      switch (state) {
        case SQL_STATE_UNIQUE_VIOLATION:
          return Optional.of(error(ErrorCode.NOT_UNIQUE, id, detail, NOT_UNIQUE));
        case SQL_STATE_NOT_NULL_VIOLATION:
          return Optional.of(error(ErrorCode.NOT_NULL, id, detail, NOT_NULL));
        case SQL_STATE_CHECK_VIOLATION_POSTGRES:
        case SQL_STATE_CHECK_VIOLATION_H2:
          return Optional.of(error(ErrorCode.CHECK_CONSTRAINT, id, detail, CHECK_CONSTRAINT));
        default:
          return Optional.of(error(ErrorCode.NOT_SPECIFIC_INTEGRITY, id, detail));
      }
    }
    if (SQL_STATES_UNDEFINED_TABLE.contains(state)) {
      return Optional.of(error(ErrorCode.MISSING_TABLE, id, detail));
    }
    return Optional.empty();
  }

  /** True when {@code target} is {@code err} itself or appears in its cause chain. */
  public static boolean is(Throwable err, Throwable target) {
    if (err == null || target == null) {
      return err == target;
    }
    var seen = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
    for (Throwable t = err; t != null && seen.add(t); t = t.getCause()) {
      if (t == target) {
        return true;
      }
    }
    return false;
  }

  /** Matches the first domain error in the cause chain of {@code err} against {@code template}. */
  public static boolean match(ErrorTemplate template, Throwable err) {
    if (template == null || err == null) {
      return false;
    }
    DomainException de = find(err, DomainException.class);
    return de != null && template.matches(de);
  }

  public static boolean match(ErrorCode code, Throwable err) {
    return match(ErrorTemplate.of(code), err);
  }

  /** First throwable of {@code type} in the cause chain, or null. */
  public static <T extends Throwable> T find(Throwable err, Class<T> type) {
    var seen = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
    for (Throwable t = err; t != null && seen.add(t); t = t.getCause()) {
      if (type.isInstance(t)) {
        return type.cast(t);
      }
    }
    return null;
  }

  private static DomainException sentinel(ErrorCode code, String msg) {
    return new DomainException(code, "", msg, null, false);
  }
}
