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

/**
 * Closed set of domain error codes. Each code carries its {@link Kind} and a default message used
 * when a {@link DomainException} is raised without one.
 *
 * <p>Codes 100-999 are reserved for general function errors, 1000-1999 for store errors.
 */
public enum ErrorCode {
  UNKNOWN(0, Kind.OTHER, "unknown"),

  INVALID_PARAMETER(100, Kind.PARAMETER, "invalid parameter"),
  INVALID_ADDRESS(101, Kind.PARAMETER, "invalid address"),
  INVALID_FIELD_MASK(103, Kind.PARAMETER, "invalid field mask"),
  EMPTY_FIELD_MASK(104, Kind.PARAMETER, "empty field"),
  MISSING_SCOPE_ID(110, Kind.PARAMETER, "missing scope id"),
  MISSING_PUBLIC_ID(111, Kind.PARAMETER, "missing public id"),
  MISSING_SET_ID(112, Kind.PARAMETER, "missing set id"),
  MISSING_VERSION(113, Kind.PARAMETER, "missing version"),
  MISSING_CATALOG_ID(114, Kind.PARAMETER, "missing catalog id"),
  MISSING_HOST_IDS(115, Kind.PARAMETER, "missing host ids"),
  GENERATE_ID(116, Kind.PARAMETER, "failed to generate ID"),

  CHECK_CONSTRAINT(1000, Kind.INTEGRITY, "constraint check failed"),
  NOT_NULL(1001, Kind.INTEGRITY, "must not be empty (null) violation"),
  NOT_UNIQUE(1002, Kind.INTEGRITY, "must be unique violation"),
  NOT_SPECIFIC_INTEGRITY(1003, Kind.INTEGRITY, "Integrity violation without specific details"),
  MISSING_TABLE(1004, Kind.INTEGRITY, "missing table"),

  RECORD_NOT_FOUND(1100, Kind.SEARCH, "record not found"),
  MULTIPLE_RECORDS(1101, Kind.SEARCH, "multiple records");

  private final int code;
  private final Kind kind;
  private final String message;

  ErrorCode(int code, Kind kind, String message) {
    this.code = code;
    this.kind = kind;
    this.message = message;
  }

  public int code() {
    return code;
  }

  public Kind kind() {
    return kind;
  }

  public String message() {
    return message;
  }

  public static ErrorCode forNumber(int code) {
    for (ErrorCode c : values()) {
      if (c.code == code) {
        return c;
      }
    }
    return UNKNOWN;
  }
}
