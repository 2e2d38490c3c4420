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
 * Domain error raised by repositories and the store layer.
 *
 * <p>The {@code errorId} is an opaque tag naming the call site. It is for diagnostics only and
 * must never drive control flow; use {@link Errors#match} or {@link Errors#is} instead.
 */
public class DomainException extends RuntimeException {

  private final ErrorCode code;
  private final String errorId;
  private final String msg;

  DomainException(ErrorCode code, String errorId, String msg, Throwable wrapped) {
    this(code, errorId, msg, wrapped, true);
  }

  DomainException(
      ErrorCode code, String errorId, String msg, Throwable wrapped, boolean writableStackTrace) {
    super(null, wrapped, false, writableStackTrace);
    this.code = code == null ? ErrorCode.UNKNOWN : code;
    this.errorId = errorId == null ? "" : errorId;
    this.msg = msg == null ? "" : msg;
  }

  public ErrorCode code() {
    return code;
  }

  public Kind kind() {
    return code.kind();
  }

  public String errorId() {
    return errorId;
  }

  /** The caller supplied message, empty when the code's default applies. */
  public String msg() {
    return msg;
  }

  public Throwable wrapped() {
    return getCause();
  }

  /**
   * Renders {@code [id: ][msg: ]<default, kind | kind>: error #<code>[: \n<wrapped>]}. Log
   * scrapers depend on this layout.
   */
  @Override
  public String getMessage() {
    var sb = new StringBuilder();
    join(sb, ": ", errorId);
    join(sb, ": ", msg);
    if (msg.isEmpty()) {
      join(sb, ": ", code.message());
      join(sb, ", ", code.kind().text());
    } else {
      join(sb, ": ", code.kind().text());
    }
    join(sb, ": ", "error #" + code.code());
    Throwable wrapped = getCause();
    if (wrapped != null) {
      join(sb, ": \n", String.valueOf(wrapped.getMessage()));
    }
    return sb.toString();
  }

  private static void join(StringBuilder sb, String delim, String s) {
    if (s == null || s.isEmpty()) {
      return;
    }
    if (sb.length() > 0) {
      sb.append(delim);
    }
    sb.append(s);
  }
}
