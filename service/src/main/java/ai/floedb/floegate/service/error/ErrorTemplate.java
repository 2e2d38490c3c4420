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
 * Partial description of a domain error. Only the fields that are set take part in {@link
 * Errors#match}.
 */
public final class ErrorTemplate {
  private final ErrorCode code;
  private final Kind kind;

  private ErrorTemplate(ErrorCode code, Kind kind) {
    this.code = code;
    this.kind = kind;
  }

  public static ErrorTemplate of(ErrorCode code) {
    return new ErrorTemplate(code, null);
  }

  public static ErrorTemplate of(Kind kind) {
    return new ErrorTemplate(null, kind);
  }

  boolean matches(DomainException e) {
    if (code != null && code != e.code()) {
      return false;
    }
    return kind == null || kind == e.kind();
  }
}
