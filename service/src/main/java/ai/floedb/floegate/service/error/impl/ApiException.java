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

package ai.floedb.floegate.service.error.impl;

import java.util.Map;
import java.util.TreeMap;

/** A request error whose status, code and message are meant for the client as they are. */
public class ApiException extends RuntimeException {
  private final int status;
  private final String code;
  private final Map<String, String> fields;

  ApiException(int status, String code, String message, Map<String, String> fields) {
    super(message);
    this.status = status;
    this.code = code;
    this.fields = fields == null ? Map.of() : new TreeMap<>(fields);
  }

  public int status() {
    return status;
  }

  public String code() {
    return code;
  }

  /** Field name to description, sorted by name. */
  public Map<String, String> fields() {
    return fields;
  }
}
