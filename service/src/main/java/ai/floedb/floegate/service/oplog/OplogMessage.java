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

package ai.floedb.floegate.service.oplog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row mutation inside an oplog entry.
 *
 * @param typeName table the row belongs to
 * @param opType kind of mutation
 * @param fieldMask columns written, update only
 * @param nullMask columns set to NULL, update only
 * @param row column values, nulls allowed; the key columns are always present
 */
public record OplogMessage(
    String typeName,
    OpType opType,
    List<String> fieldMask,
    List<String> nullMask,
    Map<String, Object> row) {

  public OplogMessage {
    fieldMask = fieldMask == null ? List.of() : List.copyOf(fieldMask);
    nullMask = nullMask == null ? List.of() : List.copyOf(nullMask);
    row = row == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(row));
  }
}
