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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Ordered multimap of oplog entry metadata. */
public final class OplogMetadata {
  public static final String RESOURCE_PUBLIC_ID = "resource-public-id";
  public static final String RESOURCE_TYPE = "resource-type";
  public static final String SCOPE_ID = "scope-id";
  public static final String CATALOG_ID = "catalog-id";
  public static final String OP_TYPE = "op-type";

  private final Map<String, List<String>> values = new LinkedHashMap<>();

  public OplogMetadata put(String key, String value) {
    values.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    return this;
  }

  public OplogMetadata addOpType(OpType opType) {
    return put(OP_TYPE, opType.name());
  }

  public List<String> get(String key) {
    return Collections.unmodifiableList(values.getOrDefault(key, List.of()));
  }

  public Map<String, List<String>> asMap() {
    var copy = new LinkedHashMap<String, List<String>>();
    values.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(copy);
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
