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
import java.util.List;
import java.util.Objects;

/** Option accepted by {@link Reader} and {@link Writer} calls. */
@FunctionalInterface
public interface DbOption {

  void apply(DbOptions opts);

  /** Write an oplog entry for the mutation, sealed by {@code wrapper}. */
  static DbOption withOplog(Wrapper wrapper, OplogMetadata metadata) {
    Objects.requireNonNull(wrapper, "wrapper");
    Objects.requireNonNull(metadata, "metadata");
    return o -> {
      o.oplogWrapper = wrapper;
      o.oplogMetadata = metadata;
    };
  }

  /** Collect the oplog messages of the mutation into {@code sink} instead of writing them. */
  static DbOption newOplogMsgs(List<OplogMessage> sink) {
    Objects.requireNonNull(sink, "sink");
    return o -> o.oplogSink = sink;
  }

  /** Only touch the row if its version still equals {@code version}. */
  static DbOption withVersion(int version) {
    return o -> o.version = version;
  }

  /** Zero means the default limit, negative means unlimited. */
  static DbOption withLimit(int limit) {
    return o -> o.limit = limit;
  }
}
