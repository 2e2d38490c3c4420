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

/** Resolved view of a set of {@link DbOption}s. */
public final class DbOptions {
  public static final int DEFAULT_LIMIT = 10000;

  Wrapper oplogWrapper;
  OplogMetadata oplogMetadata;
  List<OplogMessage> oplogSink;
  Integer version;
  int limit;

  private DbOptions() {}

  public static DbOptions of(DbOption... opts) {
    var o = new DbOptions();
    if (opts != null) {
      for (DbOption opt : opts) {
        if (opt != null) {
          opt.apply(o);
        }
      }
    }
    return o;
  }

  public Wrapper oplogWrapper() {
    return oplogWrapper;
  }

  public OplogMetadata oplogMetadata() {
    return oplogMetadata;
  }

  public boolean writeOplog() {
    return oplogWrapper != null;
  }

  public List<OplogMessage> oplogSink() {
    return oplogSink;
  }

  public Integer version() {
    return version;
  }

  /** Effective row limit; negative for unlimited. */
  public int limit() {
    return limit == 0 ? DEFAULT_LIMIT : limit;
  }
}
