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

package ai.floedb.floegate.service.host.statichost;

import java.util.List;

/**
 * @param hosts full membership of the set after the call
 * @param changed members added plus members removed
 */
public record SetMembersResult(List<Host> hosts, int changed) {
  public SetMembersResult {
    hosts = hosts == null ? List.of() : List.copyOf(hosts);
  }
}
