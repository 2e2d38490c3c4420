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

import ai.floedb.floegate.service.db.PublicIds;

/** Public id prefixes of the static host resources. */
public final class StaticHostIds {
  public static final String HOST_CATALOG_PREFIX = "hcst";
  public static final String HOST_PREFIX = "hst";
  public static final String HOST_SET_PREFIX = "hsst";

  private StaticHostIds() {}

  public static String newHostCatalogId() {
    return PublicIds.newPublicId(HOST_CATALOG_PREFIX);
  }

  public static String newHostId() {
    return PublicIds.newPublicId(HOST_PREFIX);
  }

  public static String newHostSetId() {
    return PublicIds.newPublicId(HOST_SET_PREFIX);
  }
}
