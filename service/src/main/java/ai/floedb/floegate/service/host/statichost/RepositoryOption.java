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

/** Option accepted by the static host repositories. */
@FunctionalInterface
public interface RepositoryOption {

  void apply(RepositoryOptions opts);

  /** Overrides the repository default limit; negative means unlimited. */
  static RepositoryOption withLimit(int limit) {
    return o -> o.limit = limit;
  }

  /** Creates the resource under {@code publicId} instead of a generated id. */
  static RepositoryOption withPublicId(String publicId) {
    return o -> o.publicId = publicId;
  }
}
