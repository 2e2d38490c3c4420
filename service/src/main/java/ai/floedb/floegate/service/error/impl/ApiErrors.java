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

import jakarta.ws.rs.core.Response;
import java.util.Map;

public final class ApiErrors {
  public static final String NOT_FOUND = "NotFound";
  public static final String INVALID_ARGUMENT = "InvalidArgument";
  public static final String UNIMPLEMENTED = "Unimplemented";
  public static final String INTERNAL = "Internal";

  private ApiErrors() {}

  public static ApiException notFound(String fmt, Object... args) {
    return new ApiException(
        Response.Status.NOT_FOUND.getStatusCode(), NOT_FOUND, String.format(fmt, args), Map.of());
  }

  public static ApiException invalidArgument(String msg, Map<String, String> fields) {
    return new ApiException(
        Response.Status.BAD_REQUEST.getStatusCode(), INVALID_ARGUMENT, msg, fields);
  }
}
