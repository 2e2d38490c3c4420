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

import ai.floedb.floegate.service.db.PublicIds;
import ai.floedb.floegate.service.error.DomainException;
import ai.floedb.floegate.service.error.Errors;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Renders any failure as an {@link ApiError}. Only request errors, field mask errors, uniqueness
 * violations and missing records are described to the client; everything else becomes an opaque
 * 500 whose error id is logged together with the full cause chain.
 */
@ApplicationScoped
public class ApiErrorHandler {
  private static final Logger LOG = Logger.getLogger(ApiErrorHandler.class);

  public static final String GENERIC_UNIQUENESS_MSG =
      "Invalid request.  Request attempted to make second resource with the same field value that"
          + " must be unique.";
  static final String GENERIC_NOT_FOUND_MSG = "Unable to find requested resource.";
  static final String INVALID_REQUEST_MSG = "Error in provided request";
  static final String UPDATE_MASK_FIELD = "update_mask";
  static final String UPDATE_MASK_DESCRIPTION = "Invalid update mask provided.";

  private static final int ERROR_ID_LENGTH = 10;

  public ApiError toApiError(Throwable t) {
    if (t instanceof NotFoundException) {
      var status = Response.Status.NOT_FOUND;
      return new ApiError(
          status.getStatusCode(), ApiErrors.NOT_FOUND, status.getReasonPhrase(), null);
    }
    if (t instanceof ApiException ae) {
      return new ApiError(ae.status(), ae.code(), ae.getMessage(), details(ae));
    }
    Status rpcStatus = rpcStatus(t);
    if (rpcStatus != null && rpcStatus.getCode() == Status.Code.UNIMPLEMENTED) {
      return new ApiError(
          Response.Status.METHOD_NOT_ALLOWED.getStatusCode(),
          ApiErrors.UNIMPLEMENTED,
          rpcStatus.getDescription(),
          null);
    }
    DomainException de = Errors.find(t, DomainException.class);
    if (de != null) {
      switch (de.code()) {
        case INVALID_FIELD_MASK:
        case EMPTY_FIELD_MASK:
          return new ApiError(
              Response.Status.BAD_REQUEST.getStatusCode(),
              ApiErrors.INVALID_ARGUMENT,
              INVALID_REQUEST_MSG,
              new ApiError.Details(
                  List.of(new ApiError.FieldError(UPDATE_MASK_FIELD, UPDATE_MASK_DESCRIPTION)),
                  null));
        case NOT_UNIQUE:
          return new ApiError(
              Response.Status.BAD_REQUEST.getStatusCode(),
              ApiErrors.INVALID_ARGUMENT,
              GENERIC_UNIQUENESS_MSG,
              null);
        case RECORD_NOT_FOUND:
          return new ApiError(
              Response.Status.NOT_FOUND.getStatusCode(),
              ApiErrors.NOT_FOUND,
              GENERIC_NOT_FOUND_MSG,
              null);
        default:
          break;
      }
    }
    return internal(t);
  }

  private ApiError internal(Throwable t) {
    String errorId = PublicIds.random(ERROR_ID_LENGTH);
    LOG.errorf(t, "internal error returned, error id %s", errorId);
    return new ApiError(
        Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
        ApiErrors.INTERNAL,
        null,
        new ApiError.Details(null, errorId));
  }

  private static ApiError.Details details(ApiException ae) {
    if (ae.fields().isEmpty()) {
      return null;
    }
    var fields = new ArrayList<ApiError.FieldError>(ae.fields().size());
    ae.fields().forEach((name, desc) -> fields.add(new ApiError.FieldError(name, desc)));
    return new ApiError.Details(fields, null);
  }

  private static Status rpcStatus(Throwable t) {
    StatusRuntimeException sre = Errors.find(t, StatusRuntimeException.class);
    if (sre != null) {
      return sre.getStatus();
    }
    StatusException se = Errors.find(t, StatusException.class);
    return se == null ? null : se.getStatus();
  }
}
