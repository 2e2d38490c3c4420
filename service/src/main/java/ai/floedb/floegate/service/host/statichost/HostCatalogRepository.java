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

import ai.floedb.floegate.service.common.LogHelper;
import ai.floedb.floegate.service.config.FloegateConfig;
import ai.floedb.floegate.service.db.Db;
import ai.floedb.floegate.service.db.DbOption;
import ai.floedb.floegate.service.db.RetryPolicy;
import ai.floedb.floegate.service.error.DomainException;
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import ai.floedb.floegate.service.kms.KeyManager;
import ai.floedb.floegate.service.kms.Wrapper;
import ai.floedb.floegate.service.oplog.OpType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

@ApplicationScoped
public class HostCatalogRepository extends AbstractStaticRepository {
  private static final Logger LOG = Logger.getLogger(HostCatalogRepository.class);

  @Inject
  public HostCatalogRepository(
      Db db, KeyManager kms, RetryPolicy retryPolicy, FloegateConfig config) {
    this(db, kms, retryPolicy, config.repository().defaultLimit());
  }

  HostCatalogRepository(Db db, KeyManager kms, RetryPolicy retryPolicy, int defaultLimit) {
    super(db, kms, retryPolicy, defaultLimit);
  }

  /**
   * Inserts {@code c} and returns it as stored. {@code c} must carry a scope id and no public id;
   * the id is generated unless {@link RepositoryOption#withPublicId} supplies one with the {@code
   * hcst} prefix. A name must be unique within the scope.
   */
  public HostCatalog createCatalog(HostCatalog c, RepositoryOption... opt) {
    if (c == null) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER, "static.CreateCatalog", "no static host catalog");
    }
    if (isBlank(c.scopeId())) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.CreateCatalog");
    }
    if (!isBlank(c.publicId())) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER, "static.CreateCatalog", "public id not empty");
    }
    var opts = RepositoryOptions.of(opt);
    HostCatalog toCreate =
        c.withPublicId(
            assignPublicId(
                opts,
                StaticHostIds.HOST_CATALOG_PREFIX,
                StaticHostIds::newHostCatalogId,
                "static.CreateCatalog"));

    var L = LogHelper.start(LOG, "CreateCatalog");
    var created = new AtomicReference<HostCatalog>();
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(toCreate.scopeId(), "static.CreateCatalog");
            created.set(
                w.create(
                    toCreate,
                    DbOption.withOplog(wrapper, toCreate.oplog(OpType.OP_TYPE_CREATE))));
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.CreateCatalog", "scope: " + c.scopeId());
    }
    L.okf("id=%s", created.get().publicId());
    return created.get();
  }

  /**
   * Updates the catalog {@code c.publicId()} at {@code version} with the fields in {@code
   * fieldMask}. Only {@code name} and {@code description} may be updated; a masked field whose
   * value is empty is set to NULL.
   */
  public Updated<HostCatalog> updateCatalog(HostCatalog c, int version, List<String> fieldMask) {
    if (c == null) {
      throw Errors.error(
          ErrorCode.INVALID_PARAMETER, "static.UpdateCatalog", "no static host catalog");
    }
    if (isBlank(c.publicId())) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.UpdateCatalog");
    }
    if (isBlank(c.scopeId())) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.UpdateCatalog");
    }
    if (version == 0) {
      throw Errors.error(ErrorCode.MISSING_VERSION, "static.UpdateCatalog");
    }
    if (fieldMask == null || fieldMask.isEmpty()) {
      throw Errors.error(ErrorCode.EMPTY_FIELD_MASK, "static.UpdateCatalog");
    }

    var dbMask = new ArrayList<String>();
    var nullFields = new ArrayList<String>();
    for (String f : fieldMask) {
      String path = f == null ? "" : f.trim().toLowerCase(Locale.ROOT);
      switch (path) {
        case "name":
          (isBlank(c.name()) ? nullFields : dbMask).add("name");
          break;
        case "description":
          (isBlank(c.description()) ? nullFields : dbMask).add("description");
          break;
        default:
          throw Errors.error(
              ErrorCode.INVALID_FIELD_MASK,
              "static.UpdateCatalog",
              "invalid field mask: " + f,
              Errors.INVALID_FIELD_MASK);
      }
    }

    var L = LogHelper.start(LOG, "UpdateCatalog");
    var rowsUpdated = new AtomicInteger();
    var returned = new AtomicReference<HostCatalog>(c);
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(c.scopeId(), "static.UpdateCatalog");
            int rows =
                w.update(
                    c,
                    dbMask,
                    nullFields,
                    DbOption.withOplog(wrapper, c.oplog(OpType.OP_TYPE_UPDATE)),
                    DbOption.withVersion(version));
            if (rows > 1) {
              throw Errors.error(ErrorCode.MULTIPLE_RECORDS, "static.UpdateCatalog");
            }
            rowsUpdated.set(rows);
            returned.set(rows == 1 ? r.lookupByPublicId(HostCatalog.TABLE, c.publicId()) : c);
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.UpdateCatalog", "static host catalog: " + c.publicId());
    }
    L.okf("id=%s rows=%d", c.publicId(), rowsUpdated.get());
    return new Updated<>(returned.get(), rowsUpdated.get());
  }

  /** Empty when no catalog has {@code id}. */
  public Optional<HostCatalog> lookupCatalog(String id) {
    if (isBlank(id)) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.LookupCatalog");
    }
    try {
      return Optional.of(db.reader().lookupByPublicId(HostCatalog.TABLE, id));
    } catch (DomainException e) {
      if (Errors.is(e, Errors.RECORD_NOT_FOUND)) {
        return Optional.empty();
      }
      throw Errors.wrap(e, "static.LookupCatalog", "lookup failed for " + id);
    } catch (SQLException e) {
      throw Errors.wrap(e, "static.LookupCatalog", "lookup failed for " + id);
    }
  }

  public List<HostCatalog> listCatalogs(String scopeId, RepositoryOption... opt) {
    if (isBlank(scopeId)) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.ListCatalogs");
    }
    int limit = limit(RepositoryOptions.of(opt));
    try {
      return db.reader()
          .searchWhere(
              HostCatalog.TABLE, "scope_id = ?", List.of(scopeId), DbOption.withLimit(limit));
    } catch (SQLException e) {
      throw Errors.wrap(e, "static.ListCatalogs");
    }
  }

  /** Deletes the catalog with its hosts and sets. Returns 0 when it does not exist. */
  public int deleteCatalog(String id) {
    if (isBlank(id)) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.DeleteCatalog");
    }
    Optional<HostCatalog> found = lookupCatalog(id);
    if (found.isEmpty()) {
      return 0;
    }
    HostCatalog c = found.get();
    if (isBlank(c.scopeId())) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.DeleteCatalog");
    }

    var L = LogHelper.start(LOG, "DeleteCatalog");
    var rowsDeleted = new AtomicInteger();
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(c.scopeId(), "static.DeleteCatalog");
            int rows =
                w.delete(c, DbOption.withOplog(wrapper, c.oplog(OpType.OP_TYPE_DELETE)));
            if (rows > 1) {
              throw Errors.error(ErrorCode.MULTIPLE_RECORDS, "static.DeleteCatalog");
            }
            rowsDeleted.set(rows);
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.DeleteCatalog", "failed to delete " + id);
    }
    L.okf("id=%s rows=%d", id, rowsDeleted.get());
    return rowsDeleted.get();
  }
}
