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
public class HostSetRepository extends AbstractStaticRepository {
  private static final Logger LOG = Logger.getLogger(HostSetRepository.class);

  @Inject
  public HostSetRepository(
      Db db, KeyManager kms, RetryPolicy retryPolicy, FloegateConfig config) {
    this(db, kms, retryPolicy, config.repository().defaultLimit());
  }

  HostSetRepository(Db db, KeyManager kms, RetryPolicy retryPolicy, int defaultLimit) {
    super(db, kms, retryPolicy, defaultLimit);
  }

  public HostSet createSet(String scopeId, HostSet s, RepositoryOption... opt) {
    if (s == null) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "static.CreateSet", "no static host set");
    }
    if (isBlank(s.catalogId())) {
      throw Errors.error(ErrorCode.MISSING_CATALOG_ID, "static.CreateSet");
    }
    if (!isBlank(s.publicId())) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "static.CreateSet", "public id not empty");
    }
    if (isBlank(scopeId)) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.CreateSet");
    }
    var opts = RepositoryOptions.of(opt);
    HostSet toCreate =
        s.withPublicId(
            assignPublicId(
                opts,
                StaticHostIds.HOST_SET_PREFIX,
                StaticHostIds::newHostSetId,
                "static.CreateSet"));

    var L = LogHelper.start(LOG, "CreateSet");
    var created = new AtomicReference<HostSet>();
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.CreateSet");
            created.set(
                w.create(
                    toCreate,
                    DbOption.withOplog(wrapper, toCreate.oplog(OpType.OP_TYPE_CREATE))));
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(
          e, "static.CreateSet", "catalog: " + s.catalogId() + ": \"" + s.name() + "\"");
    }
    L.okf("id=%s", created.get().publicId());
    return created.get();
  }

  /** Only {@code name} and {@code description} may be masked. */
  public Updated<HostSet> updateSet(
      String scopeId, HostSet s, int version, List<String> fieldMask) {
    if (s == null) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "static.UpdateSet", "no static host set");
    }
    if (isBlank(s.publicId())) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.UpdateSet");
    }
    if (version == 0) {
      throw Errors.error(ErrorCode.MISSING_VERSION, "static.UpdateSet");
    }
    if (isBlank(scopeId)) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.UpdateSet");
    }
    if (fieldMask == null || fieldMask.isEmpty()) {
      throw Errors.error(ErrorCode.EMPTY_FIELD_MASK, "static.UpdateSet");
    }

    var dbMask = new ArrayList<String>();
    var nullFields = new ArrayList<String>();
    for (String f : fieldMask) {
      String path = f == null ? "" : f.trim().toLowerCase(Locale.ROOT);
      switch (path) {
        case "name":
          (isBlank(s.name()) ? nullFields : dbMask).add("name");
          break;
        case "description":
          (isBlank(s.description()) ? nullFields : dbMask).add("description");
          break;
        default:
          throw Errors.error(
              ErrorCode.INVALID_FIELD_MASK,
              "static.UpdateSet",
              "invalid field mask: " + f,
              Errors.INVALID_FIELD_MASK);
      }
    }

    var L = LogHelper.start(LOG, "UpdateSet");
    var rowsUpdated = new AtomicInteger();
    var returned = new AtomicReference<HostSet>(s);
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.UpdateSet");
            int rows =
                w.update(
                    s,
                    dbMask,
                    nullFields,
                    DbOption.withOplog(wrapper, s.oplog(OpType.OP_TYPE_UPDATE)),
                    DbOption.withVersion(version));
            if (rows > 1) {
              throw Errors.error(ErrorCode.MULTIPLE_RECORDS, "static.UpdateSet");
            }
            rowsUpdated.set(rows);
            if (rows == 1) {
              returned.set(r.lookupByPublicId(HostSet.TABLE, s.publicId()));
            }
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.UpdateSet", "static host set: " + s.publicId());
    }
    L.okf("id=%s rows=%d", s.publicId(), rowsUpdated.get());
    return new Updated<>(returned.get(), rowsUpdated.get());
  }

  public Optional<HostSet> lookupSet(String publicId) {
    if (isBlank(publicId)) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.LookupSet");
    }
    try {
      return Optional.of(db.reader().lookupByPublicId(HostSet.TABLE, publicId));
    } catch (DomainException e) {
      if (Errors.is(e, Errors.RECORD_NOT_FOUND)) {
        return Optional.empty();
      }
      throw Errors.wrap(e, "static.LookupSet", "lookup failed for " + publicId);
    } catch (SQLException e) {
      throw Errors.wrap(e, "static.LookupSet", "lookup failed for " + publicId);
    }
  }

  public List<HostSet> listSets(String catalogId, RepositoryOption... opt) {
    if (isBlank(catalogId)) {
      throw Errors.error(ErrorCode.MISSING_CATALOG_ID, "static.ListSets");
    }
    int limit = limit(RepositoryOptions.of(opt));
    try {
      return db.reader()
          .searchWhere(
              HostSet.TABLE, "catalog_id = ?", List.of(catalogId), DbOption.withLimit(limit));
    } catch (SQLException e) {
      throw Errors.wrap(e, "static.ListSets");
    }
  }

  /** Deletes the set and its memberships. Returns 0 when {@code publicId} does not exist. */
  public int deleteSet(String scopeId, String publicId) {
    if (isBlank(publicId)) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.DeleteSet");
    }
    if (isBlank(scopeId)) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.DeleteSet");
    }
    HostSet s = HostSet.reference(publicId);

    var L = LogHelper.start(LOG, "DeleteSet");
    var rowsDeleted = new AtomicInteger();
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.DeleteSet");
            int rows = w.delete(s, DbOption.withOplog(wrapper, s.oplog(OpType.OP_TYPE_DELETE)));
            if (rows > 1) {
              throw Errors.error(ErrorCode.MULTIPLE_RECORDS, "static.DeleteSet");
            }
            rowsDeleted.set(rows);
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.DeleteSet", "failed to delete " + publicId);
    }
    L.okf("id=%s rows=%d", publicId, rowsDeleted.get());
    return rowsDeleted.get();
  }
}
