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
public class HostRepository extends AbstractStaticRepository {
  private static final Logger LOG = Logger.getLogger(HostRepository.class);

  @Inject
  public HostRepository(Db db, KeyManager kms, RetryPolicy retryPolicy, FloegateConfig config) {
    this(db, kms, retryPolicy, config.repository().defaultLimit());
  }

  HostRepository(Db db, KeyManager kms, RetryPolicy retryPolicy, int defaultLimit) {
    super(db, kms, retryPolicy, defaultLimit);
  }

  /**
   * Inserts {@code h} into its catalog. The address is trimmed and must be between 3 and 255
   * characters; a name must be unique within the catalog.
   */
  public Host createHost(String scopeId, Host h, RepositoryOption... opt) {
    if (h == null) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "static.CreateHost", "no static host");
    }
    if (isBlank(h.catalogId())) {
      throw Errors.error(ErrorCode.MISSING_CATALOG_ID, "static.CreateHost");
    }
    if (!isBlank(h.publicId())) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "static.CreateHost", "public id not empty");
    }
    if (isBlank(scopeId)) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.CreateHost");
    }
    String address = h.address() == null ? null : h.address().trim();
    if (!Host.validAddress(address)) {
      throw Errors.error(ErrorCode.INVALID_ADDRESS, "static.CreateHost");
    }
    var opts = RepositoryOptions.of(opt);
    Host toCreate =
        h.withAddress(address)
            .withPublicId(
                assignPublicId(
                    opts,
                    StaticHostIds.HOST_PREFIX,
                    StaticHostIds::newHostId,
                    "static.CreateHost"));

    var L = LogHelper.start(LOG, "CreateHost");
    var created = new AtomicReference<Host>();
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.CreateHost");
            created.set(
                w.create(
                    toCreate,
                    DbOption.withOplog(wrapper, toCreate.oplog(OpType.OP_TYPE_CREATE))));
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(
          e, "static.CreateHost", "catalog: " + h.catalogId() + ": \"" + h.name() + "\"");
    }
    L.okf("id=%s", created.get().publicId());
    return created.get();
  }

  /**
   * Updates {@code h.publicId()} at {@code version}. Only {@code name}, {@code description} and
   * {@code address} may be masked; an empty masked value is set to NULL.
   */
  public Updated<Host> updateHost(String scopeId, Host h, int version, List<String> fieldMask) {
    if (h == null) {
      throw Errors.error(ErrorCode.INVALID_PARAMETER, "static.UpdateHost", "no static host");
    }
    if (isBlank(h.publicId())) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.UpdateHost");
    }
    if (version == 0) {
      throw Errors.error(ErrorCode.MISSING_VERSION, "static.UpdateHost");
    }
    if (isBlank(scopeId)) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.UpdateHost");
    }

    Host target = h;
    var dbMask = new ArrayList<String>();
    var nullFields = new ArrayList<String>();
    if (fieldMask != null) {
      for (String f : fieldMask) {
        String path = f == null ? "" : f.trim().toLowerCase(Locale.ROOT);
        switch (path) {
          case "name":
            (isBlank(h.name()) ? nullFields : dbMask).add("name");
            break;
          case "description":
            (isBlank(h.description()) ? nullFields : dbMask).add("description");
            break;
          case "address":
            String address = h.address() == null ? null : h.address().trim();
            if (!Host.validAddress(address)) {
              throw Errors.error(ErrorCode.INVALID_ADDRESS, "static.UpdateHost");
            }
            target = target.withAddress(address);
            dbMask.add("address");
            break;
          default:
            throw Errors.error(
                ErrorCode.INVALID_FIELD_MASK,
                "static.UpdateHost",
                "invalid field mask: " + f,
                Errors.INVALID_FIELD_MASK);
        }
      }
    }
    if (dbMask.isEmpty() && nullFields.isEmpty()) {
      throw Errors.error(ErrorCode.EMPTY_FIELD_MASK, "static.UpdateHost");
    }

    Host toUpdate = target;
    var L = LogHelper.start(LOG, "UpdateHost");
    var rowsUpdated = new AtomicInteger();
    var returned = new AtomicReference<Host>(toUpdate);
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.UpdateHost");
            int rows =
                w.update(
                    toUpdate,
                    dbMask,
                    nullFields,
                    DbOption.withOplog(wrapper, toUpdate.oplog(OpType.OP_TYPE_UPDATE)),
                    DbOption.withVersion(version));
            if (rows > 1) {
              throw Errors.error(ErrorCode.MULTIPLE_RECORDS, "static.UpdateHost");
            }
            rowsUpdated.set(rows);
            if (rows == 1) {
              returned.set(r.lookupByPublicId(Host.TABLE, toUpdate.publicId()));
            }
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(
          e, "static.UpdateHost", "catalog: " + h.catalogId() + ": \"" + h.name() + "\"");
    }
    L.okf("id=%s rows=%d", h.publicId(), rowsUpdated.get());
    return new Updated<>(returned.get(), rowsUpdated.get());
  }

  /** Empty when no host has {@code publicId}. */
  public Optional<Host> lookupHost(String publicId) {
    if (isBlank(publicId)) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.LookupHost");
    }
    try {
      return Optional.of(db.reader().lookupByPublicId(Host.TABLE, publicId));
    } catch (DomainException e) {
      if (Errors.is(e, Errors.RECORD_NOT_FOUND)) {
        return Optional.empty();
      }
      throw Errors.wrap(e, "static.LookupHost", "lookup failed for " + publicId);
    } catch (SQLException e) {
      throw Errors.wrap(e, "static.LookupHost", "lookup failed for " + publicId);
    }
  }

  public List<Host> listHosts(String catalogId, RepositoryOption... opt) {
    if (isBlank(catalogId)) {
      throw Errors.error(ErrorCode.MISSING_CATALOG_ID, "static.ListHosts");
    }
    int limit = limit(RepositoryOptions.of(opt));
    try {
      return db.reader()
          .searchWhere(Host.TABLE, "catalog_id = ?", List.of(catalogId), DbOption.withLimit(limit));
    } catch (SQLException e) {
      throw Errors.wrap(e, "static.ListHosts");
    }
  }

  /** Returns the number of hosts deleted, 0 when {@code publicId} does not exist. */
  public int deleteHost(String scopeId, String publicId) {
    if (isBlank(publicId)) {
      throw Errors.error(ErrorCode.MISSING_PUBLIC_ID, "static.DeleteHost");
    }
    if (isBlank(scopeId)) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, "static.DeleteHost");
    }
    Host h = new Host(publicId, null, null, null, null, 0, null, null);

    var L = LogHelper.start(LOG, "DeleteHost");
    var rowsDeleted = new AtomicInteger();
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.DeleteHost");
            int rows = w.delete(h, DbOption.withOplog(wrapper, h.oplog(OpType.OP_TYPE_DELETE)));
            if (rows > 1) {
              throw Errors.error(ErrorCode.MULTIPLE_RECORDS, "static.DeleteHost");
            }
            rowsDeleted.set(rows);
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.DeleteHost", "failed to delete " + publicId);
    }
    L.okf("id=%s rows=%d", publicId, rowsDeleted.get());
    return rowsDeleted.get();
  }
}
