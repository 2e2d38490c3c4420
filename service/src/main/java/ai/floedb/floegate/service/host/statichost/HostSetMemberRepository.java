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
import ai.floedb.floegate.service.db.Reader;
import ai.floedb.floegate.service.db.ResourceTable;
import ai.floedb.floegate.service.db.RetryPolicy;
import ai.floedb.floegate.service.db.Writer;
import ai.floedb.floegate.service.error.DomainException;
import ai.floedb.floegate.service.error.ErrorCode;
import ai.floedb.floegate.service.error.Errors;
import ai.floedb.floegate.service.kms.KeyManager;
import ai.floedb.floegate.service.kms.Wrapper;
import ai.floedb.floegate.service.oplog.OpType;
import ai.floedb.floegate.service.oplog.OplogMessage;
import ai.floedb.floegate.service.oplog.OplogMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

/**
 * Membership of static host sets. Every change bumps the version of the set and writes one oplog
 * entry against it.
 */
@ApplicationScoped
public class HostSetMemberRepository extends AbstractStaticRepository {
  private static final Logger LOG = Logger.getLogger(HostSetMemberRepository.class);

  static final String ACTION_ADD = "add";
  static final String ACTION_DELETE = "delete";

  private static final String MEMBERS_WHERE =
      "public_id IN (SELECT host_id FROM static_host_set_member WHERE set_id = ?)";

  private static final String CATALOG_TARGETS =
      "SELECT h.public_id FROM static_host h"
          + " WHERE h.public_id IN (%1$s)"
          + " AND h.catalog_id ="
          + " (SELECT s.catalog_id FROM static_host_set s WHERE s.public_id = ?)";

  /**
   * Membership delta between the set and a target host list, computed by the store. Hosts outside
   * the set's catalog never count as additions. The {@code %1$s} slot takes the target list.
   */
  private static final String SET_CHANGES_QUERY =
      "SELECT CAST('delete' AS VARCHAR(16)) AS member_action, m.host_id AS host_id"
          + " FROM static_host_set_member m"
          + " WHERE m.set_id = ?"
          + " AND m.host_id NOT IN ("
          + CATALOG_TARGETS
          + ")"
          + " UNION ALL"
          + " SELECT CAST('add' AS VARCHAR(16)) AS member_action, h.public_id AS host_id"
          + " FROM static_host h"
          + " WHERE h.public_id IN (%1$s)"
          + " AND h.catalog_id ="
          + " (SELECT s.catalog_id FROM static_host_set s WHERE s.public_id = ?)"
          + " AND NOT EXISTS (SELECT 1 FROM static_host_set_member e"
          + " WHERE e.set_id = ? AND e.host_id = h.public_id)";

  record Change(String action, String hostId) {}

  @Inject
  public HostSetMemberRepository(
      Db db, KeyManager kms, RetryPolicy retryPolicy, FloegateConfig config) {
    this(db, kms, retryPolicy, config.repository().defaultLimit());
  }

  HostSetMemberRepository(Db db, KeyManager kms, RetryPolicy retryPolicy, int defaultLimit) {
    super(db, kms, retryPolicy, defaultLimit);
  }

  /**
   * Adds {@code hostIds} to {@code setId} at {@code version} and returns every host of the set. A
   * host that is already a member fails the call with NotUnique.
   */
  public List<Host> addSetMembers(
      String scopeId, String setId, int version, List<String> hostIds) {
    validate(scopeId, setId, version, "static.AddSetMembers");
    if (hostIds == null || hostIds.isEmpty()) {
      throw Errors.error(ErrorCode.MISSING_HOST_IDS, "static.AddSetMembers");
    }
    List<HostSetMember> members = newMembers(setId, hostIds);

    var L = LogHelper.start(LOG, "AddSetMembers");
    var hosts = new AtomicReference<List<Host>>(List.of());
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.AddSetMembers");
            HostSet set = HostSet.reference(setId);
            OplogMetadata metadata = set.oplog(OpType.OP_TYPE_CREATE);
            var msgs = new ArrayList<OplogMessage>();
            w.createItems(members, DbOption.newOplogMsgs(msgs));
            bumpVersion(w, wrapper, metadata, msgs, set, version, "static.AddSetMembers");
            hosts.set(members(r, setId, UNLIMITED));
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.AddSetMembers", "set: " + setId);
    }
    L.okf("set=%s added=%d", setId, members.size());
    return hosts.get();
  }

  /** Removes {@code hostIds} from {@code setId}; every id must currently be a member. */
  public int deleteSetMembers(String scopeId, String setId, int version, List<String> hostIds) {
    validate(scopeId, setId, version, "static.DeleteSetMembers");
    if (hostIds == null || hostIds.isEmpty()) {
      throw Errors.error(ErrorCode.MISSING_HOST_IDS, "static.DeleteSetMembers");
    }
    List<HostSetMember> members = newMembers(setId, hostIds);

    var L = LogHelper.start(LOG, "DeleteSetMembers");
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.DeleteSetMembers");
            HostSet set = HostSet.reference(setId);
            OplogMetadata metadata = set.oplog(OpType.OP_TYPE_DELETE);
            List<OplogMessage> msgs = deleteMembers(w, members);
            bumpVersion(w, wrapper, metadata, msgs, set, version, "static.DeleteSetMembers");
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.DeleteSetMembers", "set: " + setId);
    }
    L.okf("set=%s deleted=%d", setId, hostIds.size());
    return hostIds.size();
  }

  /**
   * Replaces the membership of {@code setId} with {@code hostIds}; an empty list removes every
   * member. Nothing is written when the membership already matches.
   */
  public SetMembersResult setSetMembers(
      String scopeId, String setId, int version, List<String> hostIds) {
    validate(scopeId, setId, version, "static.SetSetMembers");
    List<String> target = hostIds == null ? List.of() : hostIds;

    List<Change> changes;
    try {
      changes = changes(db.reader(), setId, target);
    } catch (SQLException e) {
      throw storeFailure(e, "static.SetSetMembers", "set: " + setId);
    }
    var deletions = new ArrayList<HostSetMember>();
    var additions = new ArrayList<HostSetMember>();
    for (Change c : changes) {
      var m = new HostSetMember(setId, c.hostId());
      if (ACTION_DELETE.equals(c.action())) {
        deletions.add(m);
      } else if (ACTION_ADD.equals(c.action())) {
        additions.add(m);
      }
    }

    if (changes.isEmpty()) {
      return new SetMembersResult(listSetMembers(setId, RepositoryOption.withLimit(UNLIMITED)), 0);
    }

    var L = LogHelper.start(LOG, "SetSetMembers");
    var hosts = new AtomicReference<List<Host>>(List.of());
    try {
      db.doTx(
          retryPolicy,
          (r, w) -> {
            Wrapper wrapper = oplogWrapper(scopeId, "static.SetSetMembers");
            HostSet set = HostSet.reference(setId);
            OplogMetadata metadata = set.oplog(OpType.OP_TYPE_UPDATE);
            var msgs = new ArrayList<OplogMessage>();
            if (!deletions.isEmpty()) {
              msgs.addAll(deleteMembers(w, deletions));
              metadata.addOpType(OpType.OP_TYPE_DELETE);
            }
            if (!additions.isEmpty()) {
              w.createItems(additions, DbOption.newOplogMsgs(msgs));
              metadata.addOpType(OpType.OP_TYPE_CREATE);
            }
            bumpVersion(w, wrapper, metadata, msgs, set, version, "static.SetSetMembers");
            hosts.set(members(r, setId, UNLIMITED));
          });
    } catch (SQLException | DomainException e) {
      L.fail(e);
      throw storeFailure(e, "static.SetSetMembers", "set: " + setId);
    }
    L.okf("set=%s added=%d deleted=%d", setId, additions.size(), deletions.size());
    return new SetMembersResult(hosts.get(), changes.size());
  }

  /** Hosts that belong to {@code setId}. */
  public List<Host> listSetMembers(String setId, RepositoryOption... opt) {
    if (isBlank(setId)) {
      throw Errors.error(ErrorCode.MISSING_SET_ID, "static.ListSetMembers");
    }
    int limit = limit(RepositoryOptions.of(opt));
    try {
      return members(db.reader(), setId, limit);
    } catch (SQLException e) {
      throw Errors.wrap(e, "static.ListSetMembers");
    }
  }

  private static void validate(String scopeId, String setId, int version, String id) {
    if (isBlank(scopeId)) {
      throw Errors.error(ErrorCode.MISSING_SCOPE_ID, id);
    }
    if (isBlank(setId)) {
      throw Errors.error(ErrorCode.MISSING_SET_ID, id);
    }
    if (version == 0) {
      throw Errors.error(ErrorCode.MISSING_VERSION, id);
    }
  }

  private static List<HostSetMember> newMembers(String setId, List<String> hostIds) {
    var members = new ArrayList<HostSetMember>(hostIds.size());
    for (String hostId : hostIds) {
      members.add(new HostSetMember(setId, hostId));
    }
    return members;
  }

  private static List<OplogMessage> deleteMembers(Writer w, List<HostSetMember> members)
      throws SQLException {
    var msgs = new ArrayList<OplogMessage>();
    int rowsDeleted = w.deleteItems(members, DbOption.newOplogMsgs(msgs));
    if (rowsDeleted != members.size()) {
      throw Errors.error(
          ErrorCode.UNKNOWN,
          "static.deleteMembers",
          String.format(
              "set members deleted %d did not match request for %d",
              rowsDeleted, members.size()));
    }
    return msgs;
  }

  /**
   * Bumps the set version guarded by {@code version} and writes the single oplog entry of the
   * membership change. A stale version or a missing set aborts the transaction.
   */
  private static void bumpVersion(
      Writer w,
      Wrapper wrapper,
      OplogMetadata metadata,
      List<OplogMessage> msgs,
      HostSet set,
      int version,
      String id)
      throws SQLException {
    var setMsgs = new ArrayList<OplogMessage>();
    int rows =
        w.update(
            set,
            List.of(ResourceTable.VERSION),
            List.of(),
            DbOption.newOplogMsgs(setMsgs),
            DbOption.withVersion(version));
    if (rows > 1) {
      throw Errors.error(ErrorCode.MULTIPLE_RECORDS, id);
    }
    if (rows == 0) {
      throw Errors.error(
          ErrorCode.RECORD_NOT_FOUND,
          id,
          String.format("host set %s at version %d", set.publicId(), version),
          Errors.RECORD_NOT_FOUND);
    }
    var all = new ArrayList<OplogMessage>(msgs);
    all.addAll(setMsgs);
    w.writeOplogEntryWith(wrapper, w.getTicket(set), metadata, all);
  }

  private static List<Host> members(Reader r, String setId, int limit) throws SQLException {
    return r.searchWhere(Host.TABLE, MEMBERS_WHERE, List.of(setId), DbOption.withLimit(limit));
  }

  static List<Change> changes(Reader r, String setId, List<String> hostIds) throws SQLException {
    String inClause =
        hostIds.isEmpty() ? "''" : String.join(",", Collections.nCopies(hostIds.size(), "?"));
    var params = new ArrayList<Object>(2 * hostIds.size() + 4);
    params.add(setId);
    params.addAll(hostIds);
    params.add(setId);
    params.addAll(hostIds);
    params.add(setId);
    params.add(setId);
    return r.query(
        String.format(SET_CHANGES_QUERY, inClause),
        params,
        rs -> new Change(rs.getString("member_action").trim(), rs.getString("host_id")));
  }
}
