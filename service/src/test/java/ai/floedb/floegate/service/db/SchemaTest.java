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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.floedb.floegate.service.testsupport.TestStores;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;

class SchemaTest {

  @Test
  void statementsSkipComments() {
    assertThat(Schema.statements())
        .isNotEmpty()
        .noneMatch(s -> s.startsWith("--"))
        .noneMatch(s -> s.endsWith(";"))
        .anyMatch(s -> s.startsWith("CREATE TABLE IF NOT EXISTS static_host_set_member"));
  }

  @Test
  void applyIsRepeatable() throws SQLException {
    DataSource ds = TestStores.emptyDataSource();

    Schema.apply(ds);
    Schema.apply(ds);

    assertEquals(4, TestStores.count(ds, "SELECT COUNT(*) FROM oplog_ticket"));
    assertEquals(
        1, TestStores.count(ds, "SELECT version FROM oplog_ticket WHERE name = ?", "static_host"));
  }
}
