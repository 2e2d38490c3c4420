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

package ai.floedb.floegate.service.cdi;

import ai.floedb.floegate.service.config.FloegateConfig;
import ai.floedb.floegate.service.db.Schema;
import io.agroal.api.AgroalDataSource;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.sql.SQLException;
import org.jboss.logging.Logger;

@ApplicationScoped
public class SchemaBootstrap {
  private static final Logger LOG = Logger.getLogger(SchemaBootstrap.class);

  @Inject AgroalDataSource dataSource;
  @Inject FloegateConfig config;

  void onStart(@Observes StartupEvent ev) throws SQLException {
    if (!config.db().initSchema()) {
      LOG.info("Schema bootstrap skipped (floegate.db.init-schema=false)");
      return;
    }
    Schema.apply(dataSource);
    LOG.info("Schema bootstrap completed");
  }
}
