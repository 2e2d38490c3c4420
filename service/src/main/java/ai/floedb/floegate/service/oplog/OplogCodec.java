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

package ai.floedb.floegate.service.oplog;

import ai.floedb.floegate.service.kms.Wrapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.List;

/** Serializes oplog messages and seals them with a scope wrapper. */
public final class OplogCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<OplogMessage>> MESSAGES = new TypeReference<>() {};

  private OplogCodec() {}

  public static byte[] seal(Wrapper wrapper, Ticket ticket, List<OplogMessage> messages)
      throws GeneralSecurityException {
    byte[] plain;
    try {
      plain = MAPPER.writeValueAsBytes(messages);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("oplog messages are not serializable", e);
    }
    return wrapper.encrypt(plain, aad(ticket));
  }

  public static List<OplogMessage> open(Wrapper wrapper, String aggregateName, byte[] sealed)
      throws GeneralSecurityException {
    byte[] plain = wrapper.decrypt(sealed, aggregateName.getBytes(StandardCharsets.UTF_8));
    try {
      return MAPPER.readValue(plain, MESSAGES);
    } catch (IOException e) {
      throw new IllegalStateException("corrupt oplog entry for " + aggregateName, e);
    }
  }

  private static byte[] aad(Ticket ticket) {
    return ticket.name().getBytes(StandardCharsets.UTF_8);
  }
}
