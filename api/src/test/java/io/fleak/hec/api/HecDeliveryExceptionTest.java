/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.hec.api;

import static org.junit.jupiter.api.Assertions.*;

import java.net.ConnectException;
import org.junit.jupiter.api.Test;

class HecDeliveryExceptionTest {

  @Test
  void messageCarriesStatusAndReply() {
    HecDeliveryException e =
        HecDeliveryException.builder()
            .statusCode(403)
            .serverReply("{\"text\":\"Invalid token\",\"code\":4}")
            .serializedEvents("{}\n")
            .build();

    assertEquals(
        "HEC delivery failed with status 403, reply: {\"text\":\"Invalid token\",\"code\":4}",
        e.getMessage());
    assertEquals("{}\n", e.getSerializedEvents());
    assertNull(e.getResponse());
    assertNull(e.getCause());
  }

  @Test
  void messageCarriesCause() {
    ConnectException cause = new ConnectException("Connection refused");
    HecDeliveryException e = HecDeliveryException.builder().statusCode(400).cause(cause).build();

    assertSame(cause, e.getCause());
    assertTrue(e.getMessage().contains("status 400"));
    assertTrue(e.getMessage().contains("Connection refused"));
    assertNull(e.getServerReply());
  }
}
