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

import java.net.http.HttpResponse;
import lombok.Builder;
import lombok.Getter;

/**
 * Describes a failed or degraded delivery to the collector. Published through {@link
 * ErrorReporter}, never thrown by the sender.
 */
@Getter
public class HecDeliveryException extends RuntimeException {
  private final int statusCode;
  private final String serverReply;
  private final transient HttpResponse<?> response;
  private final String serializedEvents;

  @Builder
  public HecDeliveryException(
      int statusCode,
      String serverReply,
      HttpResponse<?> response,
      String serializedEvents,
      Throwable cause) {
    super(buildMessage(statusCode, serverReply, cause), cause);
    this.statusCode = statusCode;
    this.serverReply = serverReply;
    this.response = response;
    this.serializedEvents = serializedEvents;
  }

  private static String buildMessage(int statusCode, String serverReply, Throwable cause) {
    StringBuilder sb = new StringBuilder("HEC delivery failed with status ").append(statusCode);
    if (serverReply != null) {
      sb.append(", reply: ").append(serverReply);
    }
    if (cause != null) {
      sb.append(", cause: ").append(cause);
    }
    return sb.toString();
  }
}
