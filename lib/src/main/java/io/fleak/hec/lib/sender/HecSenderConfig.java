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
package io.fleak.hec.lib.sender;

import io.fleak.hec.api.EventFormatter;
import io.fleak.hec.api.Metadata;
import io.fleak.hec.api.ProxyConfig;
import io.fleak.hec.api.SendMode;
import java.net.URI;
import java.time.Duration;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

@Value
@Builder
public class HecSenderConfig {
  /** Collector base URI, for example {@code https://localhost:8088}. */
  URI serverUri;

  @ToString.Exclude String token;
  String channel;
  @Builder.Default Metadata metadata = new Metadata(null, null, null, null);
  @Builder.Default SendMode sendMode = SendMode.PARALLEL;
  boolean ignoreSslErrors;
  @Builder.Default ProxyConfig proxyConfig = ProxyConfig.systemDefault();

  /** Concurrent posts allowed against the collector, 0 for no limit. */
  int maxConnectionsPerServer;

  boolean httpVersion10Hack;
  EventFormatter formatter;
  @Builder.Default Duration connectTimeout = Duration.ofSeconds(10);
  @Builder.Default Duration requestTimeout = Duration.ofSeconds(30);
}
