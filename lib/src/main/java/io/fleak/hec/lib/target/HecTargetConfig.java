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
package io.fleak.hec.lib.target;

import io.fleak.hec.api.EventFormatter;
import io.fleak.hec.api.Metadata;
import io.fleak.hec.api.SendMode;
import java.time.Duration;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** Settings of a {@link HecTarget}, already rendered to plain values by the host. */
@Value
@Builder
public class HecTargetConfig {
  String serverUrl;
  @ToString.Exclude String token;
  String channel;
  String index;
  String source;
  @Builder.Default String sourceType = Metadata.DEFAULT_SOURCETYPE;
  boolean includePositionalParameters;
  boolean ignoreSslErrors;
  @Builder.Default boolean useProxy = true;
  String proxyUrl;
  String proxyUser;
  @ToString.Exclude String proxyPassword;

  /** Concurrent posts allowed against the collector, 0 for no limit. */
  @Builder.Default int maxConnectionsPerServer = 10;

  boolean useHttpVersion10Hack;
  @Builder.Default SendMode sendMode = SendMode.SEQUENTIAL;
  EventFormatter formatter;
  @Builder.Default Duration connectTimeout = Duration.ofSeconds(10);
  @Builder.Default Duration requestTimeout = Duration.ofSeconds(30);
}
