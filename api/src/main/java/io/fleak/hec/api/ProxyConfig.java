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

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Proxy settings of a sender. With {@code useProxy} and no {@code proxyUrl} the JVM default proxy
 * selector is used; without {@code useProxy} connections always go direct.
 */
@Value
@Builder
public class ProxyConfig {
  @Builder.Default boolean useProxy = true;
  String proxyUrl;
  String proxyUser;
  @ToString.Exclude String proxyPassword;

  public static ProxyConfig systemDefault() {
    return ProxyConfig.builder().build();
  }

  public static ProxyConfig noProxy() {
    return ProxyConfig.builder().useProxy(false).build();
  }

  public boolean hasExplicitProxy() {
    return useProxy && StringUtils.isNotBlank(proxyUrl);
  }

  public boolean hasCredentials() {
    return StringUtils.isNotBlank(proxyUser) && StringUtils.isNotBlank(proxyPassword);
  }
}
