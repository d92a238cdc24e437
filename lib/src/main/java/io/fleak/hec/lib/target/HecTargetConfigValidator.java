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

import io.fleak.hec.api.HecConfigurationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class HecTargetConfigValidator {

  public void validateConfig(HecTargetConfig config) {
    if (config == null) {
      throw new HecConfigurationException("HEC target config is required");
    }
    if (StringUtils.isBlank(config.getServerUrl())) {
      throw new HecConfigurationException("serverUrl is not set");
    }
    if (StringUtils.isBlank(config.getToken())) {
      throw new HecConfigurationException("token is not set");
    }

    URI serverUri = parseHttpUri(config.getServerUrl(), "serverUrl");
    if (!"https".equalsIgnoreCase(serverUri.getScheme())) {
      log.warn("HEC serverUrl should use HTTPS. Current scheme: {}", serverUri.getScheme());
    }

    if (config.isUseProxy() && StringUtils.isNotBlank(config.getProxyUrl())) {
      parseHttpUri(config.getProxyUrl(), "proxyUrl");
    }
    if (config.getMaxConnectionsPerServer() < 0) {
      throw new HecConfigurationException(
          "maxConnectionsPerServer cannot be negative, got: "
              + config.getMaxConnectionsPerServer());
    }
    if (config.getSendMode() == null) {
      throw new HecConfigurationException("sendMode is required");
    }
    checkPositive(config.getConnectTimeout(), "connectTimeout");
    checkPositive(config.getRequestTimeout(), "requestTimeout");
  }

  static URI parseHttpUri(String url, String name) {
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      throw new HecConfigurationException(name + " is not a valid URL: " + url, e);
    }
    String scheme = uri.getScheme();
    if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
      throw new HecConfigurationException(name + " must have http or https scheme: " + url);
    }
    if (StringUtils.isBlank(uri.getHost())) {
      throw new HecConfigurationException(name + " must have a host: " + url);
    }
    return uri;
  }

  private static void checkPositive(Duration duration, String name) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new HecConfigurationException(name + " must be positive, got: " + duration);
    }
  }
}
