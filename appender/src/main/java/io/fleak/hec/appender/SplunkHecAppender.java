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
package io.fleak.hec.appender;

import io.fleak.hec.api.DeliveryErrorListener;
import io.fleak.hec.api.EventSerializationException;
import io.fleak.hec.api.Metadata;
import io.fleak.hec.api.SendMode;
import io.fleak.hec.lib.batch.EventBatch;
import io.fleak.hec.lib.target.HecTarget;
import io.fleak.hec.lib.target.HecTargetConfig;
import java.io.Serializable;
import java.net.http.HttpClient;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.appender.AppenderLoggingException;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderFactory;

/**
 * Log4j 2 appender that forwards every event to a Splunk HTTP Event Collector.
 *
 * <pre>{@code
 * <SplunkHec name="splunk" serverUrl="https://splunk:8088" token="..." index="main">
 *   <Property name="service" value="${sys:service.name}"/>
 * </SplunkHec>
 * }</pre>
 *
 * <p>Every {@link #append} call sends its event as one HTTP request; the post itself is
 * asynchronous. For high-volume loggers, wrap the appender in an {@code <Async>} appender or use
 * asynchronous loggers so the logging threads only enqueue events.
 *
 * <p>Delivery failures go to the Log4j status logger. Loggers of the {@code io.fleak.hec} packages
 * should not be routed to this appender.
 */
@Plugin(
    name = SplunkHecAppender.PLUGIN_NAME,
    category = Core.CATEGORY_NAME,
    elementType = Appender.ELEMENT_TYPE,
    printObject = true)
public final class SplunkHecAppender extends AbstractAppender {

  public static final String PLUGIN_NAME = "SplunkHec";

  private final HecTarget target;
  private final LogEventConverter converter;
  private final DeliveryErrorListener errorListener;

  private SplunkHecAppender(
      String name,
      Filter filter,
      Layout<? extends Serializable> layout,
      boolean ignoreExceptions,
      Property[] properties,
      HecTarget target,
      LogEventConverter converter) {
    super(name, filter, layout, ignoreExceptions, properties);
    this.target = target;
    this.converter = converter;
    this.errorListener =
        error -> LOGGER.error("SplunkHec(name={}): Failed to send LogEvents", name, error);
    target.getErrorReporter().addListener(errorListener);
  }

  @PluginBuilderFactory
  public static <B extends Builder<B>> B newBuilder() {
    return new Builder<B>().asBuilder();
  }

  @Override
  public void append(LogEvent event) {
    EventBatch batch = target.startBatch();
    try {
      batch.addEvent(converter.convert(event));
    } catch (EventSerializationException e) {
      throw new AppenderLoggingException("SplunkHec(name=" + getName() + "): " + e.getMessage(), e);
    }
    batch.send();
  }

  @Override
  public boolean stop(long timeout, TimeUnit timeUnit) {
    setStopping();
    boolean stopped = super.stop(timeout, timeUnit, false);
    target.getErrorReporter().removeListener(errorListener);
    target.close();
    setStopped();
    return stopped;
  }

  HecTarget getTarget() {
    return target;
  }

  public static class Builder<B extends Builder<B>> extends AbstractAppender.Builder<B>
      implements org.apache.logging.log4j.core.util.Builder<SplunkHecAppender> {

    @PluginBuilderAttribute private String serverUrl;

    @PluginBuilderAttribute(sensitive = true)
    private String token;

    @PluginBuilderAttribute private String channel;
    @PluginBuilderAttribute private String index;
    @PluginBuilderAttribute private String source;
    @PluginBuilderAttribute private String sourceType = Metadata.DEFAULT_SOURCETYPE;
    @PluginBuilderAttribute private boolean includePositionalParameters;
    @PluginBuilderAttribute private boolean ignoreSslErrors;
    @PluginBuilderAttribute private boolean useProxy = true;
    @PluginBuilderAttribute private String proxyUrl;
    @PluginBuilderAttribute private String proxyUser;

    @PluginBuilderAttribute(sensitive = true)
    private String proxyPassword;

    @PluginBuilderAttribute private int maxConnectionsPerServer = 10;
    @PluginBuilderAttribute private boolean useHttpVersion10Hack;
    @PluginBuilderAttribute private SendMode sendMode = SendMode.SEQUENTIAL;

    private HttpClient httpClient;

    public B setServerUrl(String serverUrl) {
      this.serverUrl = serverUrl;
      return asBuilder();
    }

    public B setToken(String token) {
      this.token = token;
      return asBuilder();
    }

    public B setChannel(String channel) {
      this.channel = channel;
      return asBuilder();
    }

    public B setIndex(String index) {
      this.index = index;
      return asBuilder();
    }

    public B setSource(String source) {
      this.source = source;
      return asBuilder();
    }

    public B setSourceType(String sourceType) {
      this.sourceType = sourceType;
      return asBuilder();
    }

    public B setIncludePositionalParameters(boolean includePositionalParameters) {
      this.includePositionalParameters = includePositionalParameters;
      return asBuilder();
    }

    public B setIgnoreSslErrors(boolean ignoreSslErrors) {
      this.ignoreSslErrors = ignoreSslErrors;
      return asBuilder();
    }

    public B setUseProxy(boolean useProxy) {
      this.useProxy = useProxy;
      return asBuilder();
    }

    public B setProxyUrl(String proxyUrl) {
      this.proxyUrl = proxyUrl;
      return asBuilder();
    }

    public B setProxyUser(String proxyUser) {
      this.proxyUser = proxyUser;
      return asBuilder();
    }

    public B setProxyPassword(String proxyPassword) {
      this.proxyPassword = proxyPassword;
      return asBuilder();
    }

    public B setMaxConnectionsPerServer(int maxConnectionsPerServer) {
      this.maxConnectionsPerServer = maxConnectionsPerServer;
      return asBuilder();
    }

    public B setUseHttpVersion10Hack(boolean useHttpVersion10Hack) {
      this.useHttpVersion10Hack = useHttpVersion10Hack;
      return asBuilder();
    }

    public B setSendMode(SendMode sendMode) {
      this.sendMode = sendMode;
      return asBuilder();
    }

    /** Posts through {@code httpClient} instead of a client built from the settings. */
    public B setHttpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return asBuilder();
    }

    /**
     * @throws io.fleak.hec.api.HecConfigurationException if serverUrl or token is missing or a
     *     setting is invalid
     */
    @Override
    public SplunkHecAppender build() {
      HecTargetConfig config =
          HecTargetConfig.builder()
              .serverUrl(serverUrl)
              .token(token)
              .channel(channel)
              .index(index)
              .source(source)
              .sourceType(sourceType)
              .includePositionalParameters(includePositionalParameters)
              .ignoreSslErrors(ignoreSslErrors)
              .useProxy(useProxy)
              .proxyUrl(proxyUrl)
              .proxyUser(proxyUser)
              .proxyPassword(proxyPassword)
              .maxConnectionsPerServer(maxConnectionsPerServer)
              .useHttpVersion10Hack(useHttpVersion10Hack)
              .sendMode(sendMode)
              .build();
      HecTarget target = HecTarget.initialize(config, httpClient);

      Configuration configuration = getConfiguration();
      LogEventConverter converter =
          new LogEventConverter(
              target,
              getLayout(),
              getPropertyArray(),
              configuration != null ? configuration.getStrSubstitutor() : null);
      return new SplunkHecAppender(
          getName(),
          getFilter(),
          getLayout(),
          isIgnoreExceptions(),
          getPropertyArray(),
          target,
          converter);
    }
  }
}
