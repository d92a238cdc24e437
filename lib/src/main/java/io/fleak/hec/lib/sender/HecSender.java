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

import com.google.common.annotations.VisibleForTesting;
import io.fleak.hec.api.DeliveryErrorListener;
import io.fleak.hec.api.ErrorReporter;
import io.fleak.hec.api.EventFormatter;
import io.fleak.hec.api.HecConfigurationException;
import io.fleak.hec.api.HecDeliveryException;
import io.fleak.hec.api.Metadata;
import io.fleak.hec.api.ProxyConfig;
import io.fleak.hec.api.SendMode;
import io.fleak.hec.lib.batch.EventBatch;
import io.fleak.hec.lib.json.HecJson;
import java.net.Authenticator;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Client side of the Splunk HTTP Event Collector: owns the HTTP transport and posts serialized
 * event payloads.
 *
 * <p>{@link #post} never throws and never completes exceptionally on its own. Every failure is
 * published to the {@link ErrorReporter} and turned into a status code: the collector's code for
 * HTTP errors, 400 for transport failures. Cancelling the returned future aborts the exchange.
 *
 * <p>One sender is shared by all batches of a target. Concurrent posts are not ordered against
 * each other; {@link SendMode#SEQUENTIAL} is enforced by {@code HecTarget}. Posts over the
 * {@code maxConnectionsPerServer} limit are queued and started as earlier exchanges finish, the
 * calling thread never waits for a connection.
 */
@Slf4j
public final class HecSender implements AutoCloseable {

  public static final String EVENT_COLLECTOR_PATH = "/services/collector/event/1.0";
  public static final String AUTHORIZATION_SCHEME = "Splunk";
  public static final String CHANNEL_HEADER = "X-Splunk-Request-Channel";
  public static final String CONTENT_TYPE = "application/json; charset=utf-8";

  static final int MAX_REPLY_SIZE_BYTES = 64 * 1024;

  private final URI endpointUri;
  private final String token;
  private final String channel;
  @Getter private final Metadata metadata;
  @Getter private final SendMode sendMode;
  private final EventFormatter formatter;
  private final Duration requestTimeout;
  private final boolean httpVersion10Hack;

  @Getter private final ErrorReporter errorReporter = new ErrorReporter();
  private final HttpClient httpClient;
  private final Semaphore connectionLimiter;
  private final Queue<Runnable> pendingExchanges = new ConcurrentLinkedQueue<>();
  private final ReplyBodyHandler replyBodyHandler = new ReplyBodyHandler(MAX_REPLY_SIZE_BYTES);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public HecSender(HecSenderConfig config) {
    this(config, null);
  }

  /**
   * Uses {@code httpClient} when given instead of building one from {@code config}.
   *
   * @throws HecConfigurationException if a required setting is missing or invalid
   */
  public HecSender(HecSenderConfig config, HttpClient httpClient) {
    validateConfig(config);

    this.endpointUri = config.getServerUri().resolve(EVENT_COLLECTOR_PATH);
    this.token = config.getToken();
    this.channel = config.getChannel();
    this.metadata = config.getMetadata();
    this.sendMode = config.getSendMode();
    this.formatter = config.getFormatter();
    this.requestTimeout = config.getRequestTimeout();
    this.httpVersion10Hack = config.isHttpVersion10Hack();
    this.connectionLimiter =
        config.getMaxConnectionsPerServer() > 0
            ? new Semaphore(config.getMaxConnectionsPerServer())
            : null;
    this.httpClient = httpClient != null ? httpClient : buildHttpClient(config, errorReporter);

    log.info(
        "HEC sender initialized (destination={}, sendMode={}, ignoreSslErrors={}, proxy={},"
            + " maxConnectionsPerServer={}, httpVersion10Hack={})",
        maskUrl(endpointUri),
        sendMode,
        config.isIgnoreSslErrors(),
        config.getProxyConfig(),
        config.getMaxConnectionsPerServer(),
        httpVersion10Hack);
  }

  public void addErrorListener(DeliveryErrorListener listener) {
    errorReporter.addListener(listener);
  }

  public EventBatch startBatch() {
    return startBatch(metadata);
  }

  public EventBatch startBatch(Metadata batchMetadata) {
    return new EventBatch(this::post, batchMetadata, formatter);
  }

  /**
   * Posts one payload of serialized events.
   *
   * @return the HTTP status of the exchange, 200 on success
   */
  public CompletableFuture<Integer> post(byte[] serializedEvents) {
    if (closed.get()) {
      return CompletableFuture.completedFuture(
          reportTransportFailure(
              serializedEvents, new IllegalStateException("HEC sender is closed")));
    }

    HttpRequest request;
    try {
      request = buildRequest(serializedEvents);
    } catch (RuntimeException e) {
      return CompletableFuture.completedFuture(reportTransportFailure(serializedEvents, e));
    }

    CompletableFuture<HttpResponse<String>> exchange = new CompletableFuture<>();
    Runnable startExchange = () -> startExchange(request, exchange);
    if (connectionLimiter == null || connectionLimiter.tryAcquire()) {
      startExchange.run();
    } else {
      log.debug("Max connections per server reached, queueing post");
      pendingExchanges.add(startExchange);
      drainPendingExchanges();
    }

    CompletableFuture<Integer> result =
        exchange.handle(
            (response, error) ->
                error == null
                    ? handleResponse(serializedEvents, response)
                    : reportTransportFailure(serializedEvents, unwrap(error)));
    result.whenComplete(
        (statusCode, error) -> {
          if (result.isCancelled()) {
            exchange.cancel(true);
            reportCancelled(serializedEvents);
          }
        });
    return result;
  }

  /** Publishes a post that was cancelled by its caller; nothing is sent. */
  public int reportCancelled(byte[] serializedEvents) {
    return reportTransportFailure(
        serializedEvents, new CancellationException("HEC post was cancelled"));
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      log.debug("HEC sender already closed, skipping");
      return;
    }
    errorReporter.clear();
    log.info("HEC sender closed (destination={})", maskUrl(endpointUri));
  }

  @VisibleForTesting
  URI getEndpointUri() {
    return endpointUri;
  }

  private HttpRequest buildRequest(byte[] serializedEvents) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(endpointUri)
            .timeout(requestTimeout)
            .header("Authorization", AUTHORIZATION_SCHEME + " " + token)
            .header("Content-Type", CONTENT_TYPE)
            .POST(HttpRequest.BodyPublishers.ofByteArray(serializedEvents));
    if (httpVersion10Hack) {
      builder.version(HttpClient.Version.HTTP_1_1);
    }
    if (StringUtils.isNotBlank(channel)) {
      builder.header(CHANNEL_HEADER, channel);
    }
    return builder.build();
  }

  private int handleResponse(byte[] serializedEvents, HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode == HttpURLConnection.HTTP_OK) {
      log.debug("HEC accepted {} bytes: {}", serializedEvents.length, response.body());
      return statusCode;
    }
    log.debug("HEC rejected {} bytes with status {}", serializedEvents.length, statusCode);
    errorReporter.publish(
        HecDeliveryException.builder()
            .statusCode(statusCode)
            .serverReply(response.body())
            .response(response)
            .serializedEvents(new String(serializedEvents, HecJson.CHARSET))
            .build());
    return statusCode;
  }

  private int reportTransportFailure(byte[] serializedEvents, Throwable cause) {
    int statusCode = HttpURLConnection.HTTP_BAD_REQUEST;
    log.debug("HEC post failed before a response was received", cause);
    errorReporter.publish(
        HecDeliveryException.builder()
            .statusCode(statusCode)
            .serializedEvents(new String(serializedEvents, HecJson.CHARSET))
            .cause(cause)
            .build());
    return statusCode;
  }

  /** Runs with a connection permit held; the permit is handed on when the exchange ends. */
  private void startExchange(
      HttpRequest request, CompletableFuture<HttpResponse<String>> exchange) {
    if (exchange.isDone()) {
      releaseConnection();
      return;
    }
    CompletableFuture<HttpResponse<String>> inFlight;
    try {
      inFlight = httpClient.sendAsync(request, replyBodyHandler);
    } catch (RuntimeException e) {
      releaseConnection();
      exchange.completeExceptionally(e);
      return;
    }
    exchange.whenComplete(
        (response, error) -> {
          if (exchange.isCancelled()) {
            inFlight.cancel(true);
          }
        });
    inFlight.whenComplete(
        (response, error) -> {
          releaseConnection();
          if (error != null) {
            exchange.completeExceptionally(error);
          } else {
            exchange.complete(response);
          }
        });
  }

  private void releaseConnection() {
    if (connectionLimiter == null) {
      return;
    }
    Runnable next = pendingExchanges.poll();
    if (next != null) {
      next.run();
      return;
    }
    connectionLimiter.release();
    drainPendingExchanges();
  }

  // closes the gap between a failed tryAcquire and the enqueue racing a release
  private void drainPendingExchanges() {
    while (!pendingExchanges.isEmpty() && connectionLimiter.tryAcquire()) {
      Runnable next = pendingExchanges.poll();
      if (next == null) {
        connectionLimiter.release();
      } else {
        next.run();
      }
    }
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  @VisibleForTesting
  static HttpClient buildHttpClient(HecSenderConfig config, ErrorReporter errorReporter) {
    try {
      HttpClient.Builder builder =
          HttpClient.newBuilder()
              .connectTimeout(config.getConnectTimeout())
              .followRedirects(HttpClient.Redirect.NEVER);
      if (config.isHttpVersion10Hack()) {
        builder.version(HttpClient.Version.HTTP_1_1);
      }
      if (config.isIgnoreSslErrors()) {
        builder.sslContext(ReportingTrustManager.createSslContext(errorReporter));
      }
      configureProxy(builder, config.getProxyConfig());
      return builder.build();
    } catch (GeneralSecurityException | RuntimeException e) {
      log.warn("Failed to build configured HTTP client, falling back to default client", e);
      return HttpClient.newHttpClient();
    }
  }

  private static void configureProxy(HttpClient.Builder builder, ProxyConfig proxyConfig) {
    if (!proxyConfig.isUseProxy()) {
      builder.proxy(HttpClient.Builder.NO_PROXY);
      return;
    }
    if (!proxyConfig.hasExplicitProxy()) {
      ProxySelector systemDefault = ProxySelector.getDefault();
      if (systemDefault != null) {
        builder.proxy(systemDefault);
      }
      return;
    }

    URI proxyUri = URI.create(proxyConfig.getProxyUrl());
    int port = proxyUri.getPort();
    if (port == -1) {
      port = "https".equalsIgnoreCase(proxyUri.getScheme()) ? 443 : 80;
    }
    builder.proxy(ProxySelector.of(InetSocketAddress.createUnresolved(proxyUri.getHost(), port)));
    if (proxyConfig.hasCredentials()) {
      builder.authenticator(
          new ProxyAuthenticator(proxyConfig.getProxyUser(), proxyConfig.getProxyPassword()));
    }
  }

  private static void validateConfig(HecSenderConfig config) {
    checkConfig(config != null, "HecSenderConfig cannot be null");
    checkConfig(config.getServerUri() != null, "server URI is required");
    checkConfig(StringUtils.isNotBlank(config.getToken()), "token is not set");
    checkConfig(config.getMetadata() != null, "metadata is required");
    checkConfig(config.getSendMode() != null, "sendMode is required");
    checkConfig(config.getProxyConfig() != null, "proxyConfig is required");
    checkConfig(
        StringUtils.isNotBlank(config.getServerUri().getHost()),
        "server URI must have a host: " + config.getServerUri());
    checkConfig(
        config.getMaxConnectionsPerServer() >= 0,
        "maxConnectionsPerServer cannot be negative, got: " + config.getMaxConnectionsPerServer());
  }

  private static void checkConfig(boolean condition, String message) {
    if (!condition) {
      throw new HecConfigurationException(message);
    }
  }

  private static String maskUrl(URI uri) {
    String scheme = uri.getScheme() != null ? uri.getScheme() : "unknown";
    String host = uri.getHost() != null ? uri.getHost() : "unknown";
    return scheme + "://" + host;
  }

  private static class ProxyAuthenticator extends Authenticator {
    private final String user;
    private final String password;

    ProxyAuthenticator(String user, String password) {
      this.user = user;
      this.password = password;
    }

    @Override
    protected PasswordAuthentication getPasswordAuthentication() {
      if (getRequestorType() != RequestorType.PROXY) {
        return null;
      }
      return new PasswordAuthentication(user, password.toCharArray());
    }
  }
}
