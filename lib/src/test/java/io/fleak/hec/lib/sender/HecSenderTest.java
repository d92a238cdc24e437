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

import static io.fleak.hec.lib.TestUtils.readBody;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import io.fleak.hec.api.ErrorReporter;
import io.fleak.hec.api.EventRecord;
import io.fleak.hec.api.HecConfigurationException;
import io.fleak.hec.api.HecDeliveryException;
import io.fleak.hec.api.Metadata;
import io.fleak.hec.api.ProxyConfig;
import io.fleak.hec.lib.batch.EventBatch;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

@SuppressWarnings("unchecked")
class HecSenderTest {

  private static final byte[] PAYLOAD =
      "{\"time\":1.000,\"event\":\"x\"}\n".getBytes(StandardCharsets.UTF_8);

  @Mock private HttpClient mockHttpClient;

  @Mock private HttpResponse<String> mockHttpResponse;

  private final List<HecDeliveryException> errors = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    errors.clear();

    when(mockHttpResponse.statusCode()).thenReturn(200);
    when(mockHttpResponse.body()).thenReturn("{\"text\":\"Success\",\"code\":0}");
    when(mockHttpClient.sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(CompletableFuture.completedFuture(mockHttpResponse));
  }

  private HecSender newSender(HecSenderConfig.HecSenderConfigBuilder config) {
    HecSender sender = new HecSender(config.build(), mockHttpClient);
    sender.addErrorListener(errors::add);
    return sender;
  }

  private static HecSenderConfig.HecSenderConfigBuilder config() {
    return HecSenderConfig.builder()
        .serverUri(URI.create("https://splunk.example.com:8088"))
        .token("test-token");
  }

  private HttpRequest captureRequest() {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(mockHttpClient).sendAsync(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }

  @Test
  void postSuccess() throws Exception {
    HecSender sender = newSender(config());

    assertEquals(200, sender.post(PAYLOAD).get(5, TimeUnit.SECONDS));
    assertTrue(errors.isEmpty());
  }

  @Test
  void requestCarriesCollectorHeadersAndBody() throws Exception {
    HecSender sender = newSender(config().channel("0aeeac95-ac74-4aa9-b30d-6c4c0ac581ba"));

    sender.post(PAYLOAD).get(5, TimeUnit.SECONDS);

    HttpRequest request = captureRequest();
    assertEquals("POST", request.method());
    assertEquals(
        URI.create("https://splunk.example.com:8088/services/collector/event/1.0"), request.uri());
    assertEquals("Splunk test-token", request.headers().firstValue("Authorization").orElseThrow());
    assertEquals(
        "application/json; charset=utf-8",
        request.headers().firstValue("Content-Type").orElseThrow());
    assertEquals(
        "0aeeac95-ac74-4aa9-b30d-6c4c0ac581ba",
        request.headers().firstValue("X-Splunk-Request-Channel").orElseThrow());
    assertEquals(new String(PAYLOAD, StandardCharsets.UTF_8), readBody(request));
    assertTrue(request.version().isEmpty());
  }

  @Test
  void channelHeaderOmittedWhenBlank() {
    HecSender sender = newSender(config().channel("  "));

    sender.post(PAYLOAD).join();

    assertTrue(captureRequest().headers().firstValue("X-Splunk-Request-Channel").isEmpty());
  }

  @Test
  void endpointReplacesServerUriPath() {
    HecSender sender =
        newSender(config().serverUri(URI.create("http://localhost:8088/ignored/path")));

    assertEquals(
        URI.create("http://localhost:8088/services/collector/event/1.0"),
        sender.getEndpointUri());
  }

  @Test
  void httpVersion10HackPinsHttp11() {
    HecSender sender = newSender(config().httpVersion10Hack(true));

    sender.post(PAYLOAD).join();

    assertEquals(HttpClient.Version.HTTP_1_1, captureRequest().version().orElseThrow());
  }

  @Test
  void nonOkStatusIsReturnedAndPublishedOnce() {
    when(mockHttpResponse.statusCode()).thenReturn(403);
    when(mockHttpResponse.body()).thenReturn("{\"text\":\"Invalid token\",\"code\":4}");
    HecSender sender = newSender(config());

    assertEquals(403, sender.post(PAYLOAD).join());

    assertEquals(1, errors.size());
    HecDeliveryException error = errors.get(0);
    assertEquals(403, error.getStatusCode());
    assertEquals("{\"text\":\"Invalid token\",\"code\":4}", error.getServerReply());
    assertSame(mockHttpResponse, error.getResponse());
    assertEquals(new String(PAYLOAD, StandardCharsets.UTF_8), error.getSerializedEvents());
  }

  @Test
  void transportFailureReturns400() {
    ConnectException cause = new ConnectException("Connection refused");
    when(mockHttpClient.sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(CompletableFuture.failedFuture(cause));
    HecSender sender = newSender(config());

    assertEquals(400, sender.post(PAYLOAD).join());

    assertEquals(1, errors.size());
    assertEquals(400, errors.get(0).getStatusCode());
    assertSame(cause, errors.get(0).getCause());
    assertNull(errors.get(0).getResponse());
    assertEquals(new String(PAYLOAD, StandardCharsets.UTF_8), errors.get(0).getSerializedEvents());
  }

  @Test
  void sendAsyncThrowingIsReportedAs400() {
    when(mockHttpClient.sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new IllegalArgumentException("bad request"));
    HecSender sender = newSender(config());

    assertEquals(400, sender.post(PAYLOAD).join());
    assertEquals(1, errors.size());
    assertInstanceOf(IllegalArgumentException.class, errors.get(0).getCause());
  }

  @Test
  void failureWithoutListenersIsDropped() {
    when(mockHttpResponse.statusCode()).thenReturn(503);
    HecSender sender = new HecSender(config().build(), mockHttpClient);

    assertEquals(503, sender.post(PAYLOAD).join());
  }

  @Test
  void cancellingResultCancelsExchange() {
    CompletableFuture<HttpResponse<String>> inFlight = new CompletableFuture<>();
    when(mockHttpClient.sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(inFlight);
    HecSender sender = newSender(config());

    CompletableFuture<Integer> result = sender.post(PAYLOAD);
    assertFalse(result.isDone());

    result.cancel(true);

    assertTrue(inFlight.isCancelled());
    assertThrows(CancellationException.class, result::join);
    assertEquals(1, errors.size());
    assertInstanceOf(CancellationException.class, errors.get(0).getCause());
  }

  @Test
  void closedSenderDoesNotPost() {
    HecSender sender = new HecSender(config().build(), mockHttpClient);
    sender.close();
    sender.close();

    assertEquals(400, sender.post(PAYLOAD).join());
    verify(mockHttpClient, never())
        .sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
  }

  @Test
  void postsOverConnectionLimitAreQueuedWithoutBlocking() throws Exception {
    CompletableFuture<HttpResponse<String>> first = new CompletableFuture<>();
    when(mockHttpClient.sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(first)
        .thenReturn(CompletableFuture.completedFuture(mockHttpResponse));
    HecSender sender = newSender(config().maxConnectionsPerServer(1));

    CompletableFuture<Integer> firstResult = sender.post(PAYLOAD);
    CompletableFuture<Integer> secondResult = sender.post(PAYLOAD);

    assertFalse(secondResult.isDone());
    verify(mockHttpClient, times(1))
        .sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));

    first.complete(mockHttpResponse);

    assertEquals(200, firstResult.get(5, TimeUnit.SECONDS));
    assertEquals(200, secondResult.get(5, TimeUnit.SECONDS));
    verify(mockHttpClient, times(2))
        .sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
  }

  @Test
  void cancelledQueuedPostIsNeverSent() throws Exception {
    CompletableFuture<HttpResponse<String>> first = new CompletableFuture<>();
    when(mockHttpClient.sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(first)
        .thenReturn(CompletableFuture.completedFuture(mockHttpResponse));
    HecSender sender = newSender(config().maxConnectionsPerServer(1));

    CompletableFuture<Integer> firstResult = sender.post(PAYLOAD);
    CompletableFuture<Integer> queued = sender.post(PAYLOAD);
    queued.cancel(true);
    first.complete(mockHttpResponse);

    assertEquals(200, firstResult.get(5, TimeUnit.SECONDS));
    verify(mockHttpClient, times(1))
        .sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    assertEquals(1, errors.size());
    assertInstanceOf(CancellationException.class, errors.get(0).getCause());

    assertEquals(200, sender.post(PAYLOAD).get(5, TimeUnit.SECONDS));
    verify(mockHttpClient, times(2))
        .sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
  }

  @Test
  void startBatchUsesSenderMetadata() throws Exception {
    Metadata metadata = new Metadata("main", "orders", null, "web-01");
    HecSender sender = newSender(config().metadata(metadata));

    EventBatch batch = sender.startBatch();
    batch.addEvent(
        EventRecord.builder().timestamp(Instant.ofEpochSecond(1)).renderedMessage("m").build());
    assertEquals(200, batch.send().get(5, TimeUnit.SECONDS));

    String body = readBody(captureRequest());
    assertTrue(body.contains("\"index\":\"main\""), body);
    assertTrue(body.contains("\"host\":\"web-01\""), body);
  }

  @Test
  void invalidConfigIsRejected() {
    assertThrows(
        HecConfigurationException.class,
        () -> new HecSender(HecSenderConfig.builder().token("t").build(), mockHttpClient));
    assertThrows(
        HecConfigurationException.class,
        () -> new HecSender(config().serverUri(URI.create("")).build(), mockHttpClient));
    assertThrows(
        HecConfigurationException.class,
        () -> new HecSender(config().token(" ").build(), mockHttpClient));
    assertThrows(
        HecConfigurationException.class,
        () -> new HecSender(config().maxConnectionsPerServer(-1).build(), mockHttpClient));
    verifyNoInteractions(mockHttpClient);
  }

  @Test
  void buildsDirectClientWhenProxyDisabled() {
    HttpClient client =
        HecSender.buildHttpClient(
            config().proxyConfig(ProxyConfig.noProxy()).build(), new ErrorReporter());

    assertSame(HttpClient.Builder.NO_PROXY, client.proxy().orElseThrow());
    assertTrue(client.authenticator().isEmpty());
  }

  @Test
  void buildsClientWithExplicitProxy() {
    ProxyConfig proxyConfig =
        ProxyConfig.builder()
            .proxyUrl("http://proxy.example.com:3128")
            .proxyUser("user")
            .proxyPassword("secret")
            .build();
    HttpClient client =
        HecSender.buildHttpClient(
            config().proxyConfig(proxyConfig).httpVersion10Hack(true).build(),
            new ErrorReporter());

    List<Proxy> proxies =
        client.proxy().orElseThrow().select(URI.create("https://splunk.example.com:8088"));
    assertEquals(1, proxies.size());
    InetSocketAddress address = (InetSocketAddress) proxies.get(0).address();
    assertEquals("proxy.example.com", address.getHostString());
    assertEquals(3128, address.getPort());
    assertTrue(client.authenticator().isPresent());
    assertEquals(HttpClient.Version.HTTP_1_1, client.version());
  }

  @Test
  void buildsClientWithReportingTrustManager() throws Exception {
    HttpClient client =
        HecSender.buildHttpClient(
            config().ignoreSslErrors(true).build(), new ErrorReporter());

    assertNotSame(SSLContext.getDefault(), client.sslContext());
  }
}
