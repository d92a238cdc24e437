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

import io.fleak.hec.api.ErrorReporter;
import io.fleak.hec.api.EventRecord;
import io.fleak.hec.api.Metadata;
import io.fleak.hec.api.ProxyConfig;
import io.fleak.hec.api.SendMode;
import io.fleak.hec.lib.batch.EventBatch;
import io.fleak.hec.lib.metadata.MetadataCache;
import io.fleak.hec.lib.sender.HecSender;
import io.fleak.hec.lib.sender.HecSenderConfig;
import java.net.http.HttpClient;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Entry point for hosts: validates settings, owns the {@link HecSender} and the metadata cache,
 * and applies the send mode to every batch it hands out.
 *
 * <p>In {@link SendMode#SEQUENTIAL} each post starts only after the previous one of this target
 * completed, whatever its outcome. In {@link SendMode#PARALLEL} posts are issued immediately.
 */
@Slf4j
public class HecTarget implements AutoCloseable {

  @Getter private final HecTargetConfig config;
  @Getter private final HecSender sender;
  private final MetadataCache metadataCache;

  private final Object sequenceLock = new Object();
  private CompletableFuture<Void> lastTurn = CompletableFuture.completedFuture(null);

  private HecTarget(HecTargetConfig config, HecSender sender, MetadataCache metadataCache) {
    this.config = config;
    this.sender = sender;
    this.metadataCache = metadataCache;
  }

  /**
   * @throws io.fleak.hec.api.HecConfigurationException if serverUrl or token is missing or any
   *     setting is invalid; no connection is attempted
   */
  public static HecTarget initialize(HecTargetConfig config) {
    return initialize(config, null, new MetadataCache());
  }

  /** Same as {@link #initialize(HecTargetConfig)} but posts through the given client. */
  public static HecTarget initialize(HecTargetConfig config, HttpClient httpClient) {
    return initialize(config, httpClient, new MetadataCache());
  }

  public static HecTarget initialize(
      HecTargetConfig config, HttpClient httpClient, MetadataCache metadataCache) {
    new HecTargetConfigValidator().validateConfig(config);

    Metadata defaultMetadata =
        metadataCache.get(config.getIndex(), config.getSource(), config.getSourceType());
    HecSenderConfig senderConfig =
        HecSenderConfig.builder()
            .serverUri(HecTargetConfigValidator.parseHttpUri(config.getServerUrl(), "serverUrl"))
            .token(config.getToken())
            .channel(config.getChannel())
            .metadata(defaultMetadata)
            .sendMode(config.getSendMode())
            .ignoreSslErrors(config.isIgnoreSslErrors())
            .proxyConfig(
                ProxyConfig.builder()
                    .useProxy(config.isUseProxy())
                    .proxyUrl(config.getProxyUrl())
                    .proxyUser(config.getProxyUser())
                    .proxyPassword(config.getProxyPassword())
                    .build())
            .maxConnectionsPerServer(config.getMaxConnectionsPerServer())
            .httpVersion10Hack(config.isUseHttpVersion10Hack())
            .formatter(config.getFormatter())
            .connectTimeout(config.getConnectTimeout())
            .requestTimeout(config.getRequestTimeout())
            .build();

    HecSender sender = new HecSender(senderConfig, httpClient);
    log.info("HEC target initialized: {}", config);
    return new HecTarget(config, sender, metadataCache);
  }

  public ErrorReporter getErrorReporter() {
    return sender.getErrorReporter();
  }

  /**
   * Metadata for an event. Blank {@code index} and {@code sourceType} fall back to the configured
   * values; the source is taken as given.
   */
  public Metadata getMetadata(String index, String source, String sourceType) {
    return metadataCache.get(
        StringUtils.defaultIfBlank(index, config.getIndex()),
        source,
        StringUtils.defaultIfBlank(sourceType, config.getSourceType()));
  }

  public EventBatch startBatch() {
    return new EventBatch(this::post, sender.getMetadata(), config.getFormatter());
  }

  /**
   * Serializes {@code records} into one batch and sends it.
   *
   * @throws io.fleak.hec.api.EventSerializationException if a record cannot be encoded; nothing is
   *     sent in that case
   */
  public CompletableFuture<Integer> write(List<EventRecord> records) {
    try (EventBatch batch = startBatch()) {
      for (EventRecord record : records) {
        batch.addEvent(record);
      }
      return batch.send();
    }
  }

  @Override
  public void close() {
    sender.close();
  }

  private CompletableFuture<Integer> post(byte[] payload) {
    if (sender.getSendMode() != SendMode.SEQUENTIAL) {
      return sender.post(payload);
    }
    synchronized (sequenceLock) {
      CompletableFuture<Integer> next = new CompletableFuture<>();
      CompletableFuture<Void> turn = new CompletableFuture<>();
      lastTurn.whenComplete((ignored, error) -> postInTurn(payload, next, turn));
      lastTurn = turn;
      return next;
    }
  }

  // the turn passes on only when the exchange itself has ended
  private void postInTurn(
      byte[] payload, CompletableFuture<Integer> next, CompletableFuture<Void> turn) {
    if (next.isCancelled()) {
      sender.reportCancelled(payload);
      turn.complete(null);
      return;
    }
    CompletableFuture<Integer> posted = sender.post(payload);
    next.whenComplete(
        (statusCode, error) -> {
          if (next.isCancelled()) {
            posted.cancel(true);
          }
        });
    posted.whenComplete(
        (statusCode, error) -> {
          if (error != null) {
            next.completeExceptionally(error);
          } else {
            next.complete(statusCode);
          }
          turn.complete(null);
        });
  }
}
