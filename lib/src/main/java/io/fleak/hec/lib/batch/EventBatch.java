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
package io.fleak.hec.lib.batch;

import com.fasterxml.jackson.core.JsonGenerator;
import com.google.common.annotations.VisibleForTesting;
import io.fleak.hec.api.EventFormatter;
import io.fleak.hec.api.EventRecord;
import io.fleak.hec.api.EventSerializationException;
import io.fleak.hec.api.Metadata;
import io.fleak.hec.lib.json.EventRecordWriter;
import io.fleak.hec.lib.json.HecJson;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Accumulates serialized events into one HEC payload.
 *
 * <p>Events are encoded as soon as they are added, one JSON object per line, in call order. An
 * event that fails to encode is cut out of the buffer again, so the events before and after it
 * are unaffected.
 *
 * <p>{@link #send()} hands the current payload to the post function and leaves the batch empty,
 * ready for the next cycle. Not thread safe; one batch belongs to one flush at a time.
 */
@Slf4j
public class EventBatch implements AutoCloseable {

  private static final int INITIAL_CAPACITY = 1024;

  private final Function<byte[], CompletableFuture<Integer>> postEvents;
  private final Metadata metadata;
  private final EventFormatter formatter;
  private final TruncatableByteArrayOutputStream buffer =
      new TruncatableByteArrayOutputStream(INITIAL_CAPACITY);

  private EventRecordWriter writer = new EventRecordWriter();
  private int eventCount;

  public EventBatch(
      Function<byte[], CompletableFuture<Integer>> postEvents,
      Metadata metadata,
      EventFormatter formatter) {
    this.postEvents = Objects.requireNonNull(postEvents, "postEvents is required");
    this.metadata = Objects.requireNonNull(metadata, "metadata is required");
    this.formatter = formatter;
  }

  public void addEvent(
      Instant timestamp,
      String id,
      String level,
      String messageTemplate,
      String renderedMessage,
      Object exception,
      Map<String, Object> properties,
      Metadata metadataOverride) {
    addEvent(
        EventRecord.builder()
            .timestamp(timestamp)
            .id(id)
            .level(level)
            .messageTemplate(messageTemplate)
            .renderedMessage(renderedMessage)
            .exception(exception)
            .properties(properties)
            .metadata(metadataOverride)
            .build());
  }

  /**
   * Encodes {@code record} into the batch. A record without metadata gets the batch metadata.
   *
   * @throws EventSerializationException if the record cannot be encoded; the batch is left exactly
   *     as it was before the call
   */
  public void addEvent(EventRecord record) {
    Objects.requireNonNull(record, "record is required");
    EventRecord resolved = record.getMetadata() == null ? record.withMetadata(metadata) : record;

    int checkpoint = buffer.size();
    JsonGenerator gen = null;
    try {
      if (formatter != null) {
        resolved = resolved.withEvent(formatter.transform(resolved));
      }
      gen = writer.createGenerator(buffer);
      writer.write(gen, resolved);
      gen.close();
      buffer.write('\n');
      eventCount++;
    } catch (IOException | RuntimeException e) {
      closeQuietly(gen, e);
      // after close, so whatever the failed generator flushed is cut off as well
      buffer.truncate(checkpoint);
      writer = new EventRecordWriter(HecJson.newObjectMapper());
      throw new EventSerializationException(
          "Failed to serialize event, dropped from batch: " + e.getMessage(), record, e);
    }
  }

  /**
   * Posts the accumulated payload and resets the batch. An empty batch is not posted and completes
   * with 200.
   */
  public CompletableFuture<Integer> send() {
    if (eventCount == 0) {
      log.debug("Skipping send of empty batch");
      return CompletableFuture.completedFuture(HttpURLConnection.HTTP_OK);
    }
    byte[] payload = buffer.toByteArray();
    int events = eventCount;
    buffer.reset();
    eventCount = 0;
    log.debug("Sending batch of {} events ({} bytes)", events, payload.length);
    return postEvents.apply(payload);
  }

  public int getEventCount() {
    return eventCount;
  }

  public int getSizeInBytes() {
    return buffer.size();
  }

  public boolean isEmpty() {
    return eventCount == 0;
  }

  private static void closeQuietly(JsonGenerator gen, Exception failure) {
    if (gen == null || gen.isClosed()) {
      return;
    }
    try {
      gen.close();
    } catch (IOException | RuntimeException e) {
      failure.addSuppressed(e);
    }
  }

  @VisibleForTesting
  byte[] peekPayload() {
    return buffer.toByteArray();
  }

  @Override
  public void close() {
    buffer.reset();
    eventCount = 0;
  }
}
