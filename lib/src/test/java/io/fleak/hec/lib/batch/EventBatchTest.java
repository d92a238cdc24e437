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

import static io.fleak.hec.lib.TestUtils.epochSeconds;
import static io.fleak.hec.lib.TestUtils.parseEvents;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleak.hec.api.EventRecord;
import io.fleak.hec.api.EventSerializationException;
import io.fleak.hec.api.Metadata;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventBatchTest {

  private static final Instant TIMESTAMP = Instant.ofEpochMilli(1_700_000_000_000L);
  private static final Metadata BATCH_METADATA = new Metadata("main", "app", null, "web-01");

  private final List<byte[]> posted = new ArrayList<>();

  private CompletableFuture<Integer> capture(byte[] payload) {
    posted.add(payload);
    return CompletableFuture.completedFuture(200);
  }

  @BeforeEach
  void setUp() {
    posted.clear();
  }

  @Test
  void eventsAreSentInCallOrder() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, null);
    batch.addEvent(message("a"));
    batch.addEvent(message("b"));
    batch.addEvent(message("c"));

    assertEquals(200, batch.send().get());

    assertEquals(1, posted.size());
    List<JsonNode> events = parseEvents(posted.get(0));
    assertEquals(3, events.size());
    assertEquals("a", events.get(0).get("event").get("message").asText());
    assertEquals("b", events.get(1).get("event").get("message").asText());
    assertEquals("c", events.get(2).get("event").get("message").asText());
    assertTrue(new String(posted.get(0)).endsWith("}\n"));
  }

  @Test
  void recordWithoutMetadataGetsBatchMetadata() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, null);
    batch.addEvent(message("a"));
    batch.addEvent(message("b").withMetadata(new Metadata("audit", "other", "custom", "db-01")));
    batch.send().get();

    List<JsonNode> events = parseEvents(posted.get(0));
    assertEquals("main", events.get(0).get("index").asText());
    assertEquals("web-01", events.get(0).get("host").asText());
    assertEquals("audit", events.get(1).get("index").asText());
    assertEquals("custom", events.get(1).get("sourcetype").asText());
  }

  @Test
  void failedEventIsRolledBack() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, null);
    batch.addEvent(message("a"));
    batch.addEvent(message("b"));
    byte[] before = batch.peekPayload();

    EventRecord unserializable =
        message("bad").toBuilder().properties(Map.of("payload", new Object())).build();
    EventSerializationException e =
        assertThrows(EventSerializationException.class, () -> batch.addEvent(unserializable));

    assertSame(unserializable, e.getRecord());
    assertArrayEquals(before, batch.peekPayload());
    assertEquals(2, batch.getEventCount());

    batch.addEvent(message("c"));
    batch.send().get();

    List<JsonNode> events = parseEvents(posted.get(0));
    assertEquals(3, events.size());
    assertEquals("c", events.get(2).get("event").get("message").asText());
  }

  @Test
  void partiallyWrittenEventIsRolledBack() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, null);
    batch.addEvent(message("a"));
    byte[] before = batch.peekPayload();

    Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("dump", "x".repeat(32 * 1024));
    properties.put("payload", new Object());
    EventRecord oversized = message("bad").toBuilder().properties(properties).build();

    assertThrows(EventSerializationException.class, () -> batch.addEvent(oversized));

    assertArrayEquals(before, batch.peekPayload());
    assertEquals(1, batch.getEventCount());

    batch.addEvent(message("b"));
    batch.send().get();

    List<JsonNode> events = parseEvents(posted.get(0));
    assertEquals(2, events.size());
    assertEquals("b", events.get(1).get("event").get("message").asText());
  }

  @Test
  void formatterReplacesEventPayload() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, record -> 42);
    batch.addEvent(message("a"));
    batch.send().get();

    String payload = new String(posted.get(0));
    assertTrue(payload.contains("\"event\":42}"), payload);
    assertTrue(payload.contains("\"index\":\"main\""), payload);
  }

  @Test
  void formatterReturningNullKeepsStructuredEvent() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, record -> null);
    batch.addEvent(message("a"));
    batch.send().get();

    JsonNode event = parseEvents(posted.get(0)).get(0).get("event");
    assertEquals("a", event.get("message").asText());
  }

  @Test
  void formatterSeesResolvedMetadata() throws Exception {
    EventBatch batch =
        new EventBatch(
            this::capture,
            BATCH_METADATA,
            record -> Map.of("idx", record.getMetadata().getIndex()));
    batch.addEvent(message("a"));
    batch.send().get();

    assertEquals("main", parseEvents(posted.get(0)).get(0).get("event").get("idx").asText());
  }

  @Test
  void failingFormatterDropsOnlyThatEvent() throws Exception {
    EventBatch batch =
        new EventBatch(
            this::capture,
            BATCH_METADATA,
            record -> {
              if ("bad".equals(record.getRenderedMessage())) {
                throw new IllegalStateException("formatter failed");
              }
              return null;
            });
    batch.addEvent(message("a"));
    assertThrows(EventSerializationException.class, () -> batch.addEvent(message("bad")));
    batch.addEvent(message("b"));
    batch.send().get();

    assertEquals(2, parseEvents(posted.get(0)).size());
  }

  @Test
  void emptyBatchIsNotPosted() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, null);

    assertTrue(batch.isEmpty());
    assertEquals(200, batch.send().get());
    assertTrue(posted.isEmpty());
  }

  @Test
  void sendResetsBatchForReuse() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, null);
    batch.addEvent(message("a"));
    batch.send().get();

    assertTrue(batch.isEmpty());
    assertEquals(0, batch.getSizeInBytes());

    batch.addEvent(message("b"));
    batch.send().get();

    assertEquals(2, posted.size());
    List<JsonNode> second = parseEvents(posted.get(1));
    assertEquals(1, second.size());
    assertEquals("b", second.get(0).get("event").get("message").asText());
  }

  @Test
  void addEventWithFields() throws Exception {
    EventBatch batch = new EventBatch(this::capture, BATCH_METADATA, null);
    batch.addEvent(
        TIMESTAMP,
        "id-1",
        "WARN",
        "user {} logged in",
        "user bob logged in",
        null,
        Map.of("{0}", "bob"),
        null);
    batch.send().get();

    JsonNode node = parseEvents(posted.get(0)).get(0);
    assertEquals("1700000000.000", epochSeconds(node));
    assertTrue(new String(posted.get(0)).startsWith("{\"time\":1700000000.000,"));
    assertEquals("id-1", node.get("event").get("id").asText());
    assertEquals("WARN", node.get("event").get("level").asText());
    assertEquals("bob", node.get("event").get("properties").get("{0}").asText());
  }

  private static EventRecord message(String text) {
    return EventRecord.builder().timestamp(TIMESTAMP).level("INFO").renderedMessage(text).build();
  }
}
