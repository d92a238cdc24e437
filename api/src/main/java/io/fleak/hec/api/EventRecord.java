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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One log occurrence plus the destination metadata it resolves to.
 *
 * <p>{@code properties} keeps insertion order. Positional message parameters, when included, are
 * stored under {@code {0}}, {@code {1}}, ... keys.
 *
 * <p>{@code event} is the payload substituted by an {@link EventFormatter}. When it is set it is
 * written as the wire {@code event} field in place of the structured fields.
 */
@Value
public class EventRecord {
  Instant timestamp;
  String id;
  String level;
  String messageTemplate;
  String renderedMessage;
  Object exception;
  Map<String, Object> properties;
  Metadata metadata;
  Object event;

  @Builder(toBuilder = true)
  private EventRecord(
      @NonNull Instant timestamp,
      String id,
      String level,
      String messageTemplate,
      String renderedMessage,
      Object exception,
      Map<String, Object> properties,
      Metadata metadata,
      Object event) {
    this.timestamp = timestamp;
    this.id = id;
    this.level = level;
    this.messageTemplate = messageTemplate;
    this.renderedMessage = renderedMessage;
    this.exception = exception;
    this.properties =
        properties == null || properties.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    this.metadata = metadata;
    this.event = event;
  }

  public boolean hasEventOverride() {
    return event != null;
  }

  public EventRecord withEvent(Object event) {
    return toBuilder().event(event).build();
  }

  public EventRecord withMetadata(Metadata metadata) {
    return toBuilder().metadata(metadata).build();
  }
}
