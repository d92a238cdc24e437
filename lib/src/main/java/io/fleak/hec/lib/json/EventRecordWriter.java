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
package io.fleak.hec.lib.json;

import static io.fleak.hec.lib.json.HecJson.*;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleak.hec.api.EventRecord;
import io.fleak.hec.api.Metadata;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/** Encodes one {@link EventRecord} as a HEC event object. */
public class EventRecordWriter {

  private final ObjectMapper objectMapper;

  public EventRecordWriter() {
    this(HecJson.newObjectMapper());
  }

  public EventRecordWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public JsonGenerator createGenerator(OutputStream out) throws IOException {
    return objectMapper.createGenerator(out, JsonEncoding.UTF8);
  }

  public void write(JsonGenerator gen, EventRecord record) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField(FIELD_TIME, toEpochSeconds(record.getTimestamp()));
    writeMetadata(gen, record.getMetadata());

    gen.writeFieldName(FIELD_EVENT);
    if (record.hasEventOverride()) {
      gen.writeObject(record.getEvent());
    } else {
      writeStructuredEvent(gen, record);
    }
    gen.writeEndObject();
  }

  private void writeMetadata(JsonGenerator gen, Metadata metadata) throws IOException {
    if (metadata == null) {
      gen.writeStringField(FIELD_SOURCETYPE, Metadata.DEFAULT_SOURCETYPE);
      return;
    }
    writeStringIfPresent(gen, FIELD_INDEX, metadata.getIndex());
    writeStringIfPresent(gen, FIELD_SOURCE, metadata.getSource());
    gen.writeStringField(FIELD_SOURCETYPE, metadata.getSourcetype());
    writeStringIfPresent(gen, FIELD_HOST, metadata.getHost());
  }

  private void writeStructuredEvent(JsonGenerator gen, EventRecord record) throws IOException {
    gen.writeStartObject();
    writeStringIfPresent(gen, FIELD_ID, record.getId());
    writeStringIfPresent(gen, FIELD_MESSAGE_TEMPLATE, record.getMessageTemplate());
    writeStringIfPresent(gen, FIELD_MESSAGE, record.getRenderedMessage());
    writeStringIfPresent(gen, FIELD_LEVEL, record.getLevel());
    if (record.getException() != null) {
      gen.writeFieldName(FIELD_EXCEPTION);
      gen.writeObject(record.getException());
    }
    if (!record.getProperties().isEmpty()) {
      gen.writeObjectFieldStart(FIELD_PROPERTIES);
      for (Map.Entry<String, Object> property : record.getProperties().entrySet()) {
        gen.writeFieldName(property.getKey());
        gen.writeObject(property.getValue());
      }
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static void writeStringIfPresent(JsonGenerator gen, String field, String value)
      throws IOException {
    if (StringUtils.isNotEmpty(value)) {
      gen.writeStringField(field, value);
    }
  }
}
