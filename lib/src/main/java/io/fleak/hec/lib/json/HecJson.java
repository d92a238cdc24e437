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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;

public abstract class HecJson {
  public static final Charset CHARSET = StandardCharsets.UTF_8;

  public static final String FIELD_TIME = "time";
  public static final String FIELD_INDEX = "index";
  public static final String FIELD_SOURCE = "source";
  public static final String FIELD_SOURCETYPE = "sourcetype";
  public static final String FIELD_HOST = "host";
  public static final String FIELD_EVENT = "event";

  public static final String FIELD_ID = "id";
  public static final String FIELD_MESSAGE_TEMPLATE = "message-template";
  public static final String FIELD_MESSAGE = "message";
  public static final String FIELD_LEVEL = "level";
  public static final String FIELD_EXCEPTION = "exception";
  public static final String FIELD_PROPERTIES = "properties";

  /**
   * Mapper used to encode event payloads. Every call returns a fresh instance so a serializer that
   * failed mid-write can be replaced wholesale.
   */
  public static ObjectMapper newObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.setLocale(Locale.US);
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

    SimpleModule hecModule = new SimpleModule("HecModule");
    hecModule.addSerializer(Throwable.class, new ThrowableSerializer());
    mapper.registerModule(hecModule);
    return mapper;
  }

  /** Event time as fractional unix epoch seconds, millisecond precision. */
  public static BigDecimal toEpochSeconds(Instant timestamp) {
    return BigDecimal.valueOf(timestamp.toEpochMilli(), 3);
  }
}
