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
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Writes a throwable as {@code {"type", "message", "stackTrace", "cause"}}, following the cause
 * chain until it ends or loops.
 */
public class ThrowableSerializer extends StdSerializer<Throwable> {

  public ThrowableSerializer() {
    super(Throwable.class);
  }

  @Override
  public void serialize(Throwable value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    writeThrowable(value, gen, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  private void writeThrowable(Throwable throwable, JsonGenerator gen, Set<Throwable> seen)
      throws IOException {
    seen.add(throwable);
    gen.writeStartObject();
    gen.writeStringField("type", throwable.getClass().getName());
    if (throwable.getMessage() != null) {
      gen.writeStringField("message", throwable.getMessage());
    }
    gen.writeArrayFieldStart("stackTrace");
    for (StackTraceElement element : throwable.getStackTrace()) {
      gen.writeString(element.toString());
    }
    gen.writeEndArray();

    Throwable cause = throwable.getCause();
    if (cause != null && !seen.contains(cause)) {
      gen.writeFieldName("cause");
      writeThrowable(cause, gen, seen);
    }
    gen.writeEndObject();
  }
}
