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

import io.fleak.hec.api.EventRecord;
import io.fleak.hec.api.Metadata;
import io.fleak.hec.lib.target.HecTarget;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.StringLayout;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.lookup.StrSubstitutor;
import org.apache.logging.log4j.message.Message;

/**
 * Maps a Log4j {@link LogEvent} to an {@link EventRecord}.
 *
 * <p>Properties are, in order: the thread context map, the appender's configured properties
 * (lookups resolved against the event), then the message parameters as {@code {0}}, {@code {1}},
 * ... when positional parameters are enabled. Without a configured source the logger name is used.
 */
public class LogEventConverter {

  private final HecTarget target;
  private final Layout<?> layout;
  private final Property[] properties;
  private final StrSubstitutor substitutor;

  public LogEventConverter(
      HecTarget target, Layout<?> layout, Property[] properties, StrSubstitutor substitutor) {
    this.target = target;
    this.layout = layout;
    this.properties = properties != null ? properties : new Property[0];
    this.substitutor = substitutor;
  }

  public EventRecord convert(LogEvent event) {
    Message message = event.getMessage();
    return EventRecord.builder()
        .timestamp(
            Instant.ofEpochSecond(
                event.getInstant().getEpochSecond(), event.getInstant().getNanoOfSecond()))
        .level(event.getLevel().name())
        .messageTemplate(message != null ? message.getFormat() : null)
        .renderedMessage(render(event))
        .exception(event.getThrown())
        .properties(collectProperties(event))
        .metadata(resolveMetadata(event))
        .build();
  }

  private Metadata resolveMetadata(LogEvent event) {
    String source =
        StringUtils.defaultIfBlank(target.getConfig().getSource(), event.getLoggerName());
    return target.getMetadata(
        target.getConfig().getIndex(), source, target.getConfig().getSourceType());
  }

  private String render(LogEvent event) {
    if (layout instanceof StringLayout) {
      return ((StringLayout) layout).toSerializable(event);
    }
    Message message = event.getMessage();
    return message != null ? message.getFormattedMessage() : null;
  }

  private Map<String, Object> collectProperties(LogEvent event) {
    Map<String, Object> result = new LinkedHashMap<>(event.getContextData().toMap());
    for (Property property : properties) {
      String value = property.getValue();
      if (property.isValueNeedsLookup() && substitutor != null) {
        value = substitutor.replace(event, value);
      }
      result.put(property.getName(), value);
    }

    if (target.getConfig().isIncludePositionalParameters() && event.getMessage() != null) {
      Object[] parameters = event.getMessage().getParameters();
      if (parameters != null) {
        for (int i = 0; i < parameters.length; ++i) {
          result.put("{" + i + "}", parameters[i]);
        }
      }
    }
    return result;
  }
}
