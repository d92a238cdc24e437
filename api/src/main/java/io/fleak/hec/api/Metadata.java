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

import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/** Destination metadata of an event: index, source, sourcetype and originating host. */
@Value
public class Metadata {
  public static final String DEFAULT_SOURCETYPE = "_json";

  String index;
  String source;
  String sourcetype;
  String host;

  public Metadata(String index, String source, String sourcetype, String host) {
    this.index = StringUtils.isEmpty(index) ? null : index;
    this.source = StringUtils.isEmpty(source) ? null : source;
    this.sourcetype = StringUtils.defaultIfBlank(sourcetype, DEFAULT_SOURCETYPE);
    this.host = StringUtils.defaultString(host);
  }
}
