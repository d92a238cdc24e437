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
package io.fleak.hec.lib.metadata;

import com.google.common.annotations.VisibleForTesting;
import io.fleak.hec.api.Metadata;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Memoizes {@link Metadata} tuples by source.
 *
 * <p>The key is the source alone (empty string when absent): on a hit the cached tuple is returned
 * as is, even if {@code index} or {@code sourcetype} differ from the first call. Callers must keep
 * those stable per source. The cache clears itself once it holds more than {@link #MAX_ENTRIES}
 * sources.
 *
 * <p>The host name is resolved once, on first use, and reused for the lifetime of the cache.
 */
@Slf4j
public class MetadataCache {

  public static final int MAX_ENTRIES = 1000;

  private final Map<String, Metadata> cache = new ConcurrentHashMap<>();
  private final HostNameResolver hostNameResolver;
  private volatile String hostName;

  public MetadataCache() {
    this(HostNameResolver.systemDefault());
  }

  public MetadataCache(HostNameResolver hostNameResolver) {
    this.hostNameResolver = hostNameResolver;
  }

  public Metadata get(String index, String source, String sourcetype) {
    String key = StringUtils.defaultString(source);
    Metadata metadata = cache.get(key);
    if (metadata != null) {
      return metadata;
    }

    if (cache.size() > MAX_ENTRIES) {
      log.warn("Metadata cache exceeded {} sources, clearing", MAX_ENTRIES);
      cache.clear();
    }
    Metadata created = new Metadata(index, source, sourcetype, getHostName());
    Metadata existing = cache.putIfAbsent(key, created);
    return existing != null ? existing : created;
  }

  public String getHostName() {
    String resolved = hostName;
    if (resolved == null) {
      synchronized (this) {
        resolved = hostName;
        if (resolved == null) {
          resolved = hostNameResolver.resolve();
          hostName = resolved;
        }
      }
    }
    return resolved;
  }

  @VisibleForTesting
  int size() {
    return cache.size();
  }
}
