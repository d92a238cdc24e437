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

import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Resolves the host identity sent with every event. Lookups run in order and the first non-blank,
 * trimmed value wins. A lookup that throws counts as blank. When every lookup comes back blank the
 * host is the empty string and events are sent without a {@code host} field.
 */
@Slf4j
public class HostNameResolver {

  private final List<Pair<String, Callable<String>>> lookups;

  public HostNameResolver(List<Pair<String, Callable<String>>> lookups) {
    this.lookups = List.copyOf(lookups);
  }

  public static HostNameResolver systemDefault() {
    return new HostNameResolver(
        List.of(
            lookup("COMPUTERNAME", () -> System.getenv("COMPUTERNAME")),
            lookup("HOSTNAME", () -> System.getenv("HOSTNAME")),
            lookup("LocalHostName", () -> InetAddress.getLocalHost().getHostName()),
            lookup("DnsHostName", () -> InetAddress.getLocalHost().getCanonicalHostName())));
  }

  public static Pair<String, Callable<String>> lookup(String name, Callable<String> lookup) {
    return Pair.of(name, lookup);
  }

  public String resolve() {
    for (Pair<String, Callable<String>> lookup : lookups) {
      String value = tryLookup(lookup.getLeft(), lookup.getRight());
      if (value != null) {
        log.debug("Resolved host name {} from {}", value, lookup.getLeft());
        return value;
      }
    }
    log.warn("Unable to resolve host name, events will be sent without host");
    return "";
  }

  private static String tryLookup(String name, Callable<String> lookup) {
    try {
      return StringUtils.trimToNull(lookup.call());
    } catch (Exception e) {
      log.warn("Failed to lookup {}", name, e);
      return null;
    }
  }
}
