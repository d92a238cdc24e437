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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * Fan-out point for delivery failures.
 *
 * <p>Failures are announced to every registered listener in registration order. With no listener
 * registered a failure is dropped; it only shows up at DEBUG level in this class's log. Hosts that
 * need to see failures must register a listener.
 *
 * <p>A listener that throws does not stop the others and never reaches the sending pipeline.
 */
@Slf4j
public class ErrorReporter {
  private final List<DeliveryErrorListener> listeners = new CopyOnWriteArrayList<>();

  public void addListener(DeliveryErrorListener listener) {
    listeners.add(listener);
  }

  public boolean removeListener(DeliveryErrorListener listener) {
    return listeners.remove(listener);
  }

  public boolean hasListeners() {
    return !listeners.isEmpty();
  }

  public void clear() {
    listeners.clear();
  }

  public void publish(HecDeliveryException error) {
    if (listeners.isEmpty()) {
      log.debug("No delivery error listener registered, dropping: {}", error.getMessage());
      return;
    }
    for (DeliveryErrorListener listener : listeners) {
      try {
        listener.onDeliveryError(error);
      } catch (RuntimeException e) {
        log.warn("Delivery error listener {} failed", listener, e);
      }
    }
  }
}
