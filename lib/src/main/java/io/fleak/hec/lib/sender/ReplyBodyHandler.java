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
package io.fleak.hec.lib.sender;

import io.fleak.hec.lib.json.HecJson;
import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * Reads the collector reply as UTF-8 text. Bytes past {@code maxSize} are discarded rather than
 * failing the exchange, the reply is only kept for diagnostics.
 */
public class ReplyBodyHandler implements HttpResponse.BodyHandler<String> {

  private final int maxSize;

  public ReplyBodyHandler(int maxSize) {
    this.maxSize = maxSize;
  }

  @Override
  public HttpResponse.BodySubscriber<String> apply(HttpResponse.ResponseInfo responseInfo) {
    return new TruncatingBodySubscriber(maxSize);
  }

  static class TruncatingBodySubscriber implements HttpResponse.BodySubscriber<String> {

    private final int maxSize;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final ByteArrayOutputStream data = new ByteArrayOutputStream();

    TruncatingBodySubscriber(int maxSize) {
      this.maxSize = maxSize;
    }

    @Override
    public CompletionStage<String> getBody() {
      return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
      for (ByteBuffer item : items) {
        int room = maxSize - data.size();
        int take = Math.min(room, item.remaining());
        if (take > 0) {
          byte[] chunk = new byte[take];
          item.get(chunk);
          data.write(chunk, 0, take);
        }
      }
    }

    @Override
    public void onError(Throwable throwable) {
      result.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
      result.complete(data.toString(HecJson.CHARSET));
    }
  }
}
