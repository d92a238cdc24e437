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

import io.fleak.hec.api.ErrorReporter;
import io.fleak.hec.api.HecDeliveryException;
import java.net.HttpURLConnection;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import lombok.extern.slf4j.Slf4j;

/**
 * Trust manager for {@code ignoreSslErrors}: runs the platform validation, publishes what it
 * rejected through the {@link ErrorReporter}, and accepts the server anyway.
 */
@Slf4j
public class ReportingTrustManager extends X509ExtendedTrustManager {

  private final X509ExtendedTrustManager delegate;
  private final ErrorReporter errorReporter;

  ReportingTrustManager(X509ExtendedTrustManager delegate, ErrorReporter errorReporter) {
    this.delegate = delegate;
    this.errorReporter = errorReporter;
  }

  public static SSLContext createSslContext(ErrorReporter errorReporter)
      throws GeneralSecurityException {
    TrustManagerFactory factory =
        TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
    factory.init((KeyStore) null);
    X509ExtendedTrustManager platformTrustManager =
        Arrays.stream(factory.getTrustManagers())
            .filter(X509ExtendedTrustManager.class::isInstance)
            .map(X509ExtendedTrustManager.class::cast)
            .findFirst()
            .orElseThrow(() -> new KeyStoreException("no X509 trust manager available"));

    SSLContext sslContext = SSLContext.getInstance("TLS");
    sslContext.init(
        null,
        new TrustManager[] {new ReportingTrustManager(platformTrustManager, errorReporter)},
        null);
    return sslContext;
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType) {
    try {
      delegate.checkServerTrusted(chain, authType);
    } catch (CertificateException e) {
      reportOverride(chain, e);
    }
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
    try {
      delegate.checkServerTrusted(chain, authType, socket);
    } catch (CertificateException e) {
      reportOverride(chain, e);
    }
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
    try {
      delegate.checkServerTrusted(chain, authType, engine);
    } catch (CertificateException e) {
      reportOverride(chain, e);
    }
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType)
      throws CertificateException {
    delegate.checkClientTrusted(chain, authType);
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
      throws CertificateException {
    delegate.checkClientTrusted(chain, authType, socket);
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
      throws CertificateException {
    delegate.checkClientTrusted(chain, authType, engine);
  }

  @Override
  public X509Certificate[] getAcceptedIssuers() {
    return delegate.getAcceptedIssuers();
  }

  private void reportOverride(X509Certificate[] chain, CertificateException e) {
    String subject = "<none>";
    String issuer = "<none>";
    if (chain != null && chain.length > 0) {
      subject = chain[0].getSubjectX500Principal().getName();
      issuer = chain[0].getIssuerX500Principal().getName();
    }
    String warning =
        String.format(
            "The following certificate errors were encountered when establishing the HTTPS"
                + " connection to the server: %s, Certificate subject: %s, Certificate issuer: %s",
            e.getMessage(), subject, issuer);
    log.debug("Accepting untrusted server certificate: {}", warning);
    errorReporter.publish(
        HecDeliveryException.builder()
            .statusCode(HttpURLConnection.HTTP_NOT_ACCEPTABLE)
            .serverReply(warning)
            .cause(e)
            .build());
  }
}
