package com.gigpulse.service.http;

import com.gigpulse.service.config.ForecasterConfig;
import com.gigpulse.service.config.ServiceEnvironment;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.logging.Logger;

public final class HttpClientFactory {
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
    }

    public static HttpClient create(ForecasterConfig config, ServiceEnvironment env) {
        return create(Duration.ofMillis(config.connectTimeoutMillis()), env.truststore());
    }

    static HttpClient create(Duration connectTimeout, UpstreamTruststore truststore) {
        // listing pages redirect between locale paths
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (truststore != null) {
            builder.sslContext(sslContext(truststore));
            LOGGER.info("Trusting upstream certificates from " + truststore.path());
        }
        return builder.build();
    }

    static SSLContext sslContext(UpstreamTruststore truststore) {
        if (!Files.exists(truststore.path())) {
            throw new IllegalStateException("Truststore file does not exist: " + truststore.path());
        }
        try (InputStream in = Files.newInputStream(truststore.path())) {
            KeyStore keyStore = KeyStore.getInstance(truststore.type());
            keyStore.load(in, truststore.password().toCharArray());
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(keyStore);
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + truststore.path(), e);
        }
    }
}
