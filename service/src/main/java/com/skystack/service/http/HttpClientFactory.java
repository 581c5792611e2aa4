package com.skystack.service.http;

import com.skystack.pipeline.config.AcquisitionConfig;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.util.Map;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(AcquisitionConfig config) {
        return create(config, System.getenv());
    }

    static HttpClient create(AcquisitionConfig config, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL);
        TrustStoreSettings.fromEnvironment(environment)
                .map(HttpClientFactory::sslContext)
                .ifPresent(builder::sslContext);
        return builder.build();
    }

    static SSLContext sslContext(TrustStoreSettings settings) {
        try (InputStream in = Files.newInputStream(settings.path())) {
            KeyStore trustStore = KeyStore.getInstance(settings.type());
            trustStore.load(in, settings.password().toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + settings.path(), e);
        }
    }
}
