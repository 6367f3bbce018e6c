package com.example.attsync.client;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;

import java.time.Duration;

/**
 * Builds the {@link CloseableHttpClient} used to publish run results.
 */
public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static CloseableHttpClient create(Duration timeout) {
        long millis = timeout == null ? 0L : timeout.toMillis();
        if (millis <= 0L) {
            millis = 10_000L;
        }
        Timeout requestTimeout = Timeout.ofMilliseconds(millis);
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(requestTimeout)
            .setConnectTimeout(requestTimeout)
            .setResponseTimeout(requestTimeout)
            .build();
        return HttpClients.custom()
            .setDefaultRequestConfig(requestConfig)
            .disableAutomaticRetries()
            .build();
    }
}
