package com.example.attsync.client;

import com.example.attsync.config.ReportConfig;
import com.example.attsync.model.RunResult;
import com.example.attsync.service.ResultReporter;
import com.example.attsync.util.JsonSupport;
import org.apache.commons.codec.binary.Base64;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Posts the run result as JSON to the dashboard. A failed post is logged and otherwise
 * ignored: the run already happened and its outcome must not change because the
 * dashboard is down.
 */
public class HttpResultReporter implements ResultReporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpResultReporter.class);

    private final ReportConfig config;
    private final CloseableHttpClient httpClient;

    public HttpResultReporter(ReportConfig config, CloseableHttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        if (config.getEndpoint() == null || config.getEndpoint().trim().isEmpty()) {
            throw new IllegalArgumentException("report.endpoint is required when report.enabled=true");
        }
    }

    @Override
    public void report(RunResult result) {
        HttpPost request = new HttpPost(URI.create(config.getEndpoint().trim()));
        request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
        applyAuthentication(request);
        request.setEntity(new StringEntity(JsonSupport.toJson(result), ContentType.APPLICATION_JSON));
        try {
            Integer status = httpClient.execute(request, response -> {
                if (response.getEntity() != null) {
                    EntityUtils.consume(response.getEntity());
                }
                return response.getCode();
            });
            if (status >= 400) {
                LOGGER.warn("Dashboard rejected run result with HTTP {}", status);
            } else {
                LOGGER.debug("Run result posted to {} (HTTP {})", config.getEndpoint(), status);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to post run result to {}", config.getEndpoint(), ex);
        }
    }

    private void applyAuthentication(HttpPost request) {
        if (config.getToken() != null && !config.getToken().isEmpty()) {
            request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getToken());
            return;
        }
        if (config.getUsername() == null || config.getPassword() == null) {
            return;
        }
        String credentials = config.getUsername() + ':' + config.getPassword();
        String encoded = Base64.encodeBase64String(credentials.getBytes(StandardCharsets.UTF_8));
        request.setHeader(HttpHeaders.AUTHORIZATION, "Basic " + encoded);
    }
}
