package com.logcount.config;

import com.logcount.upstream.DatadogLogSource;
import com.logcount.upstream.LogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Application-wide Spring configuration.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * HTTP client used for upstream log queries.
     *
     * <p>Timeouts are the only bound on a slow upstream; the cache itself never waits.
     */
    @Bean
    public RestTemplate datadogRestTemplate(
            RestTemplateBuilder builder,
            @Value("${logcount.datadog.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${logcount.datadog.read-timeout-ms:30000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public LogSource logSource(
            RestTemplate datadogRestTemplate,
            @Value("${logcount.datadog.base-url:https://api.datadoghq.com}") String baseUrl,
            @Value("${logcount.datadog.api-key:}") String apiKey,
            @Value("${logcount.datadog.app-key:}") String appKey,
            @Value("${logcount.datadog.page-limit:1000}") int pageLimit) {
        if (apiKey.isBlank() || appKey.isBlank()) {
            log.warn("Datadog API or application key is not configured; upstream queries will be rejected");
        }
        log.info("Datadog log source: baseUrl={} pageLimit={}", baseUrl, pageLimit);
        return new DatadogLogSource(datadogRestTemplate, baseUrl, apiKey, appKey, pageLimit);
    }
}
