package com.logcount.health;

import com.logcount.upstream.LogSource;
import com.logcount.upstream.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Reports whether the upstream log source accepts our credentials, by issuing an empty
 * query over a zero-length time range. Shows up as {@code logSource} under
 * {@code /actuator/health}.
 */
@Component
public class LogSourceHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(LogSourceHealthIndicator.class);

    private final LogSource logSource;

    public LogSourceHealthIndicator(LogSource logSource) {
        this.logSource = logSource;
    }

    @Override
    public Health health() {
        Instant now = Instant.now();
        try {
            logSource.fetch("", now, now, null);
            return Health.up()
                    .withDetail("message", "Log source is reachable")
                    .build();
        } catch (UpstreamFetchException e) {
            log.warn("Log source health check failed: {}", e.getMessage());
            return Health.down(e)
                    .withDetail("message", "Unable to communicate with log source")
                    .build();
        }
    }
}
