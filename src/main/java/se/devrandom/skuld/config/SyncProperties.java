/*
 * Skuld - Incremental Billing Data Extraction
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.skuld.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import se.devrandom.skuld.catalog.ExtractionMode;
import se.devrandom.skuld.util.Backoff;
import se.devrandom.skuld.util.Timestamps;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

@Configuration
@ConfigurationProperties(prefix = "skuld.sync")
public class SyncProperties {

    private boolean enabled = true;
    private String startDate;
    private Duration pollInterval = Duration.ofSeconds(60);
    private Duration jobTimeout = Duration.ofMinutes(90);
    private Duration maxWindow = Duration.ofDays(30);
    private Duration queryTimeout = Duration.ofMinutes(5);
    private int downloadConcurrency = 3;
    private ExtractionMode defaultMode = ExtractionMode.BULK;
    private String catalogPath = "catalog.json";
    private final BackoffSettings transport = new BackoffSettings(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 0.25);
    private final BackoffSettings rateLimit = new BackoffSettings(10, Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), 0.25);
    private final HttpSettings http = new HttpSettings();

    /**
     * Fails fast on values the engine cannot run with.
     */
    public void validate() {
        startInstant();
        if (downloadConcurrency < 1) {
            throw new ConfigurationException("skuld.sync.download-concurrency must be at least 1, was " + downloadConcurrency);
        }
        requirePositive("poll-interval", pollInterval);
        requirePositive("job-timeout", jobTimeout);
        requirePositive("max-window", maxWindow);
        requirePositive("query-timeout", queryTimeout);
        requirePositive("http.connect-timeout", http.getConnectTimeout());
        requirePositive("http.read-timeout", http.getReadTimeout());
        transport.toBackoff("transport");
        rateLimit.toBackoff("rate-limit");
    }

    public Instant startInstant() {
        if (startDate == null || startDate.isBlank()) {
            throw new ConfigurationException("skuld.sync.start-date is required");
        }
        try {
            return Timestamps.parse(startDate);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("skuld.sync.start-date is not a valid timestamp: " + startDate, e);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException("skuld.sync." + name + " must be positive, was " + value);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public Duration getMaxWindow() {
        return maxWindow;
    }

    public void setMaxWindow(Duration maxWindow) {
        this.maxWindow = maxWindow;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public int getDownloadConcurrency() {
        return downloadConcurrency;
    }

    public void setDownloadConcurrency(int downloadConcurrency) {
        this.downloadConcurrency = downloadConcurrency;
    }

    public ExtractionMode getDefaultMode() {
        return defaultMode;
    }

    public void setDefaultMode(ExtractionMode defaultMode) {
        this.defaultMode = defaultMode;
    }

    public String getCatalogPath() {
        return catalogPath;
    }

    public void setCatalogPath(String catalogPath) {
        this.catalogPath = catalogPath;
    }

    public BackoffSettings getTransport() {
        return transport;
    }

    public BackoffSettings getRateLimit() {
        return rateLimit;
    }

    public HttpSettings getHttp() {
        return http;
    }

    public static class HttpSettings {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofMinutes(10);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class BackoffSettings {
        private int maxAttempts;
        private Duration initialDelay;
        private double multiplier;
        private Duration maxDelay;
        private double jitter;

        public BackoffSettings() {
        }

        BackoffSettings(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay, double jitter) {
            this.maxAttempts = maxAttempts;
            this.initialDelay = initialDelay;
            this.multiplier = multiplier;
            this.maxDelay = maxDelay;
            this.jitter = jitter;
        }

        public Backoff toBackoff(String name) {
            if (maxAttempts < 1) {
                throw new ConfigurationException("skuld.sync." + name + ".max-attempts must be at least 1, was " + maxAttempts);
            }
            try {
                return new Backoff(initialDelay, multiplier, maxDelay, jitter);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid skuld.sync." + name + " backoff: " + e.getMessage(), e);
            }
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }
}
