package io.fitwatch.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the FIT inbox watcher.
 *
 * <p>Relaxed binding applies, so {@code FITWATCH_INBOX} or {@code FITWATCH_TRANSFORM}
 * in the environment override the matching keys.
 *
 * @see FitwatchAutoConfiguration
 */
@ConfigurationProperties(prefix = "fitwatch")
public class FitwatchProperties {

    /**
     * Whether to create and start the watcher.
     */
    private boolean enabled = true;

    /**
     * Directory watched for new FIT files. Created if missing.
     */
    private String inbox = "inbox";

    /**
     * Directory receiving the CSV files. Created if missing.
     */
    private String outbox = "outbox";

    /**
     * Derive pace, cadence and degree columns instead of writing raw record fields.
     */
    private boolean transform = true;

    /**
     * Extension of the files to convert, matched case-insensitively.
     */
    private String extension = ".fit";

    /**
     * Debounce window for repeated events on the same path.
     */
    private Duration debounceWindow = Duration.ofSeconds(2);

    /**
     * How long shutdown drains before logging a warning. Queued files always finish converting.
     */
    private Duration drainTimeout = Duration.ofSeconds(30);

    private final Retry retry = new Retry();
    private final Stability stability = new Stability();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getInbox() {
        return inbox;
    }

    public void setInbox(String inbox) {
        this.inbox = inbox;
    }

    public String getOutbox() {
        return outbox;
    }

    public void setOutbox(String outbox) {
        this.outbox = outbox;
    }

    public boolean isTransform() {
        return transform;
    }

    public void setTransform(boolean transform) {
        this.transform = transform;
    }

    public String getExtension() {
        return extension;
    }

    public void setExtension(String extension) {
        this.extension = extension;
    }

    public Duration getDebounceWindow() {
        return debounceWindow;
    }

    public void setDebounceWindow(Duration debounceWindow) {
        this.debounceWindow = debounceWindow;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Retry getRetry() {
        return retry;
    }

    public Stability getStability() {
        return stability;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 250;
        private long maxDelayMs = 1000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Stability {
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration timeout = Duration.ofSeconds(30);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "fitwatch";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
