package com.questrail.debounce.config;

import java.time.Duration;
import java.util.Objects;

/**
 * DebounceConfig
 * -----------------------------------------------------------------------------
 * Timing configuration for a debounce-latest operator.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>timeout</b>: how long an accepted value must stay the latest one
 *       before its action may run. Smaller values debounce less; zero runs the
 *       action at the next scheduling opportunity, still never inline with
 *       acceptance.</li>
 * </ul>
 */
public record DebounceConfig(Duration timeout) {

    public DebounceConfig {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
    }

    public static DebounceConfig ofMillis(long timeoutMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeoutMillis must be non-negative");
        }
        return new DebounceConfig(Duration.ofMillis(timeoutMillis));
    }

    /**
     * Default: 250ms, a typical window for coalescing interactive input.
     */
    public static DebounceConfig defaults() {
        return ofMillis(250);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration timeout = defaults().timeout();

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withTimeoutMillis(long timeoutMillis) {
            this.timeout = Duration.ofMillis(timeoutMillis);
            return this;
        }

        public DebounceConfig build() {
            return new DebounceConfig(timeout);
        }
    }
}
