package com.questrail.debounce.config;

import java.util.Objects;

/**
 * Aggregated configuration for the debounce production runtime.
 */
public record DebounceRuntimeConfig(
    DebounceConfig debounce,
    int schedulerThreads
) {
    public DebounceRuntimeConfig {
        Objects.requireNonNull(debounce, "debounce");
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be >= 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DebounceConfig debounce = DebounceConfig.defaults();
        private int schedulerThreads = 1;

        public Builder withDebounce(DebounceConfig debounce) {
            this.debounce = debounce;
            return this;
        }

        public Builder withSchedulerThreads(int schedulerThreads) {
            this.schedulerThreads = schedulerThreads;
            return this;
        }

        public DebounceRuntimeConfig build() {
            return new DebounceRuntimeConfig(debounce, schedulerThreads);
        }
    }
}
