/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.relaybox.delivery;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.List;

/**
 * Timing and addressing parameters of the delivery layer.
 */
public final class DeliveryConfig {
    public static final Duration DEFAULT_OUTBOX_RETENTION = Duration.ofDays(7);
    public static final List<Duration> DEFAULT_BACKOFF = List.of(
            Duration.ofSeconds(30),
            Duration.ofMinutes(1),
            Duration.ofMinutes(2),
            Duration.ofMinutes(5),
            Duration.ofMinutes(15));
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofHours(1);

    private final Duration outboxRetention;
    private final List<Duration> backoff;
    private final Duration sweepInterval;
    private final String resourceSeparator;
    private final String conversationIdPrefix;
    private final String conversationIdSeparator;
    private final String channelDomain;

    private DeliveryConfig(Builder builder) {
        this.outboxRetention = builder.outboxRetention;
        this.backoff = List.copyOf(builder.backoff);
        this.sweepInterval = builder.sweepInterval;
        this.resourceSeparator = builder.resourceSeparator;
        this.conversationIdPrefix = builder.conversationIdPrefix;
        this.conversationIdSeparator = builder.conversationIdSeparator;
        this.channelDomain = builder.channelDomain;
    }

    public static DeliveryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getOutboxRetention() {
        return outboxRetention;
    }

    /**
     * The retry delays in order. The last one is repeated once the list is exhausted.
     */
    public List<Duration> getBackoff() {
        return backoff;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public String getResourceSeparator() {
        return resourceSeparator;
    }

    public String getConversationIdPrefix() {
        return conversationIdPrefix;
    }

    public String getConversationIdSeparator() {
        return conversationIdSeparator;
    }

    public String getChannelDomain() {
        return channelDomain;
    }

    public static final class Builder {
        private Duration outboxRetention = DEFAULT_OUTBOX_RETENTION;
        private List<Duration> backoff = DEFAULT_BACKOFF;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private String resourceSeparator = "/";
        private String conversationIdPrefix = "chat:";
        private String conversationIdSeparator = ":";
        private String channelDomain = "conference.localhost";

        private Builder() {}

        public Builder outboxRetention(Duration retention) {
            this.outboxRetention = requireNonNull(retention, "retention");
            return this;
        }

        public Builder backoff(List<Duration> backoff) {
            if (backoff.isEmpty()) {
                throw new IllegalArgumentException("at least one backoff step is required");
            }
            this.backoff = backoff;
            return this;
        }

        public Builder sweepInterval(Duration interval) {
            this.sweepInterval = requireNonNull(interval, "interval");
            return this;
        }

        public Builder resourceSeparator(String separator) {
            this.resourceSeparator = requireNonNull(separator, "separator");
            return this;
        }

        public Builder conversationIdPrefix(String prefix) {
            this.conversationIdPrefix = requireNonNull(prefix, "prefix");
            return this;
        }

        public Builder conversationIdSeparator(String separator) {
            this.conversationIdSeparator = requireNonNull(separator, "separator");
            return this;
        }

        public Builder channelDomain(String domain) {
            this.channelDomain = requireNonNull(domain, "domain");
            return this;
        }

        public DeliveryConfig build() {
            return new DeliveryConfig(this);
        }
    }
}
