package com.questrail.framebus.config;

import java.util.Objects;

/**
 * Aggregated configuration for the frames created within one bus context.
 *
 * @param snapshotQueuePolicy queue bound applied to every threaded subscriber
 * @param workerNamePrefix    prefix of delivery thread names; the frame id and
 *                            callback id are appended
 * @param daemonWorkers       whether delivery threads are daemon threads
 */
public record FrameBusConfig(
    SnapshotQueuePolicy snapshotQueuePolicy,
    String workerNamePrefix,
    boolean daemonWorkers
) {
    public FrameBusConfig {
        Objects.requireNonNull(snapshotQueuePolicy, "snapshotQueuePolicy");
        Objects.requireNonNull(workerNamePrefix, "workerNamePrefix");
    }

    public static FrameBusConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SnapshotQueuePolicy snapshotQueuePolicy = SnapshotQueuePolicy.defaults();
        private String workerNamePrefix = "framebus";
        private boolean daemonWorkers = true;

        public Builder withSnapshotQueuePolicy(SnapshotQueuePolicy policy) {
            this.snapshotQueuePolicy = policy;
            return this;
        }

        public Builder withWorkerNamePrefix(String prefix) {
            this.workerNamePrefix = prefix;
            return this;
        }

        public Builder withDaemonWorkers(boolean daemon) {
            this.daemonWorkers = daemon;
            return this;
        }

        public FrameBusConfig build() {
            return new FrameBusConfig(snapshotQueuePolicy, workerNamePrefix, daemonWorkers);
        }
    }
}
