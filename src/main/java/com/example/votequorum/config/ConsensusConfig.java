package com.example.votequorum.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable settings for the consensus coordinator.
 * Values come from environment variables, falling back to the defaults below.
 */
public class ConsensusConfig {

    private static final Logger logger = LoggerFactory.getLogger(ConsensusConfig.class);

    public static final int DEFAULT_REQUIRED_CONFIRMATIONS = 3;
    public static final int DEFAULT_MAX_ROUNDS = 3;
    public static final int DEFAULT_REPLICATION_FACTOR = 3;
    public static final long DEFAULT_HEARTBEAT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_UPTIME_WINDOW_SIZE = 20;
    public static final long DEFAULT_ROUND_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_TASK_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_TASK_BASE_DELAY_MS = 100;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final long DEFAULT_STATUS_CACHE_TTL_SECONDS = 300;
    public static final long DEFAULT_SIMULATION_MIN_DELAY_MS = 500;
    public static final long DEFAULT_SIMULATION_MAX_DELAY_MS = 2000;
    public static final String DEFAULT_SQS_ENDPOINT = "http://localhost:9324";
    public static final String DEFAULT_NOTIFICATION_QUEUE_NAME = "vote-consensus-notifications";

    private final String coordinatorId;
    private final int requiredConfirmations;
    private final int maxRounds;
    private final int replicationFactor;
    private final Duration heartbeatTimeout;
    private final int uptimeWindowSize;
    private final Duration roundTimeout;
    private final int taskMaxAttempts;
    private final long taskBaseDelayMs;
    private final int workerThreads;
    private final Duration statusCacheTtl;
    private final boolean simulateConfirmations;
    private final long simulationMinDelayMs;
    private final long simulationMaxDelayMs;
    private final double simulationRejectProbability;
    private final String sqsEndpoint;
    private final String notificationQueueName;

    private ConsensusConfig(Builder builder) {
        this.coordinatorId = builder.coordinatorId;
        this.requiredConfirmations = builder.requiredConfirmations;
        this.maxRounds = builder.maxRounds;
        this.replicationFactor = builder.replicationFactor;
        this.heartbeatTimeout = builder.heartbeatTimeout;
        this.uptimeWindowSize = builder.uptimeWindowSize;
        this.roundTimeout = builder.roundTimeout;
        this.taskMaxAttempts = builder.taskMaxAttempts;
        this.taskBaseDelayMs = builder.taskBaseDelayMs;
        this.workerThreads = builder.workerThreads;
        this.statusCacheTtl = builder.statusCacheTtl;
        this.simulateConfirmations = builder.simulateConfirmations;
        this.simulationMinDelayMs = builder.simulationMinDelayMs;
        this.simulationMaxDelayMs = builder.simulationMaxDelayMs;
        this.simulationRejectProbability = builder.simulationRejectProbability;
        this.sqsEndpoint = builder.sqsEndpoint;
        this.notificationQueueName = builder.notificationQueueName;
    }

    public static ConsensusConfig defaults() {
        return builder().build();
    }

    public static ConsensusConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds a configuration from the given variables. Malformed numbers fall back to the default
     * and are logged rather than failing startup.
     */
    public static ConsensusConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();

        String coordinatorId = env.get("COORDINATOR_ID");
        if (coordinatorId == null || coordinatorId.trim().isEmpty()) {
            coordinatorId = "coordinator-" + System.currentTimeMillis();
        }
        builder.coordinatorId(coordinatorId)
            .requiredConfirmations(intValue(env, "REQUIRED_CONFIRMATIONS", DEFAULT_REQUIRED_CONFIRMATIONS))
            .maxRounds(intValue(env, "MAX_ROUNDS", DEFAULT_MAX_ROUNDS))
            .replicationFactor(intValue(env, "REPLICATION_FACTOR", DEFAULT_REPLICATION_FACTOR))
            .heartbeatTimeout(Duration.ofSeconds(longValue(env, "HEARTBEAT_TIMEOUT_SECONDS", DEFAULT_HEARTBEAT_TIMEOUT_SECONDS)))
            .uptimeWindowSize(intValue(env, "UPTIME_WINDOW_SIZE", DEFAULT_UPTIME_WINDOW_SIZE))
            .roundTimeout(Duration.ofSeconds(longValue(env, "ROUND_TIMEOUT_SECONDS", DEFAULT_ROUND_TIMEOUT_SECONDS)))
            .taskMaxAttempts(intValue(env, "TASK_MAX_ATTEMPTS", DEFAULT_TASK_MAX_ATTEMPTS))
            .taskBaseDelayMs(longValue(env, "TASK_BASE_DELAY_MS", DEFAULT_TASK_BASE_DELAY_MS))
            .workerThreads(intValue(env, "WORKER_THREADS", DEFAULT_WORKER_THREADS))
            .statusCacheTtl(Duration.ofSeconds(longValue(env, "STATUS_CACHE_TTL_SECONDS", DEFAULT_STATUS_CACHE_TTL_SECONDS)))
            .simulateConfirmations(Boolean.parseBoolean(env.getOrDefault("SIMULATE_CONFIRMATIONS", "false")))
            .simulationDelayRange(
                longValue(env, "SIMULATION_MIN_DELAY_MS", DEFAULT_SIMULATION_MIN_DELAY_MS),
                longValue(env, "SIMULATION_MAX_DELAY_MS", DEFAULT_SIMULATION_MAX_DELAY_MS))
            .simulationRejectProbability(doubleValue(env, "SIMULATION_REJECT_PROBABILITY", 0.0))
            .sqsEndpoint(env.getOrDefault("SQS_ENDPOINT", DEFAULT_SQS_ENDPOINT))
            .notificationQueueName(env.getOrDefault("NOTIFICATION_QUEUE_NAME", DEFAULT_NOTIFICATION_QUEUE_NAME));

        ConsensusConfig config = builder.build();
        logger.info("Loaded consensus configuration: {}", config);
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int intValue(Map<String, String> env, String key, int defaultValue) {
        return (int) longValue(env, key, defaultValue);
    }

    private static long longValue(Map<String, String> env, String key, long defaultValue) {
        String raw = env.get(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed value for {}: '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private static double doubleValue(Map<String, String> env, String key, double defaultValue) {
        String raw = env.get(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed value for {}: '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    public String getCoordinatorId() {
        return coordinatorId;
    }

    public int getRequiredConfirmations() {
        return requiredConfirmations;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public int getReplicationFactor() {
        return replicationFactor;
    }

    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    public int getUptimeWindowSize() {
        return uptimeWindowSize;
    }

    public Duration getRoundTimeout() {
        return roundTimeout;
    }

    public int getTaskMaxAttempts() {
        return taskMaxAttempts;
    }

    public long getTaskBaseDelayMs() {
        return taskBaseDelayMs;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Duration getStatusCacheTtl() {
        return statusCacheTtl;
    }

    public boolean isSimulateConfirmations() {
        return simulateConfirmations;
    }

    public long getSimulationMinDelayMs() {
        return simulationMinDelayMs;
    }

    public long getSimulationMaxDelayMs() {
        return simulationMaxDelayMs;
    }

    public double getSimulationRejectProbability() {
        return simulationRejectProbability;
    }

    public String getSqsEndpoint() {
        return sqsEndpoint;
    }

    public String getNotificationQueueName() {
        return notificationQueueName;
    }

    @Override
    public String toString() {
        return "ConsensusConfig{" +
               "coordinatorId='" + coordinatorId + '\'' +
               ", requiredConfirmations=" + requiredConfirmations +
               ", maxRounds=" + maxRounds +
               ", replicationFactor=" + replicationFactor +
               ", heartbeatTimeout=" + heartbeatTimeout +
               ", uptimeWindowSize=" + uptimeWindowSize +
               ", roundTimeout=" + roundTimeout +
               ", taskMaxAttempts=" + taskMaxAttempts +
               ", workerThreads=" + workerThreads +
               ", simulateConfirmations=" + simulateConfirmations +
               '}';
    }

    public static final class Builder {
        private String coordinatorId = "coordinator-1";
        private int requiredConfirmations = DEFAULT_REQUIRED_CONFIRMATIONS;
        private int maxRounds = DEFAULT_MAX_ROUNDS;
        private int replicationFactor = DEFAULT_REPLICATION_FACTOR;
        private Duration heartbeatTimeout = Duration.ofSeconds(DEFAULT_HEARTBEAT_TIMEOUT_SECONDS);
        private int uptimeWindowSize = DEFAULT_UPTIME_WINDOW_SIZE;
        private Duration roundTimeout = Duration.ofSeconds(DEFAULT_ROUND_TIMEOUT_SECONDS);
        private int taskMaxAttempts = DEFAULT_TASK_MAX_ATTEMPTS;
        private long taskBaseDelayMs = DEFAULT_TASK_BASE_DELAY_MS;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private Duration statusCacheTtl = Duration.ofSeconds(DEFAULT_STATUS_CACHE_TTL_SECONDS);
        private boolean simulateConfirmations = false;
        private long simulationMinDelayMs = DEFAULT_SIMULATION_MIN_DELAY_MS;
        private long simulationMaxDelayMs = DEFAULT_SIMULATION_MAX_DELAY_MS;
        private double simulationRejectProbability = 0.0;
        private String sqsEndpoint = DEFAULT_SQS_ENDPOINT;
        private String notificationQueueName = DEFAULT_NOTIFICATION_QUEUE_NAME;

        private Builder() {
        }

        public Builder coordinatorId(String coordinatorId) {
            this.coordinatorId = coordinatorId;
            return this;
        }

        public Builder requiredConfirmations(int requiredConfirmations) {
            this.requiredConfirmations = requiredConfirmations;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder replicationFactor(int replicationFactor) {
            this.replicationFactor = replicationFactor;
            return this;
        }

        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
            return this;
        }

        public Builder uptimeWindowSize(int uptimeWindowSize) {
            this.uptimeWindowSize = uptimeWindowSize;
            return this;
        }

        public Builder roundTimeout(Duration roundTimeout) {
            this.roundTimeout = roundTimeout;
            return this;
        }

        public Builder taskMaxAttempts(int taskMaxAttempts) {
            this.taskMaxAttempts = taskMaxAttempts;
            return this;
        }

        public Builder taskBaseDelayMs(long taskBaseDelayMs) {
            this.taskBaseDelayMs = taskBaseDelayMs;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder statusCacheTtl(Duration statusCacheTtl) {
            this.statusCacheTtl = statusCacheTtl;
            return this;
        }

        public Builder simulateConfirmations(boolean simulateConfirmations) {
            this.simulateConfirmations = simulateConfirmations;
            return this;
        }

        public Builder simulationDelayRange(long minDelayMs, long maxDelayMs) {
            this.simulationMinDelayMs = minDelayMs;
            this.simulationMaxDelayMs = maxDelayMs;
            return this;
        }

        public Builder simulationRejectProbability(double simulationRejectProbability) {
            this.simulationRejectProbability = simulationRejectProbability;
            return this;
        }

        public Builder sqsEndpoint(String sqsEndpoint) {
            this.sqsEndpoint = sqsEndpoint;
            return this;
        }

        public Builder notificationQueueName(String notificationQueueName) {
            this.notificationQueueName = notificationQueueName;
            return this;
        }

        public ConsensusConfig build() {
            if (requiredConfirmations < 1) {
                throw new IllegalArgumentException("requiredConfirmations must be at least 1");
            }
            if (maxRounds < 1) {
                throw new IllegalArgumentException("maxRounds must be at least 1");
            }
            if (replicationFactor < 1) {
                throw new IllegalArgumentException("replicationFactor must be at least 1");
            }
            if (uptimeWindowSize < 1) {
                throw new IllegalArgumentException("uptimeWindowSize must be at least 1");
            }
            if (taskMaxAttempts < 1) {
                throw new IllegalArgumentException("taskMaxAttempts must be at least 1");
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be at least 1");
            }
            if (simulationMinDelayMs < 0 || simulationMaxDelayMs < simulationMinDelayMs) {
                throw new IllegalArgumentException("invalid simulation delay range");
            }
            return new ConsensusConfig(this);
        }
    }
}
