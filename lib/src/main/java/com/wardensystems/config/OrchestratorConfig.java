package com.wardensystems.config;

import com.wardensystems.channel.ChannelType;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for the supervisor, the health monitor and service inboxes.
 * Every setting has a documented default and can be changed independently.
 */
public class OrchestratorConfig {
    // Default values
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofSeconds(3);
    public static final Duration DEFAULT_DEAD_THRESHOLD = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_RESTARTS = 3;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STARTUP_GRACE_PERIOD = Duration.ofSeconds(5);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_INBOX_CAPACITY = 1000;
    public static final ChannelType DEFAULT_CHANNEL_TYPE = ChannelType.LINKED;
    public static final boolean DEFAULT_AUTO_RESTART = true;

    private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
    private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
    private Duration slowThreshold = DEFAULT_SLOW_THRESHOLD;
    private Duration deadThreshold = DEFAULT_DEAD_THRESHOLD;
    private int maxRestarts = DEFAULT_MAX_RESTARTS;
    private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
    private Duration startupGracePeriod = DEFAULT_STARTUP_GRACE_PERIOD;
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
    private int inboxCapacity = DEFAULT_INBOX_CAPACITY;
    private ChannelType channelType = DEFAULT_CHANNEL_TYPE;
    private boolean autoRestart = DEFAULT_AUTO_RESTART;
    private Clock clock = Clock.systemUTC();

    /**
     * Creates a new OrchestratorConfig with default values.
     */
    public OrchestratorConfig() {
        // Use defaults
    }

    /**
     * Checks that durations are positive and that the slow threshold is below the dead threshold.
     *
     * @return This OrchestratorConfig instance
     * @throws IllegalArgumentException if a setting is out of range
     */
    public OrchestratorConfig validate() {
        requirePositive(checkInterval, "checkInterval");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(slowThreshold, "slowThreshold");
        requirePositive(deadThreshold, "deadThreshold");
        requirePositive(callTimeout, "callTimeout");
        requirePositive(startupGracePeriod, "startupGracePeriod");
        requirePositive(drainTimeout, "drainTimeout");
        if (slowThreshold.compareTo(deadThreshold) >= 0) {
            throw new IllegalArgumentException("slowThreshold (" + slowThreshold
                    + ") must be smaller than deadThreshold (" + deadThreshold + ")");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative: " + maxRestarts);
        }
        if (inboxCapacity <= 0) {
            throw new IllegalArgumentException("inboxCapacity must be positive: " + inboxCapacity);
        }
        return this;
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    /**
     * Sets how often the health monitor inspects every service.
     *
     * @param checkInterval the monitor period
     * @return This OrchestratorConfig instance
     */
    public OrchestratorConfig setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
        return this;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    /**
     * Sets the longest time a service loop waits on its inbox before writing a heartbeat.
     *
     * @param heartbeatInterval the heartbeat period
     * @return This OrchestratorConfig instance
     */
    public OrchestratorConfig setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
        return this;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * Sets the heartbeat age above which a service is reported DEGRADED.
     *
     * @param slowThreshold the slow threshold
     * @return This OrchestratorConfig instance
     */
    public OrchestratorConfig setSlowThreshold(Duration slowThreshold) {
        this.slowThreshold = slowThreshold;
        return this;
    }

    public Duration getSlowThreshold() {
        return slowThreshold;
    }

    /**
     * Sets the heartbeat age above which a service is reported DEAD.
     *
     * @param deadThreshold the dead threshold
     * @return This OrchestratorConfig instance
     */
    public OrchestratorConfig setDeadThreshold(Duration deadThreshold) {
        this.deadThreshold = deadThreshold;
        return this;
    }

    public Duration getDeadThreshold() {
        return deadThreshold;
    }

    /**
     * Sets how many restarts a single registration may use.
     *
     * @param maxRestarts the restart ceiling
     * @return This OrchestratorConfig instance
     */
    public OrchestratorConfig setMaxRestarts(int maxRestarts) {
        this.maxRestarts = maxRestarts;
        return this;
    }

    public int getMaxRestarts() {
        return maxRestarts;
    }

    public OrchestratorConfig setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
        return this;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public OrchestratorConfig setStartupGracePeriod(Duration startupGracePeriod) {
        this.startupGracePeriod = startupGracePeriod;
        return this;
    }

    public Duration getStartupGracePeriod() {
        return startupGracePeriod;
    }

    public OrchestratorConfig setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
        return this;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public OrchestratorConfig setInboxCapacity(int inboxCapacity) {
        this.inboxCapacity = inboxCapacity;
        return this;
    }

    public int getInboxCapacity() {
        return inboxCapacity;
    }

    public OrchestratorConfig setChannelType(ChannelType channelType) {
        this.channelType = channelType;
        return this;
    }

    public ChannelType getChannelType() {
        return channelType;
    }

    /**
     * Sets whether the health monitor restarts services it finds dead.
     *
     * @param autoRestart true to restart automatically, false to leave dead services for an operator
     * @return This OrchestratorConfig instance
     */
    public OrchestratorConfig setAutoRestart(boolean autoRestart) {
        this.autoRestart = autoRestart;
        return this;
    }

    public boolean isAutoRestart() {
        return autoRestart;
    }

    /**
     * Sets the time source shared by heartbeats and the health monitor.
     *
     * @param clock the clock
     * @return This OrchestratorConfig instance
     */
    public OrchestratorConfig setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        return this;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "checkInterval=" + checkInterval +
                ", heartbeatInterval=" + heartbeatInterval +
                ", slowThreshold=" + slowThreshold +
                ", deadThreshold=" + deadThreshold +
                ", maxRestarts=" + maxRestarts +
                ", callTimeout=" + callTimeout +
                ", startupGracePeriod=" + startupGracePeriod +
                ", drainTimeout=" + drainTimeout +
                ", inboxCapacity=" + inboxCapacity +
                ", channelType=" + channelType +
                ", autoRestart=" + autoRestart +
                '}';
    }
}
