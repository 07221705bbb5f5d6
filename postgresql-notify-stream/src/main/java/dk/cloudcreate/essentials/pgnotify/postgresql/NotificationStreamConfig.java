package dk.cloudcreate.essentials.pgnotify.postgresql;

import java.time.Duration;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Immutable configuration of a notification stream created using {@link PostgresqlNotifyFlux}
 */
public class NotificationStreamConfig {
    public static final Duration             DEFAULT_POLLING_INTERVAL      = Duration.ofMillis(1000);
    public static final Duration             DEFAULT_RECONNECTION_TIMEOUT  = Duration.ofMillis(5000);
    public static final BackpressureStrategy DEFAULT_BACKPRESSURE_STRATEGY = BackpressureStrategy.BUFFER;

    /**
     * How long to wait between two polls for new notifications
     */
    public final Duration             pollingInterval;
    /**
     * How long to wait after a failure before a new connection is opened
     */
    public final Duration             reconnectionTimeout;
    public final BackpressureStrategy backpressureStrategy;

    public NotificationStreamConfig(Duration pollingInterval,
                                    Duration reconnectionTimeout,
                                    BackpressureStrategy backpressureStrategy) {
        this.pollingInterval = requirePositive(pollingInterval, "pollingInterval");
        this.reconnectionTimeout = requirePositive(reconnectionTimeout, "reconnectionTimeout");
        this.backpressureStrategy = requireNonNull(backpressureStrategy, "No backpressureStrategy provided");
    }

    /**
     * Polling every second, reconnecting after 5 seconds and buffering notifications
     */
    public static NotificationStreamConfig defaults() {
        return new NotificationStreamConfig(DEFAULT_POLLING_INTERVAL,
                                            DEFAULT_RECONNECTION_TIMEOUT,
                                            DEFAULT_BACKPRESSURE_STRATEGY);
    }

    public static NotificationStreamConfig of(long pollingPeriodMs,
                                              long reconnectionTimeoutMs,
                                              BackpressureStrategy backpressureStrategy) {
        return new NotificationStreamConfig(Duration.ofMillis(pollingPeriodMs),
                                            Duration.ofMillis(reconnectionTimeoutMs),
                                            backpressureStrategy);
    }

    public NotificationStreamConfig withPollingInterval(Duration pollingInterval) {
        return new NotificationStreamConfig(pollingInterval, reconnectionTimeout, backpressureStrategy);
    }

    public NotificationStreamConfig withReconnectionTimeout(Duration reconnectionTimeout) {
        return new NotificationStreamConfig(pollingInterval, reconnectionTimeout, backpressureStrategy);
    }

    public NotificationStreamConfig withBackpressureStrategy(BackpressureStrategy backpressureStrategy) {
        return new NotificationStreamConfig(pollingInterval, reconnectionTimeout, backpressureStrategy);
    }

    private static Duration requirePositive(Duration duration, String name) {
        requireNonNull(duration, msg("No {} provided", name));
        requireTrue(!duration.isNegative() && !duration.isZero(), msg("{} must be larger than 0 but was {}", name, duration));
        return duration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotificationStreamConfig)) return false;
        NotificationStreamConfig that = (NotificationStreamConfig) o;
        return pollingInterval.equals(that.pollingInterval) &&
                reconnectionTimeout.equals(that.reconnectionTimeout) &&
                backpressureStrategy == that.backpressureStrategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pollingInterval, reconnectionTimeout, backpressureStrategy);
    }

    @Override
    public String toString() {
        return "NotificationStreamConfig{" +
                "pollingInterval=" + pollingInterval +
                ", reconnectionTimeout=" + reconnectionTimeout +
                ", backpressureStrategy=" + backpressureStrategy +
                '}';
    }
}
