package dk.cloudcreate.essentials.pgnotify.postgresql;

import reactor.core.publisher.FluxSink;

/**
 * What to do with notifications polled from the database while the slowest subscriber isn't ready to receive them
 */
public enum BackpressureStrategy {
    /**
     * Queue notifications without any bound. Sustained overload will grow memory usage
     */
    BUFFER(FluxSink.OverflowStrategy.BUFFER),
    /**
     * Discard newly polled notifications while downstream isn't ready
     */
    DROP(FluxSink.OverflowStrategy.DROP),
    /**
     * Only keep the most recently polled notification, discarding older unread ones
     */
    LATEST(FluxSink.OverflowStrategy.LATEST),
    /**
     * Terminate the stream with a {@link NotificationStreamOverflowException}. The stream will not reconnect
     */
    ERROR(FluxSink.OverflowStrategy.ERROR);

    private final FluxSink.OverflowStrategy overflowStrategy;

    BackpressureStrategy(FluxSink.OverflowStrategy overflowStrategy) {
        this.overflowStrategy = overflowStrategy;
    }

    public FluxSink.OverflowStrategy overflowStrategy() {
        return overflowStrategy;
    }
}
