package dk.cloudcreate.essentials.pgnotify.postgresql.poll;

import dk.cloudcreate.essentials.pgnotify.postgresql.*;
import dk.cloudcreate.essentials.pgnotify.postgresql.connection.*;
import org.slf4j.*;
import reactor.core.publisher.FluxSink;

import java.time.Duration;
import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A single activation of a notification stream: opens a connection, listens on the channels and then polls the connection
 * for notifications until it's cancelled or fails.<br>
 * The loop is blocking and must run on its own thread. Every received notification is emitted to the {@link FluxSink}.
 * A failure is emitted as an error signal after the connection has been closed, a cancellation ends the loop without any signal.
 */
public class NotificationPollLoop implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(NotificationPollLoop.class);

    private final String                          streamName;
    private final NotificationConnectionManager   connectionManager;
    private final List<ChannelName>               channels;
    private final Duration                        pollingInterval;
    private final FluxSink<NotificationEvent>     sink;

    private volatile boolean       cancelled;
    private volatile PollLoopState state = PollLoopState.INIT;

    public NotificationPollLoop(String streamName,
                                NotificationConnectionManager connectionManager,
                                List<ChannelName> channels,
                                Duration pollingInterval,
                                FluxSink<NotificationEvent> sink) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.connectionManager = requireNonNull(connectionManager, "No connectionManager provided");
        this.channels = requireNonNull(channels, "No channels provided");
        this.pollingInterval = requireNonNull(pollingInterval, "No pollingInterval provided");
        this.sink = requireNonNull(sink, "No sink provided");
    }

    @Override
    public void run() {
        NotificationConnection connection = null;
        RuntimeException       failure    = null;
        try {
            connection = connectionManager.open();
            connectionManager.registerChannels(connection, channels);
            state = PollLoopState.LISTENING;
            while (!isCancelled()) {
                state = PollLoopState.POLLING;
                poll(connection);
                Thread.sleep(pollingInterval.toMillis());
            }
            state = PollLoopState.CANCELLED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state = PollLoopState.CANCELLED;
        } catch (RuntimeException e) {
            if (isCancelled()) {
                log.debug(msg("[{}] Ignoring failure after the poll loop was cancelled", streamName), e);
                state = PollLoopState.CANCELLED;
            } else {
                state = PollLoopState.FAILED;
                failure = e;
            }
        } finally {
            connectionManager.close(connection);
        }

        if (failure != null) {
            sink.error(failure);
        } else {
            log.debug("[{}] Poll loop cancelled", streamName);
        }
    }

    /**
     * Request the loop to stop. The loop checks the flag before every poll, so the loop will end at the latest
     * one polling interval (plus the duration of an in-flight poll) later
     */
    public void cancel() {
        cancelled = true;
    }

    public PollLoopState state() {
        return state;
    }

    private boolean isCancelled() {
        return cancelled || sink.isCancelled() || Thread.currentThread().isInterrupted();
    }

    private void poll(NotificationConnection connection) {
        List<NotificationEvent> notifications;
        try {
            connection.probe();
            notifications = connection.fetchNotifications();
        } catch (NotificationStreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NotificationPollException(msg("[{}] Polling for notifications failed", streamName), e);
        }

        if (notifications.isEmpty()) {
            log.trace("[{}] No notifications received", streamName);
            return;
        }
        log.trace("[{}] Received {} notification(s)", streamName, notifications.size());
        notifications.forEach(sink::next);
    }
}
