package dk.cloudcreate.essentials.pgnotify.postgresql.listener;

import dk.cloudcreate.essentials.pgnotify.common.Lifecycle;
import dk.cloudcreate.essentials.pgnotify.postgresql.*;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.Set;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Delivers the notifications from a notification stream (see {@link PostgresqlNotifyFlux}) to a {@link NotificationHandler}
 * while it's started.<br>
 * A {@link NotificationHandler} that throws an exception doesn't stop the delivery of later notifications.
 */
public class NotificationStreamListener implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(NotificationStreamListener.class);

    private final Flux<NotificationEvent> notifications;
    private final Set<ChannelName>        channels;
    private final NotificationHandler     notificationHandler;

    private volatile Disposable subscription;

    /**
     * Listen to notifications on all channels of the stream
     */
    public NotificationStreamListener(Flux<NotificationEvent> notifications,
                                      NotificationHandler notificationHandler) {
        this(notifications, Set.of(), notificationHandler);
    }

    /**
     * @param notifications       the notification stream
     * @param channels            only deliver notifications on these channels. An empty set means all channels
     * @param notificationHandler the handler notifications are delivered to
     */
    public NotificationStreamListener(Flux<NotificationEvent> notifications,
                                      Set<ChannelName> channels,
                                      NotificationHandler notificationHandler) {
        this.notifications = requireNonNull(notifications, "No notifications stream provided");
        this.channels = Set.copyOf(requireNonNull(channels, "No channels provided"));
        this.notificationHandler = requireNonNull(notificationHandler, "You must specify a notificationHandler");
    }

    @Override
    public synchronized void start() {
        if (!isStarted()) {
            log.info("Starting NotificationStreamListener for channels {}", channels.isEmpty() ? "*" : channels);
            subscription = notifications.filter(this::isRelevant)
                                        .subscribe(this::deliver,
                                                   error -> log.error("NotificationStreamListener stream terminated", error));
        }
    }

    @Override
    public synchronized void stop() {
        if (subscription != null) {
            log.info("Stopping NotificationStreamListener for channels {}", channels.isEmpty() ? "*" : channels);
            subscription.dispose();
            subscription = null;
        }
    }

    @Override
    public boolean isStarted() {
        var currentSubscription = subscription;
        return currentSubscription != null && !currentSubscription.isDisposed();
    }

    private boolean isRelevant(NotificationEvent notification) {
        return channels.isEmpty() || channels.contains(notification.channel);
    }

    private void deliver(NotificationEvent notification) {
        try {
            notificationHandler.handle(notification);
        } catch (Exception e) {
            log.error(msg("NotificationHandler failed to handle {}", notification), e);
        }
    }
}
