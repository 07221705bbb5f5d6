package dk.cloudcreate.essentials.pgnotify.postgresql;

import org.postgresql.PGNotification;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Represents a single <code>NOTIFY</code> received on a channel the stream is listening to
 */
public class NotificationEvent {
    /**
     * The channel the notification was sent on
     */
    public final ChannelName channel;
    /**
     * The notification payload. Empty if the notification was sent without a payload
     */
    public final String      payload;
    /**
     * The process id of the database backend that sent the notification
     */
    public final int         originatingBackendId;

    public NotificationEvent(ChannelName channel, String payload, int originatingBackendId) {
        this.channel = requireNonNull(channel, "No channel provided");
        this.payload = payload != null ? payload : "";
        this.originatingBackendId = originatingBackendId;
    }

    public static NotificationEvent of(CharSequence channel, String payload, int originatingBackendId) {
        return new NotificationEvent(ChannelName.of(channel), payload, originatingBackendId);
    }

    public static NotificationEvent from(PGNotification notification) {
        requireNonNull(notification, "No notification provided");
        return new NotificationEvent(ChannelName.of(notification.getName()),
                                     notification.getParameter(),
                                     notification.getPID());
    }

    /**
     * Does this notification belong to the given channel
     */
    public boolean isFor(CharSequence channel) {
        return this.channel.toString().equals(String.valueOf(channel));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotificationEvent)) return false;
        NotificationEvent that = (NotificationEvent) o;
        return originatingBackendId == that.originatingBackendId &&
                channel.equals(that.channel) &&
                payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, payload, originatingBackendId);
    }

    @Override
    public String toString() {
        return "NotificationEvent{" +
                "channel=" + channel +
                ", payload='" + payload + '\'' +
                ", originatingBackendId=" + originatingBackendId +
                '}';
    }
}
