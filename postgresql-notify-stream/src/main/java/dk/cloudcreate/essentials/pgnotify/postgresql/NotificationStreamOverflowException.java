package dk.cloudcreate.essentials.pgnotify.postgresql;

/**
 * Subscribers couldn't keep up with the polled notifications and the stream was configured with {@link BackpressureStrategy#ERROR}.<br>
 * This is the only failure that isn't followed by a reconnection
 */
public class NotificationStreamOverflowException extends NotificationStreamException {
    public NotificationStreamOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
