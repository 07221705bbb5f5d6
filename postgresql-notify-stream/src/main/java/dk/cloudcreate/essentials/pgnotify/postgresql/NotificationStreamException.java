package dk.cloudcreate.essentials.pgnotify.postgresql;

/**
 * Base class for the failures a notification stream can experience while it's active
 */
public class NotificationStreamException extends RuntimeException {
    public NotificationStreamException(String message) {
        super(message);
    }

    public NotificationStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public NotificationStreamException(Throwable cause) {
        super(cause);
    }
}
