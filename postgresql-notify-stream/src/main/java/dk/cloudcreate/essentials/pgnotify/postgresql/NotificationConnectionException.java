package dk.cloudcreate.essentials.pgnotify.postgresql;

/**
 * Opening the dedicated notification connection failed (network, authentication, driver issues)
 */
public class NotificationConnectionException extends NotificationStreamException {
    public NotificationConnectionException(String message) {
        super(message);
    }

    public NotificationConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
