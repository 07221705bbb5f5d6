package dk.cloudcreate.essentials.pgnotify.postgresql;

/**
 * The liveness probe or the retrieval of pending notifications failed while polling
 */
public class NotificationPollException extends NotificationStreamException {
    public NotificationPollException(String message, Throwable cause) {
        super(message, cause);
    }
}
