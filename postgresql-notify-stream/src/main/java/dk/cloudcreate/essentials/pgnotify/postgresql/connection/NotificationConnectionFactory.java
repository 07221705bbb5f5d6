package dk.cloudcreate.essentials.pgnotify.postgresql.connection;

import dk.cloudcreate.essentials.pgnotify.postgresql.NotificationConnectionException;

/**
 * Opens the dedicated connections used by notification streams
 */
@FunctionalInterface
public interface NotificationConnectionFactory {
    /**
     * Open a new, authenticated connection
     *
     * @return the new connection
     * @throws NotificationConnectionException if the connection couldn't be established
     */
    NotificationConnection open();
}
