package dk.cloudcreate.essentials.pgnotify.postgresql.connection;

import dk.cloudcreate.essentials.pgnotify.postgresql.*;

import java.util.List;

/**
 * A dedicated database connection used for receiving notifications.<br>
 * An instance is owned by exactly one activation of a notification stream and is only used from that activation's polling thread.
 */
public interface NotificationConnection extends AutoCloseable {
    /**
     * Register interest in notifications sent on the given channel (<code>LISTEN channel</code>)
     */
    void listen(ChannelName channel);

    /**
     * Execute a trivial query, which both verifies the connection is alive and makes the driver
     * read any notifications the database has sent since the last round trip
     */
    void probe();

    /**
     * Retrieve the notifications received since the last call, in the order they arrived
     *
     * @return the notifications received, or an empty list
     */
    List<NotificationEvent> fetchNotifications();

    /**
     * Is the connection closed
     */
    boolean isClosed();

    /**
     * Close the connection. Calling close on an already closed or failed connection has no effect
     */
    @Override
    void close();
}
