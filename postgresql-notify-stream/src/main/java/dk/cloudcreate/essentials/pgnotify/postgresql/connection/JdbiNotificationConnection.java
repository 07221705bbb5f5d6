package dk.cloudcreate.essentials.pgnotify.postgresql.connection;

import dk.cloudcreate.essentials.pgnotify.postgresql.*;
import org.jdbi.v3.core.Handle;
import org.postgresql.*;

import java.sql.SQLException;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link NotificationConnection} on top of a Jdbi {@link Handle} whose JDBC connection is a PostgreSQL {@link PGConnection}
 */
public class JdbiNotificationConnection implements NotificationConnection {
    private final Handle        handle;
    private final PGConnection  pgConnection;
    private final AtomicBoolean closed = new AtomicBoolean();

    public JdbiNotificationConnection(Handle handle) {
        this.handle = requireNonNull(handle, "No handle provided");
        try {
            this.pgConnection = handle.getConnection().unwrap(PGConnection.class);
        } catch (SQLException e) {
            throw new NotificationConnectionException("The connection isn't a PostgreSQL connection", e);
        }
    }

    @Override
    public void listen(ChannelName channel) {
        requireNonNull(channel, "No channel provided");
        handle.execute("LISTEN " + channel.toQuotedIdentifier());
    }

    @Override
    public void probe() {
        handle.createQuery("SELECT 1")
              .mapTo(Integer.class)
              .one();
    }

    @Override
    public List<NotificationEvent> fetchNotifications() {
        PGNotification[] notifications;
        try {
            notifications = pgConnection.getNotifications();
        } catch (SQLException e) {
            throw new NotificationPollException("Failed to retrieve notifications", e);
        }
        if (notifications == null || notifications.length == 0) {
            return List.of();
        }
        return Arrays.stream(notifications)
                     .map(NotificationEvent::from)
                     .collect(Collectors.toList());
    }

    @Override
    public boolean isClosed() {
        return closed.get() || handle.isClosed();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            handle.close();
        }
    }
}
