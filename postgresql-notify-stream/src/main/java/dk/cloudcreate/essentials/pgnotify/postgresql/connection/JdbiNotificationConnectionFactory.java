package dk.cloudcreate.essentials.pgnotify.postgresql.connection;

import dk.cloudcreate.essentials.pgnotify.postgresql.NotificationConnectionException;
import org.jdbi.v3.core.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link NotificationConnectionFactory} that opens a new {@link Handle} using the provided {@link Jdbi} instance for every connection.<br>
 * Make sure the {@link Jdbi} instance isn't backed by a pooled DataSource that resets connections, since notifications are delivered
 * to the physical connection that executed the <code>LISTEN</code>
 */
public class JdbiNotificationConnectionFactory implements NotificationConnectionFactory {
    private final Jdbi jdbi;

    public JdbiNotificationConnectionFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
    }

    public static JdbiNotificationConnectionFactory create(String jdbcUrl, String user, String password) {
        requireNonNull(jdbcUrl, "No jdbcUrl provided");
        return new JdbiNotificationConnectionFactory(Jdbi.create(jdbcUrl, user, password));
    }

    @Override
    public NotificationConnection open() {
        Handle handle;
        try {
            handle = jdbi.open();
        } catch (JdbiException e) {
            throw new NotificationConnectionException("Failed to open a notification connection", e);
        }
        try {
            return new JdbiNotificationConnection(handle);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }
}
