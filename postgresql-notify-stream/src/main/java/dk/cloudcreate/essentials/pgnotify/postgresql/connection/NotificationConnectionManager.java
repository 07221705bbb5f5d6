package dk.cloudcreate.essentials.pgnotify.postgresql.connection;

import dk.cloudcreate.essentials.pgnotify.postgresql.*;
import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Opens, registers channels on and closes the single dedicated {@link NotificationConnection} used by an activation of a notification stream
 */
public class NotificationConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(NotificationConnectionManager.class);

    private final NotificationConnectionFactory connectionFactory;

    public NotificationConnectionManager(NotificationConnectionFactory connectionFactory) {
        this.connectionFactory = requireNonNull(connectionFactory, "You must supply a connectionFactory");
    }

    /**
     * Open a new connection
     *
     * @throws NotificationConnectionException if the connection couldn't be opened
     */
    public NotificationConnection open() {
        NotificationConnection connection;
        try {
            connection = connectionFactory.open();
        } catch (NotificationConnectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NotificationConnectionException("Failed to open a notification connection", e);
        }
        if (connection == null) {
            throw new NotificationConnectionException(msg("{} returned no connection", connectionFactory.getClass().getSimpleName()));
        }
        log.debug("Opened notification connection {}", connection);
        return connection;
    }

    /**
     * <code>LISTEN</code> on every channel, in the order provided. Registration is all or nothing:
     * if a single registration fails the connection is closed and no further channels are registered
     *
     * @param connection the connection to register the channels on
     * @param channels   the channels to listen to
     * @throws ChannelRegistrationException if one of the registrations failed
     */
    public void registerChannels(NotificationConnection connection, List<ChannelName> channels) {
        requireNonNull(connection, "No connection provided");
        requireNonNull(channels, "No channels provided");
        for (var channel : channels) {
            try {
                connection.listen(channel);
            } catch (RuntimeException e) {
                close(connection);
                throw new ChannelRegistrationException(channel, e);
            }
        }
        log.info("Listening on channels: {}", channels);
    }

    /**
     * Close the connection. Safe to call with null, on an already closed connection and on a failed connection
     */
    public void close(NotificationConnection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
            log.debug("Closed notification connection {}", connection);
        } catch (RuntimeException e) {
            log.debug(msg("Closing notification connection {} failed", connection), e);
        }
    }
}
