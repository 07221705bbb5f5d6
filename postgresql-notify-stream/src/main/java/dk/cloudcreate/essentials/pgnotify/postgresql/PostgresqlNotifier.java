package dk.cloudcreate.essentials.pgnotify.postgresql;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Sends notifications (<code>NOTIFY</code>) that are received by every connection listening on the channel,
 * e.g. the streams created using {@link PostgresqlNotifyFlux}
 */
public class PostgresqlNotifier {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlNotifier.class);

    private final Jdbi jdbi;

    public PostgresqlNotifier(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
    }

    public static PostgresqlNotifier create(String jdbcUrl, String user, String password) {
        requireNonNull(jdbcUrl, "No jdbcUrl provided");
        return new PostgresqlNotifier(Jdbi.create(jdbcUrl, user, password));
    }

    /**
     * Send a notification in its own transaction
     *
     * @param channel the channel to notify
     * @param payload the payload (may be empty)
     */
    public void notify(ChannelName channel, String payload) {
        jdbi.useHandle(handle -> notify(handle, channel, payload));
    }

    /**
     * Send a notification using an existing handle. If the handle is inside a transaction, the notification is first
     * delivered when the transaction commits
     *
     * @param handle  the handle to notify through
     * @param channel the channel to notify
     * @param payload the payload (may be empty)
     */
    public void notify(Handle handle, ChannelName channel, String payload) {
        requireNonNull(handle, "No handle provided");
        requireNonNull(channel, "No channel provided");
        log.trace("[{}] Sending notification with payload '{}'", channel, payload);
        handle.execute("SELECT pg_notify(?, ?)", channel.toString(), payload != null ? payload : "");
    }
}
