package dk.cloudcreate.essentials.pgnotify.postgresql;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Executing <code>LISTEN</code> for one of the channels failed. The connection the registration was performed on
 * has been closed, no channels remain registered on it
 */
public class ChannelRegistrationException extends NotificationStreamException {
    public final ChannelName channel;

    public ChannelRegistrationException(ChannelName channel, Throwable cause) {
        super(msg("Failed to LISTEN on channel '{}'", requireNonNull(channel, "No channel provided")), cause);
        this.channel = channel;
    }
}
