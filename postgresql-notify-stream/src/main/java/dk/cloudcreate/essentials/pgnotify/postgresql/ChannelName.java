package dk.cloudcreate.essentials.pgnotify.postgresql;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * The name of a PostgreSQL notification channel, i.e. the channel used in <code>LISTEN channel</code>
 * and <code>NOTIFY channel, 'payload'</code>.<br>
 * A {@link ChannelName} is never blank.
 */
public class ChannelName extends CharSequenceType<ChannelName> {
    public ChannelName(CharSequence value) {
        super(requireNonBlankChannelName(value));
    }

    public static ChannelName of(CharSequence value) {
        return new ChannelName(value);
    }

    /**
     * Convert and validate a list of channel names
     *
     * @param channelNames the channel names in the order they should be listened to
     * @return an immutable list of {@link ChannelName}'s in the same order
     * @throws IllegalArgumentException if the list is empty or any of the channel names are blank
     */
    public static List<ChannelName> ofAll(List<? extends CharSequence> channelNames) {
        requireNonNull(channelNames, "No channel names provided");
        requireTrue(!channelNames.isEmpty(), "You must specify at least one channel name");
        return channelNames.stream()
                           .map(ChannelName::of)
                           .collect(Collectors.toUnmodifiableList());
    }

    /**
     * The channel name as a quoted SQL identifier (embedded double quotes are doubled), which preserves the exact case of the name
     */
    public String toQuotedIdentifier() {
        return '"' + toString().replace("\"", "\"\"") + '"';
    }

    private static CharSequence requireNonBlankChannelName(CharSequence value) {
        requireNonNull(value, "Channel name cannot be null");
        requireTrue(!value.toString().isBlank(), "Channel name cannot be blank");
        return value;
    }
}
