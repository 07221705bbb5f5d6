package dk.cloudcreate.essentials.pgnotify.postgresql.poll;

/**
 * States of a {@link NotificationPollLoop}:<br>
 * <code>INIT → LISTENING → POLLING → (CANCELLED | FAILED)</code>
 */
public enum PollLoopState {
    INIT,
    LISTENING,
    POLLING,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == CANCELLED || this == FAILED;
    }
}
