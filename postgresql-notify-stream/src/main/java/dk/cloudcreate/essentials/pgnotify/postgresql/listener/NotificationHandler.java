package dk.cloudcreate.essentials.pgnotify.postgresql.listener;

import dk.cloudcreate.essentials.pgnotify.postgresql.NotificationEvent;

@FunctionalInterface
public interface NotificationHandler {
    void handle(NotificationEvent notification);
}
