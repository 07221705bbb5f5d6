package dk.cloudcreate.essentials.pgnotify.postgresql.connection;

import dk.cloudcreate.essentials.pgnotify.postgresql.*;
import dk.cloudcreate.essentials.pgnotify.postgresql.test_data.TestNotificationConnectionFactory;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class NotificationConnectionManagerTest {
    private TestNotificationConnectionFactory connectionFactory;
    private NotificationConnectionManager     connectionManager;

    @BeforeEach
    void setup() {
        connectionFactory = new TestNotificationConnectionFactory();
        connectionManager = new NotificationConnectionManager(connectionFactory);
    }

    @Test
    void verify_channels_are_registered_in_the_order_provided() {
        // Given
        var connection = connectionManager.open();

        // When
        connectionManager.registerChannels(connection, ChannelName.ofAll(List.of("c", "a", "b")));

        // Then
        assertThat(connectionFactory.lastConnection().listenedChannels)
                .containsExactly(ChannelName.of("c"), ChannelName.of("a"), ChannelName.of("b"));
        assertThat(connection.isClosed()).isFalse();
    }

    @Test
    void verify_a_failing_registration_closes_the_connection_and_stops_registering() {
        // Given
        connectionFactory.failListenOn("b");
        var connection = connectionManager.open();

        // When
        var channels = ChannelName.ofAll(List.of("a", "b", "c"));
        assertThatThrownBy(() -> connectionManager.registerChannels(connection, channels))
                .isInstanceOf(ChannelRegistrationException.class)
                .satisfies(e -> assertThat((CharSequence) ((ChannelRegistrationException) e).channel).isEqualTo(ChannelName.of("b")));

        // Then
        assertThat(connection.isClosed()).isTrue();
        assertThat(connectionFactory.lastConnection().listenedChannels).containsExactly(ChannelName.of("a"));
    }

    @Test
    void verify_failures_to_open_are_reported_as_NotificationConnectionException() {
        connectionFactory.failNextOpens(1);

        assertThatThrownBy(() -> connectionManager.open())
                .isInstanceOf(NotificationConnectionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(connectionManager.open()).isNotNull();
    }

    @Test
    void verify_a_factory_returning_no_connection_is_reported_as_NotificationConnectionException() {
        var manager = new NotificationConnectionManager(() -> null);

        assertThatThrownBy(manager::open).isInstanceOf(NotificationConnectionException.class);
    }

    @Test
    void verify_close_is_idempotent() {
        var connection = connectionManager.open();

        connectionManager.close(connection);
        connectionManager.close(connection);
        connectionManager.close(null);

        assertThat(connection.isClosed()).isTrue();
        assertThat(connectionFactory.lastConnection().closeCalls()).isEqualTo(2);
    }

    @Test
    void verify_a_failing_close_is_not_propagated() {
        var manager = new NotificationConnectionManager(() -> new NotificationConnection() {
            @Override
            public void listen(ChannelName channel) {
            }

            @Override
            public void probe() {
            }

            @Override
            public List<NotificationEvent> fetchNotifications() {
                return List.of();
            }

            @Override
            public boolean isClosed() {
                return false;
            }

            @Override
            public void close() {
                throw new IllegalStateException("Connection already broken");
            }
        });

        assertThatCode(() -> manager.close(manager.open())).doesNotThrowAnyException();
    }
}
