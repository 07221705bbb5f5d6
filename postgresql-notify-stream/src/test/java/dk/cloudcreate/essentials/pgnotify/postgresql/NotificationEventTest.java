package dk.cloudcreate.essentials.pgnotify.postgresql;

import org.junit.jupiter.api.Test;
import org.postgresql.PGNotification;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationEventTest {
    @Test
    void test_creating_a_NotificationEvent_from_a_PGNotification() {
        // Given
        var notification = new PGNotification() {
            @Override
            public String getName() {
                return "orders";
            }

            @Override
            public int getPID() {
                return 4711;
            }

            @Override
            public String getParameter() {
                return "order-1";
            }
        };

        // When
        var event = NotificationEvent.from(notification);

        // Then
        assertThat((CharSequence) event.channel).isEqualTo(ChannelName.of("orders"));
        assertThat(event.payload).isEqualTo("order-1");
        assertThat(event.originatingBackendId).isEqualTo(4711);
        assertThat(event).isEqualTo(NotificationEvent.of("orders", "order-1", 4711));
    }

    @Test
    void verify_a_missing_payload_is_represented_as_an_empty_payload() {
        assertThat(NotificationEvent.of("orders", null, 1).payload).isEmpty();
    }

    @Test
    void test_isFor() {
        var event = NotificationEvent.of("orders", "payload", 1);

        assertThat(event.isFor("orders")).isTrue();
        assertThat(event.isFor(ChannelName.of("orders"))).isTrue();
        assertThat(event.isFor("customers")).isFalse();
        assertThat(event.isFor("Orders")).isFalse();
    }
}
