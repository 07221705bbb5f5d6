package dk.cloudcreate.essentials.pgnotify.postgresql;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class NotificationStreamConfigTest {
    @Test
    void test_defaults() {
        var config = NotificationStreamConfig.defaults();

        assertThat(config.pollingInterval).isEqualTo(Duration.ofMillis(1000));
        assertThat(config.reconnectionTimeout).isEqualTo(Duration.ofMillis(5000));
        assertThat(config.backpressureStrategy).isEqualTo(BackpressureStrategy.BUFFER);
    }

    @Test
    void verify_periods_must_be_positive() {
        assertThatThrownBy(() -> NotificationStreamConfig.of(0, 5000, BackpressureStrategy.BUFFER))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NotificationStreamConfig.of(1000, -1, BackpressureStrategy.BUFFER))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NotificationStreamConfig.defaults().withPollingInterval(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_with_methods_return_modified_copies() {
        var defaults = NotificationStreamConfig.defaults();

        var modified = defaults.withPollingInterval(Duration.ofMillis(50))
                               .withReconnectionTimeout(Duration.ofMillis(200))
                               .withBackpressureStrategy(BackpressureStrategy.LATEST);

        assertThat(modified).isEqualTo(NotificationStreamConfig.of(50, 200, BackpressureStrategy.LATEST));
        assertThat(defaults).isEqualTo(NotificationStreamConfig.defaults());
    }
}
