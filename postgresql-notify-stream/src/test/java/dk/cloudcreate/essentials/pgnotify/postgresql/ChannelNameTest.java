package dk.cloudcreate.essentials.pgnotify.postgresql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ChannelNameTest {
    @Test
    void test_creating_a_ChannelName() {
        var channel = ChannelName.of("orders");

        assertThat(channel.toString()).isEqualTo("orders");
        assertThat((CharSequence) channel).isEqualTo(ChannelName.of("orders"));
        assertThat((CharSequence) channel).isNotEqualTo(ChannelName.of("Orders"));
    }

    @Test
    void verify_blank_channel_names_are_rejected() {
        assertThatThrownBy(() -> ChannelName.of("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChannelName.of("   ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChannelName.of("\t\n")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_ofAll_keeps_the_order_and_rejects_blank_or_missing_channel_names() {
        assertThat(ChannelName.ofAll(List.of("b", "a", "c")))
                .containsExactly(ChannelName.of("b"), ChannelName.of("a"), ChannelName.of("c"));

        assertThatThrownBy(() -> ChannelName.ofAll(List.of("a", " ", "c"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChannelName.ofAll(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void test_quoted_identifier() {
        assertThat(ChannelName.of("orders").toQuotedIdentifier()).isEqualTo("\"orders\"");
        assertThat(ChannelName.of("Mixed Case").toQuotedIdentifier()).isEqualTo("\"Mixed Case\"");
        assertThat(ChannelName.of("a\"; DROP TABLE x; --").toQuotedIdentifier()).isEqualTo("\"a\"\"; DROP TABLE x; --\"");
    }
}
