package com.example.s2s.devicebridge.registry;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    private static JsonObject ping() {
        JsonObject message = new JsonObject();
        message.addProperty("type", "ping");
        return message;
    }

    @Test
    void shouldKeepPrimaryAndCommandChannelsApart() {
        RecordingChannel primary = new RecordingChannel("primary");
        RecordingChannel command = new RecordingChannel("command");

        registry.register(ConnectionKey.primary("dev-1"), primary);
        registry.register(ConnectionKey.commandChannel("dev-1"), command);

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.lookup(ConnectionKey.primary("dev-1"))).containsSame(primary);
        assertThat(registry.lookup(ConnectionKey.commandChannel("dev-1"))).containsSame(command);
        assertThat(ConnectionKey.commandChannel("dev-1")).isNotEqualTo(ConnectionKey.primary("dev-1"));
    }

    @Test
    void shouldReplaceOnReRegistration() {
        RecordingChannel first = new RecordingChannel("first");
        RecordingChannel second = new RecordingChannel("second");

        registry.register(ConnectionKey.primary("dev-1"), first);
        registry.register(ConnectionKey.primary("dev-1"), second);

        assertThat(registry.lookup(ConnectionKey.primary("dev-1"))).containsSame(second);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldNotLetAStaleConnectionEvictItsReplacement() {
        // Arrange
        RecordingChannel stale = new RecordingChannel("stale");
        RecordingChannel current = new RecordingChannel("current");
        registry.register(ConnectionKey.primary("dev-1"), stale);
        registry.register(ConnectionKey.primary("dev-1"), current);

        // Act
        boolean removed = registry.unregister(ConnectionKey.primary("dev-1"), stale);

        // Assert
        assertThat(removed).isFalse();
        assertThat(registry.lookup(ConnectionKey.primary("dev-1"))).containsSame(current);
        assertThat(registry.unregister(ConnectionKey.primary("dev-1"), current)).isTrue();
        assertThat(registry.lookup(ConnectionKey.primary("dev-1"))).isEmpty();
    }

    @Test
    void shouldDeliverSerializedJson() {
        RecordingChannel channel = new RecordingChannel("c");
        registry.register(ConnectionKey.primary("dev-1"), channel);

        assertThat(registry.deliver(ConnectionKey.primary("dev-1"), ping())).isTrue();
        assertThat(channel.lastMessage().get("type").getAsString()).isEqualTo("ping");
    }

    @Test
    void shouldReportFailedDeliveryWithoutThrowing() {
        RecordingChannel closed = new RecordingChannel("closed");
        closed.open = false;
        RecordingChannel broken = new RecordingChannel("broken");
        broken.sendFailure = new IllegalStateException("socket gone");
        registry.register(ConnectionKey.primary("closed"), closed);
        registry.register(ConnectionKey.primary("broken"), broken);

        assertThat(registry.deliver(ConnectionKey.primary("missing"), ping())).isFalse();
        assertThat(registry.deliver(ConnectionKey.primary("closed"), ping())).isFalse();
        assertThat(registry.deliver(ConnectionKey.primary("broken"), ping())).isFalse();
    }

    @Test
    void shouldRejectEmptyDeviceIds() {
        assertThatThrownBy(() -> ConnectionKey.primary(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
