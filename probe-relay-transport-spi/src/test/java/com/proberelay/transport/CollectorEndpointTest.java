package com.proberelay.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CollectorEndpointTest {

    @AfterEach
    void clearOverride() {
        System.clearProperty(CollectorEndpoint.PROP_URL);
    }

    @Test
    void defaults_point_at_the_collector_service() {
        assertThat(CollectorEndpoint.defaults().baseUrl()).isEqualTo("http://kdc-kuzzle:7512");
    }

    @Test
    void parses_urls_and_fills_in_missing_parts() {
        assertThat(CollectorEndpoint.parse("https://collector.example:9443"))
                .isEqualTo(new CollectorEndpoint("https", "collector.example", 9443));
        assertThat(CollectorEndpoint.parse("http://collector.example").port()).isEqualTo(7512);
    }

    @Test
    void system_property_overrides_the_configured_address() {
        System.setProperty(CollectorEndpoint.PROP_URL, "http://override:8000");

        assertThat(CollectorEndpoint.of("configured", 7512).resolve()).isEqualTo(CollectorEndpoint.of("override", 8000));
    }

    @Test
    void rejects_blank_hosts_and_bad_ports() {
        assertThatThrownBy(() -> CollectorEndpoint.of(" ", 7512)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CollectorEndpoint.of("h", 70000)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void measure_requests_expose_their_event_and_payload() {
        MeasureRequest request = new MeasureRequest("p/measure", "watcher", Map.of("event", "e", "payload", "x"));

        assertThat(request.event()).isEqualTo("e");
        assertThat(request.hasPayload()).isTrue();
        assertThat(new MeasureRequest("p/measure", "monitor", Map.of("event", "e")).hasPayload()).isFalse();
    }
}
