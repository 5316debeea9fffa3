package com.proberelay.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import com.proberelay.core.ProbeRelay;
import com.proberelay.core.connection.ConnectionState;
import com.proberelay.core.probe.ProbeConfigurationException;
import com.proberelay.core.probe.ProbeKind;
import com.proberelay.spring.HostEvent;
import com.proberelay.spring.HostEventBridge;
import com.proberelay.testkit.InMemoryCollectorClient;
import com.proberelay.transport.CollectorClient;
import com.proberelay.transport.MeasureRequest;
import com.proberelay.transport.logging.LoggingCollectorClient;
import com.proberelay.transport.okhttp.OkHttpCollectorClient;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class ProbeRelayAutoConfigurationTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withConfiguration(AutoConfigurations.of(ProbeRelayAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class InMemoryCollector {
        @Bean
        InMemoryCollectorClient collectorClient() {
            return InMemoryCollectorClient.reachable();
        }
    }

    @Test
    void creates_an_idle_relay_over_okhttp_by_default() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(ProbeRelay.class).hasSingleBean(HostEventBridge.class);
            assertThat(context.getBean(CollectorClient.class)).isInstanceOf(OkHttpCollectorClient.class);

            ProbeRelay relay = context.getBean(ProbeRelay.class);
            assertThat(relay.context().isIdle()).isTrue();
            assertThat(relay.hooks()).isEmpty();
            assertThat(relay.config().collectorHost()).isEqualTo("kdc-kuzzle");
            assertThat(relay.config().collectorPort()).isEqualTo(7512);
        });
    }

    @Test
    void logging_transport_keeps_measures_in_process() {
        runner.withPropertyValues("probe-relay.transport=logging").run(context -> assertThat(
                        context.getBean(CollectorClient.class))
                .isInstanceOf(LoggingCollectorClient.class));
    }

    @Test
    void can_be_switched_off() {
        runner.withPropertyValues("probe-relay.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(ProbeRelay.class));
    }

    @Test
    void binds_probes_and_relays_host_events() {
        runner.withUserConfiguration(InMemoryCollector.class)
                .withPropertyValues(
                        "probe-relay.probes.logins.kind=counter",
                        "probe-relay.probes.logins.increasers=a",
                        "probe-relay.probes.logins.decreasers=b",
                        "probe-relay.probes.traffic.kind=monitor",
                        "probe-relay.probes.traffic.hooks[0]=a",
                        "probe-relay.probes.traffic.hooks[1]=c")
                .run(context -> {
                    ProbeRelay relay = context.getBean(ProbeRelay.class);
                    InMemoryCollectorClient client = context.getBean(InMemoryCollectorClient.class);

                    assertThat(relay.context().hooks().membership()).isEqualTo(Map.of(
                            "a", Set.of(ProbeKind.COUNTER, ProbeKind.MONITOR),
                            "b", Set.of(ProbeKind.COUNTER),
                            "c", Set.of(ProbeKind.MONITOR)));
                    assertThat(relay.hooks()).containsEntry("core:kuzzleStart", ProbeRelay.CONNECT_HANDLER);

                    context.publishEvent(HostEvent.of("core:kuzzleStart"));
                    assertThat(relay.connectionState()).isEqualTo(ConnectionState.CONNECTED);

                    context.publishEvent(new HostEvent("a", Map.of("user", "u-1")));
                    assertThat(client.requests())
                            .extracting(MeasureRequest::action)
                            .containsExactlyInAnyOrder("counter", "monitor");
                });
    }

    @Test
    void invalid_probes_are_skipped_unless_fail_fast() {
        runner.withUserConfiguration(InMemoryCollector.class)
                .withPropertyValues(
                        "probe-relay.probes.broken.kind=monitor",
                        "probe-relay.probes.fine.type=monitor",
                        "probe-relay.probes.fine.hooks=x")
                .run(context -> {
                    ProbeRelay relay = context.getBean(ProbeRelay.class);
                    assertThat(relay.context().probes()).containsOnlyKeys("fine");
                    assertThat(relay.context().diagnostics()).hasSize(1);
                });

        runner.withUserConfiguration(InMemoryCollector.class)
                .withPropertyValues("probe-relay.fail-fast=true", "probe-relay.probes.broken.kind=monitor")
                .run(context -> assertThat(context)
                        .hasFailed()
                        .getFailure()
                        .hasRootCauseInstanceOf(ProbeConfigurationException.class));
    }

    @Test
    void binds_connection_settings() {
        runner.withUserConfiguration(InMemoryCollector.class)
                .withPropertyValues(
                        "probe-relay.collector.host=collector.internal",
                        "probe-relay.collector.port=9512",
                        "probe-relay.max-connection-errors=3",
                        "probe-relay.reconnect-delay=250ms",
                        "probe-relay.max-reconnect-delay=2s",
                        "probe-relay.plugin-id=custom-probe",
                        "probe-relay.host-started-event=app:ready")
                .run(context -> {
                    ProbeRelay relay = context.getBean(ProbeRelay.class);
                    assertThat(relay.config().endpoint().baseUrl()).isEqualTo("http://collector.internal:9512");
                    assertThat(relay.config().maxConnectionErrors()).isEqualTo(3);
                    assertThat(relay.config().reconnectDelay()).isEqualTo(Duration.ofMillis(250));
                    assertThat(relay.config().maxReconnectDelay()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(relay.config().pluginId()).isEqualTo("custom-probe");
                    assertThat(relay.config().hostStartedEvent()).isEqualTo("app:ready");
                });
    }

    @Test
    void application_ready_connects_unless_disabled() {
        runner.withUserConfiguration(InMemoryCollector.class)
                .withPropertyValues("probe-relay.probes.traffic.kind=monitor", "probe-relay.probes.traffic.hooks=a")
                .run(context -> {
                    context.getBean(HostEventBridge.class).onApplicationReady();
                    assertThat(context.getBean(ProbeRelay.class).connectionState()).isEqualTo(ConnectionState.CONNECTED);
                });

        runner.withUserConfiguration(InMemoryCollector.class)
                .withPropertyValues(
                        "probe-relay.connect-on-ready=false",
                        "probe-relay.probes.traffic.kind=monitor",
                        "probe-relay.probes.traffic.hooks=a")
                .run(context -> {
                    context.getBean(HostEventBridge.class).onApplicationReady();
                    assertThat(context.getBean(InMemoryCollectorClient.class).connectCalls()).isZero();
                });
    }

    @Test
    void declarations_leave_unset_settings_out() {
        ProbeDeclaration declaration = new ProbeDeclaration();
        declaration.setKind("sampler");
        declaration.setIndex("iot");
        declaration.setCollection("sensors");
        declaration.setSampleSize(100);

        assertThat(declaration.toRaw()).containsExactly(
                Map.entry("kind", "sampler"),
                Map.entry("index", "iot"),
                Map.entry("collection", "sensors"),
                Map.entry("sampleSize", 100));
    }
}
