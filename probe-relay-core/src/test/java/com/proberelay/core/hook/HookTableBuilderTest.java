package com.proberelay.core.hook;

import static org.assertj.core.api.Assertions.assertThat;

import com.proberelay.core.probe.CollectionProbe;
import com.proberelay.core.probe.CounterProbe;
import com.proberelay.core.probe.MonitorProbe;
import com.proberelay.core.probe.Probe;
import com.proberelay.core.probe.ProbeKind;
import com.proberelay.core.probe.ProbeValidator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HookTableBuilderTest {

    @Test
    void monitor_hooks_are_bound_to_monitor() {
        HookTable table = HookTableBuilder.build(Map.of("m", new MonitorProbe("m", List.of("a", "b"))));

        assertThat(table.events()).containsExactlyInAnyOrder("a", "b");
        assertThat(table.kindsFor("a")).containsExactly(ProbeKind.MONITOR);
        assertThat(table.kindsFor("b")).containsExactly(ProbeKind.MONITOR);
        assertThat(table.kindsFor("c")).isEmpty();
    }

    @Test
    void counter_binds_both_increasers_and_decreasers() {
        HookTable table = HookTableBuilder.build(
                Map.of("c", new CounterProbe("c", List.of("login"), List.of("logout", "expire"))));

        assertThat(table.membership()).isEqualTo(Map.of(
                "login", Set.of(ProbeKind.COUNTER),
                "logout", Set.of(ProbeKind.COUNTER),
                "expire", Set.of(ProbeKind.COUNTER)));
    }

    @Test
    void watcher_and_sampler_listen_to_document_and_realtime_events() {
        Map<String, Probe> probes = new LinkedHashMap<>();
        probes.put("w", new CollectionProbe("w", ProbeKind.WATCHER, "idx", "col", null));
        probes.put("s", new CollectionProbe("s", ProbeKind.SAMPLER, "idx", "col", null));

        HookTable table = HookTableBuilder.build(probes);

        assertThat(table.events()).containsExactlyInAnyOrderElementsOf(CollectionProbe.STRUCTURAL_EVENTS);
        for (String event : CollectionProbe.STRUCTURAL_EVENTS) {
            assertThat(table.kindsFor(event)).containsExactly(ProbeKind.WATCHER, ProbeKind.SAMPLER);
        }
    }

    @Test
    void same_kind_on_same_event_dispatches_once() {
        Map<String, Probe> probes = new LinkedHashMap<>();
        probes.put("m1", new MonitorProbe("m1", List.of("a")));
        probes.put("m2", new MonitorProbe("m2", List.of("a", "a")));

        HookTable table = HookTableBuilder.build(probes);

        assertThat(table.kindsFor("a")).containsExactly(ProbeKind.MONITOR);
        assertThat(table.toHostHooks()).containsExactly(Map.entry("a", "monitor"));
    }

    @Test
    void builds_the_table_of_a_mixed_configuration() {
        Map<String, Probe> probes = new LinkedHashMap<>();
        probes.put("counter", new CounterProbe("counter", List.of("a"), List.of("b")));
        probes.put("monitor", new MonitorProbe("monitor", List.of("a", "c")));

        HookTable table = HookTableBuilder.build(probes);

        assertThat(table.entries()).containsExactly(
                Map.entry("a", List.of(ProbeKind.COUNTER, ProbeKind.MONITOR)),
                Map.entry("b", List.of(ProbeKind.COUNTER)),
                Map.entry("c", List.of(ProbeKind.MONITOR)));
        assertThat(table.toHostHooks()).containsExactly(
                Map.entry("a", List.of("counter", "monitor")),
                Map.entry("b", "counter"),
                Map.entry("c", "monitor"));
    }

    @Test
    void membership_does_not_depend_on_declaration_order() {
        List<Probe> probes = List.of(
                new MonitorProbe("m1", List.of("a", "b")),
                new MonitorProbe("m2", List.of("c")),
                new CounterProbe("c1", List.of("a"), List.of("c")),
                new CounterProbe("c2", List.of("d"), List.of()),
                new CollectionProbe("w", ProbeKind.WATCHER, "i", "c", null),
                new CollectionProbe("s", ProbeKind.SAMPLER, "i", "c", null),
                new MonitorProbe("m3", List.of(CollectionProbe.REALTIME_BEFORE_PUBLISH)));
        Map<String, Set<ProbeKind>> expected = build(probes).membership();

        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            List<Probe> shuffled = new ArrayList<>(probes);
            Collections.shuffle(shuffled, random);
            assertThat(build(shuffled).membership()).isEqualTo(expected);
        }
        assertThat(expected.get(CollectionProbe.REALTIME_BEFORE_PUBLISH))
                .containsExactlyInAnyOrder(ProbeKind.WATCHER, ProbeKind.SAMPLER, ProbeKind.MONITOR);
    }

    @Test
    void registering_twice_is_idempotent() {
        HookTableBuilder builder = new HookTableBuilder();
        builder.register("a", ProbeKind.COUNTER);
        builder.register("a", ProbeKind.MONITOR);
        HookTable once = builder.build();
        builder.register("a", ProbeKind.COUNTER);
        builder.register("a", ProbeKind.MONITOR);

        assertThat(builder.build()).isEqualTo(once);
    }

    @Test
    void rejected_counters_contribute_no_hook() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("conflicting", Map.of("kind", "counter", "increasers", List.of("x"), "decreasers", List.of("x")));
        raw.put("monitor", Map.of("kind", "monitor", "hooks", List.of("y")));

        HookTable table = HookTableBuilder.build(new ProbeValidator().validate(raw).probes());

        assertThat(table.events()).containsExactly("y");
    }

    @Test
    void no_probe_means_an_empty_table() {
        assertThat(HookTableBuilder.build(Map.of())).isSameAs(HookTable.empty());
        assertThat(HookTableBuilder.build(null).isEmpty()).isTrue();
        assertThat(HookTable.empty().toHostHooks()).isEmpty();
    }

    private static HookTable build(List<Probe> probes) {
        HookTableBuilder builder = new HookTableBuilder();
        probes.forEach(builder::add);
        return builder.build();
    }
}
