package com.proberelay.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proberelay.core.connection.CollectorConnectionManager;
import com.proberelay.core.connection.ConnectionState;
import com.proberelay.core.dispatch.MeasureDispatcher;
import com.proberelay.core.hook.HookTable;
import com.proberelay.core.hook.HookTableBuilder;
import com.proberelay.core.probe.ProbeKind;
import com.proberelay.core.probe.ProbeValidation;
import com.proberelay.core.probe.ProbeValidator;
import com.proberelay.transport.CollectorClient;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point the host talks to.
 *
 * <p>Initialization validates the probes, builds the hook table and freezes both into a
 * {@link ProbeContext}. The host then registers {@link #hooks()}, fires its events through
 * {@link #onEvent(String, Object)} (or {@link #handle(String, String, Object)}) and signals its
 * start, which opens the collector connection.
 *
 * <p>Probe configuration example:
 * <pre>{@code
 * probes:
 *   requests:   { kind: monitor, hooks: ["server:afterInfo"] }
 *   sessions:   { kind: counter, increasers: ["auth:afterLogin"], decreasers: ["auth:afterLogout"] }
 *   orders:     { kind: watcher, index: "shop", collection: "orders" }
 *   sensorFeed: { kind: sampler, index: "iot", collection: "sensors" }
 * }</pre>
 */
public final class ProbeRelay implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProbeRelay.class);

    /** Handler id bound to the host-started event. */
    public static final String CONNECT_HANDLER = "connectToCollector";

    private final ProbeRelayConfig config;
    private final ProbeContext context;
    private final CollectorConnectionManager connection;
    private final MeasureDispatcher dispatcher;

    ProbeRelay(
            ProbeRelayConfig config,
            ProbeContext context,
            CollectorConnectionManager connection,
            MeasureDispatcher dispatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.context = Objects.requireNonNull(context, "context");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public static ProbeRelay initialize(ProbeRelayConfig config, CollectorClient client) {
        return initialize(config, client, new ObjectMapper());
    }

    public static ProbeRelay initialize(ProbeRelayConfig config, CollectorClient client, ObjectMapper json) {
        ProbeContext context = buildContext(config, json);
        CollectorConnectionManager connection = new CollectorConnectionManager(
                client, config.maxConnectionErrors(), config.reconnectDelay(), config.maxReconnectDelay());
        return new ProbeRelay(config, context, connection, dispatcher(config, connection, json));
    }

    /** Variant for callers that manage the connection (and its scheduler) themselves. */
    public static ProbeRelay initialize(
            ProbeRelayConfig config, CollectorConnectionManager connection, ObjectMapper json) {
        ProbeContext context = buildContext(config, json);
        return new ProbeRelay(config, context, connection, dispatcher(config, connection, json));
    }

    private static ProbeContext buildContext(ProbeRelayConfig config, ObjectMapper json) {
        ProbeValidation validation = new ProbeValidator(json).validate(config.probes());
        validation.diagnostics().forEach(diagnostic -> log.error("probe-relay: {}", diagnostic));
        if (config.failFast()) {
            validation.requireValid();
        }

        HookTable hooks = HookTableBuilder.build(validation.probes());
        ProbeContext context = ProbeContext.of(validation, hooks);
        if (context.isIdle()) {
            log.info("No valid probe configured, probe relay stays idle");
        } else {
            log.info(
                    "Probe relay initialized: {} probe(s) listening to {} event(s), {} declaration(s) rejected",
                    context.probes().size(),
                    hooks.size(),
                    context.diagnostics().size());
        }
        return context;
    }

    private static MeasureDispatcher dispatcher(
            ProbeRelayConfig config, CollectorConnectionManager connection, ObjectMapper json) {
        return new MeasureDispatcher(connection::client, config.pluginId(), json);
    }

    public ProbeContext context() {
        return context;
    }

    public ProbeRelayConfig config() {
        return config;
    }

    /**
     * Host-facing hook registrations: event name to handler id (a probe kind name) or list of handler
     * ids, plus the host-started event bound to {@link #CONNECT_HANDLER}. Empty when no probe is
     * valid.
     */
    public Map<String, Object> hooks() {
        if (context.isIdle()) return Map.of();
        Map<String, Object> hooks = new LinkedHashMap<>(context.hooks().toHostHooks());
        hooks.merge(config.hostStartedEvent(), CONNECT_HANDLER, ProbeRelay::appendHandler);
        return hooks;
    }

    /** Opens the collector connection; only the first call has an effect. */
    public CompletableFuture<ConnectionState> onHostStarted() {
        if (context.isIdle()) {
            log.debug("Host started but no probe is configured, not connecting to the collector");
            return CompletableFuture.completedFuture(connection.state());
        }
        log.info("Host started, connecting to collector at {}", connection.endpoint());
        return connection.connect();
    }

    /** Dispatches one measure per probe kind bound to {@code event}. Never throws. */
    public void onEvent(String event, Object payload) {
        if (event == null || context.isIdle()) return;
        if (event.equals(config.hostStartedEvent())) {
            onHostStarted();
        }
        for (ProbeKind kind : context.hooks().kindsFor(event)) {
            dispatcher.dispatch(kind, event, payload);
        }
    }

    /** Runs the handler registered under {@code handlerId} by {@link #hooks()}. Never throws. */
    public void handle(String handlerId, String event, Object payload) {
        if (CONNECT_HANDLER.equals(handlerId)) {
            onHostStarted();
            return;
        }
        Optional<ProbeKind> kind = ProbeKind.fromWireName(handlerId);
        if (kind.isEmpty()) {
            log.warn("Unknown probe handler {} for event {}, ignored", handlerId, event);
            return;
        }
        dispatcher.dispatch(kind.get(), event, payload);
    }

    public ConnectionState connectionState() {
        return connection.state();
    }

    @Override
    public void close() {
        connection.close();
    }

    private static Object appendHandler(Object existing, Object handler) {
        List<Object> handlers = new ArrayList<>();
        if (existing instanceof Collection<?> many) handlers.addAll(many);
        else handlers.add(existing);
        handlers.add(handler);
        return List.copyOf(handlers);
    }
}
