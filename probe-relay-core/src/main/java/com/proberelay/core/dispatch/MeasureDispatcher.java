package com.proberelay.core.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proberelay.core.probe.ProbeKind;
import com.proberelay.transport.CollectorClient;
import com.proberelay.transport.MeasureRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and sends one measure request per (event, probe kind).
 *
 * <p>Fire-and-forget: the host thread never waits for the collector, and no failure, whether while
 * serializing or sending, ever reaches the caller. Failures are logged and the measure is lost.
 */
public final class MeasureDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MeasureDispatcher.class);

    public static final String MEASURE_CHANNEL = "measure";

    private final Supplier<CollectorClient> clients;
    private final String destination;
    private final ObjectMapper json;

    public MeasureDispatcher(Supplier<CollectorClient> clients, String pluginId, ObjectMapper json) {
        this.clients = Objects.requireNonNull(clients, "clients");
        this.destination = destinationFor(pluginId);
        this.json = Objects.requireNonNull(json, "json");
    }

    public static String destinationFor(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new IllegalArgumentException("pluginId must not be blank");
        }
        return pluginId.trim() + "/" + MEASURE_CHANNEL;
    }

    public String destination() {
        return destination;
    }

    public void dispatch(ProbeKind kind, String event, Object payload) {
        if (kind == null || event == null) {
            log.warn("Ignoring measure without kind or event (kind={}, event={})", kind, event);
            return;
        }
        log.debug("Received measure for {} {}", kind, event);

        MeasureRequest request;
        try {
            request = toRequest(kind, event, payload);
        } catch (RuntimeException e) {
            log.error("Could not serialize the payload of {} for the {} probes, measure dropped: {}", event, kind, e.toString());
            return;
        }

        CompletableFuture<?> sent;
        try {
            sent = clients.get().query(request);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        if (sent == null) {
            log.debug("Collector client returned no result for {} measure of {}", kind, event);
            return;
        }
        sent.whenComplete((response, error) -> {
            if (error != null) {
                log.error("Failed to send {} measure for {} to the collector: {}", kind, event, unwrap(error).toString());
            }
        });
    }

    /** Request for one measure; only watcher and sampler measures carry the serialized payload. */
    public MeasureRequest toRequest(ProbeKind kind, String event, Object payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(MeasureRequest.EVENT, event);
        if (kind.carriesPayload() && payload != null) {
            body.put(MeasureRequest.PAYLOAD, serialize(payload));
        }
        return new MeasureRequest(destination, kind.wireName(), body);
    }

    private Object serialize(Object payload) {
        if (payload instanceof SerializablePayload serializable) {
            return serializable.serialize();
        }
        return json.valueToTree(payload);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
