package com.proberelay.transport.logging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.proberelay.transport.CollectorClient;
import com.proberelay.transport.MeasureRequest;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Dry-run client: every measure is written to the log instead of the collector. */
public final class LoggingCollectorClient implements CollectorClient {
    private static final Logger log = LoggerFactory.getLogger(LoggingCollectorClient.class);

    @Override
    public CompletableFuture<Void> connect() {
        log.info("Logging collector client ready, measures will only be logged");
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<JsonNode> query(MeasureRequest request) {
        if (request == null) return CompletableFuture.completedFuture(NullNode.getInstance());
        log.info(
                "measure destination={}, action={}, event={}, payload={}",
                request.destination(),
                request.action(),
                request.event(),
                request.body().get(MeasureRequest.PAYLOAD));
        return CompletableFuture.completedFuture(NullNode.getInstance());
    }

    @Override
    public void disconnect() {
        // nothing to release
    }

    @Override
    public String endpoint() {
        return "log";
    }
}
