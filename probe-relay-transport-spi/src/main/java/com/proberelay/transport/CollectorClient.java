package com.proberelay.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal transport SPI: one client per process talking to the remote measure collector.
 *
 * <p>Implementations may buffer requests issued before {@link #connect()} completes and replay them
 * once connected. Retries of a failed {@link #connect()} are the caller's business: each call is a
 * single attempt.
 */
public interface CollectorClient {

    /** Opens the transport. Completes normally when the collector is reachable. */
    CompletableFuture<Void> connect();

    /** Sends one request; the future carries the collector's response, if any. */
    CompletableFuture<JsonNode> query(MeasureRequest request);

    /** Closes the transport. No request is accepted afterwards. */
    void disconnect();

    /** Human readable address of the collector, used in log messages. */
    String endpoint();
}
