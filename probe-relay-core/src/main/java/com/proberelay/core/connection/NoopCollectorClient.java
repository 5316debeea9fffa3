package com.proberelay.core.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.proberelay.transport.CollectorClient;
import com.proberelay.transport.MeasureRequest;
import java.util.concurrent.CompletableFuture;

/** Handle served while no usable connection exists: requests are silently dropped. */
final class NoopCollectorClient implements CollectorClient {
    static final NoopCollectorClient INSTANCE = new NoopCollectorClient();

    private NoopCollectorClient() {}

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<JsonNode> query(MeasureRequest request) {
        return CompletableFuture.completedFuture(NullNode.getInstance());
    }

    @Override
    public void disconnect() {
        // nothing to close
    }

    @Override
    public String endpoint() {
        return "none";
    }
}
