package com.proberelay.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.proberelay.transport.CollectorClient;
import com.proberelay.transport.MeasureRequest;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double that records requests in memory.
 *
 * <p>Connect outcomes are scripted: each call to {@link #connect()} consumes the next scripted
 * outcome, falling back to the default outcome once the script is exhausted.
 */
public class InMemoryCollectorClient implements CollectorClient {
    private final List<MeasureRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private final Deque<Boolean> script = new ArrayDeque<>();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger disconnects = new AtomicInteger();
    private volatile boolean connectByDefault = true;
    private volatile boolean failQueries;

    public static InMemoryCollectorClient reachable() {
        return new InMemoryCollectorClient();
    }

    public static InMemoryCollectorClient unreachable() {
        InMemoryCollectorClient client = new InMemoryCollectorClient();
        client.connectByDefault = false;
        return client;
    }

    /** Queues connect outcomes, {@code true} meaning success. */
    public synchronized InMemoryCollectorClient thenConnect(boolean... outcomes) {
        for (boolean outcome : outcomes) script.addLast(outcome);
        return this;
    }

    public InMemoryCollectorClient failingQueries() {
        this.failQueries = true;
        return this;
    }

    @Override
    public CompletableFuture<Void> connect() {
        connects.incrementAndGet();
        boolean success;
        synchronized (this) {
            Boolean next = script.pollFirst();
            success = next != null ? next : connectByDefault;
        }
        if (success) return CompletableFuture.completedFuture(null);
        return CompletableFuture.failedFuture(new IOException("connection refused"));
    }

    @Override
    public CompletableFuture<JsonNode> query(MeasureRequest request) {
        requests.add(request);
        if (failQueries) return CompletableFuture.failedFuture(new IOException("collector rejected request"));
        return CompletableFuture.completedFuture(NullNode.getInstance());
    }

    @Override
    public void disconnect() {
        disconnects.incrementAndGet();
    }

    @Override
    public String endpoint() {
        return "memory://collector";
    }

    public List<MeasureRequest> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public int connectCalls() {
        return connects.get();
    }

    public int disconnectCalls() {
        return disconnects.get();
    }

    public void clear() {
        requests.clear();
    }
}
