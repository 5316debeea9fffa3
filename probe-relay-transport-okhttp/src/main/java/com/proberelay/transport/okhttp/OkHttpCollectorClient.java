package com.proberelay.transport.okhttp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proberelay.transport.CollectorClient;
import com.proberelay.transport.CollectorEndpoint;
import com.proberelay.transport.MeasureRequest;
import java.io.IOException;
import java.net.Inet4Address;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dns;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OkHttp-based collector client.
 *
 * <p>Requests issued before {@link #connect()} succeeds are held in a bounded queue and replayed in
 * order once the collector answers its server-info probe.
 */
public class OkHttpCollectorClient implements CollectorClient {
    private static final Logger log = LoggerFactory.getLogger(OkHttpCollectorClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    public static final String SERVER_INFO_PATH = "_serverInfo";
    public static final String PLUGIN_PATH = "_plugin";
    public static final int DEFAULT_QUEUE_CAPACITY = 500;

    private final CollectorEndpoint endpoint;
    private final OkHttpClient client;
    private final ObjectMapper json;
    private final int queueCapacity;

    private final Deque<Pending> offline = new ArrayDeque<>();
    private boolean connected;
    private boolean closed;

    public OkHttpCollectorClient(CollectorEndpoint endpoint) {
        this(endpoint, new ObjectMapper(), DEFAULT_QUEUE_CAPACITY);
    }

    public OkHttpCollectorClient(CollectorEndpoint endpoint, ObjectMapper json, int queueCapacity) {
        this(endpoint, new OkHttpClient.Builder().dns(PREFER_IPV4_DNS).build(), json, queueCapacity);
    }

    public OkHttpCollectorClient(CollectorEndpoint endpoint, OkHttpClient client, ObjectMapper json, int queueCapacity) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint").resolve();
        this.client = Objects.requireNonNull(client, "client");
        this.json = Objects.requireNonNull(json, "json");
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must not be negative: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    @Override
    public CompletableFuture<Void> connect() {
        synchronized (this) {
            if (closed) {
                return CompletableFuture.failedFuture(new IOException("Client disconnected from " + endpoint));
            }
        }
        Request req = new Request.Builder().url(url(SERVER_INFO_PATH)).get().build();
        return execute(req).thenAccept(ignored -> onConnected());
    }

    @Override
    public CompletableFuture<JsonNode> query(MeasureRequest request) {
        Objects.requireNonNull(request, "request");
        synchronized (this) {
            if (closed) {
                return CompletableFuture.failedFuture(new IOException("Client disconnected from " + endpoint));
            }
            if (!connected) {
                return enqueue(request);
            }
        }
        return send(request);
    }

    @Override
    public void disconnect() {
        List<Pending> dropped;
        synchronized (this) {
            if (closed) return;
            closed = true;
            connected = false;
            dropped = new ArrayList<>(offline);
            offline.clear();
        }
        IOException cause = new IOException("Client disconnected from " + endpoint);
        dropped.forEach(p -> p.result().completeExceptionally(cause));
        if (!dropped.isEmpty()) {
            log.warn("Discarded {} queued measure request(s) for {}", dropped.size(), endpoint);
        }
        client.connectionPool().evictAll();
    }

    @Override
    public String endpoint() {
        return endpoint.baseUrl();
    }

    public synchronized boolean isConnected() {
        return connected;
    }

    public synchronized int queuedRequests() {
        return offline.size();
    }

    private CompletableFuture<JsonNode> enqueue(MeasureRequest request) {
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        if (queueCapacity == 0) {
            result.completeExceptionally(new IOException("Not connected to " + endpoint + " and queueing is disabled"));
            return result;
        }
        if (offline.size() >= queueCapacity) {
            Pending oldest = offline.pollFirst();
            log.warn("Offline queue for {} is full ({}), dropping oldest request {}", endpoint, queueCapacity, oldest.request());
            oldest.result().completeExceptionally(new IOException("Dropped from full offline queue"));
        }
        offline.addLast(new Pending(request, result));
        return result;
    }

    private void onConnected() {
        List<Pending> replay;
        synchronized (this) {
            if (closed) return;
            connected = true;
            replay = new ArrayList<>(offline);
            offline.clear();
        }
        if (!replay.isEmpty()) {
            log.info("Replaying {} queued measure request(s) to {}", replay.size(), endpoint);
        }
        // one at a time so the collector sees measures in the order they were issued
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Pending p : replay) {
            chain = chain.thenCompose(ignored -> send(p.request()).handle((body, err) -> {
                if (err != null) p.result().completeExceptionally(err);
                else p.result().complete(body);
                return null;
            }));
        }
    }

    private CompletableFuture<JsonNode> send(MeasureRequest request) {
        byte[] body;
        try {
            body = json.writeValueAsBytes(request.body());
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        HttpUrl url = url(PLUGIN_PATH).newBuilder()
                .addPathSegments(request.destination())
                .addPathSegment(request.action())
                .build();
        Request req = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON))
                .build();
        if (log.isDebugEnabled()) {
            log.debug("Sending measure request {} {} with body: {}", req.method(), url, request.body());
        }
        return execute(req);
    }

    private CompletableFuture<JsonNode> execute(Request req) {
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        client.newCall(req).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    String responseBody = response.body() != null ? response.body().string() : "";
                    if (!response.isSuccessful()) {
                        log.warn(
                                "Collector request {} {} failed with status {} and body: {}",
                                req.method(),
                                req.url(),
                                response.code(),
                                responseBody);
                        result.completeExceptionally(new IOException("HTTP " + response.code() + " - " + responseBody));
                        return;
                    }
                    result.complete(parse(responseBody));
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    private JsonNode parse(String responseBody) {
        if (responseBody.isBlank()) return json.nullNode();
        try {
            return json.readTree(responseBody);
        } catch (JsonProcessingException e) {
            return json.getNodeFactory().textNode(responseBody);
        }
    }

    private HttpUrl url(String segment) {
        HttpUrl base = HttpUrl.get(endpoint.baseUrl());
        return base.newBuilder().addPathSegment(segment).build();
    }

    private record Pending(MeasureRequest request, CompletableFuture<JsonNode> result) {}
}
