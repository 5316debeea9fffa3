package com.proberelay.core.connection;

import com.proberelay.transport.CollectorClient;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the process-wide connection to the collector.
 *
 * <p>{@link #connect()} runs a bounded loop: every failed attempt bumps the error counter and, below
 * {@code maxConnectionErrors}, schedules another attempt after an exponential backoff. Reaching the
 * maximum disconnects the transport once and disables the connection for good.
 */
@Slf4j
public final class CollectorConnectionManager implements AutoCloseable {
    private static final int MAX_BACKOFF_SHIFT = 20;

    private final CollectorClient client;
    private final int maxConnectionErrors;
    private final Duration reconnectDelay;
    private final Duration maxReconnectDelay;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean disconnected = new AtomicBoolean();
    private final AtomicInteger connectionErrors = new AtomicInteger();
    private final CompletableFuture<ConnectionState> settled = new CompletableFuture<>();
    private volatile ConnectionState state = ConnectionState.UNINITIALIZED;
    private volatile boolean closed;

    public CollectorConnectionManager(
            CollectorClient client, int maxConnectionErrors, Duration reconnectDelay, Duration maxReconnectDelay) {
        this(client, maxConnectionErrors, reconnectDelay, maxReconnectDelay, newScheduler(), true);
    }

    public CollectorConnectionManager(
            CollectorClient client,
            int maxConnectionErrors,
            Duration reconnectDelay,
            Duration maxReconnectDelay,
            ScheduledExecutorService scheduler) {
        this(client, maxConnectionErrors, reconnectDelay, maxReconnectDelay, scheduler, false);
    }

    private CollectorConnectionManager(
            CollectorClient client,
            int maxConnectionErrors,
            Duration reconnectDelay,
            Duration maxReconnectDelay,
            ScheduledExecutorService scheduler,
            boolean ownsScheduler) {
        this.client = Objects.requireNonNull(client, "client");
        if (maxConnectionErrors < 1) {
            throw new IllegalArgumentException("maxConnectionErrors must be positive: " + maxConnectionErrors);
        }
        this.maxConnectionErrors = maxConnectionErrors;
        this.reconnectDelay = nonNegative(reconnectDelay, "reconnectDelay");
        this.maxReconnectDelay = nonNegative(maxReconnectDelay, "maxReconnectDelay");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Starts the connection loop. Only the first call opens the transport; every call returns the same
     * future, completed with {@link ConnectionState#CONNECTED} or
     * {@link ConnectionState#PERMANENTLY_DISABLED}.
     */
    public CompletableFuture<ConnectionState> connect() {
        if (started.compareAndSet(false, true)) {
            attempt();
        }
        return settled;
    }

    public ConnectionState state() {
        return state;
    }

    public int connectionErrors() {
        return connectionErrors.get();
    }

    /**
     * Handle the dispatcher sends through. While connecting the transport itself decides whether to
     * queue; before {@link #connect()} and once disabled, requests are dropped.
     */
    public CollectorClient client() {
        return state.acceptsRequests() ? client : NoopCollectorClient.INSTANCE;
    }

    public String endpoint() {
        return client.endpoint();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (ownsScheduler) scheduler.shutdownNow();
        if (started.get()) {
            disconnectQuietly();
        }
        settled.complete(state);
    }

    private void attempt() {
        if (closed) return;
        state = ConnectionState.CONNECTING;
        CompletableFuture<Void> attempt;
        try {
            attempt = client.connect();
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        attempt.whenComplete((ignored, error) -> {
            if (error == null) onConnected();
            else onFailure(unwrap(error));
        });
    }

    private void onConnected() {
        if (closed) return;
        connectionErrors.set(0);
        state = ConnectionState.CONNECTED;
        log.info("Successfully connected to collector at {}", client.endpoint());
        settled.complete(ConnectionState.CONNECTED);
    }

    private void onFailure(Throwable error) {
        if (closed) return;
        int errors = connectionErrors.incrementAndGet();
        if (errors >= maxConnectionErrors) {
            disable(errors, error);
            return;
        }
        Duration delay = backoff(errors);
        state = ConnectionState.BACKOFF;
        log.info(
                "Trying to connect to collector at {}... (attempt {}/{} failed: {}, retrying in {} ms)",
                client.endpoint(),
                errors,
                maxConnectionErrors,
                error.toString(),
                delay.toMillis());
        try {
            scheduler.schedule(this::attempt, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Reconnection to {} abandoned, scheduler is shut down", client.endpoint());
            settled.complete(state);
        }
    }

    private void disable(int errors, Throwable error) {
        state = ConnectionState.PERMANENTLY_DISABLED;
        log.error(
                "Collector at {} seems to be down after {} failed connection attempts ({}). No measures will be sent to probes.",
                client.endpoint(),
                errors,
                error.toString());
        disconnectQuietly();
        settled.complete(ConnectionState.PERMANENTLY_DISABLED);
    }

    /** The transport is disconnected at most once, whether by giving up or by {@link #close()}. */
    private void disconnectQuietly() {
        if (!disconnected.compareAndSet(false, true)) return;
        try {
            client.disconnect();
        } catch (RuntimeException e) {
            log.warn("Failed to disconnect from collector at {}: {}", client.endpoint(), e.toString());
        }
    }

    Duration backoff(int errors) {
        int shift = Math.min(Math.max(errors - 1, 0), MAX_BACKOFF_SHIFT);
        Duration delay = reconnectDelay.multipliedBy(1L << shift);
        return delay.compareTo(maxReconnectDelay) > 0 ? maxReconnectDelay : delay;
    }

    private static Duration nonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) throw new IllegalArgumentException(name + " must not be negative: " + value);
        return value;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(task -> {
            Thread thread = new Thread(task, "probe-relay-collector-reconnect");
            thread.setDaemon(true);
            return thread;
        });
    }
}
