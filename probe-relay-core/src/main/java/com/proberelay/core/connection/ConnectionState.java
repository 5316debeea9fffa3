package com.proberelay.core.connection;

/**
 * Lifecycle of the collector connection.
 *
 * <pre>
 * UNINITIALIZED -> CONNECTING -> CONNECTED
 *                  CONNECTING -> BACKOFF -> CONNECTING -> ... -> PERMANENTLY_DISABLED
 * </pre>
 *
 * {@link #CONNECTED} and {@link #PERMANENTLY_DISABLED} are terminal.
 */
public enum ConnectionState {
    UNINITIALIZED,
    CONNECTING,
    BACKOFF,
    CONNECTED,
    PERMANENTLY_DISABLED;

    public boolean isTerminal() {
        return this == CONNECTED || this == PERMANENTLY_DISABLED;
    }

    /** Whether requests may be handed to the transport in this state. */
    public boolean acceptsRequests() {
        return this == CONNECTING || this == BACKOFF || this == CONNECTED;
    }
}
