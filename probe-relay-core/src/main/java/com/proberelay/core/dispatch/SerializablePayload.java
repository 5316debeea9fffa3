package com.proberelay.core.dispatch;

/** Event payload able to render itself for the collector (watcher and sampler measures). */
@FunctionalInterface
public interface SerializablePayload {

    /** Transport-safe form: a string, a map, a list, a Jackson node or a scalar. */
    Object serialize();
}
