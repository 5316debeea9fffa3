package com.proberelay.core.probe;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Watcher or sampler bound to one data collection.
 *
 * <p>{@code declaration} is an independent copy of the raw declaration (with {@code name} injected).
 * Fields such as {@code filter}, {@code collects}, {@code mapping}, {@code interval} or
 * {@code sampleSize} are only meaningful to the collector and are not interpreted here.
 */
public record CollectionProbe(String name, ProbeKind kind, String index, String collection, ObjectNode declaration)
        implements Probe {

    public static final String REALTIME_BEFORE_PUBLISH = "realtime:beforePublish";
    public static final String DOCUMENT_BEFORE_CREATE = "document:beforeCreate";
    public static final String DOCUMENT_BEFORE_CREATE_OR_REPLACE = "document:beforeCreateOrReplace";

    /** New messages and documents, whatever their collection: filtering happens on the collector. */
    public static final List<String> STRUCTURAL_EVENTS =
            List.of(REALTIME_BEFORE_PUBLISH, DOCUMENT_BEFORE_CREATE, DOCUMENT_BEFORE_CREATE_OR_REPLACE);

    public CollectionProbe {
        Objects.requireNonNull(name, "name");
        if (!Objects.requireNonNull(kind, "kind").carriesPayload()) {
            throw new IllegalArgumentException("Collection probe " + name + " must be a watcher or a sampler, got " + kind);
        }
        if (index == null || index.isBlank() || collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Collection probe " + name + " needs an index and a collection");
        }
        declaration = declaration == null ? null : declaration.deepCopy();
    }

    @Override
    public List<String> triggerEvents() {
        return STRUCTURAL_EVENTS;
    }

    @Override
    public ObjectNode declaration() {
        return declaration == null ? null : declaration.deepCopy();
    }
}
