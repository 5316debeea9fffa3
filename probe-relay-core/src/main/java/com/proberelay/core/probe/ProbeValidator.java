package com.proberelay.core.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw probe declarations ({@code name -> settings}) into typed {@link Probe}s.
 *
 * <p>Never throws on malformed input. Each rejected declaration yields one {@link ProbeDiagnostic}
 * and is left out of the result, so the remaining probes still activate. Declarations are deep
 * copied through Jackson before inspection; the caller's maps are never touched.
 */
public final class ProbeValidator {
    static final String NAME = "name";
    static final String KIND = "kind";
    static final String LEGACY_KIND = "type";
    static final String HOOKS = "hooks";
    static final String INCREASERS = "increasers";
    static final String DECREASERS = "decreasers";
    static final String INDEX = "index";
    static final String COLLECTION = "collection";

    private final ObjectMapper mapper;

    public ProbeValidator() {
        this(new ObjectMapper());
    }

    public ProbeValidator(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ProbeValidation validate(Map<String, ?> rawProbes) {
        if (rawProbes == null || rawProbes.isEmpty()) return ProbeValidation.empty();

        Map<String, Probe> probes = new LinkedHashMap<>();
        List<ProbeDiagnostic> diagnostics = new ArrayList<>();
        for (Map.Entry<String, ?> entry : rawProbes.entrySet()) {
            String name = String.valueOf(entry.getKey());
            try {
                probes.put(name, toProbe(name, entry.getValue()));
            } catch (Rejected rejected) {
                diagnostics.add(new ProbeDiagnostic(name, rejected.getMessage()));
            }
        }
        return new ProbeValidation(probes, diagnostics);
    }

    private Probe toProbe(String name, Object raw) throws Rejected {
        JsonNode node;
        try {
            node = raw == null ? null : mapper.valueToTree(raw);
        } catch (IllegalArgumentException e) {
            throw new Rejected("Configuration error: declaration cannot be copied: " + e.getMessage());
        }
        if (node == null || !node.isObject()) {
            throw new Rejected("Configuration error: declaration must be a mapping of probe settings");
        }
        ObjectNode declaration = (ObjectNode) node;
        declaration.put(NAME, name);

        JsonNode kindNode = declaration.get(KIND);
        if (scalar(kindNode) == null && !isContainer(kindNode)) kindNode = declaration.get(LEGACY_KIND);
        if (isContainer(kindNode)) {
            throw new Rejected("kind \"" + kindNode + "\" is not supported");
        }
        String declaredKind = scalar(kindNode);
        if (declaredKind == null) {
            throw new Rejected("\"kind\" parameter missing");
        }
        ProbeKind kind = ProbeKind.fromWireName(declaredKind)
                .orElseThrow(() -> new Rejected("kind \"" + declaredKind + "\" is not supported"));

        return switch (kind) {
            case MONITOR -> monitor(name, declaration);
            case COUNTER -> counter(name, declaration);
            case WATCHER, SAMPLER -> collection(name, kind, declaration);
        };
    }

    private MonitorProbe monitor(String name, ObjectNode declaration) throws Rejected {
        JsonNode hooks = declaration.get(HOOKS);
        if (hooks == null || !hooks.isArray() || hooks.isEmpty()) {
            throw new Rejected("Configuration error: missing \"hooks\"");
        }
        return new MonitorProbe(name, events(HOOKS, hooks));
    }

    private CounterProbe counter(String name, ObjectNode declaration) throws Rejected {
        JsonNode increasers = declaration.get(INCREASERS);
        JsonNode decreasers = declaration.get(DECREASERS);
        if (absent(increasers) && absent(decreasers)) {
            throw new Rejected("Configuration error: missing \"increasers\" or \"decreasers\"");
        }
        if (!absent(increasers) && !increasers.isArray()) {
            throw new Rejected("Configuration error: \"increasers\" must be an array");
        }
        if (!absent(decreasers) && !decreasers.isArray()) {
            throw new Rejected("Configuration error: \"decreasers\" must be an array");
        }

        List<String> up = absent(increasers) ? List.of() : events(INCREASERS, increasers);
        List<String> down = absent(decreasers) ? List.of() : events(DECREASERS, decreasers);
        if (up.isEmpty() && down.isEmpty()) {
            throw new Rejected("Configuration error: missing \"increasers\" or \"decreasers\"");
        }
        List<String> shared = CounterProbe.sharedEvents(up, down);
        if (!shared.isEmpty()) {
            throw new Rejected(
                    "Configuration error: an event cannot be set both to increase and to decrease a counter " + shared);
        }
        return new CounterProbe(name, up, down);
    }

    private CollectionProbe collection(String name, ProbeKind kind, ObjectNode declaration) throws Rejected {
        String index = scalar(declaration.get(INDEX));
        String collection = scalar(declaration.get(COLLECTION));
        if (index == null || collection == null) {
            throw new Rejected("Configuration error: missing \"index\" or \"collection\"");
        }
        return new CollectionProbe(name, kind, index, collection, declaration);
    }

    private static List<String> events(String field, JsonNode array) throws Rejected {
        List<String> events = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new Rejected("Configuration error: \"" + field + "\" must only contain event names");
            }
            events.add(item.asText());
        }
        return events;
    }

    private static boolean isContainer(JsonNode node) {
        return node != null && node.isContainerNode();
    }

    private static boolean absent(JsonNode node) {
        return node == null || node.isNull();
    }

    /** Text of a value node, {@code null} when absent or blank. */
    private static String scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        String text = node.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static final class Rejected extends Exception {
        Rejected(String message) {
            super(message, null, false, false);
        }
    }
}
