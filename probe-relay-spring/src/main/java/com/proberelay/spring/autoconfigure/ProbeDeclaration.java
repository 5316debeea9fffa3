package com.proberelay.spring.autoconfigure;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One probe as bound from {@code probe-relay.probes.<name>}.
 *
 * <p>Binding stays lenient: nothing is checked here. {@link #toRaw()} hands the declared settings to
 * the validator, which reports what is wrong with them.
 */
public class ProbeDeclaration {

    private String kind;

    /** Legacy name of {@link #kind}. */
    private String type;

    private List<String> hooks;
    private List<String> increasers;
    private List<String> decreasers;
    private String index;
    private String collection;
    private Map<String, Object> filter;
    private List<String> collects;
    private Map<String, Object> mapping;
    private String interval;
    private Integer sampleSize;

    /** Declared settings only; unset ones are left out so the validator sees them as missing. */
    public Map<String, Object> toRaw() {
        Map<String, Object> raw = new LinkedHashMap<>();
        putIfSet(raw, "kind", kind);
        putIfSet(raw, "type", type);
        putIfSet(raw, "hooks", hooks);
        putIfSet(raw, "increasers", increasers);
        putIfSet(raw, "decreasers", decreasers);
        putIfSet(raw, "index", index);
        putIfSet(raw, "collection", collection);
        putIfSet(raw, "filter", filter);
        putIfSet(raw, "collects", collects);
        putIfSet(raw, "mapping", mapping);
        putIfSet(raw, "interval", interval);
        putIfSet(raw, "sampleSize", sampleSize);
        return raw;
    }

    private static void putIfSet(Map<String, Object> raw, String key, Object value) {
        if (value != null) raw.put(key, value);
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public List<String> getHooks() {
        return hooks;
    }

    public void setHooks(List<String> hooks) {
        this.hooks = hooks;
    }

    public List<String> getIncreasers() {
        return increasers;
    }

    public void setIncreasers(List<String> increasers) {
        this.increasers = increasers;
    }

    public List<String> getDecreasers() {
        return decreasers;
    }

    public void setDecreasers(List<String> decreasers) {
        this.decreasers = decreasers;
    }

    public String getIndex() {
        return index;
    }

    public void setIndex(String index) {
        this.index = index;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public void setFilter(Map<String, Object> filter) {
        this.filter = filter;
    }

    public List<String> getCollects() {
        return collects;
    }

    public void setCollects(List<String> collects) {
        this.collects = collects;
    }

    public Map<String, Object> getMapping() {
        return mapping;
    }

    public void setMapping(Map<String, Object> mapping) {
        this.mapping = mapping;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }

    public Integer getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(Integer sampleSize) {
        this.sampleSize = sampleSize;
    }
}
