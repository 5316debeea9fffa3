package com.proberelay.core.probe;

import java.util.List;

/**
 * A validated probe declaration. Instances only exist in a fully valid state: each record checks
 * its kind-specific constraints on construction.
 */
public sealed interface Probe permits MonitorProbe, CounterProbe, CollectionProbe {

    /** Configuration key of the probe, also the collector's measurement channel. */
    String name();

    ProbeKind kind();

    /** Host events this probe reacts to, in declaration order. */
    List<String> triggerEvents();
}
