package com.proberelay.spring;

import com.proberelay.core.ProbeRelay;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@Slf4j
public class HostEventBridge {

    private final ProbeRelay relay;
    private final boolean connectOnReady;

    public HostEventBridge(ProbeRelay relay, boolean connectOnReady) {
        this.relay = Objects.requireNonNull(relay, "relay");
        this.connectOnReady = connectOnReady;
    }

    @EventListener
    public void onHostEvent(HostEvent event) {
        relay.onEvent(event.name(), event.payload());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!connectOnReady) {
            log.debug("Application ready, waiting for {} to connect to the collector", relay.config().hostStartedEvent());
            return;
        }
        relay.onHostStarted();
    }
}
