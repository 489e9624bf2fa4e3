package com.agentrelay.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sink used until a transport is wired in: writes each event to the log.
 */
@Component
public class LoggingStatusEventSink implements StatusEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingStatusEventSink.class);

    @Override
    public void publish(StageEvent event) {
        if (event.type() == StageEventType.AGENT_FAILED) {
            log.warn("[{}] run={} agent={} {}", event.type().value(), event.runId(),
                    event.agentName(), event.payload());
        } else {
            log.info("[{}] run={} agent={} {}", event.type().value(), event.runId(),
                    event.agentName(), event.payload());
        }
    }
}
