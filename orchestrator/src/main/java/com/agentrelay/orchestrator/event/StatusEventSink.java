package com.agentrelay.orchestrator.event;

/**
 * Receives run and stage progress events. Implemented by the transport layer
 * (WebSocket, SSE, ...); the supervisor only publishes.
 *
 * Implementations must not block for long and must not throw: the supervisor
 * treats delivery as best-effort.
 */
@FunctionalInterface
public interface StatusEventSink {

    void publish(StageEvent event);
}
