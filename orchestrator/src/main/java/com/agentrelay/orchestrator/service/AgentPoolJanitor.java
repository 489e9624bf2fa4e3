package com.agentrelay.orchestrator.service;

import com.agentrelay.orchestrator.config.AgentRelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Periodic housekeeping: destroys agent instances idle longer than
 * {@code agentrelay.agents.idle-eviction} and forgets runs that finished more
 * than an hour ago. Stages whose agent has not started an attempt within
 * {@code agentrelay.agents.heartbeat-timeout} are marked stalled.
 */
@Component
@EnableScheduling
public class AgentPoolJanitor {

    private static final Logger log = LoggerFactory.getLogger(AgentPoolJanitor.class);

    static final Duration RUN_RETENTION = Duration.ofHours(1);

    private final AgentPool        agentPool;
    private final ExecutionTracker tracker;
    private final Duration         idleEviction;
    private final Duration         heartbeatTimeout;
    private final Clock            clock;

    public AgentPoolJanitor(AgentPool agentPool, ExecutionTracker tracker, AgentRelayProperties properties) {
        this(agentPool, tracker, properties.agents().idleEviction(), properties.agents().heartbeatTimeout(),
                Clock.systemUTC());
    }

    AgentPoolJanitor(AgentPool agentPool, ExecutionTracker tracker, Duration idleEviction,
                     Duration heartbeatTimeout, Clock clock) {
        this.agentPool        = agentPool;
        this.tracker          = tracker;
        this.idleEviction     = idleEviction;
        this.heartbeatTimeout = heartbeatTimeout;
        this.clock            = clock;
    }

    @Scheduled(fixedDelayString = "${agentrelay.agents.janitor-interval:60000}")
    public void sweep() {
        Map<String, List<String>> stalled = tracker.markStalledStages(heartbeatTimeout);
        stalled.forEach((runId, agents) ->
                log.warn("Run {} has stage(s) {} with no heartbeat for over {}", runId, agents, heartbeatTimeout));

        int evicted = agentPool.evictIdle(idleEviction);
        int purged  = tracker.purgeFinishedBefore(clock.instant().minus(RUN_RETENTION));
        if (evicted > 0 || purged > 0) {
            log.info("Janitor evicted {} idle agent(s), purged {} finished run(s)", evicted, purged);
        }
    }
}
