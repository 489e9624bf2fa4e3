package com.agentrelay.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentRelayApplication.class, args);
    }
}
