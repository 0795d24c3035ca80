package io.github.drompincen.clawfork.gateway.config;

import io.github.drompincen.clawfork.runtime.config.SubagentProperties;
import io.github.drompincen.clawfork.runtime.lifecycle.SubagentLifecycleManager;
import io.github.drompincen.clawfork.runtime.lifecycle.SubagentShutdownTimeoutException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs every subagent status change and drains running subagents when the
 * application context closes.
 */
@Configuration
public class SubagentLifecycleConfig {

    private static final Logger log = LoggerFactory.getLogger(SubagentLifecycleConfig.class);

    private final SubagentLifecycleManager manager;
    private final SubagentProperties properties;

    public SubagentLifecycleConfig(SubagentLifecycleManager manager, SubagentProperties properties) {
        this.manager = manager;
        this.properties = properties;
    }

    @PostConstruct
    void installMonitoringHook() {
        manager.setMonitoringHook((id, status) -> log.info("Subagent {} is now {}", id, status));
    }

    @PreDestroy
    void drain() {
        try {
            manager.shutdown(properties.getShutdownTimeout());
        } catch (SubagentShutdownTimeoutException e) {
            log.warn("{}: {}", e.getMessage(), e.getStillRunning());
        }
    }
}
