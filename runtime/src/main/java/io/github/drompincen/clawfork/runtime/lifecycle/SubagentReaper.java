package io.github.drompincen.clawfork.runtime.lifecycle;

import io.github.drompincen.clawfork.runtime.config.SubagentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops finished subagents from the lifecycle manager once they
 * have been queryable for the configured retention.
 */
@Component
public class SubagentReaper {

    private static final Logger log = LoggerFactory.getLogger(SubagentReaper.class);

    private final SubagentLifecycleManager manager;
    private final SubagentProperties properties;

    public SubagentReaper(SubagentLifecycleManager manager, SubagentProperties properties) {
        this.manager = manager;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${clawfork.subagent.reaper-interval-ms:60000}")
    public void reap() {
        try {
            int removed = manager.evictFinished(properties.getRetention());
            log.debug("Reaper pass removed {} entr{}, {} still tracked",
                    removed, removed == 1 ? "y" : "ies", manager.trackedCount());
        } catch (RuntimeException e) {
            log.error("Reaper pass failed", e);
        }
    }
}
