package io.github.drompincen.clawfork.gateway.controller;

import io.github.drompincen.clawfork.protocol.api.ResourceLimits;
import io.github.drompincen.clawfork.protocol.api.StartSubagentRequest;
import io.github.drompincen.clawfork.protocol.api.SubagentContext;
import io.github.drompincen.clawfork.protocol.api.SubagentResult;
import io.github.drompincen.clawfork.runtime.agent.SubagentCapacityException;
import io.github.drompincen.clawfork.runtime.agent.SubagentConflictException;
import io.github.drompincen.clawfork.runtime.agent.SubagentNotFoundException;
import io.github.drompincen.clawfork.runtime.agent.SubagentValidationException;
import io.github.drompincen.clawfork.runtime.config.SubagentProperties;
import io.github.drompincen.clawfork.runtime.fork.ContextForker;
import io.github.drompincen.clawfork.runtime.lifecycle.SubagentLifecycleManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/subagents")
public class SubagentController {

    private final ContextForker forker;
    private final SubagentLifecycleManager manager;
    private final SubagentProperties properties;

    public SubagentController(ContextForker forker,
                              SubagentLifecycleManager manager,
                              SubagentProperties properties) {
        this.forker = forker;
        this.manager = manager;
        this.properties = properties;
    }

    @PostMapping
    public ResponseEntity<SubagentResult> start(@RequestBody StartSubagentRequest req) {
        if (req == null) {
            throw new SubagentValidationException("request body is required");
        }
        SubagentContext ctx = forker.fork(
                req.parentContextId(),
                req.history(),
                req.skillName(),
                req.allowedTools(),
                limitsFor(req),
                req.metadata() != null ? req.metadata() : Map.of());
        manager.start(ctx);
        return ResponseEntity.accepted().body(manager.getStatus(ctx.id()));
    }

    @GetMapping
    public List<String> listRunning() {
        return manager.listRunning();
    }

    @GetMapping("/{id}")
    public ResponseEntity<SubagentResult> get(@PathVariable String id) {
        return ResponseEntity.ok(manager.getStatus(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<SubagentResult> cancel(@PathVariable String id) {
        manager.cancel(id);
        return ResponseEntity.ok(manager.getStatus(id));
    }

    private ResourceLimits limitsFor(StartSubagentRequest req) {
        ResourceLimits defaults = properties.getDefaultLimits().toResourceLimits();
        return new ResourceLimits(
                req.maxTokens() != null ? req.maxTokens() : defaults.maxTokens(),
                req.maxToolCalls() != null ? req.maxToolCalls() : defaults.maxToolCalls(),
                req.timeoutSeconds() != null ? Duration.ofSeconds(req.timeoutSeconds()) : defaults.timeout());
    }

    @ExceptionHandler(SubagentValidationException.class)
    ResponseEntity<Map<String, String>> badRequest(SubagentValidationException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(SubagentNotFoundException.class)
    ResponseEntity<Map<String, String>> notFound(SubagentNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(SubagentConflictException.class)
    ResponseEntity<Map<String, String>> conflict(SubagentConflictException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(SubagentCapacityException.class)
    ResponseEntity<Map<String, String>> unavailable(SubagentCapacityException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
