package io.github.drompincen.clawfork.runtime.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawfork.runtime.tools.Tool;
import io.github.drompincen.clawfork.runtime.tools.ToolContext;
import io.github.drompincen.clawfork.runtime.tools.ToolResult;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/** Reports the current date and time, optionally in a given zone. */
public class CurrentTimeTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Clock clock;

    public CurrentTimeTool() {
        this(Clock.systemUTC());
    }

    public CurrentTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override public String name() { return "current_time"; }

    @Override public String description() {
        return "Returns the current date and time. Optional input: zone (IANA id, default UTC).";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("zone").put("type", "string");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        String zoneId = input != null ? input.path("zone").asText("UTC") : "UTC";
        ZoneId zone;
        try {
            zone = ZoneId.of(zoneId.isBlank() ? "UTC" : zoneId);
        } catch (DateTimeException e) {
            return ToolResult.failure("Unknown time zone: " + zoneId);
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        ObjectNode output = MAPPER.createObjectNode();
        output.put("iso", now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        output.put("zone", zone.getId());
        output.put("dayOfWeek", now.getDayOfWeek().toString());
        return ToolResult.success(output);
    }
}
