package me.golemcore.reasoning.tools;

import me.golemcore.reasoning.domain.component.ToolComponent;
import me.golemcore.reasoning.domain.model.ToolDefinition;
import me.golemcore.reasoning.domain.model.ToolResult;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Built-in tool returning the current date and time.
 */
public class DateTimeTool implements ToolComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("datetime")
                .description("Get the current date and time. Optionally specify a timezone.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description", "Timezone (e.g., 'America/New_York', 'Europe/London', "
                                                + "'UTC'). Default is UTC.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object timezone = parameters != null ? parameters.get("timezone") : null;
        ZoneId zoneId;
        if (timezone != null && !timezone.toString().isBlank()) {
            try {
                zoneId = ZoneId.of(timezone.toString());
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolResult.failure("Invalid timezone: " + timezone));
            }
        } else {
            zoneId = ZoneId.of("UTC");
        }

        ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), zoneId);
        Map<String, Object> data = Map.of(
                "timezone", zoneId.getId(),
                "timestamp", now.toInstant().toEpochMilli(),
                "dayOfWeek", now.getDayOfWeek().name());
        return CompletableFuture.completedFuture(ToolResult.success(now.format(FORMATTER), data));
    }
}
