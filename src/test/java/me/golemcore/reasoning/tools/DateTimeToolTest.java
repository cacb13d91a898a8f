package me.golemcore.reasoning.tools;

import me.golemcore.reasoning.domain.model.ToolDefinition;
import me.golemcore.reasoning.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DateTimeToolTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));

    private final DateTimeTool tool = new DateTimeTool(CLOCK);

    @Test
    void shouldDescribeItself() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("datetime", definition.getName());
        assertEquals("datetime", tool.getToolName());
        assertTrue(tool.isEnabled());
    }

    @Test
    void shouldDefaultToUtc() throws Exception {
        ToolResult result = tool.execute(Map.of()).get();

        assertTrue(result.isSuccess());
        assertEquals("2026-02-14 00:00:00 UTC", result.getOutput());
    }

    @Test
    void shouldHonorTimezone() throws Exception {
        ToolResult result = tool.execute(Map.of("timezone", "Asia/Tokyo")).get();

        assertTrue(result.getOutput().startsWith("2026-02-14 09:00:00"));
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals("Asia/Tokyo", data.get("timezone"));
        assertEquals("SATURDAY", data.get("dayOfWeek"));
    }

    @Test
    void shouldRejectInvalidTimezone() throws Exception {
        ToolResult result = tool.execute(Map.of("timezone", "Mars/Olympus")).get();

        assertFalse(result.isSuccess());
        assertEquals("Invalid timezone: Mars/Olympus", result.getError());
    }
}
