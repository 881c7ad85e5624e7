package io.huddle.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.huddle.util.Hashing;
import io.huddle.util.Jsons;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class AuditLoggerTest {
    @Test
    void linesFormAHashChainAcrossRestarts() throws Exception {
        Path root = Files.createTempDirectory("huddle-audit-test-");
        Path file = root.resolve("audit").resolve("audit.log");

        AuditLogger first = new AuditLogger(file);
        first.log(AuditLogger.AuditEvent.of("task.create", null, "task/1", "ok", Map.of("title", "fix bug")));
        first.log(AuditLogger.AuditEvent.of("task.claim", "abc", "task/1", "ok", Map.of()));

        AuditLogger reopened = new AuditLogger(file);
        assertEquals(first.currentHash(), reopened.currentHash());
        reopened.log(AuditLogger.AuditEvent.of("task.done", "abc", "task/1", "ok", Map.of("token", "t0k3n")));

        List<JsonNode> rows = reopened.readAll();
        assertEquals(3, rows.size());
        assertEquals("human", rows.get(0).path("actor").asText());
        assertEquals("", rows.get(0).path("prev_hash").asText());
        assertEquals("***", rows.get(2).path("details").path("token").asText());

        String prev = "";
        for (JsonNode row : rows) {
            assertEquals(prev, row.path("prev_hash").asText());
            Map<String, Object> unhashed = Jsons.mapper().convertValue(row, LinkedHashMap.class);
            unhashed.remove("hash");
            assertEquals(Hashing.sha256Hex(Jsons.toCompactJson(unhashed)), row.path("hash").asText());
            prev = row.path("hash").asText();
        }
        assertNotEquals(rows.get(0).path("hash").asText(), rows.get(1).path("hash").asText());
    }
}
