package com.foreman.core.persistence;

import com.foreman.core.state.ProjectState;
import com.foreman.core.state.ProjectStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonColumnsTest {

    private final JsonColumns json = new JsonColumns();

    @Nested
    @DisplayName("lenient reads")
    class ReadTests {

        @Test
        @DisplayName("parses a JSON array of strings")
        void readsList() {
            assertEquals(List.of("t1", "t2"), json.readList("[\"t1\",\"t2\"]", "pending_tasks"));
        }

        @Test
        @DisplayName("renders non-string elements and drops nulls")
        void coercesListElements() {
            assertEquals(List.of("1", "t2"), json.readList("[1, null, \"t2\"]", "pending_tasks"));
        }

        @Test
        @DisplayName("null, blank and malformed JSON become empty collections")
        void degradesToEmpty() {
            assertTrue(json.readList(null, "pending_tasks").isEmpty());
            assertTrue(json.readList("   ", "pending_tasks").isEmpty());
            assertTrue(json.readList("[\"t1\",", "pending_tasks").isEmpty());
            assertTrue(json.readMap("{not json", "metadata").isEmpty());
        }

        @Test
        @DisplayName("wrong JSON shape becomes an empty collection")
        void wrongShape() {
            assertTrue(json.readList("{\"a\":1}", "completed_tasks").isEmpty());
            assertTrue(json.readMap("[1,2,3]", "metadata").isEmpty());
            assertTrue(json.readMap("\"text\"", "metadata").isEmpty());
        }

        @Test
        @DisplayName("nullable map keeps SQL NULL distinct")
        void nullableMap() {
            assertNull(json.readNullableMap(null, "previous_state"));
            assertEquals(Map.of("a", 1), json.readNullableMap("{\"a\":1}", "previous_state"));
        }

        @Test
        @DisplayName("nested objects survive a round trip")
        void nestedRoundTrip() {
            Map<String, Object> metadata = Map.of("task_results", Map.of("t1", Map.of("score", 9)));
            assertEquals(metadata, json.readMap(json.write(metadata), "metadata"));
        }
    }

    @Nested
    @DisplayName("coercion helpers")
    class CoercionTests {

        @Test
        @DisplayName("coerceMap copies maps and ignores other values")
        void coerceMap() {
            var source = Map.of("k", "v");
            var copy = JsonColumns.coerceMap(source);
            copy.put("extra", true);

            assertEquals(Map.of("k", "v"), source);
            assertTrue(JsonColumns.coerceMap("not a map").isEmpty());
            assertTrue(JsonColumns.coerceMap(null).isEmpty());
        }

        @Test
        @DisplayName("coerceList ignores non-lists")
        void coerceList() {
            assertEquals(List.of("a"), JsonColumns.coerceList(List.of("a")));
            assertTrue(JsonColumns.coerceList(42).isEmpty());
        }
    }

    @Test
    @DisplayName("default mapper writes ISO-8601 instants")
    void writesIsoInstants() throws Exception {
        var state = new ProjectState("P1", "planning", null, null, List.of(), List.of("t1"), Map.of(),
                ProjectStatus.ACTIVE, null, Instant.parse("2026-01-01T00:00:00Z"),
                Instant.parse("2026-01-01T00:00:01.000123Z"));

        String rendered = json.objectMapper().writeValueAsString(state);

        assertTrue(rendered.contains("\"lastUpdated\":\"2026-01-01T00:00:01.000123Z\""), rendered);
        assertTrue(rendered.contains("\"status\":\"ACTIVE\""), rendered);
    }
}
