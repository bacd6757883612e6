package cloud.txlog.sdk;

import cloud.txlog.sdk.internal.Json;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogEntryTest {

    @Test
    void serialisesWithWireFieldNamesInOrder() throws Exception {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("zeta", "last");
        attributes.put("alpha", "first");
        LogEntry entry = new LogEntry("10.03.2025 17:00:00", "INFO", "test message 1", "TxLogger", "Default",
            "1234567890", "00000000000", attributes);

        String json = Json.mapper().writeValueAsString(entry);

        assertEquals("{\"Timestamp\":\"10.03.2025 17:00:00\",\"Severity\":\"INFO\",\"Message\":\"test message 1\","
            + "\"LoggerName\":\"TxLogger\",\"ServiceName\":\"Default\",\"TraceID\":\"1234567890\","
            + "\"SpanID\":\"00000000000\",\"Attributes\":{\"alpha\":\"first\",\"zeta\":\"last\"}}", json);
    }

    @Test
    void nullAttributesEncodeAsEmptyObject() throws Exception {
        LogEntry entry = new LogEntry("ts", "ERROR", null, "l", "s", "1", "2", null);

        String json = Json.mapper().writeValueAsString(entry);

        assertTrue(json.endsWith("\"Attributes\":{}}"));
        assertTrue(json.contains("\"Message\":\"\""));
    }

    @Test
    void isImmutableAgainstCallerMaps() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("k", "v");
        LogEntry entry = new LogEntry("ts", "INFO", "m", "l", "s", "1", "2", attributes);

        attributes.put("k", "changed");

        assertEquals("v", entry.attributes().get("k"));
        assertThrows(UnsupportedOperationException.class, () -> entry.attributes().put("x", "y"));
    }

    @Test
    void readsBackFromWireFormat() throws Exception {
        String json = "{\"Timestamp\":\"t\",\"Severity\":\"DEBUG\",\"Message\":\"m\",\"LoggerName\":\"l\","
            + "\"ServiceName\":\"s\",\"TraceID\":\"7\",\"SpanID\":\"8\",\"Attributes\":{\"a\":\"b\"}}";

        LogEntry entry = Json.mapper().readValue(json, LogEntry.class);

        assertEquals("DEBUG", entry.severity());
        assertEquals("7", entry.traceId());
        assertEquals(Map.of("a", "b"), entry.attributes());
    }
}
