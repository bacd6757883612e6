package cloud.txlog.sdk.internal;

import cloud.txlog.sdk.LogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Renders entries in the line format shared by the console and text exporters:
 * {@code [SEVERITY] [TIMESTAMP] <json>}.
 */
public final class EntryLines {

    private EntryLines() {
    }

    public static String format(LogEntry entry) throws JsonProcessingException {
        String json = Json.mapper().writeValueAsString(entry);
        return "[" + entry.severity() + "] [" + entry.timestamp() + "] " + json + "\n";
    }
}
