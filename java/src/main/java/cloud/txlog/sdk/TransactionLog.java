package cloud.txlog.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time view of an open transaction: its trace ID, the attributes supplied when it was opened, and the
 * entries recorded so far in emission order.
 */
public record TransactionLog(String traceId, Map<String, String> attributes, List<LogEntry> entries) {

    public TransactionLog {
        Objects.requireNonNull(traceId, "traceId");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
