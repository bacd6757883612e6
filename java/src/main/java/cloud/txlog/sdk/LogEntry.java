package cloud.txlog.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One structured record attached to a transaction. The JSON property names and their order form the wire format
 * shared by every exporter.
 *
 * @param timestamp   creation time, formatted {@code dd.MM.yyyy HH:mm:ss}.
 * @param severity    wire name of the {@link Level}.
 * @param message     free-form text.
 * @param loggerName  logger identity at the time the entry was recorded.
 * @param serviceName service identity at the time the entry was recorded.
 * @param traceId     transaction the entry belongs to.
 * @param spanId      identifier of this entry, unique within the process.
 * @param attributes  caller-supplied attributes; never {@code null}.
 */
@JsonPropertyOrder({"Timestamp", "Severity", "Message", "LoggerName", "ServiceName", "TraceID", "SpanID", "Attributes"})
public record LogEntry(
    @JsonProperty("Timestamp") String timestamp,
    @JsonProperty("Severity") String severity,
    @JsonProperty("Message") String message,
    @JsonProperty("LoggerName") String loggerName,
    @JsonProperty("ServiceName") String serviceName,
    @JsonProperty("TraceID") String traceId,
    @JsonProperty("SpanID") String spanId,
    @JsonProperty("Attributes") Map<String, String> attributes
) {

    public LogEntry {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(spanId, "spanId");
        message = message == null ? "" : message;
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
