package cloud.txlog.sdk.export;

import cloud.txlog.sdk.ExporterException;
import cloud.txlog.sdk.LogEntry;
import cloud.txlog.sdk.internal.EntryLines;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default exporter: prints one line per entry to a {@link PrintStream}. Options are ignored.
 */
public final class ConsoleExporter implements Exporter {

    private final PrintStream out;

    public ConsoleExporter() {
        this(System.out);
    }

    public ConsoleExporter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void export(String traceId, List<LogEntry> entries, Map<String, String> options) throws ExporterException {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        StringBuilder lines = new StringBuilder();
        for (LogEntry entry : entries) {
            try {
                lines.append(EntryLines.format(entry));
            } catch (JsonProcessingException ex) {
                throw new ExporterException("encode entry " + entry.spanId() + ": " + ex.getMessage(), ex);
            }
        }
        // all lines of one transaction go out in a single write
        synchronized (out) {
            out.print(lines);
            out.flush();
        }
        if (out.checkError()) {
            throw new ExporterException("write console export for trace " + traceId + " failed");
        }
    }
}
