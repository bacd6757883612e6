package cloud.txlog.sdk.export;

import cloud.txlog.sdk.ExporterException;
import cloud.txlog.sdk.LogEntry;
import cloud.txlog.sdk.TxLogException;
import cloud.txlog.sdk.internal.Json;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes each transaction as an indented JSON array to {@code <filepath>/<filename>_<traceId>.json}, replacing any
 * previous file of that name.
 */
public final class JsonFileExporter implements Exporter {

    @Override
    public void export(String traceId, List<LogEntry> entries, Map<String, String> options) throws TxLogException {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        Path target = FileTargets.resolve(options, traceId, "json");
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(Json.indentedWriter().writeValueAsString(entries));
            writer.write('\n');
        } catch (IOException ex) {
            throw new ExporterException("write json export " + target + ": " + ex.getMessage(), ex);
        }
    }
}
