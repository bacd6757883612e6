package cloud.txlog.sdk.export;

import cloud.txlog.sdk.ExporterException;
import cloud.txlog.sdk.LogEntry;
import cloud.txlog.sdk.TxLogException;
import cloud.txlog.sdk.internal.EntryLines;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

/**
 * Appends the console line format to {@code <filepath>/<filename>_<traceId>.txt}, creating the file when needed.
 */
public final class TextFileExporter implements Exporter {

    @Override
    public void export(String traceId, List<LogEntry> entries, Map<String, String> options) throws TxLogException {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        Path target = FileTargets.resolve(options, traceId, "txt");
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            for (LogEntry entry : entries) {
                writer.write(EntryLines.format(entry));
            }
        } catch (IOException ex) {
            throw new ExporterException("write text export " + target + ": " + ex.getMessage(), ex);
        }
    }
}
