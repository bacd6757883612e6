package cloud.txlog.sdk.export;

import cloud.txlog.sdk.ConfigurationException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves the per-transaction output file of the file based exporters from their options.
 */
final class FileTargets {

    static final String FILEPATH = "filepath";
    static final String FILENAME = "filename";

    private FileTargets() {
    }

    /**
     * Returns {@code <filepath>/<filename>_<traceId>.<extension>}.
     */
    static Path resolve(Map<String, String> options, String traceId, String extension) throws ConfigurationException {
        if (options == null) {
            throw new ConfigurationException("no config provided");
        }
        String directory = options.get(FILEPATH);
        if (directory == null) {
            throw new ConfigurationException("no filepath in config");
        }
        String filename = options.get(FILENAME);
        if (filename == null) {
            throw new ConfigurationException("no filename in config");
        }
        try {
            Path base = directory.isEmpty() ? Path.of("") : Path.of(directory);
            return base.resolve(filename + "_" + traceId + "." + extension);
        } catch (InvalidPathException ex) {
            throw new ConfigurationException("invalid export path: " + ex.getMessage(), ex);
        }
    }
}
