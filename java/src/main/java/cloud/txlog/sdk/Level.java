package cloud.txlog.sdk;

import java.util.Optional;

/**
 * Totally ordered severity used to filter which entries a {@link TransactionRegistry} records.
 */
public enum Level {
    DEBUG(1),
    INFO(2),
    WARNING(3),
    ERROR(4);

    private final int severity;

    Level(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    /**
     * Name written into the {@code Severity} field of an exported entry.
     */
    public String wireName() {
        return name();
    }

    public static Optional<Level> fromSeverity(int severity) {
        for (Level level : values()) {
            if (level.severity == severity) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a configuration value. Matching is case-sensitive and anything unrecognised, including {@code null},
     * resolves to {@link #INFO}.
     */
    public static Level parse(String value) {
        if (value == null) {
            return INFO;
        }
        switch (value) {
            case "DEBUG":
                return DEBUG;
            case "INFO":
                return INFO;
            case "WARNING":
                return WARNING;
            case "ERROR":
                return ERROR;
            default:
                return INFO;
        }
    }

    static boolean isRecognised(String value) {
        return value != null && (value.equals("DEBUG") || value.equals("INFO")
            || value.equals("WARNING") || value.equals("ERROR"));
    }
}
