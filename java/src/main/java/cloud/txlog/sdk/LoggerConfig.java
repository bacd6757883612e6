package cloud.txlog.sdk;

import cloud.txlog.sdk.ids.IdGenerator;
import cloud.txlog.sdk.ids.RandomIdGenerator;
import cloud.txlog.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Immutable configuration container used to bootstrap {@link TransactionLogger} instances.
 */
public final class LoggerConfig {

    private static final Logger LOGGER = Logger.getLogger(LoggerConfig.class.getName());

    public static final String DEFAULT_LOGGER_NAME = "TxLogger";
    public static final String DEFAULT_SERVICE_NAME = "Default";
    public static final Level DEFAULT_LEVEL = Level.INFO;

    public static final String KEY_LOGGER_NAME = "loggerName";
    public static final String KEY_SERVICE_NAME = "serviceName";
    public static final String KEY_LEVEL = "level";

    private final String loggerName;
    private final String serviceName;
    private final Level level;
    private final Map<String, String> exporterOptions;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final int flushConcurrency;

    private LoggerConfig(Builder builder) {
        this.loggerName = builder.loggerName;
        this.serviceName = builder.serviceName;
        this.level = builder.level;
        this.exporterOptions = builder.exporterOptions == null
            ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.exporterOptions));
        this.idGenerator = builder.idGenerator;
        this.clock = builder.clock;
        this.flushConcurrency = builder.flushConcurrency;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from a flat option map. The recognised keys {@code loggerName}, {@code serviceName} and
     * {@code level} are applied; the whole map, recognised keys included, is kept as exporter options.
     */
    public static LoggerConfig fromOptions(Map<String, String> options) {
        Builder builder = builder();
        if (options == null) {
            return builder.build();
        }
        applyOptions(builder, options);
        return builder.exporterOptions(options).build();
    }

    /**
     * Reads a JSON object of string values from {@code path}, see {@link #fromOptions(Map)}.
     *
     * @throws ConfigurationException when the file cannot be read, is not a JSON object, or holds a non-string value.
     */
    public static LoggerConfig load(Path path) throws ConfigurationException {
        return fromOptions(readOptions(path));
    }

    static Map<String, String> readOptions(Path path) throws ConfigurationException {
        JsonNode root;
        try {
            root = Json.mapper().readTree(Files.readAllBytes(path));
        } catch (IOException ex) {
            throw new ConfigurationException("read config " + path + ": " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("config " + path + " must contain a JSON object");
        }

        Map<String, String> options = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new ConfigurationException(String.format(Locale.ROOT,
                    "config %s: value of '%s' must be a string, got %s",
                    path, field.getKey(), field.getValue().getNodeType()));
            }
            options.put(field.getKey(), field.getValue().asText());
        }
        return options;
    }

    static void applyOptions(Builder builder, Map<String, String> options) {
        String name = options.get(KEY_LOGGER_NAME);
        if (name != null) {
            builder.loggerName(name);
        }
        String service = options.get(KEY_SERVICE_NAME);
        if (service != null) {
            builder.serviceName(service);
        }
        if (options.containsKey(KEY_LEVEL)) {
            builder.level(parseLevel(options.get(KEY_LEVEL)));
        }
    }

    static Level parseLevel(String value) {
        if (!Level.isRecognised(value)) {
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[txlog] unrecognised level '%s' in config, using %s", value, Level.INFO));
        }
        return Level.parse(value);
    }

    public LoggerConfig withDefaults() {
        if (flushConcurrency < 0) {
            throw new IllegalArgumentException("FlushConcurrency cannot be negative");
        }
        return new Builder()
            .loggerName(Optional.ofNullable(loggerName).orElse(DEFAULT_LOGGER_NAME))
            .serviceName(Optional.ofNullable(serviceName).orElse(DEFAULT_SERVICE_NAME))
            .level(Optional.ofNullable(level).orElse(DEFAULT_LEVEL))
            .exporterOptions(exporterOptions)
            .idGenerator(Optional.ofNullable(idGenerator).orElseGet(RandomIdGenerator::new))
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemDefaultZone))
            .flushConcurrency(flushConcurrency)
            .buildInternal();
    }

    public String getLoggerName() {
        return loggerName;
    }

    public String getServiceName() {
        return serviceName;
    }

    public Level getLevel() {
        return level;
    }

    /**
     * Options handed to the exporter on every flush, or {@code null} when no configuration was supplied.
     */
    public Map<String, String> getExporterOptions() {
        return exporterOptions;
    }

    public IdGenerator getIdGenerator() {
        return idGenerator;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Maximum number of concurrent exports during a flush of every transaction; {@code 0} means one thread per
     * transaction.
     */
    public int getFlushConcurrency() {
        return flushConcurrency;
    }

    public static final class Builder {
        private String loggerName;
        private String serviceName;
        private Level level;
        private Map<String, String> exporterOptions;
        private IdGenerator idGenerator;
        private Clock clock;
        private int flushConcurrency;

        public Builder loggerName(String loggerName) {
            this.loggerName = loggerName;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder level(Level level) {
            this.level = level;
            return this;
        }

        public Builder exporterOptions(Map<String, String> exporterOptions) {
            this.exporterOptions = exporterOptions == null ? null : new LinkedHashMap<>(exporterOptions);
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder flushConcurrency(int flushConcurrency) {
            this.flushConcurrency = flushConcurrency;
            return this;
        }

        public LoggerConfig build() {
            return new LoggerConfig(this).withDefaults();
        }

        private LoggerConfig buildInternal() {
            return new LoggerConfig(this);
        }
    }
}
