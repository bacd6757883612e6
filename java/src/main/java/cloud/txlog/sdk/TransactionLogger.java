package cloud.txlog.sdk;

import cloud.txlog.sdk.export.ConsoleExporter;
import cloud.txlog.sdk.export.Exporter;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <p>
 * Primary entry point for transaction-scoped logging. Open a transaction, attach entries to it from any thread, then
 * export it as a group. One instance can serve a whole process; independent instances share no state.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Entries below the configured {@link Level} are dropped silently.</li>
 *   <li>Exports go through a pluggable {@link Exporter}; the {@link ConsoleExporter} is used unless another is set.</li>
 *   <li>A successful export retires the transaction; a failed one leaves it open for a retry.</li>
 *   <li>{@link #exportAllLogs()} exports every open transaction concurrently and reports the first failure.</li>
 * </ul>
 *
 * <pre>{@code
 * TransactionLogger logger = new TransactionLogger(Level.INFO);
 * String traceId = logger.startTransaction(Map.of("user", "42"));
 * logger.info("payment accepted", traceId, Map.of("amount", "10.00"));
 * logger.exportLogs(traceId);
 * }</pre>
 */
public final class TransactionLogger {

    private final TransactionRegistry registry;
    private final ExportCoordinator coordinator;

    /**
     * Constructs a logger from the supplied configuration.
     *
     * @param config logger configuration; unset fields take the defaults described on {@link LoggerConfig}.
     */
    public TransactionLogger(LoggerConfig config) {
        Objects.requireNonNull(config, "config");
        LoggerConfig resolved = config.withDefaults();
        this.registry = new TransactionRegistry(resolved);
        this.coordinator = new ExportCoordinator(
            registry,
            new ConsoleExporter(),
            resolved.getExporterOptions(),
            resolved.getFlushConcurrency()
        );
    }

    /**
     * Constructs a logger with default names, the console exporter and the given threshold.
     */
    public TransactionLogger(Level level) {
        this(LoggerConfig.builder().level(Objects.requireNonNull(level, "level")).build());
    }

    /**
     * Builds a logger from a JSON config file, see {@link LoggerConfig#load(Path)}.
     */
    public static TransactionLogger fromConfigFile(Path path) throws ConfigurationException {
        return new TransactionLogger(LoggerConfig.load(path));
    }

    /**
     * Applies a JSON config file to this logger. Only the recognised keys present in the file change the logger
     * name, service name or level; the file's full contents replace the exporter options.
     *
     * @return this logger.
     * @throws ConfigurationException when the file cannot be read or parsed; the logger is left unchanged.
     */
    public TransactionLogger configure(Path path) throws ConfigurationException {
        Map<String, String> options = LoggerConfig.readOptions(path);
        String name = options.get(LoggerConfig.KEY_LOGGER_NAME);
        if (name != null) {
            registry.setLoggerName(name);
        }
        String service = options.get(LoggerConfig.KEY_SERVICE_NAME);
        if (service != null) {
            registry.setServiceName(service);
        }
        if (options.containsKey(LoggerConfig.KEY_LEVEL)) {
            registry.setLevel(LoggerConfig.parseLevel(options.get(LoggerConfig.KEY_LEVEL)));
        }
        coordinator.setExporterOptions(options);
        return this;
    }

    /**
     * Replaces the exporter used by subsequent exports.
     *
     * @return this logger.
     */
    public TransactionLogger withExporter(Exporter exporter) {
        coordinator.setExporter(exporter);
        return this;
    }

    /**
     * Opens a transaction and returns its trace ID.
     */
    public String startTransaction(Map<String, String> attributes) {
        return registry.open(attributes);
    }

    public void debug(String message, String traceId, Map<String, String> attributes) throws TxLogException {
        registry.record(Level.DEBUG, traceId, message, attributes);
    }

    public void info(String message, String traceId, Map<String, String> attributes) throws TxLogException {
        registry.record(Level.INFO, traceId, message, attributes);
    }

    public void warning(String message, String traceId, Map<String, String> attributes) throws TxLogException {
        registry.record(Level.WARNING, traceId, message, attributes);
    }

    public void error(String message, String traceId, Map<String, String> attributes) throws TxLogException {
        registry.record(Level.ERROR, traceId, message, attributes);
    }

    public void log(Level level, String message, String traceId, Map<String, String> attributes)
        throws TxLogException {
        registry.record(level, traceId, message, attributes);
    }

    /**
     * Exports one transaction and retires it on success.
     *
     * @throws UnknownTransactionException when the trace ID is not open.
     * @throws ExporterException           when the exporter fails; the transaction stays open.
     */
    public void exportLogs(String traceId) throws TxLogException {
        coordinator.flush(traceId);
    }

    /**
     * Exports every open transaction concurrently, see {@link ExportCoordinator#flushAll()}.
     */
    public void exportAllLogs() throws TxLogException {
        coordinator.flushAll();
    }

    public Optional<TransactionLog> transaction(String traceId) {
        return registry.lookup(traceId);
    }

    public int openTransactions() {
        return registry.size();
    }

    public Level getLevel() {
        return registry.level();
    }

    public void setLevel(Level level) {
        registry.setLevel(level);
    }

    public String getLoggerName() {
        return registry.loggerName();
    }

    public void setLoggerName(String name) {
        registry.setLoggerName(name);
    }

    public String getServiceName() {
        return registry.serviceName();
    }

    public void setServiceName(String name) {
        registry.setServiceName(name);
    }

    public Exporter getExporter() {
        return coordinator.exporter();
    }

    public TransactionRegistry registry() {
        return registry;
    }

    public ExportCoordinator coordinator() {
        return coordinator;
    }
}
