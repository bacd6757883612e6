package cloud.txlog.sdk;

import cloud.txlog.sdk.ids.IdGenerator;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * <p>
 * Thread-safe store of open transactions. Every read and write of the transaction map, and every append to a
 * transaction's entries, happens under one registry lock; these are constant-time map operations, so exporter I/O is
 * never performed while it is held.
 * </p>
 *
 * <h2>Filtering</h2>
 * <p>
 * Entries whose severity is below the configured threshold are dropped without error. The threshold and the
 * logger/service identity stamped onto new entries can be changed at any time; a change applies to entries recorded
 * afterwards and never rewrites entries already recorded.
 * </p>
 *
 * <h2>Exports in flight</h2>
 * <p>
 * While {@link ExportCoordinator} exports a transaction, the transaction is marked in flight. Recording into it or
 * flushing it again waits until that export finishes and then sees the outcome: gone after a successful export,
 * unchanged after a failed one. Other transactions are unaffected.
 * </p>
 */
public final class TransactionRegistry {

    private static final Logger LOGGER = Logger.getLogger(TransactionRegistry.class.getName());

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss", Locale.ROOT);
    private static final int MAX_TRACE_ID_ATTEMPTS = 1000;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition exportFinished = lock.newCondition();
    private final Map<String, OpenTransaction> transactions = new HashMap<>();

    private final IdGenerator idGenerator;
    private final Clock clock;

    private volatile Level level;
    private volatile String loggerName;
    private volatile String serviceName;

    /**
     * @param config logger configuration; defaults are applied to a copy, so later changes to the builder have no effect.
     */
    public TransactionRegistry(LoggerConfig config) {
        Objects.requireNonNull(config, "config");
        LoggerConfig resolved = config.withDefaults();
        this.idGenerator = resolved.getIdGenerator();
        this.clock = resolved.getClock();
        this.level = resolved.getLevel();
        this.loggerName = resolved.getLoggerName();
        this.serviceName = resolved.getServiceName();
    }

    public TransactionRegistry(Level level) {
        this(LoggerConfig.builder().level(Objects.requireNonNull(level, "level")).build());
    }

    /**
     * Opens a transaction seeded with {@code attributes} and returns its trace ID, which is unique among the
     * transactions currently open.
     */
    public String open(Map<String, String> attributes) {
        lock.lock();
        try {
            String traceId = freshTraceId();
            transactions.put(traceId, new OpenTransaction(traceId, attributes));
            LOGGER.fine(() -> "[txlog] opened transaction " + traceId);
            return traceId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records an entry at {@code level}.
     *
     * @throws UnknownTransactionException when {@code traceId} is not open, whatever the level.
     * @throws UnknownLevelException       when {@code level} is {@code null}.
     * @throws TxLogException              when interrupted while waiting for an export of the same transaction.
     */
    public void record(Level level, String traceId, String message, Map<String, String> attributes)
        throws TxLogException {
        if (level == null) {
            requireOpen(traceId);
            throw new UnknownLevelException(0);
        }
        record(level.severity(), traceId, message, attributes);
    }

    /**
     * Records an entry at a numeric severity ({@code 1} = DEBUG through {@code 4} = ERROR).
     *
     * <p>
     * Checks run in this order: the transaction must be open, then severities below the threshold are silently
     * dropped, then the severity must name a known {@link Level}.
     * </p>
     *
     * @throws UnknownTransactionException when {@code traceId} is not open, whatever the severity.
     * @throws UnknownLevelException       when a severity at or above the threshold is not a known level.
     * @throws TxLogException              when interrupted while waiting for an export of the same transaction.
     */
    public void record(int severity, String traceId, String message, Map<String, String> attributes)
        throws TxLogException {
        lock.lock();
        try {
            OpenTransaction transaction = awaitSettled(traceId);
            if (transaction == null) {
                throw new UnknownTransactionException(traceId);
            }
            if (severity < level.severity()) {
                return;
            }
            Level resolved = Level.fromSeverity(severity).orElseThrow(() -> new UnknownLevelException(severity));

            String timestamp = TIMESTAMP_FORMAT.format(LocalDateTime.now(clock));
            transaction.entries.add(new LogEntry(
                timestamp,
                resolved.wireName(),
                message,
                loggerName,
                serviceName,
                traceId,
                idGenerator.nextSpanId(),
                attributes
            ));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the transaction, or empty when it is not open.
     */
    public Optional<TransactionLog> lookup(String traceId) {
        lock.lock();
        try {
            OpenTransaction transaction = transactions.get(traceId);
            return transaction == null ? Optional.empty() : Optional.of(transaction.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards an open transaction without exporting it.
     *
     * @throws UnknownTransactionException when {@code traceId} is not open.
     */
    public void remove(String traceId) throws TxLogException {
        lock.lock();
        try {
            if (awaitSettled(traceId) == null) {
                throw new UnknownTransactionException(traceId);
            }
            transactions.remove(traceId);
            LOGGER.fine(() -> "[txlog] removed transaction " + traceId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time snapshot of the open trace IDs, in no particular order.
     */
    public List<String> traceIds() {
        lock.lock();
        try {
            return List.copyOf(transactions.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return transactions.size();
        } finally {
            lock.unlock();
        }
    }

    public Level level() {
        return level;
    }

    public void setLevel(Level level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    public String loggerName() {
        return loggerName;
    }

    public void setLoggerName(String loggerName) {
        this.loggerName = loggerName;
    }

    public String serviceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    /**
     * Marks the transaction in flight and returns the entries to export. Pair with {@link #release(String, boolean)}.
     */
    TransactionLog claim(String traceId) throws TxLogException {
        lock.lock();
        try {
            OpenTransaction transaction = awaitSettled(traceId);
            if (transaction == null) {
                throw new UnknownTransactionException(traceId);
            }
            transaction.inFlight = true;
            return transaction.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends an export started by {@link #claim(String)}: removes the transaction when it was exported, otherwise
     * leaves it open with its entries intact.
     */
    void release(String traceId, boolean exported) {
        lock.lock();
        try {
            OpenTransaction transaction = transactions.get(traceId);
            if (transaction != null) {
                if (exported) {
                    transactions.remove(traceId);
                } else {
                    transaction.inFlight = false;
                }
            }
            exportFinished.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void requireOpen(String traceId) throws TxLogException {
        lock.lock();
        try {
            if (awaitSettled(traceId) == null) {
                throw new UnknownTransactionException(traceId);
            }
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private OpenTransaction awaitSettled(String traceId) throws TxLogException {
        OpenTransaction transaction = transactions.get(traceId);
        while (transaction != null && transaction.inFlight) {
            try {
                exportFinished.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TxLogException("wait for export of trace " + traceId + " interrupted", ex);
            }
            transaction = transactions.get(traceId);
        }
        return transaction;
    }

    // Caller holds the lock.
    private String freshTraceId() {
        for (int attempt = 0; attempt < MAX_TRACE_ID_ATTEMPTS; attempt++) {
            String candidate = idGenerator.nextTraceId();
            if (candidate != null && !candidate.isBlank() && !transactions.containsKey(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException(String.format(Locale.ROOT,
            "id generator %s produced no unused trace ID in %d attempts",
            idGenerator.getClass().getName(), MAX_TRACE_ID_ATTEMPTS));
    }

    private static final class OpenTransaction {
        private final String traceId;
        private final Map<String, String> attributes;
        private final List<LogEntry> entries = new ArrayList<>();
        private boolean inFlight;

        private OpenTransaction(String traceId, Map<String, String> attributes) {
            this.traceId = traceId;
            this.attributes = attributes == null ? Map.of() : new LinkedHashMap<>(attributes);
        }

        private TransactionLog snapshot() {
            return new TransactionLog(traceId, attributes, entries);
        }
    }
}
