package cloud.txlog.sdk;

import cloud.txlog.sdk.export.Exporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Hands transactions from a {@link TransactionRegistry} to an {@link Exporter}.
 *
 * <p>
 * A flush removes the transaction from the registry only after the exporter succeeds; on failure the transaction
 * stays open with its entries so the caller can retry. Nothing is retried automatically.
 * </p>
 */
public final class ExportCoordinator {

    private static final Logger LOGGER = Logger.getLogger(ExportCoordinator.class.getName());

    private final TransactionRegistry registry;
    private final int flushConcurrency;
    private final AtomicInteger threadCounter = new AtomicInteger();

    private volatile Exporter exporter;
    private volatile Map<String, String> exporterOptions;

    /**
     * @param registry         registry whose transactions are exported.
     * @param exporter         destination of flushed entries.
     * @param exporterOptions  passed to every export call; {@code null} when no configuration is available.
     * @param flushConcurrency upper bound on concurrent exports in {@link #flushAll()}; {@code 0} runs one thread per
     *                         transaction.
     */
    public ExportCoordinator(
        TransactionRegistry registry,
        Exporter exporter,
        Map<String, String> exporterOptions,
        int flushConcurrency
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        if (flushConcurrency < 0) {
            throw new IllegalArgumentException("flushConcurrency cannot be negative");
        }
        this.flushConcurrency = flushConcurrency;
        setExporterOptions(exporterOptions);
    }

    /**
     * Exports one transaction and, when the exporter succeeds, removes it from the registry.
     *
     * @throws UnknownTransactionException when {@code traceId} is not open (never opened or already flushed).
     * @throws ExporterException           when the exporter fails; the transaction stays open.
     * @throws TxLogException              when interrupted while another export of the same transaction is running.
     */
    public void flush(String traceId) throws TxLogException {
        TransactionLog claimed = registry.claim(traceId);
        Exporter target = exporter;
        Map<String, String> options = exporterOptions;

        boolean exported = false;
        try {
            target.export(claimed.traceId(), claimed.entries(), options);
            exported = true;
        } catch (ExporterException ex) {
            logFailure(traceId, ex);
            throw ex;
        } catch (TxLogException | RuntimeException ex) {
            logFailure(traceId, ex);
            throw new ExporterException("export transaction " + traceId + ": " + ex.getMessage(), ex);
        } finally {
            registry.release(traceId, exported);
        }
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[txlog] exported %d entries of transaction %s", claimed.size(), traceId));
    }

    /**
     * Flushes every transaction open at the time of the call, concurrently, and waits for all of them.
     *
     * <p>
     * Transactions that export successfully are removed even when others fail. If any flush fails, the failure
     * observed first is thrown and the rest are logged and discarded; which one is reported is not deterministic
     * when several fail.
     * </p>
     *
     * <p>
     * An {@link Error} thrown by an exporter is rethrown only after every other flush has completed, and takes
     * precedence over exporter failures.
     * </p>
     *
     * @throws TxLogException the first observed flush failure, or an interruption while waiting.
     */
    public void flushAll() throws TxLogException {
        List<String> traceIds = registry.traceIds();
        if (traceIds.isEmpty()) {
            return;
        }
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[txlog] flushing %d transactions", traceIds.size()));

        AtomicReference<TxLogException> firstFailure = new AtomicReference<>();
        AtomicInteger failures = new AtomicInteger();
        Throwable unexpected = null;
        ExecutorService executor = newExecutor(traceIds.size());
        try {
            List<Future<?>> tasks = new ArrayList<>(traceIds.size());
            for (String traceId : traceIds) {
                tasks.add(executor.submit(() -> {
                    try {
                        flush(traceId);
                    } catch (TxLogException ex) {
                        failures.incrementAndGet();
                        if (!firstFailure.compareAndSet(null, ex)) {
                            LOGGER.log(java.util.logging.Level.WARNING, ex,
                                () -> "[txlog] discarding additional flush failure for transaction " + traceId);
                        }
                    }
                }));
            }
            // every task is awaited before anything is rethrown
            for (int i = 0; i < tasks.size(); i++) {
                try {
                    tasks.get(i).get();
                } catch (ExecutionException ex) {
                    failures.incrementAndGet();
                    Throwable cause = ex.getCause();
                    if (unexpected == null) {
                        unexpected = cause;
                    } else {
                        String traceId = traceIds.get(i);
                        LOGGER.log(java.util.logging.Level.WARNING, cause,
                            () -> "[txlog] discarding additional flush failure for transaction " + traceId);
                    }
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TxLogException("flush all transactions interrupted", ex);
        } finally {
            executor.shutdown();
        }

        TxLogException failure = firstFailure.get();
        if (unexpected != null || failure != null) {
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[txlog] flushed %d of %d transactions, %d failed",
                traceIds.size() - failures.get(), traceIds.size(), failures.get()));
        }
        if (unexpected instanceof Error) {
            throw (Error) unexpected;
        }
        if (unexpected instanceof RuntimeException) {
            throw (RuntimeException) unexpected;
        }
        if (failure != null) {
            throw failure;
        }
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[txlog] flushed %d transactions", traceIds.size()));
    }

    public Exporter exporter() {
        return exporter;
    }

    public void setExporter(Exporter exporter) {
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    public Map<String, String> exporterOptions() {
        return exporterOptions;
    }

    public void setExporterOptions(Map<String, String> exporterOptions) {
        this.exporterOptions = exporterOptions == null
            ? null : Collections.unmodifiableMap(new LinkedHashMap<>(exporterOptions));
    }

    public int flushConcurrency() {
        return flushConcurrency;
    }

    private ExecutorService newExecutor(int transactions) {
        int threads = flushConcurrency == 0 ? transactions : Math.min(flushConcurrency, transactions);
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "txlog-flush-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    private static void logFailure(String traceId, Exception ex) {
        LOGGER.warning(() -> String.format(Locale.ROOT,
            "[txlog] export of transaction %s failed: %s", traceId, ex.getMessage()));
    }
}
