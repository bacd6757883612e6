package cloud.txlog.sdk.export;

import cloud.txlog.sdk.LogEntry;
import cloud.txlog.sdk.TxLogException;

import java.util.List;
import java.util.Map;

/**
 * Sink that receives a transaction's entries when it is flushed.
 *
 * <p>
 * Implementations must treat an empty entry list as a successful no-op. Backends that need settings read them from
 * {@code options}, which is {@code null} when no configuration was given; a missing required key is reported as a
 * {@link cloud.txlog.sdk.ConfigurationException}.
 * </p>
 *
 * <p>
 * An exporter must not record into or flush the transaction it is exporting: the transaction stays marked in flight
 * until {@code export} returns, so such a call waits forever.
 * </p>
 */
public interface Exporter {

    void export(String traceId, List<LogEntry> entries, Map<String, String> options) throws TxLogException;
}
