package cloud.txlog.sdk;

/**
 * Raised when a trace ID does not resolve to an open transaction, either because it was never opened or because
 * it has already been flushed.
 */
public class UnknownTransactionException extends TxLogException {

    private static final long serialVersionUID = 1L;

    private final String traceId;

    public UnknownTransactionException(String traceId) {
        super("invalid trace ID: " + traceId);
        this.traceId = traceId;
    }

    public String traceId() {
        return traceId;
    }
}
