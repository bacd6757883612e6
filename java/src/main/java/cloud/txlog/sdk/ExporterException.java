package cloud.txlog.sdk;

/**
 * Failure reported by an exporter backend while writing a transaction's entries.
 */
public class ExporterException extends TxLogException {

    private static final long serialVersionUID = 1L;

    public ExporterException(String message) {
        super(message);
    }

    public ExporterException(String message, Throwable cause) {
        super(message, cause);
    }
}
