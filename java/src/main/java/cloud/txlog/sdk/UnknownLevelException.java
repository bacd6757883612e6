package cloud.txlog.sdk;

/**
 * Raised when an entry is recorded with a severity outside {@link Level}.
 */
public class UnknownLevelException extends TxLogException {

    private static final long serialVersionUID = 1L;

    private final int severity;

    public UnknownLevelException(int severity) {
        super("unknown log level: " + severity);
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }
}
