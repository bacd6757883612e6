package cloud.txlog.sdk;

/**
 * Base exception thrown by the txlog SDK.
 */
public class TxLogException extends Exception {

    private static final long serialVersionUID = 1L;

    public TxLogException(String message) {
        super(message);
    }

    public TxLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
