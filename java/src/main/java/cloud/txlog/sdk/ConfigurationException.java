package cloud.txlog.sdk;

/**
 * Missing or malformed configuration, raised by config loading and by exporters that require settings.
 */
public class ConfigurationException extends TxLogException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
