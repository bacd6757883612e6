package cloud.txlog.sdk.ids;

/**
 * Source of transaction (trace) and entry (span) identifiers.
 */
public interface IdGenerator {

    String nextTraceId();

    String nextSpanId();
}
