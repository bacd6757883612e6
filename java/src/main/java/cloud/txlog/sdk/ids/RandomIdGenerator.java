package cloud.txlog.sdk.ids;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link IdGenerator}. Trace IDs are random non-negative 63-bit integers rendered in decimal. Span IDs come
 * from a process-wide counter with a random starting point, so they never repeat while the JVM is up.
 */
public final class RandomIdGenerator implements IdGenerator {

    private static final AtomicLong SPAN_SEQUENCE =
        new AtomicLong(ThreadLocalRandom.current().nextLong(0, Long.MAX_VALUE / 2));

    @Override
    public String nextTraceId() {
        return Long.toString(ThreadLocalRandom.current().nextLong(0, Long.MAX_VALUE));
    }

    @Override
    public String nextSpanId() {
        return Long.toString(SPAN_SEQUENCE.getAndIncrement());
    }
}
