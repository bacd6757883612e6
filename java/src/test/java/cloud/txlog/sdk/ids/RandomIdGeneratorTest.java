package cloud.txlog.sdk.ids;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RandomIdGeneratorTest {

    @Test
    void traceIdsAreNonNegativeDecimalLongs() {
        RandomIdGenerator generator = new RandomIdGenerator();

        for (int i = 0; i < 100; i++) {
            long value = Long.parseLong(generator.nextTraceId());
            assertTrue(value >= 0);
        }
    }

    @Test
    void spanIdsNeverRepeatAcrossInstances() {
        RandomIdGenerator first = new RandomIdGenerator();
        RandomIdGenerator second = new RandomIdGenerator();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            assertTrue(seen.add(first.nextSpanId()));
            assertTrue(seen.add(second.nextSpanId()));
        }
        seen.forEach(id -> assertDoesNotThrow(() -> Long.parseLong(id)));
    }
}
