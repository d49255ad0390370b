package com.axonops.tracepipe.provider;

import com.axonops.tracepipe.api.EventLevel;
import com.axonops.tracepipe.metrics.NoOpMetricsRegistry;
import com.axonops.tracepipe.util.PipeLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for emitted event instances.
 */
class EventInstanceTest {

    private TraceEvent event;

    @BeforeEach
    void setUp() {
        ProviderRegistry registry = new ProviderRegistry(new PipeLock(), NoOpMetricsRegistry.INSTANCE);
        event = registry.register("P", null, null).orElseThrow()
            .addEvent(1, 0, 0, EventLevel.INFORMATIONAL, false, null);
    }

    @Test
    void testPayload_CopiedOnTheWayInAndOut() {
        byte[] payload = {1, 2, 3};
        EventInstance instance = new EventInstance(event, 7, payload, 100L);

        payload[0] = 9;
        instance.getPayload()[1] = 9;

        assertThat(instance.getPayload()).containsExactly(1, 2, 3);
        assertThat(instance.getPayloadLength()).isEqualTo(3);
    }

    @Test
    void testNullPayload_IsEmpty() {
        EventInstance instance = new EventInstance(event, 7, null);

        assertThat(instance.getPayload()).isEmpty();
        assertThat(instance.getPayloadLength()).isZero();
    }

    @Test
    void testTimestamp_Settable() {
        EventInstance instance = new EventInstance(event, 7, null, 100L);

        instance.setTimestamp(200L);

        assertThat(instance.getTimestamp()).isEqualTo(200L);
        assertThat(instance.getThreadId()).isEqualTo(7);
        assertThat(instance.getEvent()).isSameAs(event);
    }
}
