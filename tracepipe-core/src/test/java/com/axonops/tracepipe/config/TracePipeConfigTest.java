package com.axonops.tracepipe.config;

import com.axonops.tracepipe.metrics.NoOpMetricsRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for configuration defaults, validation and environment parsing.
 */
class TracePipeConfigTest {

    @Test
    void testDefaults() {
        TracePipeConfig config = TracePipeConfig.DEFAULT;

        assertThat(config.catchAllAtStartup()).isFalse();
        assertThat(config.defaultCircularBufferSizeBytes()).isEqualTo(1024L * 1024 * 1000);
        assertThat(config.teardownLockTimeoutMillis()).isEqualTo(5000);
        assertThat(config.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
        assertThat(TracePipeConfig.builder().build()).isEqualTo(config);
    }

    @Test
    void testBuilder() {
        TracePipeConfig config = TracePipeConfig.builder()
            .catchAllAtStartup(true)
            .defaultCircularBufferSizeBytes(4096)
            .teardownLockTimeoutMillis(0)
            .build();

        assertThat(config.catchAllAtStartup()).isTrue();
        assertThat(config.defaultCircularBufferSizeBytes()).isEqualTo(4096);
        assertThat(config.teardownLockTimeoutMillis()).isZero();
    }

    @Test
    void testValidation() {
        assertThatThrownBy(() -> TracePipeConfig.builder().defaultCircularBufferSizeBytes(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TracePipeConfig.builder().teardownLockTimeoutMillis(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TracePipeConfig.builder().metricsRegistry(null).build())
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testParseTracingFlags() {
        assertThat(TracePipeConfig.parseTracingFlags(null)).isFalse();
        assertThat(TracePipeConfig.parseTracingFlags("")).isFalse();
        assertThat(TracePipeConfig.parseTracingFlags("  ")).isFalse();
        assertThat(TracePipeConfig.parseTracingFlags("0")).isFalse();
        assertThat(TracePipeConfig.parseTracingFlags("1")).isTrue();
        assertThat(TracePipeConfig.parseTracingFlags("2")).isFalse();
        assertThat(TracePipeConfig.parseTracingFlags("3")).isTrue();
        assertThat(TracePipeConfig.parseTracingFlags(" 1 ")).isTrue();
        assertThat(TracePipeConfig.parseTracingFlags("0x11")).isTrue();
        assertThat(TracePipeConfig.parseTracingFlags("0X10")).isFalse();
    }

    @Test
    void testParseTracingFlags_Invalid_Throws() {
        assertThatThrownBy(() -> TracePipeConfig.parseTracingFlags("yes"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("yes");
    }

    @Test
    void testFromSources_PropertyWinsOverEnvironment() {
        Properties properties = new Properties();
        properties.setProperty(TracePipeConfig.PERFORMANCE_TRACING_PROPERTY, "0");

        TracePipeConfig config = TracePipeConfig.fromSources(
            properties, Map.of(TracePipeConfig.PERFORMANCE_TRACING_ENV, "1"));

        assertThat(config.catchAllAtStartup()).isFalse();
    }

    @Test
    void testFromSources_FallsBackToEnvironment() {
        Properties properties = new Properties();
        properties.setProperty(TracePipeConfig.PERFORMANCE_TRACING_PROPERTY, " ");

        TracePipeConfig config = TracePipeConfig.fromSources(
            properties, Map.of(TracePipeConfig.PERFORMANCE_TRACING_ENV, "1"));

        assertThat(config.catchAllAtStartup()).isTrue();
    }

    @Test
    void testFromSources_NothingSet_CatchAllOff() {
        TracePipeConfig config = TracePipeConfig.fromSources(new Properties(), Map.of());

        assertThat(config.catchAllAtStartup()).isFalse();
        assertThat(config.defaultCircularBufferSizeBytes())
            .isEqualTo(TracePipeConfig.DEFAULT_CIRCULAR_BUFFER_SIZE_BYTES);
    }
}
