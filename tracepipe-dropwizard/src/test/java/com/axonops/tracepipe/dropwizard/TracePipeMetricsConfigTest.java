package com.axonops.tracepipe.dropwizard;

import com.axonops.tracepipe.api.TracePipe;
import com.axonops.tracepipe.config.TracePipeConfig;
import com.axonops.tracepipe.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the Dropwizard configuration factory.
 */
class TracePipeMetricsConfigTest {

    @AfterEach
    void cleanup() {
        TracePipeMetricsConfig.shutdown();
    }

    @Test
    void testWithMetrics_UsesDropwizardAdapter() {
        TracePipeConfig config = TracePipeMetricsConfig.withMetrics(new MetricRegistry(), "com.test", false);

        assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
        assertThat(TracePipeMetricsConfig.isJmxReporterRunning()).isFalse();
    }

    @Test
    void testWithMetrics_CustomPrefix() {
        MetricRegistry registry = new MetricRegistry();

        try (TracePipe pipe = TracePipe.create(TracePipeMetricsConfig.withMetrics(registry, "com.myapp.tracing", false))) {
            pipe.createProvider("A");
        }

        assertThat(registry.getCounters()).containsKey("com.myapp.tracing.providers.registered.total.count");
        assertThat(registry.counter("com.myapp.tracing.providers.registered.total.count").getCount()).isEqualTo(2);
    }

    @Test
    void testWithMetrics_DefaultPrefix() {
        MetricRegistry registry = new MetricRegistry();

        try (TracePipe pipe = TracePipe.create(TracePipeMetricsConfig.withMetrics(registry))) {
            assertThat(registry.getGauges()).containsKey("com.axonops.tracepipe.providers.registered.current.count");
        }
        assertThat(TracePipeMetricsConfig.isJmxReporterRunning()).isTrue();
    }

    @Test
    void testJmxReporter_OnePerRegistry() {
        MetricRegistry first = new MetricRegistry();
        MetricRegistry second = new MetricRegistry();

        TracePipeMetricsConfig.withMetrics(first, "com.test.a", true);
        TracePipeMetricsConfig.withMetrics(first, "com.test.a2", true);
        assertThat(TracePipeMetricsConfig.isJmxReporterRunning(first)).isTrue();
        assertThat(TracePipeMetricsConfig.isJmxReporterRunning(second)).isFalse();

        TracePipeMetricsConfig.withMetrics(second, "com.test.b", true);
        assertThat(TracePipeMetricsConfig.isJmxReporterRunning(second)).isTrue();

        TracePipeMetricsConfig.shutdown();
        assertThat(TracePipeMetricsConfig.isJmxReporterRunning()).isFalse();
        assertThat(TracePipeMetricsConfig.isJmxReporterRunning(first)).isFalse();
    }

    @Test
    void testJmxExposure_SecondRegistryVisible() throws Exception {
        MetricRegistry first = new MetricRegistry();
        MetricRegistry second = new MetricRegistry();

        try (TracePipe a = TracePipe.create(TracePipeMetricsConfig.withMetrics(first, "com.test.first"));
             TracePipe b = TracePipe.create(TracePipeMetricsConfig.withMetrics(second, "com.test.second"))) {
            MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
            assertThat(mBeanServer.queryNames(new ObjectName("metrics:name=com.test.first.*,type=*"), null))
                .isNotEmpty();
            assertThat(mBeanServer.queryNames(new ObjectName("metrics:name=com.test.second.*,type=*"), null))
                .isNotEmpty();
        }
    }

    @Test
    void testBuilderWithMetrics_KeepsOtherOptions() {
        TracePipeConfig config = TracePipeMetricsConfig
            .builderWithMetrics(new MetricRegistry(), "com.test", false)
            .catchAllAtStartup(true)
            .defaultCircularBufferSizeBytes(4096)
            .build();

        assertThat(config.catchAllAtStartup()).isTrue();
        assertThat(config.defaultCircularBufferSizeBytes()).isEqualTo(4096);
        assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
    }

    @Test
    void testNullArguments_Rejected() {
        assertThatThrownBy(() -> TracePipeMetricsConfig.withMetrics(null, "p", false))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> TracePipeMetricsConfig.withMetrics(new MetricRegistry(), null, false))
            .isInstanceOf(NullPointerException.class);
    }
}
