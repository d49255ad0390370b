package com.axonops.tracepipe.session;

import com.axonops.tracepipe.api.EventLevel;
import com.axonops.tracepipe.api.ProviderConfiguration;
import com.axonops.tracepipe.api.WellKnownProviders;
import com.axonops.tracepipe.config.TracePipeConfig;
import com.axonops.tracepipe.provider.ProviderRegistry;
import com.axonops.tracepipe.provider.TraceProvider;
import com.axonops.tracepipe.test.TestUtils;
import com.axonops.tracepipe.util.PipeLock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for session enable, disable, rundown and buffer sizing.
 */
class SessionControllerTest {

    private static final long MB = 1024L * 1024;

    private PipeLock lock;
    private ProviderRegistry registry;
    private SessionController session;

    private void setUp(TracePipeConfig config) {
        lock = new PipeLock();
        registry = new ProviderRegistry(lock, config.metricsRegistry());
        session = new SessionController(registry, config);
    }

    private void setUp() {
        setUp(TestUtils.testConfigBuilder().build());
    }

    private void enable(int mb, ProviderConfiguration... rules) {
        TestUtils.underLock(lock, () -> session.enable(mb, List.of(rules)));
    }

    @Test
    void testInitialState() {
        setUp();

        assertThat(session.isEnabled()).isFalse();
        assertThat(session.isRundownEnabled()).isFalse();
        assertThat(session.getCircularBufferSize()).isEqualTo(1000 * MB);
    }

    @Test
    void testEnable_EnablesOnlyMatchingProviders() {
        setUp();
        TraceProvider a = registry.register("A", null, null).orElseThrow();
        TraceProvider b = registry.register("B", null, null).orElseThrow();

        enable(10, new ProviderConfiguration("A", 0xFF, EventLevel.INFORMATIONAL));

        assertThat(session.isEnabled()).isTrue();
        assertThat(session.getCircularBufferSize()).isEqualTo(10 * MB);
        assertThat(a.isEnabled()).isTrue();
        assertThat(a.getKeywords()).isEqualTo(0xFF);
        assertThat(a.getLevel()).isEqualTo(EventLevel.INFORMATIONAL);
        assertThat(b.isEnabled()).isFalse();
    }

    @Test
    void testEnable_ProviderRegisteredLater_IsEnabled() {
        setUp();
        enable(10, new ProviderConfiguration("Late", 0x5, EventLevel.WARNING));

        TraceProvider late = registry.register("Late", null, null).orElseThrow();

        assertThat(late.isEnabled()).isTrue();
        assertThat(late.getKeywords()).isEqualTo(0x5);
        assertThat(late.getLevel()).isEqualTo(EventLevel.WARNING);
    }

    @Test
    void testEnable_BufferSizeIsUnsigned() {
        setUp();

        enable(-1);

        assertThat(session.getCircularBufferSize()).isEqualTo(0xFFFFFFFFL * MB);
    }

    @Test
    void testEnable_InvalidLevel_NoStateChange() {
        setUp();
        TraceProvider a = registry.register("A", null, null).orElseThrow();

        assertThatThrownBy(() -> enable(10, new ProviderConfiguration("A", 0xFF, 6)))
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(session.isEnabled()).isFalse();
        assertThat(session.getCircularBufferSize()).isEqualTo(1000 * MB);
        assertThat(a.isEnabled()).isFalse();
    }

    @Test
    void testEnable_AlreadyEnabled_Throws() {
        setUp();
        enable(10);

        assertThatThrownBy(() -> enable(20))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already enabled");
        assertThat(session.getCircularBufferSize()).isEqualTo(10 * MB);
    }

    @Test
    void testOperations_WithoutLock_Throw() {
        setUp();

        assertThatThrownBy(() -> session.enable(1, List.of())).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(session::disable).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(session::enableRundown).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.setCircularBufferSize(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testCatchAll_EnablesEveryProvider() {
        setUp(TestUtils.testConfigBuilder().catchAllAtStartup(true).build());
        TraceProvider a = registry.register("A", null, null).orElseThrow();

        enable(10, new ProviderConfiguration("Unrelated", 0x1, EventLevel.CRITICAL));
        TraceProvider late = registry.register("Late", null, null).orElseThrow();

        for (TraceProvider provider : List.of(a, late)) {
            assertThat(provider.isEnabled()).isTrue();
            assertThat(provider.getKeywords()).isEqualTo(0xFFFFFFFFFFFFFFFFL);
            assertThat(provider.getLevel()).isEqualTo(EventLevel.VERBOSE);
        }
    }

    @Test
    void testDisable_ResetsAllProviders() {
        setUp();
        List<String> calls = new ArrayList<>();
        TraceProvider a = registry.register("A",
            (name, enabled, keywords, level, data) -> calls.add(enabled + ":" + keywords + ":" + level),
            null).orElseThrow();

        enable(10, new ProviderConfiguration("A", 0xFF, EventLevel.VERBOSE));
        TestUtils.underLock(lock, session::disable);

        assertThat(session.isEnabled()).isFalse();
        assertThat(a.isEnabled()).isFalse();
        assertThat(a.getKeywords()).isZero();
        assertThat(a.getLevel()).isEqualTo(EventLevel.CRITICAL);
        assertThat(calls).containsExactly("true:255:VERBOSE", "false:0:CRITICAL");

        // Filters are gone: a late provider stays disabled
        assertThat(registry.register("A2", null, null).orElseThrow().isEnabled()).isFalse();
    }

    @Test
    void testDisable_NotifiesUnmatchedProvidersToo() {
        setUp();
        List<String> calls = new ArrayList<>();
        registry.register("B", (name, enabled, keywords, level, data) -> calls.add(name + ":" + enabled), null);

        enable(10, new ProviderConfiguration("A", 0xFF, EventLevel.VERBOSE));
        TestUtils.underLock(lock, session::disable);

        assertThat(calls).containsExactly("B:false");
    }

    @Test
    void testDisable_WhenNotEnabled_IsHarmless() {
        setUp();
        TraceProvider a = registry.register("A", null, null).orElseThrow();

        TestUtils.underLock(lock, session::disable);

        assertThat(session.isEnabled()).isFalse();
        assertThat(a.isEnabled()).isFalse();
    }

    @Test
    void testEnableAfterDisable_Allowed() {
        setUp();
        TraceProvider a = registry.register("A", null, null).orElseThrow();

        enable(10, new ProviderConfiguration("A", 0x1, EventLevel.ERROR));
        TestUtils.underLock(lock, session::disable);
        enable(20, new ProviderConfiguration("A", 0x2, EventLevel.VERBOSE));

        assertThat(a.getKeywords()).isEqualTo(0x2);
        assertThat(session.getCircularBufferSize()).isEqualTo(20 * MB);
    }

    @Test
    void testEnableRundown_EnablesRundownProviders() {
        setUp();
        TraceProvider runtime = registry.register(WellKnownProviders.RUNTIME_PROVIDER_NAME, null, null).orElseThrow();
        TraceProvider rundown = registry.register(WellKnownProviders.RUNDOWN_PROVIDER_NAME, null, null).orElseThrow();
        TraceProvider other = registry.register("Other", null, null).orElseThrow();

        TestUtils.underLock(lock, session::enableRundown);

        assertThat(session.isRundownEnabled()).isTrue();
        assertThat(session.isEnabled()).isTrue();
        assertThat(session.getCircularBufferSize()).isEqualTo(MB);
        for (TraceProvider provider : List.of(runtime, rundown)) {
            assertThat(provider.isEnabled()).isTrue();
            assertThat(provider.getKeywords()).isEqualTo(0x80020138L);
            assertThat(provider.getLevel()).isEqualTo(EventLevel.VERBOSE);
        }
        assertThat(other.isEnabled()).isFalse();

        TestUtils.underLock(lock, session::disable);
        assertThat(session.isRundownEnabled()).isFalse();
        assertThat(runtime.isEnabled()).isFalse();
    }

    @Test
    void testEnableRundown_WhileEnabled_Throws() {
        setUp();
        enable(10);

        assertThatThrownBy(() -> TestUtils.underLock(lock, session::enableRundown))
            .isInstanceOf(IllegalStateException.class);
        assertThat(session.isRundownEnabled()).isFalse();
        assertThat(session.getCircularBufferSize()).isEqualTo(10 * MB);
    }

    @Test
    void testSetCircularBufferSize_WhileDisabled_Applies() {
        setUp();

        TestUtils.underLock(lock, () -> session.setCircularBufferSize(4096));

        assertThat(session.getCircularBufferSize()).isEqualTo(4096);
    }

    @Test
    void testSetCircularBufferSize_NonPositive_Rejected() {
        setUp();

        assertThatThrownBy(() -> TestUtils.underLock(lock, () -> session.setCircularBufferSize(0)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TestUtils.underLock(lock, () -> session.setCircularBufferSize(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("-1");
        assertThat(session.getCircularBufferSize()).isEqualTo(1000 * MB);
    }

    @Test
    void testEnable_AfterRegistryTornDown_Throws() {
        setUp();
        registry.teardown(100);

        assertThatThrownBy(() -> enable(10))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("torn down");
        assertThatThrownBy(() -> TestUtils.underLock(lock, session::enableRundown))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("torn down");
        assertThat(session.isEnabled()).isFalse();
        assertThat(session.isRundownEnabled()).isFalse();
    }

    @Test
    void testSetCircularBufferSize_WhileEnabled_Ignored() {
        setUp();
        enable(10);

        TestUtils.underLock(lock, () -> session.setCircularBufferSize(4096));

        assertThat(session.getCircularBufferSize()).isEqualTo(10 * MB);
    }

    @Test
    void testCallbackFailure_DoesNotAbortSweep() {
        setUp();
        registry.register("Bad", (name, enabled, keywords, level, data) -> {
            throw new RuntimeException("callback failure");
        }, null);
        TraceProvider good = registry.register("Good", null, null).orElseThrow();

        enable(10,
            new ProviderConfiguration("Bad", 0x1, EventLevel.VERBOSE),
            new ProviderConfiguration("Good", 0x1, EventLevel.VERBOSE));

        assertThat(good.isEnabled()).isTrue();
        assertThat(registry.lookup("Bad").orElseThrow().isEnabled()).isTrue();
    }
}
