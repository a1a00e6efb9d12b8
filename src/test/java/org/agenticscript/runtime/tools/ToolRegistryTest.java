package org.agenticscript.runtime.tools;

import org.agenticscript.runtime.api.DuplicateToolException;
import org.agenticscript.runtime.api.ErrorCode;
import org.agenticscript.runtime.api.UnknownToolException;
import org.agenticscript.runtime.bus.MessageBus;
import org.agenticscript.runtime.model.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ToolRegistryTest {

    @Mock
    private Tool echo;

    private ToolRegistry registry;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        context = new ToolContext("caller_001", List.of(), new MessageBus(10));
    }

    @Test
    void executeCountsCallsAndPassesArguments() {
        when(echo.execute(any(), anyList())).thenReturn(Value.of("pong"));
        registry.register("Echo", echo, "Echoes", Set.of("test"));

        Value result = registry.execute("Echo", context, List.of(Value.of("ping")));

        assertThat(result).isEqualTo(Value.of("pong"));
        verify(echo).execute(context, List.of(Value.of("ping")));
        ToolStatistics stats = registry.statistics("Echo");
        assertThat(stats.callCount()).isEqualTo(1);
        assertThat(stats.failureCount()).isZero();
        assertThat(stats.lastUsed()).isNotNull();
        assertThat(stats.description()).isEqualTo("Echoes");
    }

    @Test
    void neverCalledToolHasNoLastUse() {
        registry.register("Echo", echo, "Echoes", Set.of());

        ToolStatistics stats = registry.statistics("Echo");

        assertThat(stats.callCount()).isZero();
        assertThat(stats.lastUsed()).isNull();
        verify(echo, never()).execute(any(), anyList());
    }

    @Test
    void registeringSameNameTwiceFails() {
        registry.register("Echo", echo, "Echoes", Set.of());

        assertThatThrownBy(() -> registry.register("Echo", echo, "Again", Set.of()))
                .isInstanceOf(DuplicateToolException.class)
                .hasMessage("Tool already registered: Echo");
        assertThat(registry.statistics("Echo").description()).isEqualTo("Echoes");
    }

    @Test
    void unknownToolIsRejected() {
        assertThatThrownBy(() -> registry.execute("Ghost", context, List.of()))
                .isInstanceOf(UnknownToolException.class)
                .extracting(e -> ((UnknownToolException) e).getCode())
                .isEqualTo(ErrorCode.UNKNOWN_TOOL);
        assertThatThrownBy(() -> registry.statistics("Ghost")).isInstanceOf(UnknownToolException.class);
    }

    @Test
    void handlerFailureIsCountedAndWrapped() {
        when(echo.execute(any(), anyList())).thenThrow(new IllegalStateException("boom"));
        registry.register("Echo", echo, "Echoes", Set.of());

        assertThatThrownBy(() -> registry.execute("Echo", context, List.of()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Tool Echo failed: boom")
                .hasCauseInstanceOf(IllegalStateException.class);

        ToolStatistics stats = registry.statistics("Echo");
        assertThat(stats.callCount()).isEqualTo(1);
        assertThat(stats.failureCount()).isEqualTo(1);
    }

    @Test
    void toolExecutionExceptionPassesThroughUnchanged() {
        ToolExecutionException failure = new ToolExecutionException("bad input");
        when(echo.execute(any(), anyList())).thenThrow(failure);
        registry.register("Echo", echo, "Echoes", Set.of());

        assertThatThrownBy(() -> registry.execute("Echo", context, List.of())).isSameAs(failure);
        assertThat(registry.statistics("Echo").failureCount()).isEqualTo(1);
    }

    @Test
    void pluginRegistrationIsAllOrNothing() {
        registry.register("Taken", echo, "Existing", Set.of());
        Map<String, Tool> plugin = new LinkedHashMap<>();
        plugin.put("Fresh", (ctx, args) -> Value.NULL);
        plugin.put("Taken", (ctx, args) -> Value.NULL);

        assertThatThrownBy(() -> registry.registerPlugin("extras", plugin))
                .isInstanceOf(DuplicateToolException.class);
        assertThat(registry.isRegistered("Fresh")).isFalse();
        assertThat(registry.names()).containsExactly("Taken");
    }

    @Test
    void pluginToolsAreTaggedWithPluginName() {
        registry.register("Echo", echo, "Echoes", Set.of("core"));
        registry.registerPlugin("extras", Map.of("Beta", (ctx, args) -> Value.NULL, "Alpha", (ctx, args) -> Value.NULL));

        assertThat(registry.names("extras")).containsExactly("Alpha", "Beta");
        assertThat(registry.names("core")).containsExactly("Echo");
        assertThat(registry.names()).containsExactly("Alpha", "Beta", "Echo");
        assertThat(registry.statistics()).extracting(ToolStatistics::name).containsExactly("Alpha", "Beta", "Echo");
        assertThat(registry.statistics("Alpha").description()).isEqualTo("extras plugin tool");
    }

    @Test
    void disabledToolRefusesCallsWithoutCountingThem() {
        registry.register("Echo", echo, "Echoes", Set.of());

        assertThat(registry.disable("Echo")).isTrue();

        assertThatThrownBy(() -> registry.execute("Echo", context, List.of()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Tool Echo is disabled");
        verify(echo, never()).execute(any(), anyList());
        ToolStatistics stats = registry.statistics("Echo");
        assertThat(stats.enabled()).isFalse();
        assertThat(stats.callCount()).isZero();
        assertThat(stats.failureCount()).isZero();
        assertThat(registry.isRegistered("Echo")).isTrue();
        assertThat(registry.isEnabled("Echo")).isFalse();
    }

    @Test
    void enabledToolAcceptsCallsAgain() {
        when(echo.execute(any(), anyList())).thenReturn(Value.of("pong"));
        registry.register("Echo", echo, "Echoes", Set.of());
        registry.disable("Echo");

        assertThat(registry.enable("Echo")).isTrue();

        assertThat(registry.execute("Echo", context, List.of())).isEqualTo(Value.of("pong"));
        assertThat(registry.statistics("Echo").enabled()).isTrue();
        assertThat(registry.statistics("Echo").callCount()).isEqualTo(1);
    }

    @Test
    void enablingUnknownToolReportsFalse() {
        assertThat(registry.enable("Ghost")).isFalse();
        assertThat(registry.disable("Ghost")).isFalse();
        assertThat(registry.isEnabled("Ghost")).isFalse();
    }

    @Test
    void listPluginsReturnsRegisteredPluginNames() {
        registry.register("Echo", echo, "Echoes", Set.of("core"));
        registry.registerPlugin("web", Map.of("Fetch", (ctx, args) -> Value.NULL));
        registry.registerPlugin("extras", Map.of("Alpha", (ctx, args) -> Value.NULL));
        registry.registerPlugin("extras", Map.of("Beta", (ctx, args) -> Value.NULL));

        assertThat(registry.listPlugins()).containsExactly("extras", "web");
        assertThat(registry.pluginTools("extras")).containsExactly("Alpha", "Beta");
        assertThat(registry.pluginTools("core")).isEmpty();
    }

    @Test
    void failedPluginRegistrationIsNotListed() {
        registry.register("Taken", echo, "Existing", Set.of());

        assertThatThrownBy(() -> registry.registerPlugin("extras", Map.of("Taken", (ctx, args) -> Value.NULL)))
                .isInstanceOf(DuplicateToolException.class);
        assertThat(registry.listPlugins()).isEmpty();
    }

    @Test
    void parallelCallsAreCountedExactly() throws Exception {
        int threads = 8;
        int callsPerThread = 250;
        registry.register("Count", (ctx, args) -> Value.of(1), "Counts", Set.of());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        registry.execute("Count", context, List.of());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.statistics("Count").callCount()).isEqualTo((long) threads * callsPerThread);
        assertThat(registry.statistics("Count").failureCount()).isZero();
    }

    @Test
    void nonReentrantToolRunsOneCallAtATime() throws Exception {
        ConcurrencyTrackingTool tracking = new ConcurrencyTrackingTool(false);
        registry.register("Exclusive", tracking, "Serialized", Set.of());

        runConcurrently("Exclusive", 6);

        assertThat(tracking.maxConcurrent.get()).isEqualTo(1);
        assertThat(registry.statistics("Exclusive").callCount()).isEqualTo(6);
    }

    @Test
    void reentrantToolMayRunConcurrently() throws Exception {
        ConcurrencyTrackingTool tracking = new ConcurrencyTrackingTool(true);
        registry.register("Shared", tracking, "Parallel", Set.of());

        runConcurrently("Shared", 6);

        assertThat(tracking.maxConcurrent.get()).isGreaterThan(1);
    }

    private void runConcurrently(String toolName, int threads) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.execute(toolName, context, List.of());
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Holds every call for a moment and records how many calls were inside at once.
     */
    private static final class ConcurrencyTrackingTool implements Tool {
        private final boolean reentrant;
        private final AtomicInteger inside = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();

        ConcurrencyTrackingTool(boolean reentrant) {
            this.reentrant = reentrant;
        }

        @Override
        public Value execute(ToolContext context, List<Value> args) {
            int now = inside.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ToolExecutionException("interrupted", e);
            } finally {
                inside.decrementAndGet();
            }
            return Value.NULL;
        }

        @Override
        public boolean isReentrant() {
            return reentrant;
        }
    }
}
