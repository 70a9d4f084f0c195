package com.ryuqq.wrapper.core;

import com.ryuqq.wrapper.core.combinator.CatchPolicy;
import com.ryuqq.wrapper.core.combinator.TimingPolicy;
import com.ryuqq.wrapper.core.diagnostic.StandardStreamDiagnosticSink;
import com.ryuqq.wrapper.core.function.Decorator;
import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.outcome.Guarded;
import com.ryuqq.wrapper.core.spi.CompletionHandle;
import com.ryuqq.wrapper.core.spi.FutureCompletionHandle;
import com.ryuqq.wrapper.core.spi.WorkerPool;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wrappers 진입점 통합 테스트.
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
class WrappersTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final StandardStreamDiagnosticSink sink = new StandardStreamDiagnosticSink(
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)
    );

    /** 호출 스레드에서 바로 실행하는 pool. */
    private final WorkerPool callerRuns = new WorkerPool() {
        @Override
        public <T> CompletionHandle<T> submit(Callable<T> work) {
            FutureCompletionHandle<T> handle = new FutureCompletionHandle<>();
            try {
                handle.complete(work.call());
            } catch (Exception e) {
                handle.fail(e);
            }
            return handle;
        }
    };

    @Test
    void repeat_ThenTimeit_ComposesAndReportsOnce() throws Exception {
        // Given
        AtomicInteger counter = new AtomicInteger();
        Invocable<Integer> next = Invocable.named("next", call -> counter.incrementAndGet());
        Decorator stack = Wrappers.repeat(3)
            .andThen(Wrappers.timeit(new TimingPolicy().withTimer(() -> 1.0).withSink(sink)));

        // When
        Integer result = stack.decorate(next).invoke();

        // Then
        assertEquals(3, result);
        assertEquals("next executed in 0.0 seconds" + System.lineSeparator(),
            out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void threadedRepeat_UsesGivenPool() throws Exception {
        AtomicInteger counter = new AtomicInteger();
        Invocable<Integer> next = Invocable.named("next", call -> counter.incrementAndGet());

        Wrappers.threadedRepeat(4, callerRuns).decorate(next).invoke();

        assertEquals(4, counter.get());
    }

    @Test
    void catching_BareTarget_SuppressesException() throws Exception {
        Invocable<Integer> failing = Invocable.named("failing", call -> {
            throw new IllegalArgumentException("bad");
        });

        Guarded<Integer> result = Wrappers.catching(new CatchPolicy().withSilent(true)).guard(failing).invoke();

        assertTrue(result.isSuppressed());
    }

    @Test
    void catching_Bare_ReturnsValue() throws Exception {
        Guarded<String> result = Wrappers.catching(Invocable.named("ok", call -> "ok")).invoke();

        assertEquals("ok", result.orElse(null));
    }

    @Test
    void timeit_BareTarget_ReturnsResultUnchanged() throws Exception {
        Invocable<String> timed = Wrappers.timeit(
            Wrappers.timeit(new TimingPolicy().withSink(sink)).decorate(Invocable.named("v", call -> "v")));

        assertEquals("v", timed.name());
        assertNotNull(Wrappers.timeit().getPolicy());
    }

    @Test
    void decorator_BuildsFactory() throws Exception {
        Invocable<Object> doubled = Wrappers.<Object>decorator(
            (target, invocation) -> invocation.positional(0, Integer.class) * 2
        ).bare(Invocable.named("ignored", call -> 0));

        assertEquals(10, doubled.call(5));
    }
}
