package com.ryuqq.wrapper.core.spi;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CompletionOrder 및 FutureCompletionHandle 테스트.
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
class CompletionOrderTest {

    @Test
    void next_HandlesCompletedOutOfOrder_YieldsInCompletionOrder() throws Exception {
        // Given
        FutureCompletionHandle<String> first = new FutureCompletionHandle<>();
        FutureCompletionHandle<String> second = new FutureCompletionHandle<>();
        FutureCompletionHandle<String> third = new FutureCompletionHandle<>();
        CompletionOrder<String> order = CompletionOrder.of(List.of(first, second, third));

        // When
        third.complete("c");
        first.complete("a");
        second.complete("b");
        List<String> drained = new ArrayList<>();
        for (CompletionHandle<String> handle : order) {
            drained.add(handle.await());
        }

        // Then
        assertEquals(List.of("c", "a", "b"), drained);
        assertEquals(0, order.remaining());
    }

    @Test
    void next_AlreadyCompletedHandles_AllYielded() {
        // Given
        FutureCompletionHandle<Integer> done = new FutureCompletionHandle<>();
        done.complete(1);
        FutureCompletionHandle<Integer> failed = new FutureCompletionHandle<>();
        failed.fail(new IllegalStateException("x"));

        // When
        CompletionOrder<Integer> order = CompletionOrder.of(List.of(done, failed));
        order.next();
        order.next();

        // Then
        assertFalse(order.hasNext());
        assertThrows(NoSuchElementException.class, order::next);
    }

    @Test
    void next_CompletedFromAnotherThread_Unblocks() throws Exception {
        // Given
        FutureCompletionHandle<String> handle = new FutureCompletionHandle<>();
        CompletionOrder<String> order = CompletionOrder.of(List.of(handle));
        Thread completer = new Thread(() -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            handle.complete("late");
        });

        // When
        completer.start();
        CompletionHandle<String> next = order.next();
        completer.join();

        // Then
        assertEquals("late", next.await());
    }

    @Test
    void next_WaitingThreadInterrupted_KeepsWaitingAndRestoresFlag() throws Exception {
        // Given
        FutureCompletionHandle<String> handle = new FutureCompletionHandle<>();
        CompletionOrder<String> order = CompletionOrder.of(List.of(handle));
        Thread waiter = Thread.currentThread();
        Thread helper = new Thread(() -> {
            try {
                Thread.sleep(20);
                waiter.interrupt();
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            handle.complete("done");
        });

        // When
        helper.start();
        CompletionHandle<String> next = order.next();
        boolean interrupted = Thread.interrupted();
        helper.join();

        // Then
        assertTrue(interrupted);
        assertEquals("done", next.await());
    }

    @Test
    void of_EmptyList_HasNoElements() {
        assertFalse(CompletionOrder.<String>of(List.of()).hasNext());
    }

    @Test
    void of_NullHandles_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CompletionOrder.of(null));
    }

    @Test
    void await_FailedHandle_ThrowsExecutionExceptionWithCause() {
        // Given
        IllegalStateException boom = new IllegalStateException("boom");
        FutureCompletionHandle<String> handle = new FutureCompletionHandle<>();

        // When
        handle.fail(boom);

        // Then
        assertTrue(handle.isDone());
        ExecutionException exception = assertThrows(ExecutionException.class, handle::await);
        assertSame(boom, exception.getCause());
    }

    @Test
    void whenDone_RegisteredBeforeCompletion_RunsOnCompletion() {
        // Given
        FutureCompletionHandle<String> handle = new FutureCompletionHandle<>();
        List<String> calls = new ArrayList<>();
        handle.whenDone(() -> calls.add("done"));

        // When
        assertTrue(calls.isEmpty());
        handle.complete("x");

        // Then
        assertEquals(List.of("done"), calls);
    }
}
