package com.ryuqq.wrapper.testkit;

import com.ryuqq.wrapper.core.spi.CompletionHandle;
import com.ryuqq.wrapper.core.spi.FutureCompletionHandle;
import com.ryuqq.wrapper.core.spi.WorkerPool;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출 스레드에서 즉시 실행하는 WorkerPool.
 *
 * <p>submit()이 반환될 때 작업은 이미 완료되어 있으므로,
 * 완료 순서가 제출 순서와 같아 테스트 결과가 결정적입니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class InlineWorkerPool implements WorkerPool {

    private final AtomicInteger submitted = new AtomicInteger();

    @Override
    public <T> CompletionHandle<T> submit(Callable<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        submitted.incrementAndGet();
        FutureCompletionHandle<T> handle = new FutureCompletionHandle<>();
        try {
            handle.complete(work.call());
        } catch (Throwable t) {
            handle.fail(t);
        }
        return handle;
    }

    /**
     * 지금까지 제출된 작업 수.
     *
     * @return 제출 횟수
     */
    public int submittedCount() {
        return submitted.get();
    }
}
