package com.ryuqq.wrapper.core.spi;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * CompletableFuture 기반 CompletionHandle.
 *
 * <p>WorkerPool 구현체가 작업 결과를 기록할 때 사용합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class FutureCompletionHandle<T> implements CompletionHandle<T> {

    private final CompletableFuture<T> future;

    /**
     * 아직 완료되지 않은 핸들 생성.
     */
    public FutureCompletionHandle() {
        this(new CompletableFuture<>());
    }

    /**
     * 기존 future를 감싸는 핸들 생성.
     *
     * @param future 감쌀 future
     * @throws IllegalArgumentException future가 null인 경우
     */
    public FutureCompletionHandle(CompletableFuture<T> future) {
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
        this.future = future;
    }

    /**
     * 값으로 완료.
     *
     * @param value 결과
     * @return 이번 호출로 완료되었으면 true
     */
    public boolean complete(T value) {
        return future.complete(value);
    }

    /**
     * 실패로 완료.
     *
     * @param error 작업이 던진 예외
     * @return 이번 호출로 완료되었으면 true
     */
    public boolean fail(Throwable error) {
        return future.completeExceptionally(error);
    }

    @Override
    public T await() throws ExecutionException, InterruptedException {
        return future.get();
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    @Override
    public void whenDone(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        future.whenComplete((value, error) -> callback.run());
    }
}
