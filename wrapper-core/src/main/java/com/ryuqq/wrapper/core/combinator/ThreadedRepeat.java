package com.ryuqq.wrapper.core.combinator;

import com.ryuqq.wrapper.core.function.CallWrapper;
import com.ryuqq.wrapper.core.function.Decorator;
import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;
import com.ryuqq.wrapper.core.spi.CompletionHandle;
import com.ryuqq.wrapper.core.spi.CompletionOrder;
import com.ryuqq.wrapper.core.spi.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * 동시 반복 combinator.
 *
 * <p>호출마다 같은 인자로 n개의 독립 호출을 WorkerPool에 제출하고,
 * n개가 모두 끝날 때까지 기다린 뒤 반환합니다.</p>
 *
 * <p><strong>반환값 ("last completed"):</strong></p>
 * <ul>
 *   <li>완료 <em>순서</em>로 결과를 관찰하며, 마지막으로 관찰된 결과를 반환합니다.</li>
 *   <li>"첫 번째 성공"도, "먼저 제출된 것"도, "가장 좋은 것"도 아닙니다.</li>
 *   <li>대상이 순수 함수이면 항상 그 공통값, 아니면 결과는 비결정적입니다.</li>
 * </ul>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>모든 제출 작업이 끝날 때까지 기다린 뒤에 실패를 전파합니다.</li>
 *   <li>먼저 관찰된 실패를 원래 예외 인스턴스 그대로 던집니다.</li>
 *   <li>이후 관찰된 다른 실패는 그 인스턴스에 {@link Throwable#addSuppressed(Throwable)}로 붙습니다.
 *       즉 호출자가 받는 예외 객체는 대상이 던진 객체이지만 suppressed 목록이 늘어난 상태입니다.
 *       같은 인스턴스가 여러 번 관찰되면 붙이지 않습니다.</li>
 *   <li>취소와 타임아웃은 없습니다. 대상이 멈추면 호출자도 멈춥니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (ExecutorServiceWorkerPool pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig())) {
 *     Invocable<Quote> raced = ThreadedRepeat.times(3, pool).decorate(fetchQuote);
 *     Quote quote = raced.call("ACME");
 * }
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class ThreadedRepeat implements Decorator {

    private static final Logger log = LoggerFactory.getLogger(ThreadedRepeat.class);

    private final int times;
    private final WorkerPool pool;

    private ThreadedRepeat(int times, WorkerPool pool) {
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        this.times = times;
        this.pool = pool;
    }

    /**
     * 반복 횟수와 WorkerPool 지정.
     *
     * @param times 동시 호출 수 (1 이상)
     * @param pool 작업을 실행할 pool
     * @return ThreadedRepeat 인스턴스
     * @throws IllegalArgumentException times가 양수가 아니거나 pool이 null인 경우
     */
    public static ThreadedRepeat times(int times, WorkerPool pool) {
        return new ThreadedRepeat(times, pool);
    }

    @Override
    public <R> Invocable<R> decorate(Invocable<R> target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return new ConcurrentCall<>(target, times, pool);
    }

    public int getTimes() {
        return times;
    }

    public WorkerPool getPool() {
        return pool;
    }

    private static final class ConcurrentCall<R> extends CallWrapper<R, R> {

        private final int times;
        private final WorkerPool pool;

        ConcurrentCall(Invocable<R> target, int times, WorkerPool pool) {
            super(target);
            this.times = times;
            this.pool = pool;
        }

        @Override
        protected R around(Invocable<R> target, Invocation invocation) throws Exception {
            // 1. n개 제출 (제출 자체가 실패하면 이미 제출된 것만 기다린 뒤 전파)
            List<CompletionHandle<R>> handles = new ArrayList<>(times);
            RuntimeException submitFailure = null;
            for (int i = 0; i < times; i++) {
                try {
                    handles.add(pool.submit(() -> target.invoke(invocation)));
                } catch (RuntimeException e) {
                    submitFailure = e;
                    break;
                }
            }

            // 2. 완료 순서대로 전부 drain
            R last = null;
            Throwable firstFailure = submitFailure;
            int failed = 0;
            for (CompletionHandle<R> done : CompletionOrder.of(handles)) {
                try {
                    last = awaitCompleted(done);
                } catch (ExecutionException e) {
                    failed++;
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (firstFailure == null) {
                        firstFailure = cause;
                    } else if (cause != firstFailure) {
                        firstFailure.addSuppressed(cause);
                    }
                }
            }

            log.debug("{} drained {} of {} submissions ({} failed)", name(), handles.size(), times, failed);

            // 3. 결과 또는 실패 전파
            if (firstFailure == null) {
                return last;
            }
            if (firstFailure instanceof Exception exception) {
                throw exception;
            }
            if (firstFailure instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Concurrent invocation of " + name() + " failed", firstFailure);
        }

        /**
         * 이미 완료된 핸들에서 결과 조회.
         *
         * <p>인터럽트가 발생해도 결과를 얻을 때까지 재시도하고, 반환 전에 인터럽트 플래그를 복원합니다.</p>
         */
        private static <R> R awaitCompleted(CompletionHandle<R> handle) throws ExecutionException {
            boolean interrupted = false;
            try {
                while (true) {
                    try {
                        return handle.await();
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
