package com.ryuqq.wrapper.adapter.executor;

import com.ryuqq.wrapper.core.spi.CompletionHandle;
import com.ryuqq.wrapper.core.spi.FutureCompletionHandle;
import com.ryuqq.wrapper.core.spi.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ExecutorService 기반 WorkerPool 구현체.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>작업 제출 및 결과/실패를 CompletionHandle에 기록</li>
 *   <li>이름 붙은 worker 스레드 생성 (예: wrapper-worker-1)</li>
 *   <li>close() 시 graceful shutdown, 타임아웃 초과 시 shutdownNow</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>submit()은 thread-safe (여러 호출 지점에서 동시 제출 가능)</li>
 *   <li>작업이 던진 모든 Throwable(Error 포함)은 handle의 실패로 기록</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (ExecutorServiceWorkerPool pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(4))) {
 *     Invocable<Price> raced = ThreadedRepeat.times(3, pool).decorate(fetchPrice);
 *     Price price = raced.call("ACME");
 * }
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class ExecutorServiceWorkerPool implements WorkerPool, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorServiceWorkerPool.class);

    private final WorkerPoolConfig config;
    private final ExecutorService executorService;

    /**
     * 생성자 (설정 기반으로 ExecutorService 생성).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ExecutorServiceWorkerPool(WorkerPoolConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.executorService = createExecutorService(config);
        log.info("WorkerPool started: threads={}, prefix={}",
            config.isBounded() ? config.threads() : "unbounded", config.threadNamePrefix());
    }

    /**
     * 생성자 (외부 ExecutorService 주입).
     *
     * <p>close() 시 주입된 ExecutorService도 종료됩니다.</p>
     *
     * @param executorService 작업을 실행할 ExecutorService
     * @param config 설정 (shutdownTimeoutMs만 사용)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ExecutorServiceWorkerPool(ExecutorService executorService, WorkerPoolConfig config) {
        if (executorService == null) {
            throw new IllegalArgumentException("executorService cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.executorService = executorService;
    }

    @Override
    public <T> CompletionHandle<T> submit(Callable<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        FutureCompletionHandle<T> handle = new FutureCompletionHandle<>();
        try {
            executorService.execute(new SubmittedWork<>(work, handle));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("WorkerPool is shut down", e);
        }
        return handle;
    }

    /**
     * 종료 여부 확인.
     *
     * @return shutdown이 시작되었으면 true
     */
    public boolean isShutdown() {
        return executorService.isShutdown();
    }

    public WorkerPoolConfig getConfig() {
        return config;
    }

    /**
     * Pool 종료 (리소스 정리).
     *
     * <p>진행 중인 작업이 완료되도록 shutdownTimeoutMs 동안 대기하고,
     * 초과하면 shutdownNow()로 강제 종료합니다.
     * 강제 종료로 실행되지 못한 작업의 handle은 IllegalStateException으로 실패 처리됩니다.
     * 대기 중 인터럽트가 발생하면 강제 종료 후 인터럽트 플래그를 복원합니다.</p>
     */
    @Override
    public void close() {
        if (executorService.isShutdown()) {
            return;
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("WorkerPool did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
                forceShutdown();
            }
        } catch (InterruptedException e) {
            forceShutdown();
            Thread.currentThread().interrupt();
        }
        log.info("WorkerPool closed: prefix={}", config.threadNamePrefix());
    }

    /**
     * shutdownNow() 후 대기열에 남아 있던 작업의 handle을 실패로 완료.
     */
    private void forceShutdown() {
        List<Runnable> neverStarted = executorService.shutdownNow();
        int abandoned = 0;
        for (Runnable runnable : neverStarted) {
            if (runnable instanceof SubmittedWork<?> work) {
                work.abandon();
                abandoned++;
            }
        }
        if (abandoned > 0) {
            log.warn("WorkerPool abandoned {} queued submissions on forced shutdown", abandoned);
        }
    }

    private static ExecutorService createExecutorService(WorkerPoolConfig config) {
        ThreadFactory threadFactory = new NamedThreadFactory(config.threadNamePrefix(), config.daemon());
        if (config.isBounded()) {
            return Executors.newFixedThreadPool(config.threads(), threadFactory);
        }
        return Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * handle을 함께 보관하는 제출 작업.
     *
     * @param <T> 작업 결과 타입
     */
    private static final class SubmittedWork<T> implements Runnable {

        private final Callable<T> work;
        private final FutureCompletionHandle<T> handle;

        SubmittedWork(Callable<T> work, FutureCompletionHandle<T> handle) {
            this.work = work;
            this.handle = handle;
        }

        @Override
        public void run() {
            try {
                handle.complete(work.call());
            } catch (Throwable t) {
                handle.fail(t);
            }
        }

        void abandon() {
            handle.fail(new IllegalStateException("WorkerPool is shut down"));
        }
    }

        private static final class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();
        private final String prefix;
        private final boolean daemon;

        NamedThreadFactory(String prefix, boolean daemon) {
            this.prefix = prefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        }
    }
}
