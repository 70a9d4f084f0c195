package com.ryuqq.wrapper.adapter.executor;

import com.ryuqq.wrapper.core.combinator.ThreadedRepeat;
import com.ryuqq.wrapper.core.spi.CompletionHandle;
import com.ryuqq.wrapper.testkit.CountingInvocable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutorServiceWorkerPool 생명주기 테스트.
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
class ExecutorServiceWorkerPoolTest {

    private ExecutorServiceWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    @Test
    @DisplayName("작업 스레드는 설정한 prefix로 이름이 붙고 daemon으로 생성된다")
    void 스레드_이름과_daemon() throws Exception {
        // given
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(2).withThreadNamePrefix("calc"));

        // when
        CompletionHandle<Thread> handle = pool.submit(Thread::currentThread);
        Thread worker = handle.await();

        // then
        assertThat(worker.getName()).startsWith("calc-");
        assertThat(worker.isDaemon()).isTrue();
    }

    @Test
    @DisplayName("threads=2이면 동시에 최대 2개의 스레드만 사용한다")
    void 고정_크기_pool() throws Exception {
        // given
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(2).withThreadNamePrefix("fixed"));
        Set<String> names = ConcurrentHashMap.newKeySet();
        CountingInvocable<String> capture = CountingInvocable.of("capture", call -> {
            names.add(Thread.currentThread().getName());
            Thread.sleep(5);
            return "ok";
        });

        // when
        ThreadedRepeat.times(10, pool).decorate(capture).invoke();

        // then
        assertThat(capture.count()).isEqualTo(10);
        assertThat(names).hasSizeLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("threads=0이면 unbounded cached pool로 동작한다")
    void unbounded_pool() throws Exception {
        // given
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig());
        int parallel = 6;
        CountDownLatch allStarted = new CountDownLatch(parallel);
        CountingInvocable<Boolean> rendezvous = CountingInvocable.of("rendezvous", call -> {
            allStarted.countDown();
            return allStarted.await(5, TimeUnit.SECONDS);
        });

        // when
        Boolean allMet = ThreadedRepeat.times(parallel, pool).decorate(rendezvous).invoke();

        // then
        assertThat(allMet).isTrue();
        assertThat(pool.getConfig().isBounded()).isFalse();
    }

    @Test
    @DisplayName("close() 이후 submit은 IllegalStateException을 던진다")
    void close_후_submit_거부() {
        // given
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(1));

        // when
        pool.close();

        // then
        assertThat(pool.isShutdown()).isTrue();
        assertThatThrownBy(() -> pool.submit(() -> 1))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("WorkerPool is shut down");
    }

    @Test
    @DisplayName("close()는 진행 중인 작업이 끝날 때까지 기다린다")
    void close_진행중_작업_대기() throws Exception {
        // given
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(1));
        CompletionHandle<String> handle = pool.submit(() -> {
            Thread.sleep(50);
            return "finished";
        });

        // when
        pool.close();

        // then
        assertThat(handle.isDone()).isTrue();
        assertThat(handle.await()).isEqualTo("finished");
    }

    @Test
    @DisplayName("close()는 여러 번 호출해도 안전하다")
    void close_멱등() {
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(1));

        pool.close();
        pool.close();

        assertThat(pool.isShutdown()).isTrue();
    }

    @Test
    @DisplayName("timeout 안에 끝나지 않는 작업은 shutdownNow로 중단된다")
    void close_timeout_강제_종료() throws Exception {
        // given
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(1).withShutdownTimeoutMs(50));
        CountDownLatch started = new CountDownLatch(1);
        CompletionHandle<String> handle = pool.submit(() -> {
            started.countDown();
            Thread.sleep(10_000);
            return "never";
        });
        started.await(5, TimeUnit.SECONDS);

        // when
        pool.close();

        // then
        assertThat(pool.isShutdown()).isTrue();
        assertThatThrownBy(handle::await).hasCauseInstanceOf(InterruptedException.class);
    }

    @Test
    @DisplayName("강제 종료 시 대기열에 남은 작업의 handle은 실패로 완료된다")
    void close_강제_종료_대기열_handle_실패() throws Exception {
        // given
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(1).withShutdownTimeoutMs(50));
        CountDownLatch started = new CountDownLatch(1);
        CompletionHandle<String> running = pool.submit(() -> {
            started.countDown();
            Thread.sleep(10_000);
            return "never";
        });
        CompletionHandle<String> queued = pool.submit(() -> "queued");
        started.await(5, TimeUnit.SECONDS);

        // when
        pool.close();

        // then
        assertThat(queued.isDone()).isTrue();
        assertThatThrownBy(queued::await)
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("WorkerPool is shut down");
        assertThatThrownBy(running::await).isInstanceOf(ExecutionException.class);
    }

    @Test
    @DisplayName("강제 종료되어도 ThreadedRepeat 호출자는 실패로 반환된다")
    void close_강제_종료_ThreadedRepeat_호출자_해제() throws Exception {
        // given
        pool = new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreads(1).withShutdownTimeoutMs(100));
        CountDownLatch started = new CountDownLatch(1);
        CountingInvocable<String> slow = CountingInvocable.of("slow", call -> {
            started.countDown();
            Thread.sleep(1_000);
            return "done";
        });
        AtomicReference<Throwable> outcome = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                ThreadedRepeat.times(3, pool).decorate(slow).invoke();
            } catch (Throwable t) {
                outcome.set(t);
            }
        });
        caller.start();
        started.await(5, TimeUnit.SECONDS);

        // when
        pool.close();
        caller.join(3_000);

        // then
        assertThat(caller.isAlive()).isFalse();
        assertThat(outcome.get()).isNotNull();
        assertThat(slow.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("외부에서 주입한 ExecutorService를 사용할 수 있다")
    void 외부_ExecutorService_주입() throws Exception {
        // given
        ExecutorService executor = Executors.newSingleThreadExecutor();
        pool = new ExecutorServiceWorkerPool(executor, new WorkerPoolConfig());

        // when
        Integer result = pool.submit(() -> 42).await();

        // then
        assertThat(result).isEqualTo(42);
        pool.close();
        assertThat(executor.isShutdown()).isTrue();
    }

    @Test
    @DisplayName("null 인자는 거부된다")
    void null_인자_거부() {
        assertThatThrownBy(() -> new ExecutorServiceWorkerPool(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        assertThatThrownBy(() -> new ExecutorServiceWorkerPool(null, new WorkerPoolConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("executorService cannot be null");
    }
}
