package com.ryuqq.wrapper.testkit.contract;

import com.ryuqq.wrapper.core.combinator.ThreadedRepeat;
import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;
import com.ryuqq.wrapper.core.spi.CompletionHandle;
import com.ryuqq.wrapper.core.spi.CompletionOrder;
import com.ryuqq.wrapper.core.spi.WorkerPool;
import com.ryuqq.wrapper.testkit.CountingInvocable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkerPool SPI 계약 테스트 기반 클래스.
 *
 * <p>WorkerPool 구현체는 이 클래스를 상속하여 {@link #createPool()}만 구현하면
 * 다음 계약을 검증받습니다:</p>
 * <ul>
 *   <li>submit 결과/실패가 handle에 정확히 기록됨</li>
 *   <li>Error도 실패로 기록되어 관찰 가능</li>
 *   <li>여러 스레드의 동시 submit이 안전함</li>
 *   <li>ThreadedRepeat와 결합 시 n회 실행, 전부 drain 후 반환/전파</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * class MyPoolContractTest extends AbstractWorkerPoolContractTest {
 *     {@literal @}Override
 *     protected WorkerPool createPool() {
 *         return new MyPool();
 *     }
 * }
 * </pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public abstract class AbstractWorkerPoolContractTest {

    protected WorkerPool pool;

    /**
     * 테스트 대상 pool 생성.
     *
     * @return 새 WorkerPool 인스턴스
     */
    protected abstract WorkerPool createPool();

    @BeforeEach
    void setUpPool() {
        pool = createPool();
    }

    /**
     * pool이 AutoCloseable이면 테스트 후 종료합니다.
     */
    @AfterEach
    void tearDownPool() throws Exception {
        if (pool instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    // ============================================================
    // 1. 단일 submit 계약
    // ============================================================

    @Test
    @DisplayName("submit() 결과는 handle.await()로 조회된다")
    void submit_결과_조회() throws Exception {
        // when
        CompletionHandle<String> handle = pool.submit(() -> "done");

        // then
        assertThat(handle.await()).isEqualTo("done");
        assertThat(handle.isDone()).isTrue();
    }

    @Test
    @DisplayName("작업이 던진 예외는 ExecutionException의 cause로 원래 인스턴스가 전달된다")
    void submit_실패_원래_예외_보존() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");

        // when
        CompletionHandle<Object> handle = pool.submit(() -> {
            throw boom;
        });

        // then
        assertThatThrownBy(handle::await)
            .isInstanceOf(ExecutionException.class)
            .hasCauseReference(boom);
    }

    @Test
    @DisplayName("작업이 던진 Error도 실패로 기록된다")
    void submit_Error_기록() {
        // given
        AssertionError error = new AssertionError("fatal");

        // when
        CompletionHandle<Object> handle = pool.submit(() -> {
            throw error;
        });

        // then
        assertThatThrownBy(handle::await)
            .isInstanceOf(ExecutionException.class)
            .hasCauseReference(error);
    }

    @Test
    @DisplayName("whenDone() 콜백은 완료 후 정확히 한 번 실행된다")
    void whenDone_콜백_한번_실행() throws Exception {
        // given
        CompletionHandle<Integer> handle = pool.submit(() -> 1);
        handle.await();
        AtomicInteger calls = new AtomicInteger();

        // when
        handle.whenDone(calls::incrementAndGet);

        // then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("submit(null)은 IllegalArgumentException을 던진다")
    void submit_null_거부() {
        assertThatThrownBy(() -> pool.submit(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 2. 동시 submit 안전성
    // ============================================================

    @Test
    @DisplayName("여러 스레드에서 동시에 submit해도 모든 작업이 한 번씩 실행된다")
    void 동시_submit_안전() throws Exception {
        // given
        int submitters = 8;
        int perSubmitter = 50;
        AtomicInteger executed = new AtomicInteger();
        ExecutorService callers = Executors.newFixedThreadPool(submitters);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<CompletionHandle<Integer>>>> batches = new ArrayList<>();

        // when
        for (int s = 0; s < submitters; s++) {
            batches.add(callers.submit(() -> {
                start.await();
                List<CompletionHandle<Integer>> handles = new ArrayList<>();
                for (int i = 0; i < perSubmitter; i++) {
                    handles.add(pool.submit(executed::incrementAndGet));
                }
                return handles;
            }));
        }
        start.countDown();

        List<CompletionHandle<Integer>> all = new ArrayList<>();
        for (Future<List<CompletionHandle<Integer>>> batch : batches) {
            all.addAll(batch.get(10, TimeUnit.SECONDS));
        }
        for (CompletionHandle<Integer> handle : CompletionOrder.of(all)) {
            handle.await();
        }
        callers.shutdown();

        // then
        assertThat(all).hasSize(submitters * perSubmitter);
        assertThat(executed.get()).isEqualTo(submitters * perSubmitter);
    }

    // ============================================================
    // 3. ThreadedRepeat 결합
    // ============================================================

    @Test
    @DisplayName("ThreadedRepeat는 대상을 정확히 n번 실행하고 순수 함수의 값을 반환한다")
    void threadedRepeat_n회_실행_값_반환() throws Exception {
        // given
        CountingInvocable<Integer> square = CountingInvocable.of("square",
            call -> call.positional(0, Integer.class) * call.positional(0, Integer.class));
        Invocable<Integer> wrapped = ThreadedRepeat.times(5, pool).decorate(square);

        // when
        Integer result = wrapped.call(7);

        // then
        assertThat(result).isEqualTo(49);
        assertThat(square.count()).isEqualTo(5);
        assertThat(square.getInvocations()).containsOnly(Invocation.of(7));
    }

    @Test
    @DisplayName("ThreadedRepeat는 모든 호출이 실패하면 n번 모두 실행된 뒤 예외를 전파한다")
    void threadedRepeat_전부_실패_시_전파() {
        // given
        CountingInvocable<Object> failing = CountingInvocable.throwing("failing",
            new IllegalStateException("always"));
        Invocable<Object> wrapped = ThreadedRepeat.times(4, pool).decorate(failing);

        // when & then
        assertThatThrownBy(wrapped::invoke)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("always");
        assertThat(failing.count()).isEqualTo(4);
    }

    @Test
    @DisplayName("ThreadedRepeat는 모든 제출 작업이 끝난 뒤에 반환한다")
    void threadedRepeat_전부_완료_후_반환() throws Exception {
        // given
        AtomicInteger finished = new AtomicInteger();
        Invocable<Integer> slow = Invocable.named("slow", call -> {
            Thread.sleep(20);
            return finished.incrementAndGet();
        });

        // when
        ThreadedRepeat.times(3, pool).decorate(slow).invoke();

        // then
        assertThat(finished.get()).isEqualTo(3);
    }
}
