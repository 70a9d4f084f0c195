package com.ryuqq.wrapper.core.spi;

import java.util.concurrent.Callable;

/**
 * Worker Pool SPI.
 *
 * <p>인자 없는 작업 단위를 받아 worker 스레드에서 실행하고,
 * 최종 완료를 나타내는 {@link CompletionHandle}을 돌려줍니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>구현체는 thread-safe해야 합니다 (여러 호출 지점에서 동시 submit).</li>
 *   <li>제출된 작업은 취소되지 않으며 끝까지 실행됩니다.</li>
 *   <li>작업이 던진 예외(Error 포함)는 handle에 실패로 기록되어야 합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CompletionHandle<Integer> handle = pool.submit(() -> compute());
 * Integer value = handle.await();
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public interface WorkerPool {

    /**
     * 작업 제출.
     *
     * @param work 실행할 작업
     * @param <T> 결과 타입
     * @return 완료 핸들
     * @throws IllegalArgumentException work가 null인 경우
     * @throws IllegalStateException pool이 이미 종료된 경우
     */
    <T> CompletionHandle<T> submit(Callable<T> work);
}
