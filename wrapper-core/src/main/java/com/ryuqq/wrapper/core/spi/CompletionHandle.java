package com.ryuqq.wrapper.core.spi;

import java.util.concurrent.ExecutionException;

/**
 * 제출된 작업 하나의 완료 핸들.
 *
 * <p>값 또는 실패로 정확히 한 번 완료됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public interface CompletionHandle<T> {

    /**
     * 완료까지 대기 후 결과 조회.
     *
     * @return 작업 결과
     * @throws ExecutionException 작업이 실패한 경우 (cause가 원래 예외)
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    T await() throws ExecutionException, InterruptedException;

    /**
     * 완료 여부 확인 (비블로킹).
     *
     * @return 값 또는 실패로 완료되었으면 true
     */
    boolean isDone();

    /**
     * 완료 시 콜백 등록.
     *
     * <p>이미 완료된 경우 즉시(호출 스레드에서) 실행됩니다.</p>
     *
     * @param callback 완료 콜백
     * @throws IllegalArgumentException callback이 null인 경우
     */
    void whenDone(Runnable callback);
}
