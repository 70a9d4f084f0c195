package com.ryuqq.wrapper.adapter.executor;

import com.ryuqq.wrapper.core.combinator.ThreadedRepeat;

/**
 * 프로세스 공용 기본 WorkerPool.
 *
 * <p>pool을 직접 관리하고 싶지 않은 호출자를 위한 편의 진입점입니다.
 * 처음 사용할 때 한 번만 생성되며(lazy), 이후 재사용됩니다.
 * 생성되는 pool은 상한 없는 daemon cached pool이므로 JVM 종료를 막지 않습니다.</p>
 *
 * <p>core의 combinator는 이 클래스에 의존하지 않습니다.
 * 테스트나 수명 관리가 필요한 코드는 {@link ExecutorServiceWorkerPool}을 직접 생성해 주입하세요.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Invocable<Result> raced = DefaultWorkerPool.threadedRepeat(3).decorate(call);
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class DefaultWorkerPool {

    private DefaultWorkerPool() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 공용 pool 조회.
     *
     * @return 프로세스 공용 ExecutorServiceWorkerPool
     */
    public static ExecutorServiceWorkerPool shared() {
        return Holder.INSTANCE;
    }

    /**
     * 공용 pool을 사용하는 ThreadedRepeat.
     *
     * @param times 동시 호출 수 (1 이상)
     * @return ThreadedRepeat 인스턴스
     * @throws IllegalArgumentException times가 양수가 아닌 경우
     */
    public static ThreadedRepeat threadedRepeat(int times) {
        return ThreadedRepeat.times(times, shared());
    }

    private static final class Holder {
        private static final ExecutorServiceWorkerPool INSTANCE =
            new ExecutorServiceWorkerPool(new WorkerPoolConfig().withThreadNamePrefix("wrapper-shared"));
    }
}
