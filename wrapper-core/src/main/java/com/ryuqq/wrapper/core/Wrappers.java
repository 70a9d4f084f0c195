package com.ryuqq.wrapper.core;

import com.ryuqq.wrapper.core.combinator.Catch;
import com.ryuqq.wrapper.core.combinator.CatchPolicy;
import com.ryuqq.wrapper.core.combinator.Repeat;
import com.ryuqq.wrapper.core.combinator.ThreadedRepeat;
import com.ryuqq.wrapper.core.combinator.TimeIt;
import com.ryuqq.wrapper.core.combinator.TimingPolicy;
import com.ryuqq.wrapper.core.decorator.DecoratorBody;
import com.ryuqq.wrapper.core.decorator.DecoratorFactory;
import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.outcome.Guarded;
import com.ryuqq.wrapper.core.spi.WorkerPool;

/**
 * Combinator 진입점 모음.
 *
 * <p>각 combinator의 정적 팩토리를 한 곳에 모았습니다.
 * 프로세스 전역 상태는 없으며, ThreadedRepeat의 WorkerPool은 항상 명시적으로 전달합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Invocable<String> wrapped = Wrappers.repeat(3)
 *     .andThen(Wrappers.timeit())
 *     .decorate(task);
 *
 * Guarded<String> result = Wrappers.catching(task).invoke();
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class Wrappers {

    private Wrappers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Repeat repeat(int times) {
        return Repeat.times(times);
    }

    public static ThreadedRepeat threadedRepeat(int times, WorkerPool pool) {
        return ThreadedRepeat.times(times, pool);
    }

    /**
     * 기본 설정 Catch로 대상 감싸기.
     */
    public static <R> Invocable<Guarded<R>> catching(Invocable<R> target) {
        return Catch.bare().guard(target);
    }

    public static Catch catching(CatchPolicy policy) {
        return Catch.configured(policy);
    }

    public static TimeIt timeit() {
        return TimeIt.bare();
    }

    /**
     * 기본 설정 TimeIt으로 대상 감싸기.
     */
    public static <R> Invocable<R> timeit(Invocable<R> target) {
        return TimeIt.bare().decorate(target);
    }

    public static TimeIt timeit(TimingPolicy policy) {
        return TimeIt.configured(policy);
    }

    public static <R> DecoratorFactory<R> decorator(DecoratorBody<R> body) {
        return DecoratorFactory.of(body);
    }
}
