package com.ryuqq.wrapper.core.combinator;

import com.ryuqq.wrapper.core.function.CallWrapper;
import com.ryuqq.wrapper.core.function.Decorator;
import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;

/**
 * 순차 반복 combinator.
 *
 * <p>감싼 대상을 같은 인자로 n번 순서대로 호출하고, 마지막 호출의 결과만 반환합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>n = 1: 대상을 감싸지 않고 그대로 반환 (identity)</li>
 *   <li>n &gt; 1: 앞의 n-1번 결과는 버리지만 부수 효과는 순서대로 발생</li>
 *   <li>예외 발생 시 즉시 전파, 이후 반복은 실행되지 않음 (fail-fast)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Invocable<String> thrice = Repeat.times(3).decorate(greet);
 * String last = thrice.call("world");
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class Repeat implements Decorator {

    private final int times;

    private Repeat(int times) {
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        this.times = times;
    }

    /**
     * 반복 횟수 지정.
     *
     * @param times 반복 횟수 (1 이상)
     * @return Repeat 인스턴스
     * @throws IllegalArgumentException times가 양수가 아닌 경우
     */
    public static Repeat times(int times) {
        return new Repeat(times);
    }

    @Override
    public <R> Invocable<R> decorate(Invocable<R> target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (times == 1) {
            return target;
        }
        return new RepeatingCall<>(target, times);
    }

    public int getTimes() {
        return times;
    }

    private static final class RepeatingCall<R> extends CallWrapper<R, R> {

        private final int times;

        RepeatingCall(Invocable<R> target, int times) {
            super(target);
            this.times = times;
        }

        @Override
        protected R around(Invocable<R> target, Invocation invocation) throws Exception {
            for (int i = 1; i < times; i++) {
                target.invoke(invocation);
            }
            return target.invoke(invocation);
        }
    }
}
