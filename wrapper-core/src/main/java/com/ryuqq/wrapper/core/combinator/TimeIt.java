package com.ryuqq.wrapper.core.combinator;

import com.ryuqq.wrapper.core.function.CallWrapper;
import com.ryuqq.wrapper.core.function.Decorator;
import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;

/**
 * 실행 시간 측정 combinator.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. start = timer.read()
 * 2. result = target.invoke(invocation)   (예외는 그대로 전파, 보고 없음)
 * 3. end = timer.read()
 * 4. elapsed = end - start
 * 5. handler.onTiming(name, elapsed)      (handler가 있을 때만)
 * 6. sink.reportTiming(name, elapsed)     (항상)
 * 7. return result                        (변형 없음)
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Invocable<Report> timed = TimeIt.configured(
 *         new TimingPolicy().withHandler((name, seconds) -> histogram.record(seconds)))
 *     .decorate(buildReport);
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class TimeIt implements Decorator {

    private final TimingPolicy policy;

    private TimeIt(TimingPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
    }

    /**
     * 기본 설정 TimeIt.
     *
     * @return TimeIt 인스턴스
     */
    public static TimeIt bare() {
        return new TimeIt(new TimingPolicy());
    }

    /**
     * 설정을 지정한 TimeIt.
     *
     * @param policy 설정
     * @return TimeIt 인스턴스
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public static TimeIt configured(TimingPolicy policy) {
        return new TimeIt(policy);
    }

    @Override
    public <R> Invocable<R> decorate(Invocable<R> target) {
        return new TimedCall<>(target, policy);
    }

    public TimingPolicy getPolicy() {
        return policy;
    }

    private static final class TimedCall<R> extends CallWrapper<R, R> {

        private final TimingPolicy policy;

        TimedCall(Invocable<R> target, TimingPolicy policy) {
            super(target);
            this.policy = policy;
        }

        @Override
        protected R around(Invocable<R> target, Invocation invocation) throws Exception {
            double start = policy.timer().read();
            R result = target.invoke(invocation);
            double end = policy.timer().read();
            double elapsed = end - start;

            if (policy.handler() != null) {
                policy.handler().onTiming(name(), elapsed);
            }
            policy.sink().reportTiming(name(), elapsed);
            return result;
        }
    }
}
