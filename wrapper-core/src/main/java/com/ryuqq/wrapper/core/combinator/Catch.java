package com.ryuqq.wrapper.core.combinator;

import com.ryuqq.wrapper.core.function.CallWrapper;
import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;
import com.ryuqq.wrapper.core.outcome.Disposition;
import com.ryuqq.wrapper.core.outcome.Guarded;

/**
 * 예외 가로채기 combinator.
 *
 * <p>대상을 호출하다 설정된 예외가 발생하면 전파를 막고 {@link Guarded}의
 * Suppressed 결과로 바꿉니다. 일치하지 않는 예외는 변형 없이 그대로 전파합니다.</p>
 *
 * <p><strong>두 가지 생성 경로:</strong></p>
 * <ul>
 *   <li>{@link #bare()}: 기본 설정 (모든 Exception, 표준 에러 스트림에 trace 출력)</li>
 *   <li>{@link #configured(CatchPolicy)}: exceptions / handler / silent / sink 지정</li>
 * </ul>
 *
 * <p><strong>진단 라우팅 (정확히 한 곳):</strong></p>
 * <pre>
 * silent = true        → 보고 없음         (SILENCED)
 * handler != null      → handler(error)    (HANDLED)
 * 그 외                → sink.reportFailure (REPORTED)
 * </pre>
 *
 * <p>InterruptedException을 가로채면 현재 스레드의 인터럽트 플래그를 복원합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Invocable<Guarded<Integer>> safeParse = Catch.configured(
 *         new CatchPolicy().withExceptions(NumberFormatException.class).withSilent(true))
 *     .guard(parse);
 *
 * int value = safeParse.call("x").orElse(0);
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class Catch {

    private final CatchPolicy policy;

    private Catch(CatchPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
    }

    /**
     * 기본 설정 Catch.
     *
     * @return Catch 인스턴스
     */
    public static Catch bare() {
        return new Catch(new CatchPolicy());
    }

    /**
     * 설정을 지정한 Catch.
     *
     * @param policy 설정
     * @return Catch 인스턴스
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public static Catch configured(CatchPolicy policy) {
        return new Catch(policy);
    }

    /**
     * 대상 감싸기.
     *
     * @param target 대상
     * @param <R> 대상 반환 타입
     * @return Guarded 결과를 반환하는 Invocable
     * @throws IllegalArgumentException target이 null인 경우
     */
    public <R> Invocable<Guarded<R>> guard(Invocable<R> target) {
        return new GuardedCall<>(target, policy);
    }

    /**
     * 대상 감싸기 (억제 시 대체값 반환).
     *
     * <p>원래 반환 타입을 유지해야 할 때 사용합니다.
     * 억제된 경우에도 진단 라우팅은 {@link #guard(Invocable)}와 동일합니다.</p>
     *
     * @param target 대상
     * @param fallback 억제 시 반환할 값 (null 허용)
     * @param <R> 대상 반환 타입
     * @return 대상과 같은 반환 타입의 Invocable
     * @throws IllegalArgumentException target이 null인 경우
     */
    public <R> Invocable<R> guardOrElse(Invocable<R> target, R fallback) {
        return new FallbackCall<>(guard(target), fallback);
    }

    public CatchPolicy getPolicy() {
        return policy;
    }

    private static final class GuardedCall<R> extends CallWrapper<R, Guarded<R>> {

        private final CatchPolicy policy;

        GuardedCall(Invocable<R> target, CatchPolicy policy) {
            super(target);
            this.policy = policy;
        }

        @Override
        protected Guarded<R> around(Invocable<R> target, Invocation invocation) throws Exception {
            try {
                return Guarded.returned(target.invoke(invocation));
            } catch (Exception e) {
                if (!policy.matches(e)) {
                    throw e;
                }
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                return suppress(e);
            } catch (Error e) {
                if (!policy.matches(e)) {
                    throw e;
                }
                return suppress(e);
            }
        }

        private Guarded<R> suppress(Throwable error) {
            Disposition disposition;
            if (policy.silent()) {
                disposition = Disposition.SILENCED;
            } else if (policy.handler() != null) {
                policy.handler().onFailure(error);
                disposition = Disposition.HANDLED;
            } else {
                policy.sink().reportFailure(name(), error);
                disposition = Disposition.REPORTED;
            }
            return Guarded.suppressed(name(), error, disposition);
        }
    }

    private static final class FallbackCall<R> extends CallWrapper<Guarded<R>, R> {

        private final R fallback;

        FallbackCall(Invocable<Guarded<R>> guarded, R fallback) {
            super(guarded);
            this.fallback = fallback;
        }

        @Override
        protected R around(Invocable<Guarded<R>> target, Invocation invocation) throws Exception {
            return target.invoke(invocation).orElse(fallback);
        }
    }
}
