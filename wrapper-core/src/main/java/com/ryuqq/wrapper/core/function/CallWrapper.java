package com.ryuqq.wrapper.core.function;

import com.ryuqq.wrapper.core.model.Invocation;

/**
 * Call Wrapper 공통 골격.
 *
 * <p>대상 Invocable과 정책을 붙잡고, 매 호출마다 {@link #around(Invocable, Invocation)}로
 * 정책을 적용합니다. 모든 combinator(Repeat, ThreadedRepeat, Catch, TimeIt,
 * DecoratorFactory)의 wrapper가 이 클래스를 확장합니다.</p>
 *
 * <p><strong>불변 조건:</strong></p>
 * <ul>
 *   <li>생성 후 상태 변경 없음 (호출 간 카운터/캐시 없음)</li>
 *   <li>여러 스레드에서 동시에 호출 가능 (대상 자체의 재진입성은 호출자 책임)</li>
 *   <li>{@link #name()}은 대상의 이름을 그대로 반환</li>
 * </ul>
 *
 * @param <T> 대상 반환 타입
 * @param <R> wrapper 반환 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public abstract class CallWrapper<T, R> implements Invocable<R> {

    private final Invocable<T> target;

    /**
     * 생성자.
     *
     * @param target 감쌀 대상
     * @throws IllegalArgumentException target이 null인 경우
     */
    protected CallWrapper(Invocable<T> target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        this.target = target;
    }

    @Override
    public final R invoke(Invocation invocation) throws Exception {
        if (invocation == null) {
            throw new IllegalArgumentException("invocation cannot be null");
        }
        return around(target, invocation);
    }

    /**
     * 정책 적용.
     *
     * @param target 감싼 대상
     * @param invocation 이번 호출의 인자
     * @return wrapper 결과
     * @throws Exception 정책이 전파하기로 한 예외
     */
    protected abstract R around(Invocable<T> target, Invocation invocation) throws Exception;

    @Override
    public String name() {
        return target.name();
    }

    /**
     * 감싼 대상 조회.
     *
     * @return 대상 Invocable
     */
    public Invocable<T> target() {
        return target;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name() + '}';
    }
}
