package com.ryuqq.wrapper.core.function;

/**
 * 시그니처를 보존하는 combinator.
 *
 * <p>{@code Invocable<R>}을 받아 같은 반환 타입의 {@code Invocable<R>}을 돌려줍니다.
 * Repeat, ThreadedRepeat, TimeIt, 그리고 DecoratorFactory가 만든 configured 데코레이터가
 * 이 인터페이스를 구현합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Decorator decorator = Repeat.times(3).andThen(TimeIt.bare());
 * Invocable<String> wrapped = decorator.decorate(target);
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public interface Decorator {

    /**
     * 대상 감싸기.
     *
     * @param target 대상
     * @param <R> 반환 타입
     * @return 정책이 적용된 Invocable
     * @throws IllegalArgumentException target이 null인 경우
     */
    <R> Invocable<R> decorate(Invocable<R> target);

    /**
     * 두 데코레이터 합성.
     *
     * <p>{@code this}가 안쪽, {@code outer}가 바깥쪽이 됩니다.
     * 즉 {@code a.andThen(b).decorate(f)}는 {@code b.decorate(a.decorate(f))}와 같습니다.</p>
     *
     * @param outer 바깥쪽 데코레이터
     * @return 합성된 데코레이터
     * @throws IllegalArgumentException outer가 null인 경우
     */
    default Decorator andThen(Decorator outer) {
        if (outer == null) {
            throw new IllegalArgumentException("outer cannot be null");
        }
        Decorator inner = this;
        return new Decorator() {
            @Override
            public <R> Invocable<R> decorate(Invocable<R> target) {
                return outer.decorate(inner.decorate(target));
            }
        };
    }
}
