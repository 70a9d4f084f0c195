package com.ryuqq.wrapper.core.decorator;

import com.ryuqq.wrapper.core.function.Invocable;

/**
 * {@link DecoratorFactory#apply(com.ryuqq.wrapper.core.model.Invocation)}의 결과.
 *
 * <ul>
 *   <li>{@link BareApplication}: 인자가 대상 하나였음 → 이미 감싼 Invocable</li>
 *   <li>{@link ConfiguredApplication}: 인자가 설정값이었음 → 대상에 적용할 데코레이터</li>
 * </ul>
 *
 * @param <R> 결과 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public sealed interface DecoratorApplication<R> permits BareApplication, ConfiguredApplication {

    default boolean isBare() {
        return this instanceof BareApplication;
    }

    /**
     * bare 적용 결과 조회.
     *
     * @return 감싼 Invocable
     * @throws IllegalStateException configured 적용인 경우
     */
    default Invocable<R> asWrapped() {
        if (this instanceof BareApplication<R> bare) {
            return bare.wrapped();
        }
        throw new IllegalStateException("decorator was applied with configuration arguments, not a bare target");
    }

    /**
     * configured 적용 결과 조회.
     *
     * @return 대상에 적용할 데코레이터
     * @throws IllegalStateException bare 적용인 경우
     */
    default ConfiguredDecorator<R> asDecorator() {
        if (this instanceof ConfiguredApplication<R> configured) {
            return configured.decorator();
        }
        throw new IllegalStateException("decorator was applied bare to a target, not with configuration arguments");
    }
}
