package com.ryuqq.wrapper.core.decorator;

import com.ryuqq.wrapper.core.function.Invocable;

/**
 * bare 적용 결과.
 *
 * @param wrapped 감싼 Invocable
 * @param <R> 결과 타입
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public record BareApplication<R>(Invocable<R> wrapped) implements DecoratorApplication<R> {

    public BareApplication {
        if (wrapped == null) {
            throw new IllegalArgumentException("wrapped cannot be null");
        }
    }
}
