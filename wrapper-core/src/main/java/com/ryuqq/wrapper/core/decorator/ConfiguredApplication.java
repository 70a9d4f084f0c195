package com.ryuqq.wrapper.core.decorator;

/**
 * configured 적용 결과.
 *
 * @param decorator 대상에 적용할 데코레이터
 * @param <R> 결과 타입
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public record ConfiguredApplication<R>(ConfiguredDecorator<R> decorator) implements DecoratorApplication<R> {

    public ConfiguredApplication {
        if (decorator == null) {
            throw new IllegalArgumentException("decorator cannot be null");
        }
    }
}
