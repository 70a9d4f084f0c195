package com.ryuqq.wrapper.core.decorator;

import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;

/**
 * 데코레이터 인자가 고정된 2단계 데코레이터.
 *
 * <p>{@link #decorate(Invocable)}로 만든 wrapper는 호출마다
 * {@code body(target, *decoratorArgs, *callArgs, **{**decoratorKwargs, **callKwargs})}를 실행합니다.
 * 같은 이름의 이름 인자는 호출 시점 값이 우선합니다.</p>
 *
 * @param <R> 결과 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class ConfiguredDecorator<R> {

    private final DecoratorBody<R> body;
    private final Invocation configuration;

    ConfiguredDecorator(DecoratorBody<R> body, Invocation configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        this.body = body;
        this.configuration = configuration;
    }

    /**
     * 대상 감싸기.
     *
     * @param target 대상
     * @return 감싼 Invocable
     * @throws IllegalArgumentException target이 null인 경우
     */
    public Invocable<R> decorate(Invocable<?> target) {
        return DecoratorFactory.wrap(target, body, configuration);
    }

    /**
     * 고정된 데코레이터 인자.
     *
     * @return 데코레이터 인자
     */
    public Invocation getConfiguration() {
        return configuration;
    }

    @Override
    public String toString() {
        return "ConfiguredDecorator{" + configuration + '}';
    }
}
