package com.ryuqq.wrapper.core.decorator;

import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;

/**
 * 데코레이터 본문.
 *
 * <p>{@code (target, *args, **kwargs) -> result} 형태의 평범한 함수입니다.
 * {@link DecoratorFactory}가 이 본문을 bare/configured 두 가지 방식으로
 * 쓸 수 있는 데코레이터로 바꿔줍니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * DecoratorBody<Object> logged = (target, call) -> {
 *     String prefix = call.keyword("prefix", String.class);
 *     return prefix + target.invoke(call);
 * };
 * }</pre>
 *
 * @param <R> 데코레이터 결과 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DecoratorBody<R> {

    /**
     * 본문 실행.
     *
     * @param target 감싼 대상
     * @param invocation 데코레이터 인자와 호출 인자가 합성된 Invocation
     * @return 결과
     * @throws Exception 본문 또는 대상이 던진 예외
     */
    R apply(Invocable<?> target, Invocation invocation) throws Exception;
}
