package com.ryuqq.wrapper.core.decorator;

import com.ryuqq.wrapper.core.function.CallWrapper;
import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;

/**
 * 범용 데코레이터 빌더.
 *
 * <p>{@link DecoratorBody}를 받아 두 가지 형태로 적용할 수 있는 데코레이터를 만듭니다.</p>
 *
 * <p><strong>정적 경로 (권장):</strong></p>
 * <ul>
 *   <li>{@link #bare(Invocable)}: 대상을 바로 감쌈.
 *       호출 시 {@code body(target, callArgs)}</li>
 *   <li>{@link #configured(Invocation)}: 데코레이터 인자를 먼저 받고, 대상은 나중에.
 *       호출 시 {@code body(target, merge(decoratorArgs, callArgs))}</li>
 * </ul>
 *
 * <p><strong>동적 경로:</strong> {@link #apply(Invocation)}는 인자 모양으로 두 경로 중 하나를 고릅니다.
 * 판정 규칙은 {@link #isBareUsage(Invocation)} 하나뿐입니다:</p>
 * <pre>
 * 위치 인자 정확히 1개 AND 그 인자가 Invocable AND 이름 인자 없음  → bare
 * 그 외 모든 경우                                                 → configured
 * </pre>
 *
 * <p><strong>주의:</strong> Invocable 하나만 설정값으로 넘기려는 경우에도 bare로 판정됩니다.
 * 그런 경우에는 {@link #configured(Invocation)}를 직접 호출해야 합니다.</p>
 *
 * <p><strong>주의:</strong> {@link #apply(Invocation)}와 {@link #apply(Object...)}는 오버로드입니다.
 * Invocation 하나를 넘기면 그것이 설정값 하나가 아니라 인자 전체로 해석됩니다.
 * Invocation을 위치 설정값으로 넘기려면 {@code apply(Invocation.of(invocation))}처럼 감싸야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * DecoratorFactory<Object> tagged = DecoratorFactory.of((target, call) ->
 *     call.keyword("tag") + ":" + target.invoke(Invocation.of(call.positionalArgs(), Map.of())));
 *
 * Invocable<Object> plain = tagged.bare(render);
 * Invocable<Object> withTag = tagged.configured(Invocation.empty().withKeyword("tag", "v1")).decorate(render);
 * }</pre>
 *
 * @param <R> 데코레이터 결과 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class DecoratorFactory<R> {

    private final DecoratorBody<R> body;

    private DecoratorFactory(DecoratorBody<R> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        this.body = body;
    }

    /**
     * 본문으로 데코레이터 팩토리 생성.
     *
     * @param body 데코레이터 본문
     * @param <R> 결과 타입
     * @return DecoratorFactory 인스턴스
     * @throws IllegalArgumentException body가 null인 경우
     */
    public static <R> DecoratorFactory<R> of(DecoratorBody<R> body) {
        return new DecoratorFactory<>(body);
    }

    /**
     * bare/configured 판정.
     *
     * @param arguments 데코레이터에 전달된 인자
     * @return 위치 인자가 정확히 1개이고, 그 인자가 Invocable이며, 이름 인자가 없으면 true
     * @throws IllegalArgumentException arguments가 null인 경우
     */
    public static boolean isBareUsage(Invocation arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        return arguments.size() == 1
            && arguments.positional(0) instanceof Invocable
            && arguments.keywordArgs().isEmpty();
    }

    /**
     * bare 적용: 대상을 바로 감쌈.
     *
     * @param target 대상
     * @return 호출마다 {@code body(target, callArgs)}를 실행하는 Invocable
     * @throws IllegalArgumentException target이 null인 경우
     */
    public Invocable<R> bare(Invocable<?> target) {
        return wrap(target, body, Invocation.empty());
    }

    /**
     * configured 적용: 데코레이터 인자를 고정한 데코레이터 생성.
     *
     * @param configuration 데코레이터 인자
     * @return 대상에 적용할 ConfiguredDecorator
     * @throws IllegalArgumentException configuration이 null인 경우
     */
    public ConfiguredDecorator<R> configured(Invocation configuration) {
        return new ConfiguredDecorator<>(body, configuration);
    }

    /**
     * configured 적용 (위치 인자만).
     *
     * @param args 데코레이터 위치 인자
     * @return 대상에 적용할 ConfiguredDecorator
     */
    public ConfiguredDecorator<R> configured(Object... args) {
        return configured(Invocation.of(args));
    }

    /**
     * 인자 모양으로 적용 방식 결정.
     *
     * @param arguments 데코레이터에 전달된 인자
     * @return bare이면 {@link BareApplication}, 아니면 {@link ConfiguredApplication}
     * @throws IllegalArgumentException arguments가 null인 경우
     */
    public DecoratorApplication<R> apply(Invocation arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        if (isBareUsage(arguments)) {
            return new BareApplication<>(bare((Invocable<?>) arguments.positional(0)));
        }
        return new ConfiguredApplication<>(configured(arguments));
    }

    /**
     * 인자 모양으로 적용 방식 결정 (위치 인자만).
     *
     * @param arguments 데코레이터 위치 인자
     * @return 적용 결과
     */
    public DecoratorApplication<R> apply(Object... arguments) {
        return apply(Invocation.of(arguments));
    }

    static <T, R> Invocable<R> wrap(Invocable<T> target, DecoratorBody<R> body, Invocation configuration) {
        return new BodyCall<>(target, body, configuration);
    }

    private static final class BodyCall<T, R> extends CallWrapper<T, R> {

        private final DecoratorBody<R> body;
        private final Invocation configuration;

        BodyCall(Invocable<T> target, DecoratorBody<R> body, Invocation configuration) {
            super(target);
            this.body = body;
            this.configuration = configuration;
        }

        @Override
        protected R around(Invocable<T> target, Invocation invocation) throws Exception {
            return body.apply(target, Invocation.merge(configuration, invocation));
        }
    }
}
