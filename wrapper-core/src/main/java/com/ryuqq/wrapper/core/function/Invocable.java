package com.ryuqq.wrapper.core.function;

import com.ryuqq.wrapper.core.model.Invocation;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 감쌀 수 있는 호출 대상.
 *
 * <p>모든 combinator는 Invocable을 받아 같은 시그니처의 Invocable을 돌려줍니다.
 * {@link #name()}은 timing 보고 등 진단 출력에서 함수 이름으로 쓰이며,
 * wrapper는 대상의 이름을 그대로 물려받습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Invocable<Integer> add = Invocable.named("add",
 *     call -> call.positional(0, Integer.class) + call.positional(1, Integer.class));
 *
 * int sum = add.invoke(Invocation.of(1, 2)); // 3
 * }</pre>
 *
 * @param <R> 반환 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Invocable<R> {

    /**
     * 대상 호출.
     *
     * @param invocation 호출 인자
     * @return 호출 결과 (null 가능)
     * @throws Exception 대상이 던진 예외 (combinator는 변형 없이 전파)
     */
    R invoke(Invocation invocation) throws Exception;

    /**
     * 대상 이름.
     *
     * <p>기본값은 구현 클래스의 simple name입니다.
     * 의미 있는 이름이 필요하면 {@link #named(String, Invocable)}를 사용합니다.</p>
     *
     * @return 이름
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * 인자 없이 호출.
     *
     * @return 호출 결과
     * @throws Exception 대상이 던진 예외
     */
    default R invoke() throws Exception {
        return invoke(Invocation.empty());
    }

    /**
     * 위치 인자로 호출.
     *
     * @param args 위치 인자
     * @return 호출 결과
     * @throws Exception 대상이 던진 예외
     */
    default R call(Object... args) throws Exception {
        return invoke(Invocation.of(args));
    }

    /**
     * 이름을 붙인 Invocable 생성.
     *
     * @param name 이름
     * @param body 실제 호출 본문
     * @param <R> 반환 타입
     * @return 이름이 붙은 Invocable
     * @throws IllegalArgumentException name이 blank이거나 body가 null인 경우
     */
    static <R> Invocable<R> named(String name, Invocable<R> body) {
        return new NamedInvocable<>(name, body);
    }

    /**
     * Supplier를 인자를 무시하는 Invocable로 변환.
     *
     * @param name 이름
     * @param supplier 값 공급자
     * @param <R> 반환 타입
     * @return Invocable
     */
    static <R> Invocable<R> ofSupplier(String name, Supplier<? extends R> supplier) {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier cannot be null");
        }
        return named(name, invocation -> supplier.get());
    }

    /**
     * 단일 인자 Function을 첫 번째 위치 인자를 받는 Invocable로 변환.
     *
     * @param name 이름
     * @param type 첫 번째 인자 타입
     * @param function 변환 함수
     * @param <T> 인자 타입
     * @param <R> 반환 타입
     * @return Invocable
     */
    static <T, R> Invocable<R> ofFunction(String name, Class<T> type, Function<? super T, ? extends R> function) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        return named(name, invocation -> function.apply(invocation.positional(0, type)));
    }
}
