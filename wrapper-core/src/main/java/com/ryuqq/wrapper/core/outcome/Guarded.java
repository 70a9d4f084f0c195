package com.ryuqq.wrapper.core.outcome;

import java.util.Optional;

/**
 * Catch combinator의 호출 결과.
 *
 * <p>Guarded는 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Returned}: 대상이 정상 완료됨 (값은 null일 수도 있음)</li>
 *   <li>{@link Suppressed}: 설정된 예외가 잡혀 전파되지 않음 ("no result")</li>
 * </ul>
 *
 * <p>대상이 정상적으로 null을 반환한 경우와 예외가 억제된 경우를
 * 타입으로 구분하기 위해 sealed interface로 정의합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Guarded&lt;Integer&gt; result = guarded.invoke(invocation);
 * if (result instanceof Returned&lt;Integer&gt; returned) {
 *     use(returned.value());
 * } else if (result instanceof Suppressed&lt;Integer&gt; suppressed) {
 *     log(suppressed.error());
 * }
 * </pre>
 *
 * @param <R> 대상 반환 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public sealed interface Guarded<R> permits Returned, Suppressed {

    /**
     * 정상 완료 결과 생성.
     *
     * @param value 대상 반환값 (null 허용)
     * @param <R> 반환 타입
     * @return Returned 인스턴스
     */
    static <R> Guarded<R> returned(R value) {
        return new Returned<>(value);
    }

    /**
     * 억제된 결과 생성.
     *
     * @param name 대상 이름
     * @param error 잡힌 예외
     * @param disposition 진단 처리 방식
     * @param <R> 반환 타입
     * @return Suppressed 인스턴스
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    static <R> Guarded<R> suppressed(String name, Throwable error, Disposition disposition) {
        return new Suppressed<>(name, error, disposition);
    }

    /**
     * 정상 완료 여부.
     *
     * @return 정상 완료이면 true
     */
    default boolean isReturned() {
        return this instanceof Returned;
    }

    /**
     * 예외 억제 여부.
     *
     * @return 억제되었으면 true
     */
    default boolean isSuppressed() {
        return this instanceof Suppressed;
    }

    /**
     * 값 또는 대체값.
     *
     * @param fallback 억제된 경우 반환할 값
     * @return 정상 완료이면 대상 반환값, 아니면 fallback
     */
    default R orElse(R fallback) {
        if (this instanceof Returned<R> returned) {
            return returned.value();
        }
        return fallback;
    }

    /**
     * 값을 Optional로 조회.
     *
     * <p>정상 완료이지만 값이 null인 경우에도 empty가 되므로,
     * 두 경우를 구분해야 하면 {@link #isReturned()}를 사용합니다.</p>
     *
     * @return 값 Optional
     */
    default Optional<R> toOptional() {
        return Optional.ofNullable(orElse(null));
    }

    /**
     * 억제된 예외 조회.
     *
     * @return 억제된 경우 예외, 아니면 empty
     */
    default Optional<Throwable> error() {
        if (this instanceof Suppressed<R> suppressed) {
            return Optional.of(suppressed.cause());
        }
        return Optional.empty();
    }
}
