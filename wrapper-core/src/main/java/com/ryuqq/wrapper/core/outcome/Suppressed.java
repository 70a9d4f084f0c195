package com.ryuqq.wrapper.core.outcome;

/**
 * 예외가 잡혀 전파되지 않은 결과.
 *
 * <p>"no result" sentinel 역할을 하며, 어떤 예외가 잡혔고
 * 그 예외가 어디로 보고되었는지(또는 보고되지 않았는지)를 함께 담습니다.</p>
 *
 * @param name 대상 이름
 * @param cause 잡힌 예외
 * @param disposition 진단 처리 방식
 * @param <R> 대상 반환 타입
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public record Suppressed<R>(
    String name,
    Throwable cause,
    Disposition disposition
) implements Guarded<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Suppressed {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (disposition == null) {
            throw new IllegalArgumentException("disposition cannot be null");
        }
    }
}
