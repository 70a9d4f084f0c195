package com.ryuqq.wrapper.core.outcome;

/**
 * 정상 완료 결과.
 *
 * @param value 대상 반환값 (null 허용)
 * @param <R> 반환 타입
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public record Returned<R>(R value) implements Guarded<R> {
}
