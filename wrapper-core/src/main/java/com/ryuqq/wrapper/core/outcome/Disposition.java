package com.ryuqq.wrapper.core.outcome;

/**
 * 억제된 예외의 진단 처리 방식.
 *
 * <p>한 예외는 정확히 한 곳으로만 보고됩니다 (중복 보고 없음).</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public enum Disposition {

    /**
     * 사용자 handler에 전달됨.
     */
    HANDLED,

    /**
     * 기본 DiagnosticSink에 보고됨.
     */
    REPORTED,

    /**
     * silent 설정으로 아무 곳에도 보고되지 않음.
     */
    SILENCED
}
