package com.ryuqq.wrapper.core.combinator;

/**
 * Catch combinator의 예외 handler.
 *
 * <p>handler가 지정되면 잡힌 예외는 DiagnosticSink 대신 handler로만 전달됩니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureHandler {

    /**
     * 잡힌 예외 처리.
     *
     * @param error 대상이 던진 예외 (원래 인스턴스)
     */
    void onFailure(Throwable error);
}
