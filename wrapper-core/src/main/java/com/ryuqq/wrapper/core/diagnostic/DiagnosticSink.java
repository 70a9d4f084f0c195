package com.ryuqq.wrapper.core.diagnostic;

/**
 * 진단 출력 채널.
 *
 * <p>Catch combinator는 handler가 없을 때 잡힌 예외를, TimeIt combinator는
 * 매 호출의 경과 시간을 이 채널로 보고합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link StandardStreamDiagnosticSink}: 표준 출력/에러 스트림 (기본값)</li>
 *   <li>SLF4J 어댑터: {@code wrapper-adapter-slf4j} 모듈</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public interface DiagnosticSink {

    /**
     * 잡힌 예외 보고.
     *
     * @param name 대상 이름
     * @param error 잡힌 예외
     */
    void reportFailure(String name, Throwable error);

    /**
     * 실행 시간 보고.
     *
     * @param name 대상 이름
     * @param elapsedSeconds 경과 시간 (초)
     */
    void reportTiming(String name, double elapsedSeconds);

    /**
     * 기본 sink.
     *
     * @return 표준 스트림 sink
     */
    static DiagnosticSink standardStreams() {
        return StandardStreamDiagnosticSink.INSTANCE;
    }

    /**
     * 타이밍 보고 메시지.
     *
     * @param name 대상 이름
     * @param elapsedSeconds 경과 시간 (초)
     * @return {@code "<name> executed in <elapsed> seconds"}
     */
    static String timingMessage(String name, double elapsedSeconds) {
        return name + " executed in " + elapsedSeconds + " seconds";
    }
}
