package com.ryuqq.wrapper.core.diagnostic;

import java.io.PrintStream;

/**
 * 표준 스트림 기반 DiagnosticSink.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>reportFailure(): 전체 stack trace를 에러 스트림에 출력</li>
 *   <li>reportTiming(): {@code "<name> executed in <elapsed> seconds"}를 출력 스트림에 출력</li>
 * </ul>
 *
 * <p>기본 생성자로 만든 인스턴스는 호출 시점의 {@link System#out}/{@link System#err}를 사용합니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class StandardStreamDiagnosticSink implements DiagnosticSink {

    static final StandardStreamDiagnosticSink INSTANCE = new StandardStreamDiagnosticSink();

    private final PrintStream out;
    private final PrintStream err;

    /**
     * 시스템 표준 스트림을 사용하는 sink 생성.
     */
    public StandardStreamDiagnosticSink() {
        this.out = null;
        this.err = null;
    }

    /**
     * 지정 스트림을 사용하는 sink 생성.
     *
     * @param out 타이밍 출력 스트림
     * @param err 예외 출력 스트림
     * @throws IllegalArgumentException 스트림이 null인 경우
     */
    public StandardStreamDiagnosticSink(PrintStream out, PrintStream err) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
        this.out = out;
        this.err = err;
    }

    @Override
    public void reportFailure(String name, Throwable error) {
        PrintStream stream = err != null ? err : System.err;
        error.printStackTrace(stream);
    }

    @Override
    public void reportTiming(String name, double elapsedSeconds) {
        PrintStream stream = out != null ? out : System.out;
        stream.println(DiagnosticSink.timingMessage(name, elapsedSeconds));
    }
}
