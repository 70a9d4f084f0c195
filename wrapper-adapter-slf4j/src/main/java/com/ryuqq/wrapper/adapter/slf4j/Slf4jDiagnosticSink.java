package com.ryuqq.wrapper.adapter.slf4j;

import com.ryuqq.wrapper.core.diagnostic.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 기반 DiagnosticSink.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>reportFailure(): ERROR 레벨, stack trace 포함</li>
 *   <li>reportTiming(): 설정된 레벨(기본 INFO)로 {@code "<name> executed in <elapsed> seconds"}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * DiagnosticSink sink = new Slf4jDiagnosticSink();
 * Invocable<Report> timed = TimeIt.configured(new TimingPolicy().withSink(sink)).decorate(buildReport);
 * Catch guard = Catch.configured(new CatchPolicy().withSink(sink));
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class Slf4jDiagnosticSink implements DiagnosticSink {

    /**
     * 타이밍 보고 레벨.
     */
    public enum TimingLevel {
        TRACE,
        DEBUG,
        INFO
    }

    private final Logger logger;
    private final TimingLevel timingLevel;

    /**
     * 기본 생성자 (이 클래스 이름의 Logger, INFO 레벨).
     */
    public Slf4jDiagnosticSink() {
        this(LoggerFactory.getLogger(Slf4jDiagnosticSink.class), TimingLevel.INFO);
    }

    /**
     * 생성자 (Logger 및 타이밍 레벨 지정).
     *
     * @param logger 출력할 Logger
     * @param timingLevel 타이밍 보고 레벨
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Slf4jDiagnosticSink(Logger logger, TimingLevel timingLevel) {
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
        if (timingLevel == null) {
            throw new IllegalArgumentException("timingLevel cannot be null");
        }
        this.logger = logger;
        this.timingLevel = timingLevel;
    }

    @Override
    public void reportFailure(String name, Throwable error) {
        logger.error("{} raised {}", name, error.toString(), error);
    }

    @Override
    public void reportTiming(String name, double elapsedSeconds) {
        switch (timingLevel) {
            case TRACE -> {
                if (logger.isTraceEnabled()) {
                    logger.trace(DiagnosticSink.timingMessage(name, elapsedSeconds));
                }
            }
            case DEBUG -> {
                if (logger.isDebugEnabled()) {
                    logger.debug(DiagnosticSink.timingMessage(name, elapsedSeconds));
                }
            }
            case INFO -> {
                if (logger.isInfoEnabled()) {
                    logger.info(DiagnosticSink.timingMessage(name, elapsedSeconds));
                }
            }
        }
    }

    public TimingLevel getTimingLevel() {
        return timingLevel;
    }
}
