package com.ryuqq.wrapper.core.combinator;

import com.ryuqq.wrapper.core.diagnostic.DiagnosticSink;
import com.ryuqq.wrapper.core.spi.MonotonicTimer;

/**
 * TimeIt combinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timer: 시각을 읽을 시계 (기본 {@link MonotonicTimer#system()})</li>
 *   <li>handler: 경과 시간을 받을 handler (기본 없음, null 허용)</li>
 *   <li>sink: 매 호출 경과 시간을 보고할 DiagnosticSink (기본 표준 스트림)</li>
 * </ul>
 *
 * @author Wrapper Team
 * @since 1.0.0
 * @param timer 시계
 * @param handler 경과 시간 handler (null 허용)
 * @param sink 진단 출력 채널
 */
public record TimingPolicy(
    MonotonicTimer timer,
    TimingHandler handler,
    DiagnosticSink sink
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timer=System.nanoTime 기반, handler=null, sink=표준 스트림</p>
     */
    public TimingPolicy() {
        this(MonotonicTimer.system(), null, DiagnosticSink.standardStreams());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TimingPolicy {
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
    }

    /**
     * timer만 변경한 새 인스턴스 생성.
     */
    public TimingPolicy withTimer(MonotonicTimer timer) {
        return new TimingPolicy(timer, handler, sink);
    }

    /**
     * handler만 변경한 새 인스턴스 생성.
     */
    public TimingPolicy withHandler(TimingHandler handler) {
        return new TimingPolicy(timer, handler, sink);
    }

    /**
     * sink만 변경한 새 인스턴스 생성.
     */
    public TimingPolicy withSink(DiagnosticSink sink) {
        return new TimingPolicy(timer, handler, sink);
    }
}
