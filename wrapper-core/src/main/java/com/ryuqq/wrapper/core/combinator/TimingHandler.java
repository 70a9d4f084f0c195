package com.ryuqq.wrapper.core.combinator;

/**
 * TimeIt combinator의 실행 시간 handler.
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimingHandler {

    /**
     * 실행 시간 수신.
     *
     * @param name 대상 이름
     * @param elapsedSeconds 경과 시간 (timer 단위, 기본은 초)
     */
    void onTiming(String name, double elapsedSeconds);
}
