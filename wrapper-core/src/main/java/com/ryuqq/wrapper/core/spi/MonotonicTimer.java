package com.ryuqq.wrapper.core.spi;

/**
 * 단조 증가 시계.
 *
 * <p>TimeIt combinator가 경과 시간을 잴 때 사용합니다.
 * 테스트에서는 가짜 시계로 바꿔 결정적인 값을 얻을 수 있습니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MonotonicTimer {

    /**
     * 현재 시각 (초 단위).
     *
     * <p>값 자체의 기준점은 의미가 없고, 두 값의 차이만 의미가 있습니다.</p>
     *
     * @return 단조 비감소 타임스탬프 (초)
     */
    double read();

    /**
     * {@link System#nanoTime()} 기반 기본 시계.
     *
     * @return 고해상도 단조 시계
     */
    static MonotonicTimer system() {
        return () -> System.nanoTime() / 1_000_000_000.0;
    }
}
