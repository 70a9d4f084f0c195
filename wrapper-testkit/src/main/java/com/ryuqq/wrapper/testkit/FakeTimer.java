package com.ryuqq.wrapper.testkit;

import com.ryuqq.wrapper.core.spi.MonotonicTimer;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 미리 정한 값을 순서대로 반환하는 가짜 시계.
 *
 * <p>값을 모두 소진하면 마지막 값을 계속 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FakeTimer timer = FakeTimer.of(0.0, 5.0);
 * timer.read(); // 0.0
 * timer.read(); // 5.0
 * timer.read(); // 5.0
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class FakeTimer implements MonotonicTimer {

    private final double[] readings;
    private final AtomicInteger cursor = new AtomicInteger();

    private FakeTimer(double[] readings) {
        if (readings == null || readings.length == 0) {
            throw new IllegalArgumentException("readings cannot be null or empty");
        }
        for (int i = 1; i < readings.length; i++) {
            if (readings[i] < readings[i - 1]) {
                throw new IllegalArgumentException("readings must be non-decreasing (index " + i + ")");
            }
        }
        this.readings = readings.clone();
    }

    /**
     * 가짜 시계 생성.
     *
     * @param readings 순서대로 반환할 값 (비감소)
     * @return FakeTimer 인스턴스
     * @throws IllegalArgumentException 값이 없거나 감소하는 경우
     */
    public static FakeTimer of(double... readings) {
        return new FakeTimer(readings);
    }

    @Override
    public double read() {
        int index = cursor.getAndIncrement();
        return readings[Math.min(index, readings.length - 1)];
    }

    /**
     * 지금까지 read() 호출 횟수.
     *
     * @return 호출 횟수
     */
    public int readCount() {
        return cursor.get();
    }
}
