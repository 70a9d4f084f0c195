package com.ryuqq.wrapper.core.spi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MonotonicTimerTest {

    @Test
    void system_ConsecutiveReads_NonDecreasing() {
        MonotonicTimer timer = MonotonicTimer.system();

        double first = timer.read();
        double second = timer.read();

        assertTrue(second >= first);
    }
}
