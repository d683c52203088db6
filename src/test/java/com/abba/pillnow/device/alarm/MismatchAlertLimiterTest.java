package com.abba.pillnow.device.alarm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MismatchAlertLimiterTest {

    @Test
    void allowsOneAlertPerCooldown() {
        MismatchAlertLimiter limiter = new MismatchAlertLimiter();

        assertThat(limiter.tryAcquire(0)).isTrue();
        assertThat(limiter.tryAcquire(14_999)).isFalse();
        assertThat(limiter.tryAcquire(15_000)).isTrue();
        assertThat(limiter.tryAcquire(20_000)).isFalse();
    }
}
