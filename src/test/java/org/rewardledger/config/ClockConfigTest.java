package org.rewardledger.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClockConfigTest {

    @Test
    void clock_shouldTickInWholeSeconds() {
        assertThat(new ClockConfig().clock().instant().getNano()).isZero();
    }
}
