package com.vigil.status;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UptimeTest {

    @Test
    void noProbesIsNotAvailable() {
        assertThat(Uptime.format(0, 0)).isEqualTo("N/A");
    }

    @Test
    void formatsOneDecimalPercentage() {
        assertThat(Uptime.format(2, 1)).isEqualTo("66.7%");
        assertThat(Uptime.format(5, 0)).isEqualTo("100.0%");
        assertThat(Uptime.format(0, 4)).isEqualTo("0.0%");
    }
}
