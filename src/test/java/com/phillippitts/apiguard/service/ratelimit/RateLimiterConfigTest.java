package com.phillippitts.apiguard.service.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterConfigTest {

    @Test
    void rejectsNonPositiveRequestsPerMinute() {
        assertThatThrownBy(() -> RateLimiterConfig.perMinute(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requestsPerMinute");
    }

    @Test
    void rejectsNonPositiveDailyLimit() {
        assertThatThrownBy(() -> RateLimiterConfig.of(10, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dailyLimit");
    }

    @Test
    void rejectsNegativeMaxWait() {
        assertThatThrownBy(() -> RateLimiterConfig.perMinute(1).withMaxWaitDuration(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void factoriesDefaultToWaiting() {
        RateLimiterConfig config = RateLimiterConfig.of(10, 600);

        assertThat(config.allowWait()).isTrue();
        assertThat(config.maxWaitDuration()).isEqualTo(RateLimiterConfig.DEFAULT_MAX_WAIT);
        assertThat(config.hasDailyLimit()).isTrue();
        assertThat(RateLimiterConfig.perMinute(10).hasDailyLimit()).isFalse();
    }
}
