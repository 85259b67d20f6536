package fr.lapetina.resilientfetch.infrastructure.http;

import fr.lapetina.resilientfetch.integration.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        rateLimiter = new RateLimiter(RateLimitOptions.of(2, Duration.ofMillis(400)), clock);
    }

    @Test
    @DisplayName("should admit up to the limit within one window")
    void shouldAdmitUpToLimit() {
        assertThat(rateLimiter.tryAcquire().admitted()).isTrue();
        assertThat(rateLimiter.tryAcquire().admitted()).isTrue();
        assertThat(rateLimiter.getRemainingQuota()).isZero();

        RateLimiter.Admission denied = rateLimiter.tryAcquire();
        assertThat(denied.admitted()).isFalse();
    }

    @Test
    @DisplayName("should report time remaining in the window on denial")
    void shouldReportRemainingTime() {
        rateLimiter.tryAcquire();
        rateLimiter.tryAcquire();
        clock.advance(Duration.ofMillis(150));

        RateLimiter.Admission denied = rateLimiter.tryAcquire();

        assertThat(denied.admitted()).isFalse();
        assertThat(denied.remainingTimeInWindow()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("should refill the quota when the window rolls over")
    void shouldRefillOnNewWindow() {
        rateLimiter.tryAcquire();
        rateLimiter.tryAcquire();

        clock.advance(Duration.ofMillis(400));

        assertThat(rateLimiter.tryAcquire().admitted()).isTrue();
        assertThat(rateLimiter.getRemainingQuota()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject invalid options")
    void shouldRejectInvalidOptions() {
        assertThatThrownBy(() -> RateLimitOptions.of(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RateLimitOptions.of(1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should admit exactly the limit when callers race for one window")
    void shouldAdmitExactlyLimitUnderContention() throws Exception {
        RateLimiter shared = new RateLimiter(RateLimitOptions.of(5, Duration.ofSeconds(1)), clock);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<RateLimiter.Admission>> attempts = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                attempts.add(executor.submit(() -> {
                    start.await();
                    return shared.tryAcquire();
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<RateLimiter.Admission> attempt : attempts) {
                if (attempt.get(5, TimeUnit.SECONDS).admitted()) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(5);
            assertThat(shared.getRemainingQuota()).isZero();
        } finally {
            executor.shutdownNow();
        }
    }
}
