package fun.fengwk.msh.core.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
class DispatchRateLimiterTest {

    @Test
    void shouldBeDisabledForZeroInterval() throws Exception {
        DispatchRateLimiter limiter = new DispatchRateLimiter(Duration.ZERO);

        long start = System.nanoTime();
        for (int i = 0; i < 10; i++) {
            limiter.acquire();
        }

        assertThat(limiter.isEnabled()).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(100));
        assertThat(new DispatchRateLimiter(null).isEnabled()).isFalse();
    }

    @Test
    void shouldSpaceConsecutiveAcquisitions() throws Exception {
        DispatchRateLimiter limiter = new DispatchRateLimiter(Duration.ofMillis(100));

        long first = System.nanoTime();
        limiter.acquire();
        long afterFirst = System.nanoTime();
        limiter.acquire();
        long afterSecond = System.nanoTime();
        limiter.acquire();
        long afterThird = System.nanoTime();

        assertThat(Duration.ofNanos(afterFirst - first)).isLessThan(Duration.ofMillis(50));
        assertThat(Duration.ofNanos(afterSecond - afterFirst)).isGreaterThanOrEqualTo(Duration.ofMillis(80));
        assertThat(Duration.ofNanos(afterThird - afterFirst)).isGreaterThanOrEqualTo(Duration.ofMillis(180));
    }

}
