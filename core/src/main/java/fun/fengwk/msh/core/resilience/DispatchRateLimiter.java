package fun.fengwk.msh.core.resilience;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;

import java.time.Duration;

/**
 * Enforces a minimum gap between consecutive task starts.
 *
 * <p>Backed by a single-token bucket, so the first dispatch passes immediately and every
 * following one waits until the gap since the previous one has elapsed.
 *
 * @author fengwk
 */
public class DispatchRateLimiter {

    private final Bucket bucket;

    public DispatchRateLimiter(Duration minInterval) {
        if (minInterval == null || minInterval.isZero() || minInterval.isNegative()) {
            this.bucket = null;
        } else {
            this.bucket = Bucket.builder()
                .addLimit(Bandwidth.classic(1, Refill.greedy(1, minInterval)))
                .build();
        }
    }

    public boolean isEnabled() {
        return bucket != null;
    }

    public void acquire() throws InterruptedException {
        if (bucket != null) {
            bucket.asBlocking().consume(1);
        }
    }

}
