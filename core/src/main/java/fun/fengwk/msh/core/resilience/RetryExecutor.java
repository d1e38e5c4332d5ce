package fun.fengwk.msh.core.resilience;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Runs a call under a {@link RetryPolicy}, retrying only failures accepted by the predicate.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class RetryExecutor {

    public <T> T execute(String name, RetryPolicy policy, Predicate<Throwable> retryable, Callable<T> call) throws Exception {
        Retry retry = Retry.of(name, policy.toRetryConfig(retryable));
        retry.getEventPublisher().onRetry(event -> log.warn(
            "retrying call, name={}, attempt={}, waitMs={}, error={}",
            name,
            event.getNumberOfRetryAttempts(),
            event.getWaitInterval().toMillis(),
            event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()
        ));
        return retry.executeCallable(call);
    }

}
