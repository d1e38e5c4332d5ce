package fun.fengwk.msh.core.service.storage;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * File operation circuit breaker.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.circuit-breaker")
public class CircuitBreakerProperties {

    /**
     * Consecutive failures opening the breaker.
     */
    private int failMax = 5;

    /**
     * Time the breaker stays open before one probe call is let through.
     */
    private long resetTimeoutMs = 60000;

    public void validate() {
        ConfigurationException.check(failMax >= 1, "circuit-breaker.fail-max must be >= 1, actual=%s", failMax);
        ConfigurationException.check(resetTimeoutMs >= 1, "circuit-breaker.reset-timeout-ms must be >= 1, actual=%s", resetTimeoutMs);
    }

}
