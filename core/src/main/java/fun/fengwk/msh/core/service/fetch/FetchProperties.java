package fun.fengwk.msh.core.service.fetch;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ranking corpus fetch configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.fetch")
public class FetchProperties {

    /**
     * Deadline for the whole batch.
     */
    private long sessionTimeoutMs = 60000;

    /**
     * Deadline for a single url.
     */
    private long requestTimeoutMs = 10000;

    /**
     * Larger bodies are treated as non-text.
     */
    private long maxContentBytes = 10L * 1024 * 1024;

    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

    public void validate() {
        ConfigurationException.check(sessionTimeoutMs > 0, "fetch.session-timeout-ms must be > 0, actual=%s", sessionTimeoutMs);
        ConfigurationException.check(requestTimeoutMs > 0, "fetch.request-timeout-ms must be > 0, actual=%s", requestTimeoutMs);
        ConfigurationException.check(maxContentBytes > 0, "fetch.max-content-bytes must be > 0, actual=%s", maxContentBytes);
    }

}
