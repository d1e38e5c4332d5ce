package fun.fengwk.msh.core.facade.search;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import fun.fengwk.msh.core.resilience.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Search aggregation configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search")
public class SearchProperties {

    /**
     * Number of ranked results kept per query.
     */
    private int maxResults = 10;

    /**
     * Number of top ranked urls receiving full extraction.
     */
    private int scrapeTopN = 2;

    /**
     * Provider names in the order they are consulted.
     */
    private List<String> fallbackOrder = new ArrayList<>(List.of("duckduckgo", "tavily", "google"));

    private Retry retry = new Retry();

    public void validate() {
        ConfigurationException.check(maxResults > 0, "search.max-results must be > 0, actual=%s", maxResults);
        ConfigurationException.check(scrapeTopN >= 0, "search.scrape-top-n must be >= 0, actual=%s", scrapeTopN);
        ConfigurationException.check(fallbackOrder != null && !fallbackOrder.isEmpty(),
            "search.fallback-order must not be empty");
        toRetryPolicy();
    }

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.ofMillis(retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getMaxDelayMs());
    }

    @Data
    public static class Retry {

        private int maxAttempts = 3;

        private long baseDelayMs = 1000;

        private long maxDelayMs = 10000;

    }

}
