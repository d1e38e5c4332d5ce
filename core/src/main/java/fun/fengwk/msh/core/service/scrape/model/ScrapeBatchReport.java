package fun.fengwk.msh.core.service.scrape.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Per-url outcomes of a batch with success and failure counts.
 *
 * @author fengwk
 */
@Data
@Builder
public class ScrapeBatchReport {

    private ScrapeMode mode;
    private List<ScrapeOutcome> outcomes;
    private int succeeded;
    private int partiallyFailed;
    private int failed;

    public static ScrapeBatchReport of(ScrapeMode mode, List<ScrapeOutcome> outcomes) {
        int succeeded = 0;
        int partiallyFailed = 0;
        int failed = 0;
        for (ScrapeOutcome outcome : outcomes) {
            switch (outcome.getStatus()) {
                case SUCCEEDED -> succeeded++;
                case PARTIALLY_FAILED -> partiallyFailed++;
                default -> failed++;
            }
        }
        return ScrapeBatchReport.builder()
            .mode(mode)
            .outcomes(List.copyOf(outcomes))
            .succeeded(succeeded)
            .partiallyFailed(partiallyFailed)
            .failed(failed)
            .build();
    }

    public int total() {
        return outcomes.size();
    }

}
