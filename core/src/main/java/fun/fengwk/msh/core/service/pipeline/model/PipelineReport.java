package fun.fengwk.msh.core.service.pipeline.model;

import fun.fengwk.msh.core.facade.search.model.ProviderReport;
import fun.fengwk.msh.core.service.rank.RankedResult;
import fun.fengwk.msh.core.service.scrape.model.ScrapeBatchReport;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class PipelineReport {

    private String query;
    private String sessionDir;
    private List<ProviderReport> providerReports;
    private int candidateCount;
    private int admittedCount;
    private List<RankedResult> rankedResults;

    /**
     * Path of the ranked results file, null when it could not be saved.
     */
    private String resultsFile;

    /**
     * Null when no candidate survived admission.
     */
    private ScrapeBatchReport scrapeReport;

    private List<String> warnings;
    private long durationMs;

    public boolean isNoResults() {
        return rankedResults == null || rankedResults.isEmpty();
    }

}
