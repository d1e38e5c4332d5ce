package fun.fengwk.msh.core.service.pipeline;

import fun.fengwk.msh.core.service.pipeline.model.PipelineReport;
import fun.fengwk.msh.core.service.scrape.model.ScrapeMode;

/**
 * Answers one query end to end: search, admission, ranking, persistence and scraping.
 *
 * @author fengwk
 */
public interface SearchPipelineService {

    /**
     * Run the pipeline for a query.
     *
     * @param query search query, not blank
     * @param mode scrape mode, null for the configured default
     * @return report of every stage, never null
     */
    PipelineReport run(String query, ScrapeMode mode);

}
