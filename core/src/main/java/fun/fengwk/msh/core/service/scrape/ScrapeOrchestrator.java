package fun.fengwk.msh.core.service.scrape;

import fun.fengwk.msh.core.service.scrape.model.ScrapeBatchReport;
import fun.fengwk.msh.core.service.scrape.model.ScrapeMode;
import fun.fengwk.msh.core.service.storage.ResultsStore;

import java.util.List;

/**
 * Scrapes a ranked url batch into a session store.
 *
 * @author fengwk
 */
public interface ScrapeOrchestrator {

    /**
     * The first {@code scrapeTopN} urls get a full extraction, the rest a lightweight status
     * pass. Task failures never propagate; each url yields exactly one outcome.
     *
     * @param urls ranked urls, best first
     * @param scrapeTopN full extraction budget
     * @param mode extraction depth
     * @param resultsStore session store receiving artifacts
     * @return outcomes in submission order with counts
     */
    ScrapeBatchReport scrape(List<String> urls, int scrapeTopN, ScrapeMode mode, ResultsStore resultsStore);

}
