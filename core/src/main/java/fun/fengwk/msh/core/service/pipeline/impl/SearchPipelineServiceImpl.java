package fun.fengwk.msh.core.service.pipeline.impl;

import fun.fengwk.msh.core.facade.search.SearchFacade;
import fun.fengwk.msh.core.facade.search.SearchProperties;
import fun.fengwk.msh.core.facade.search.model.AggregatedSearchResult;
import fun.fengwk.msh.core.facade.search.model.ProviderReport;
import fun.fengwk.msh.core.facade.search.model.ProviderStatus;
import fun.fengwk.msh.core.service.fetch.LightContentFetcher;
import fun.fengwk.msh.core.service.pipeline.SearchPipelineService;
import fun.fengwk.msh.core.service.pipeline.model.PipelineReport;
import fun.fengwk.msh.core.service.rank.Bm25Properties;
import fun.fengwk.msh.core.service.rank.RankedResult;
import fun.fengwk.msh.core.service.rank.RelevanceRanker;
import fun.fengwk.msh.core.service.scrape.ScrapeOrchestrator;
import fun.fengwk.msh.core.service.scrape.model.ScrapeBatchReport;
import fun.fengwk.msh.core.service.scrape.model.ScrapeMode;
import fun.fengwk.msh.core.service.storage.ResultsStore;
import fun.fengwk.msh.core.service.storage.ResultsStoreFactory;
import fun.fengwk.msh.core.service.storage.SaveResult;
import fun.fengwk.msh.core.service.validation.UrlAdmissionFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
@Slf4j
@Service
public class SearchPipelineServiceImpl implements SearchPipelineService {

    private final SearchFacade searchFacade;
    private final UrlAdmissionFilter urlAdmissionFilter;
    private final LightContentFetcher lightContentFetcher;
    private final RelevanceRanker relevanceRanker;
    private final ScrapeOrchestrator scrapeOrchestrator;
    private final ResultsStoreFactory resultsStoreFactory;
    private final SearchProperties searchProperties;
    private final Bm25Properties bm25Properties;

    public SearchPipelineServiceImpl(SearchFacade searchFacade,
                                     UrlAdmissionFilter urlAdmissionFilter,
                                     LightContentFetcher lightContentFetcher,
                                     RelevanceRanker relevanceRanker,
                                     ScrapeOrchestrator scrapeOrchestrator,
                                     ResultsStoreFactory resultsStoreFactory,
                                     SearchProperties searchProperties,
                                     Bm25Properties bm25Properties) {
        this.searchFacade = searchFacade;
        this.urlAdmissionFilter = urlAdmissionFilter;
        this.lightContentFetcher = lightContentFetcher;
        this.relevanceRanker = relevanceRanker;
        this.scrapeOrchestrator = scrapeOrchestrator;
        this.resultsStoreFactory = resultsStoreFactory;
        this.searchProperties = searchProperties;
        this.bm25Properties = bm25Properties;
    }

    @Override
    public PipelineReport run(String query, ScrapeMode mode) {
        if (!StringUtils.hasText(query)) {
            throw new IllegalArgumentException("query must not be blank");
        }
        long startedAt = System.currentTimeMillis();
        int maxResults = searchProperties.getMaxResults();
        List<String> warnings = new ArrayList<>();

        ResultsStore store = resultsStoreFactory.open(query);
        log.info("search pipeline started, query={}, session={}", query, store.getSession().getRoot());

        AggregatedSearchResult aggregated = searchFacade.search(query, maxResults);
        List<String> candidates = aggregated.urls();

        Map<String, Object> rawMetadata = new LinkedHashMap<>();
        rawMetadata.put("stage", "raw");
        rawMetadata.put("providers", describeProviders(aggregated.getProviderReports()));
        List<String> snapshot = candidates.stream().filter(ResultsStore::isHttpUrl).toList();
        checkSave(store.saveSearchResults(snapshot, rawMetadata), "raw results", warnings);

        List<String> admitted = urlAdmissionFilter.validateMany(candidates);
        log.info("candidates admitted, query={}, candidates={}, admitted={}", query, candidates.size(), admitted.size());

        PipelineReport.PipelineReportBuilder report = PipelineReport.builder()
            .query(query)
            .sessionDir(store.getSession().getRoot().toString())
            .providerReports(aggregated.getProviderReports())
            .candidateCount(candidates.size())
            .admittedCount(admitted.size())
            .warnings(warnings);

        if (admitted.isEmpty()) {
            log.info("no results, query={}", query);
            return report
                .rankedResults(List.of())
                .durationMs(System.currentTimeMillis() - startedAt)
                .build();
        }

        List<String> documents = lightContentFetcher.fetchAll(admitted);
        List<RankedResult> ranked = relevanceRanker.rank(query, admitted, documents);
        List<RankedResult> top = ranked.subList(0, Math.min(maxResults, ranked.size()));
        List<String> topUrls = top.stream().map(RankedResult::getUrl).toList();

        SaveResult rankedSave = store.saveSearchResults(topUrls, rankedMetadata(aggregated, top, maxResults));
        checkSave(rankedSave, "ranked results", warnings);

        ScrapeBatchReport scrapeReport = scrapeOrchestrator.scrape(topUrls, searchProperties.getScrapeTopN(), mode, store);

        long durationMs = System.currentTimeMillis() - startedAt;
        log.info("search pipeline completed, query={}, ranked={}, scraped={}, failed={}, durationMs={}",
            query, top.size(), scrapeReport.total(), scrapeReport.getFailed(), durationMs);
        return report
            .rankedResults(List.copyOf(top))
            .resultsFile(rankedSave.isSaved() ? rankedSave.getPath().toString() : null)
            .scrapeReport(scrapeReport)
            .durationMs(durationMs)
            .build();
    }

    private Map<String, Object> rankedMetadata(AggregatedSearchResult aggregated, List<RankedResult> top, int maxResults) {
        List<Map<String, Object>> scores = new ArrayList<>(top.size());
        for (RankedResult result : top) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("url", result.getUrl());
            entry.put("score", result.getScore());
            scores.add(entry);
        }
        Map<String, Object> bm25 = new LinkedHashMap<>();
        bm25.put("k1", bm25Properties.getK1());
        bm25.put("b", bm25Properties.getB());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("stage", "ranked");
        metadata.put("maxResults", maxResults);
        metadata.put("providers", aggregated.getProviderReports().stream()
            .filter(r -> r.getStatus() == ProviderStatus.SUCCEEDED)
            .map(ProviderReport::getProvider)
            .toList());
        metadata.put("bm25", bm25);
        metadata.put("scores", scores);
        return metadata;
    }

    private List<Map<String, Object>> describeProviders(List<ProviderReport> providerReports) {
        List<Map<String, Object>> described = new ArrayList<>(providerReports.size());
        for (ProviderReport providerReport : providerReports) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("provider", providerReport.getProvider());
            entry.put("status", providerReport.getStatus().name());
            entry.put("attempts", providerReport.getAttempts());
            entry.put("resultCount", providerReport.getResultCount());
            if (providerReport.getError() != null) {
                entry.put("error", providerReport.getError());
            }
            described.add(entry);
        }
        return described;
    }

    private void checkSave(SaveResult saveResult, String what, List<String> warnings) {
        if (!saveResult.isSaved()) {
            String warning = "failed to save " + what + ": " + saveResult.getMessage();
            warnings.add(warning);
            log.warn("search results not saved, stage={}, failure={}, error={}",
                what, saveResult.getFailure(), saveResult.getMessage());
        }
    }

}
