package fun.fengwk.msh.core.service.scrape.runtime;

import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import fun.fengwk.msh.core.service.browser.runtime.BrowserRuntimeContext;
import fun.fengwk.msh.core.service.browser.runtime.BrowserTask;
import fun.fengwk.msh.core.service.scrape.ScrapeProperties;
import fun.fengwk.msh.core.service.scrape.model.ScrapeErrorKind;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOutcome;
import fun.fengwk.msh.core.service.scrape.model.ScrapeTask;
import fun.fengwk.msh.core.service.scrape.model.ScrapeToggles;
import fun.fengwk.msh.core.service.scrape.support.PageResourceFetcher;
import fun.fengwk.msh.core.service.scrape.support.PageResourceFetcher.PageResource;
import fun.fengwk.msh.core.service.scrape.support.ScrapeMediaUtils;
import fun.fengwk.msh.core.service.storage.ArtifactKind;
import fun.fengwk.msh.core.service.storage.ResultsStore;
import fun.fengwk.msh.core.service.storage.ScrapedArtifact;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Lightweight pass for urls outside the full extraction budget: status check without
 * rendering, plus the body when it is a pdf.
 *
 * @author fengwk
 */
@RequiredArgsConstructor
public class ProbeBrowserTask implements BrowserTask<ScrapeOutcome> {

    @Getter
    private final ScrapeTask task;
    private final ScrapeToggles toggles;
    private final ScrapeProperties scrapeProperties;
    private final ResultsStore resultsStore;

    @Override
    public ScrapeOutcome execute(BrowserRuntimeContext context) {
        String url = task.getUrl();
        ScrapeTaskTracker tracker = new ScrapeTaskTracker(url, false);

        tracker.transition(ScrapeTaskState.NAVIGATING);
        context.checkpoint();
        PageResource resource;
        try {
            resource = PageResourceFetcher.get(context.getPage(), url, scrapeProperties.getProbeTimeoutMs());
        } catch (TimeoutError ex) {
            return tracker.navigationFailed(ScrapeErrorKind.TIMEOUT, "status check timed out: " + ex.getMessage());
        } catch (PlaywrightException ex) {
            return tracker.navigationFailed(ScrapeErrorKind.NAVIGATION, ex.getMessage());
        }

        tracker.statusCode(resource.status());
        if (resource.status() >= 400) {
            return tracker.navigationFailed(ScrapeErrorKind.HTTP_STATUS, "http status " + resource.status());
        }
        tracker.transition(ScrapeTaskState.RENDERED);

        if (ScrapeMediaUtils.isPdf(resource.mime()) && toggles.isSavePdfs() && resource.hasBody()) {
            context.checkpoint();
            tracker.transition(ScrapeTaskState.SAVING);
            tracker.recordSecondary(resultsStore.saveScrapedContent(ScrapedArtifact.builder()
                .url(url)
                .kind(ArtifactKind.PDF)
                .content(resource.body())
                .contentType(resource.mime())
                .metadata(Map.of("statusCode", resource.status()))
                .build()), url);
        }
        return tracker.finish();
    }

}
