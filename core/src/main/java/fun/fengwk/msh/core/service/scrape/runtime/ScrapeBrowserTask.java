package fun.fengwk.msh.core.service.scrape.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.ScreenshotType;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.msh.core.service.browser.runtime.BrowserRuntimeContext;
import fun.fengwk.msh.core.service.browser.runtime.BrowserTask;
import fun.fengwk.msh.core.service.scrape.ScrapeProperties;
import fun.fengwk.msh.core.service.scrape.model.ScrapeErrorKind;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOutcome;
import fun.fengwk.msh.core.service.scrape.model.ScrapeTask;
import fun.fengwk.msh.core.service.scrape.model.ScrapeToggles;
import fun.fengwk.msh.core.service.scrape.support.PageMetadataExtractor;
import fun.fengwk.msh.core.service.scrape.support.PageResourceFetcher;
import fun.fengwk.msh.core.service.scrape.support.PageResourceFetcher.PageResource;
import fun.fengwk.msh.core.service.scrape.support.ScrapeMediaUtils;
import fun.fengwk.msh.core.service.storage.ArtifactKind;
import fun.fengwk.msh.core.service.storage.ResultsStore;
import fun.fengwk.msh.core.service.storage.SaveResult;
import fun.fengwk.msh.core.service.storage.ScrapedArtifact;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full extraction of one page: render, then save html, text, formula screenshots, images,
 * linked pdfs and a page metadata record. Only the primary content (html, or text when html
 * is disabled) decides whether the task fails.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class ScrapeBrowserTask implements BrowserTask<ScrapeOutcome> {

    private static final int MAX_FORMULAS = 50;

    private static final String DOWNLOAD_STARTING = "Download is starting";

    @Getter
    private final ScrapeTask task;
    private final ScrapeToggles toggles;
    private final ScrapeProperties scrapeProperties;
    private final ResultsStore resultsStore;
    private final ObjectMapper objectMapper;

    @Override
    public ScrapeOutcome execute(BrowserRuntimeContext context) {
        Page page = context.getPage();
        String url = task.getUrl();
        ScrapeTaskTracker tracker = new ScrapeTaskTracker(url, true);

        tracker.transition(ScrapeTaskState.NAVIGATING);
        context.checkpoint();
        if (ScrapeMediaUtils.hasPdfExtension(url)) {
            return captureDocument(context, page, tracker);
        }

        Response response;
        try {
            response = page.navigate(url,
                new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.LOAD)
                    .setTimeout((double) scrapeProperties.getTimeoutMs())
            );
        } catch (TimeoutError ex) {
            return tracker.navigationFailed(ScrapeErrorKind.TIMEOUT, "navigation timed out: " + ex.getMessage());
        } catch (PlaywrightException ex) {
            if (ex.getMessage() != null && ex.getMessage().contains(DOWNLOAD_STARTING)) {
                // served as an attachment, e.g. a pdf without a .pdf path
                return captureDocument(context, page, tracker);
            }
            return tracker.navigationFailed(ScrapeErrorKind.NAVIGATION, ex.getMessage());
        }

        int statusCode = response == null ? 200 : response.status();
        tracker.statusCode(statusCode);
        if (statusCode >= 400) {
            return tracker.navigationFailed(ScrapeErrorKind.HTTP_STATUS, "http status " + statusCode);
        }
        tracker.transition(ScrapeTaskState.RENDERED);

        context.checkpoint();
        tracker.transition(ScrapeTaskState.EXTRACTING);
        String html = page.content();
        Document document = Jsoup.parse(html, url);
        String text = document.text();

        tracker.transition(ScrapeTaskState.SAVING);
        if (toggles.isSaveHtml()) {
            SaveResult primary = save(context, ArtifactKind.HTML, html.getBytes(StandardCharsets.UTF_8), null, null, null, Map.of());
            if (!tracker.recordPrimary(primary)) {
                return tracker.primaryFailed(primary);
            }
            if (toggles.isSaveText()) {
                tracker.recordSecondary(
                    save(context, ArtifactKind.TEXT, text.getBytes(StandardCharsets.UTF_8), null, null, null, Map.of()), url);
            }
        } else if (toggles.isSaveText()) {
            SaveResult primary = save(context, ArtifactKind.TEXT, text.getBytes(StandardCharsets.UTF_8), null, null, null, Map.of());
            if (!tracker.recordPrimary(primary)) {
                return tracker.primaryFailed(primary);
            }
        }

        if (toggles.isSaveFormulas()) {
            context.checkpoint();
            captureFormulas(context, page, tracker);
        }
        if (toggles.isSaveImages() && toggles.getMaxImages() > 0) {
            context.checkpoint();
            saveImages(context, page, document, tracker);
        }
        if (toggles.isSavePdfs() && toggles.isFollowPdfLinks() && toggles.getMaxPdfLinks() > 0) {
            context.checkpoint();
            saveLinkedPdfs(context, page, document, tracker);
        }

        context.checkpoint();
        saveMetadata(context, document, statusCode, tracker);
        return tracker.finish();
    }

    private ScrapeOutcome captureDocument(BrowserRuntimeContext context, Page page, ScrapeTaskTracker tracker) {
        String url = task.getUrl();
        PageResource resource;
        try {
            resource = PageResourceFetcher.get(page, url, scrapeProperties.getTimeoutMs());
        } catch (TimeoutError ex) {
            return tracker.navigationFailed(ScrapeErrorKind.TIMEOUT, "request timed out: " + ex.getMessage());
        } catch (PlaywrightException ex) {
            return tracker.navigationFailed(ScrapeErrorKind.NAVIGATION, ex.getMessage());
        }

        tracker.statusCode(resource.status());
        if (resource.status() >= 400) {
            return tracker.navigationFailed(ScrapeErrorKind.HTTP_STATUS, "http status " + resource.status());
        }
        tracker.transition(ScrapeTaskState.SAVING);
        if (ScrapeMediaUtils.isPdf(resource.mime()) && toggles.isSavePdfs() && resource.hasBody()) {
            SaveResult primary = save(context, ArtifactKind.PDF, resource.body(), resource.mime(), null, null, Map.of());
            if (!tracker.recordPrimary(primary)) {
                return tracker.primaryFailed(primary);
            }
        }
        return tracker.finish();
    }

    private void captureFormulas(BrowserRuntimeContext context, Page page, ScrapeTaskTracker tracker) {
        String selector = scrapeProperties.getFormulaSelector();
        List<ElementHandle> elements;
        try {
            elements = page.querySelectorAll(selector);
        } catch (PlaywrightException ex) {
            tracker.recordFailure(ArtifactKind.FORMULA, selector, ex.getMessage());
            return;
        }

        int count = Math.min(elements.size(), MAX_FORMULAS);
        for (int i = 0; i < count; i++) {
            context.checkpoint();
            String variant = "formula_" + i;
            try {
                byte[] screenshot = elements.get(i).screenshot(
                    new ElementHandle.ScreenshotOptions()
                        .setType(ScreenshotType.PNG)
                        .setTimeout((double) scrapeProperties.getTimeoutMs())
                );
                tracker.recordSecondary(
                    save(context, ArtifactKind.FORMULA, screenshot, "image/png", variant, ".png", Map.of("formulaIndex", i)),
                    variant);
            } catch (PlaywrightException ex) {
                tracker.recordFailure(ArtifactKind.FORMULA, variant, ex.getMessage());
            }
        }
        log.debug("formulas captured, url={}, found={}", task.getUrl(), elements.size());
    }

    private void saveImages(BrowserRuntimeContext context, Page page, Document document, ScrapeTaskTracker tracker) {
        List<String> sources = PageMetadataExtractor.imageSources(document, toggles.getMaxImages());
        for (int i = 0; i < sources.size(); i++) {
            context.checkpoint();
            String src = sources.get(i);
            try {
                PageResource resource = PageResourceFetcher.get(page, src, scrapeProperties.getProbeTimeoutMs());
                if (resource.status() >= 400 || !resource.hasBody()) {
                    tracker.recordFailure(ArtifactKind.IMAGE, src, "http status " + resource.status());
                    continue;
                }
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("src", src);
                metadata.put("imageIndex", i);
                tracker.recordSecondary(save(
                    context,
                    ArtifactKind.IMAGE,
                    resource.body(),
                    resource.mime(),
                    "image_" + i,
                    ScrapeMediaUtils.imageExtension(resource.mime(), src),
                    metadata
                ), src);
            } catch (PlaywrightException ex) {
                tracker.recordFailure(ArtifactKind.IMAGE, src, ex.getMessage());
            }
        }
    }

    private void saveLinkedPdfs(BrowserRuntimeContext context, Page page, Document document, ScrapeTaskTracker tracker) {
        List<String> links = PageMetadataExtractor.pdfLinks(document, toggles.getMaxPdfLinks());
        for (int i = 0; i < links.size(); i++) {
            context.checkpoint();
            String link = links.get(i);
            try {
                PageResource resource = PageResourceFetcher.get(page, link, scrapeProperties.getProbeTimeoutMs());
                if (resource.status() >= 400 || !resource.hasBody()) {
                    tracker.recordFailure(ArtifactKind.PDF, link, "http status " + resource.status());
                    continue;
                }
                if (!ScrapeMediaUtils.isPdf(resource.mime())) {
                    log.debug("linked resource is not a pdf, url={}, link={}, mime={}", task.getUrl(), link, resource.mime());
                    continue;
                }
                tracker.recordSecondary(save(context, ArtifactKind.PDF, resource.body(), resource.mime(), "pdf_" + i, null,
                    Map.of("source", link)), link);
            } catch (PlaywrightException ex) {
                tracker.recordFailure(ArtifactKind.PDF, link, ex.getMessage());
            }
        }
    }

    private void saveMetadata(BrowserRuntimeContext context, Document document, int statusCode, ScrapeTaskTracker tracker) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("url", task.getUrl());
        record.put("query", resultsStore.getSession().getQuery());
        record.put("timestamp", Instant.now().toString());
        record.put("mode", task.getMode() == null ? null : task.getMode().getValue());
        record.put("toggles", objectMapper.convertValue(toggles, Map.class));
        record.put("statusCode", statusCode);
        record.put("title", PageMetadataExtractor.title(document));
        record.put("description", PageMetadataExtractor.description(document));
        record.put("links", PageMetadataExtractor.links(document));
        record.put("savedArtifacts", tracker.savedArtifactPaths());
        record.put("artifactFailures", tracker.artifactFailureCount());
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record);
            tracker.recordSecondary(save(context, ArtifactKind.METADATA, content, "application/json", null, null, null), task.getUrl());
        } catch (JsonProcessingException ex) {
            tracker.recordFailure(ArtifactKind.METADATA, task.getUrl(), ex.getOriginalMessage());
        }
    }

    /**
     * Writes one artifact unless the task was cancelled while producing it.
     */
    private SaveResult save(BrowserRuntimeContext context, ArtifactKind kind, byte[] content, String contentType,
                            String variant, String extension, Map<String, Object> metadata) {
        context.checkpoint();
        return resultsStore.saveScrapedContent(ScrapedArtifact.builder()
            .url(task.getUrl())
            .kind(kind)
            .content(content)
            .contentType(contentType)
            .variant(variant)
            .extension(extension)
            .metadata(metadata)
            .build());
    }

}
