package fun.fengwk.msh.core.service.scrape.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.APIRequestContext;
import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.RequestOptions;
import fun.fengwk.msh.core.service.browser.runtime.BrowserRuntimeContext;
import fun.fengwk.msh.core.service.browser.runtime.BrowserTaskSignal;
import fun.fengwk.msh.core.service.scrape.ScrapeProperties;
import fun.fengwk.msh.core.service.scrape.model.ScrapeErrorKind;
import fun.fengwk.msh.core.service.scrape.model.ScrapeMode;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOutcome;
import fun.fengwk.msh.core.service.scrape.model.ScrapeStatus;
import fun.fengwk.msh.core.service.scrape.model.ScrapeTask;
import fun.fengwk.msh.core.service.storage.ArtifactKind;
import fun.fengwk.msh.core.service.storage.CircuitBreakerProperties;
import fun.fengwk.msh.core.service.storage.DirectoryProperties;
import fun.fengwk.msh.core.service.storage.ResultsStore;
import fun.fengwk.msh.core.service.storage.ResultsStoreFactory;
import fun.fengwk.msh.core.service.storage.SaveFailure;
import fun.fengwk.msh.core.service.storage.SaveResult;
import fun.fengwk.msh.core.service.storage.ScrapedArtifact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class ScrapeBrowserTaskTest {

    private static final String URL = "https://example.com/article";

    private static final String HTML = """
        <html><head>
          <title>BM25 explained</title>
          <meta name="description" content="How BM25 ranks documents">
        </head><body>
          <h1>BM25</h1>
          <p>Term frequency saturation and length normalization.</p>
          <img src="/img/chart.png">
          <img src="data:image/png;base64,AAAA">
          <a href="/paper.pdf">paper</a>
          <a href="https://other.test/page">other</a>
          <a href="#top">top</a>
        </body></html>
        """;

    @TempDir
    Path tempDir;

    @Mock
    private Page page;

    @Mock
    private Response navigateResponse;

    @Mock
    private APIRequestContext apiRequestContext;

    @Mock
    private ElementHandle formula;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScrapeProperties properties = new ScrapeProperties();
    private ResultsStore resultsStore;

    @BeforeEach
    void setUp() {
        DirectoryProperties directories = new DirectoryProperties();
        directories.setBase(tempDir.toString());
        resultsStore = new ResultsStoreFactory(directories, new CircuitBreakerProperties(), objectMapper).open("bm25");
        lenient().when(page.request()).thenReturn(apiRequestContext);
    }

    @Test
    public void shouldSaveAllArtifactsOfRenderedPage() throws Exception {
        stubRenderedPage(200);
        when(page.querySelectorAll(properties.getFormulaSelector())).thenReturn(List.of(formula));
        when(formula.screenshot(any(ElementHandle.ScreenshotOptions.class))).thenReturn(new byte[] {9, 9});
        APIResponse image = apiResponse(200, "image/png", new byte[] {1, 2, 3});
        when(apiRequestContext.get(eq("https://example.com/img/chart.png"), any(RequestOptions.class))).thenReturn(image);

        ScrapeOutcome outcome = newTask(ScrapeMode.STANDARD).execute(context(new BrowserTaskSignal()));

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.SUCCEEDED);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isFullExtraction()).isTrue();
        assertThat(outcome.getStatusCode()).isEqualTo(200);
        assertThat(outcome.getArtifactFailures()).isEmpty();
        assertThat(outcome.getSavedArtifactPaths()).hasSize(5);
        assertThat(outcome.getSavedArtifactPaths()).allSatisfy(path -> assertThat(Path.of(path)).exists());
        assertThat(outcome.getSavedArtifactPaths().get(0)).endsWith(".html");
        assertThat(outcome.getSavedArtifactPaths().get(1)).endsWith(".txt");
        assertThat(outcome.getSavedArtifactPaths().get(2)).endsWith("_formula_0.png");
        assertThat(outcome.getSavedArtifactPaths().get(3)).endsWith("_image_0.png");
        assertThat(outcome.getSavedArtifactPaths().get(4)).endsWith(".json");
        verify(image).dispose();
        // linked pdfs are only followed in deep mode
        verify(apiRequestContext, never()).get(eq("https://example.com/paper.pdf"), any(RequestOptions.class));

        JsonNode metadata = objectMapper.readTree(Path.of(outcome.getSavedArtifactPaths().get(4)).toFile());
        assertThat(metadata.path("title").asText()).isEqualTo("BM25 explained");
        assertThat(metadata.path("description").asText()).isEqualTo("How BM25 ranks documents");
        assertThat(metadata.path("query").asText()).isEqualTo("bm25");
        assertThat(metadata.path("mode").asText()).isEqualTo("standard");
        assertThat(metadata.path("links")).hasSize(2);
    }

    @Test
    public void shouldFollowLinkedPdfsInDeepMode() {
        stubRenderedPage(200);
        when(page.querySelectorAll(anyString())).thenReturn(List.of());
        APIResponse image = apiResponse(200, "image/png", new byte[] {1});
        APIResponse pdf = apiResponse(200, "application/pdf", "%PDF-1.4".getBytes(StandardCharsets.US_ASCII));
        when(apiRequestContext.get(eq("https://example.com/img/chart.png"), any(RequestOptions.class))).thenReturn(image);
        when(apiRequestContext.get(eq("https://example.com/paper.pdf"), any(RequestOptions.class))).thenReturn(pdf);

        ScrapeOutcome outcome = newTask(ScrapeMode.DEEP).execute(context(new BrowserTaskSignal()));

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.SUCCEEDED);
        assertThat(outcome.getSavedArtifactPaths()).anySatisfy(path -> assertThat(path).endsWith("_pdf_0.pdf"));
    }

    @Test
    public void shouldReportPartialFailureWhenSecondaryArtifactFails() {
        stubRenderedPage(200);
        when(page.querySelectorAll(anyString())).thenThrow(new PlaywrightException("selector engine crashed"));
        APIResponse image = apiResponse(404, "text/html", null);
        when(apiRequestContext.get(eq("https://example.com/img/chart.png"), any(RequestOptions.class))).thenReturn(image);

        ScrapeOutcome outcome = newTask(ScrapeMode.STANDARD).execute(context(new BrowserTaskSignal()));

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.PARTIALLY_FAILED);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getArtifactFailures()).extracting(failure -> failure.getKind())
            .containsExactly(ArtifactKind.FORMULA, ArtifactKind.IMAGE);
        assertThat(outcome.getSavedArtifactPaths()).hasSize(3);
        assertThat(outcome.getSavedArtifactPaths()).allSatisfy(path -> assertThat(Path.of(path)).exists());
    }

    @Test
    public void shouldSaveOnlyTextInTextOnlyMode() {
        stubRenderedPage(200);

        ScrapeOutcome outcome = newTask(ScrapeMode.TEXT_ONLY).execute(context(new BrowserTaskSignal()));

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.SUCCEEDED);
        assertThat(outcome.getSavedArtifactPaths()).hasSize(2);
        assertThat(outcome.getSavedArtifactPaths().get(0)).endsWith(".txt");
        verify(page, never()).querySelectorAll(anyString());
        verify(apiRequestContext, never()).get(anyString(), any(RequestOptions.class));
    }

    @Test
    public void shouldFailOnHttpErrorStatus() {
        when(navigateResponse.status()).thenReturn(404);
        when(page.navigate(eq(URL), any(Page.NavigateOptions.class))).thenReturn(navigateResponse);

        ScrapeOutcome outcome = newTask(ScrapeMode.STANDARD).execute(context(new BrowserTaskSignal()));

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.FAILED);
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getErrorKind()).isEqualTo(ScrapeErrorKind.HTTP_STATUS);
        assertThat(outcome.getStatusCode()).isEqualTo(404);
        assertThat(outcome.getSavedArtifactPaths()).isEmpty();
        verify(page, never()).content();
    }

    @Test
    public void shouldMapNavigationErrors() {
        when(page.navigate(eq(URL), any(Page.NavigateOptions.class)))
            .thenThrow(new TimeoutError("Timeout 30000ms exceeded"))
            .thenThrow(new PlaywrightException("net::ERR_NAME_NOT_RESOLVED"));

        ScrapeOutcome timedOut = newTask(ScrapeMode.STANDARD).execute(context(new BrowserTaskSignal()));
        ScrapeOutcome unresolved = newTask(ScrapeMode.STANDARD).execute(context(new BrowserTaskSignal()));

        assertThat(timedOut.getErrorKind()).isEqualTo(ScrapeErrorKind.TIMEOUT);
        assertThat(unresolved.getErrorKind()).isEqualTo(ScrapeErrorKind.NAVIGATION);
        assertThat(unresolved.getErrorMessage()).contains("ERR_NAME_NOT_RESOLVED");
    }

    @Test
    public void shouldCaptureDownloadWhenNavigationStartsDownload() {
        when(page.navigate(eq(URL), any(Page.NavigateOptions.class)))
            .thenThrow(new PlaywrightException("Download is starting"));
        APIResponse pdf = apiResponse(200, "application/pdf", "%PDF-1.7".getBytes(StandardCharsets.US_ASCII));
        when(apiRequestContext.get(eq(URL), any(RequestOptions.class))).thenReturn(pdf);

        ScrapeOutcome outcome = newTask(ScrapeMode.STANDARD).execute(context(new BrowserTaskSignal()));

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.SUCCEEDED);
        assertThat(outcome.getSavedArtifactPaths()).singleElement().satisfies(path -> assertThat(path).endsWith(".pdf"));
    }

    @Test
    public void shouldFetchPdfUrlWithoutRendering() {
        String pdfUrl = "https://example.com/paper.pdf?download=1";
        APIResponse pdf = apiResponse(200, "application/pdf", "%PDF-1.7".getBytes(StandardCharsets.US_ASCII));
        when(apiRequestContext.get(eq(pdfUrl), any(RequestOptions.class))).thenReturn(pdf);
        ScrapeTask task = ScrapeTask.builder().url(pdfUrl).mode(ScrapeMode.STANDARD).fullExtraction(true).build();

        ScrapeOutcome outcome = new ScrapeBrowserTask(task, properties.resolveToggles(ScrapeMode.STANDARD), properties,
            resultsStore, objectMapper).execute(context(new BrowserTaskSignal()));

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.SUCCEEDED);
        assertThat(outcome.getSavedArtifactPaths()).hasSize(1);
        verify(page, never()).navigate(anyString(), any(Page.NavigateOptions.class));
    }

    @Test
    public void shouldFailWhenPrimaryContentNotSaved() {
        stubRenderedPage(200);
        ResultsStore failingStore = mock(ResultsStore.class);
        when(failingStore.saveScrapedContent(any(ScrapedArtifact.class)))
            .thenReturn(SaveResult.failed(ArtifactKind.HTML, SaveFailure.STORAGE_UNAVAILABLE, "storage unavailable"));
        ScrapeTask task = ScrapeTask.builder().url(URL).mode(ScrapeMode.STANDARD).fullExtraction(true).build();

        ScrapeOutcome outcome = new ScrapeBrowserTask(task, properties.resolveToggles(ScrapeMode.STANDARD), properties,
            failingStore, objectMapper).execute(context(new BrowserTaskSignal()));

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.FAILED);
        assertThat(outcome.getErrorKind()).isEqualTo(ScrapeErrorKind.STORAGE_UNAVAILABLE);
        assertThat(outcome.getSavedArtifactPaths()).isEmpty();
        verify(page, never()).querySelectorAll(anyString());
    }

    @Test
    public void shouldStopWhenCancelled() {
        BrowserTaskSignal signal = new BrowserTaskSignal();
        signal.cancel("task timed out");

        assertThatThrownBy(() -> newTask(ScrapeMode.STANDARD).execute(context(signal)))
            .isInstanceOf(CancellationException.class);
        verify(page, never()).navigate(anyString(), any(Page.NavigateOptions.class));
    }

    @Test
    public void shouldNotSaveWhenCancelledDuringFetch() {
        String pdfUrl = "https://example.com/doc.pdf";
        BrowserTaskSignal signal = new BrowserTaskSignal();
        APIResponse pdf = apiResponse(200, "application/pdf", "%PDF-1.7".getBytes(StandardCharsets.US_ASCII));
        when(apiRequestContext.get(eq(pdfUrl), any(RequestOptions.class))).thenAnswer(invocation -> {
            signal.cancel("task timed out");
            return pdf;
        });
        ResultsStore store = mock(ResultsStore.class);
        ScrapeTask task = ScrapeTask.builder().url(pdfUrl).mode(ScrapeMode.STANDARD).fullExtraction(true).build();
        ScrapeBrowserTask scrapeTask = new ScrapeBrowserTask(task, properties.resolveToggles(ScrapeMode.STANDARD),
            properties, store, objectMapper);

        assertThatThrownBy(() -> scrapeTask.execute(context(signal)))
            .isInstanceOf(CancellationException.class)
            .hasMessage("task timed out");
        verify(store, never()).saveScrapedContent(any(ScrapedArtifact.class));
    }

    @Test
    public void shouldNotSaveImageFetchedAfterCancellation() throws Exception {
        stubRenderedPage(200);
        BrowserTaskSignal signal = new BrowserTaskSignal();
        when(page.querySelectorAll(anyString())).thenReturn(List.of());
        APIResponse image = apiResponse(200, "image/png", new byte[] {1, 2, 3});
        when(apiRequestContext.get(eq("https://example.com/img/chart.png"), any(RequestOptions.class)))
            .thenAnswer(invocation -> {
                signal.cancel("task timed out");
                return image;
            });

        assertThatThrownBy(() -> newTask(ScrapeMode.STANDARD).execute(context(signal)))
            .isInstanceOf(CancellationException.class);
        try (Stream<Path> files = Files.walk(resultsStore.getSession().getRoot())) {
            assertThat(files.map(Path::toString).filter(path -> path.contains("_image_"))).isEmpty();
        }
    }

    private void stubRenderedPage(int status) {
        when(navigateResponse.status()).thenReturn(status);
        when(page.navigate(eq(URL), any(Page.NavigateOptions.class))).thenReturn(navigateResponse);
        when(page.content()).thenReturn(HTML);
    }

    private ScrapeBrowserTask newTask(ScrapeMode mode) {
        ScrapeTask task = ScrapeTask.builder().url(URL).mode(mode).fullExtraction(true).build();
        return new ScrapeBrowserTask(task, properties.resolveToggles(mode), properties, resultsStore, objectMapper);
    }

    private BrowserRuntimeContext context(BrowserTaskSignal signal) {
        return BrowserRuntimeContext.builder().page(page).signal(signal).build();
    }

    private static APIResponse apiResponse(int status, String contentType, byte[] body) {
        APIResponse response = mock(APIResponse.class);
        when(response.status()).thenReturn(status);
        when(response.headers()).thenReturn(Map.of("content-type", contentType));
        if (status < 400) {
            when(response.body()).thenReturn(body);
        }
        return response;
    }

}
