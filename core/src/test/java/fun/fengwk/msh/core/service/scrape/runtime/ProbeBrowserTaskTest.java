package fun.fengwk.msh.core.service.scrape.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.APIRequestContext;
import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.Page;
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
import fun.fengwk.msh.core.service.storage.CircuitBreakerProperties;
import fun.fengwk.msh.core.service.storage.DirectoryProperties;
import fun.fengwk.msh.core.service.storage.ResultsStore;
import fun.fengwk.msh.core.service.storage.ResultsStoreFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class ProbeBrowserTaskTest {

    private static final String URL = "https://example.com/report";

    @TempDir
    Path tempDir;

    @Mock
    private Page page;

    @Mock
    private APIRequestContext apiRequestContext;

    @Mock
    private APIResponse apiResponse;

    private final ScrapeProperties properties = new ScrapeProperties();
    private ResultsStore resultsStore;

    @BeforeEach
    void setUp() {
        DirectoryProperties directories = new DirectoryProperties();
        directories.setBase(tempDir.toString());
        resultsStore = new ResultsStoreFactory(directories, new CircuitBreakerProperties(), new ObjectMapper()).open("probe");
        lenient().when(page.request()).thenReturn(apiRequestContext);
    }

    @Test
    public void shouldSucceedWithoutArtifactsForHtmlPage() {
        stubResponse(200, "text/html; charset=utf-8", "<html></html>".getBytes(StandardCharsets.UTF_8));

        ScrapeOutcome outcome = probe(ScrapeMode.STANDARD);

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.SUCCEEDED);
        assertThat(outcome.isFullExtraction()).isFalse();
        assertThat(outcome.getStatusCode()).isEqualTo(200);
        assertThat(outcome.getSavedArtifactPaths()).isEmpty();
        verify(page, never()).navigate(anyString(), any(Page.NavigateOptions.class));
        verify(apiResponse).dispose();
    }

    @Test
    public void shouldFailOnHttpErrorStatus() {
        when(apiResponse.status()).thenReturn(404);
        when(apiResponse.headers()).thenReturn(Map.of());
        when(apiRequestContext.get(eq(URL), any(RequestOptions.class))).thenReturn(apiResponse);

        ScrapeOutcome outcome = probe(ScrapeMode.STANDARD);

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.FAILED);
        assertThat(outcome.getErrorKind()).isEqualTo(ScrapeErrorKind.HTTP_STATUS);
        assertThat(outcome.getStatusCode()).isEqualTo(404);
        verify(apiResponse, never()).body();
    }

    @Test
    public void shouldMapRequestTimeout() {
        when(apiRequestContext.get(eq(URL), any(RequestOptions.class))).thenThrow(new TimeoutError("Request timed out"));

        ScrapeOutcome outcome = probe(ScrapeMode.STANDARD);

        assertThat(outcome.getErrorKind()).isEqualTo(ScrapeErrorKind.TIMEOUT);
        assertThat(outcome.isSuccess()).isFalse();
    }

    @Test
    public void shouldSavePdfBody() {
        stubResponse(200, "application/pdf", "%PDF-1.5".getBytes(StandardCharsets.US_ASCII));

        ScrapeOutcome outcome = probe(ScrapeMode.STANDARD);

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.SUCCEEDED);
        assertThat(outcome.getSavedArtifactPaths()).singleElement().satisfies(path -> {
            assertThat(path).endsWith(".pdf");
            assertThat(Files.exists(Path.of(path))).isTrue();
        });
    }

    @Test
    public void shouldNotSavePdfWhenModeDisablesPdfs() {
        stubResponse(200, "application/pdf", "%PDF-1.5".getBytes(StandardCharsets.US_ASCII));

        ScrapeOutcome outcome = probe(ScrapeMode.TEXT_ONLY);

        assertThat(outcome.getStatus()).isEqualTo(ScrapeStatus.SUCCEEDED);
        assertThat(outcome.getSavedArtifactPaths()).isEmpty();
    }

    private void stubResponse(int status, String contentType, byte[] body) {
        when(apiResponse.status()).thenReturn(status);
        when(apiResponse.headers()).thenReturn(Map.of("Content-Type", contentType));
        when(apiResponse.body()).thenReturn(body);
        when(apiRequestContext.get(eq(URL), any(RequestOptions.class))).thenReturn(apiResponse);
    }

    private ScrapeOutcome probe(ScrapeMode mode) {
        ScrapeTask task = ScrapeTask.builder().url(URL).mode(mode).fullExtraction(false).build();
        BrowserRuntimeContext context = BrowserRuntimeContext.builder()
            .page(page)
            .signal(new BrowserTaskSignal())
            .build();
        return new ProbeBrowserTask(task, properties.resolveToggles(mode), properties, resultsStore).execute(context);
    }

}
