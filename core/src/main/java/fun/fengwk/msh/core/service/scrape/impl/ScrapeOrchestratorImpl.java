package fun.fengwk.msh.core.service.scrape.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.resilience.DispatchRateLimiter;
import fun.fengwk.msh.core.service.browser.runtime.BrowserTask;
import fun.fengwk.msh.core.service.browser.runtime.BrowserTaskExecutor;
import fun.fengwk.msh.core.service.browser.runtime.BrowserTaskSignal;
import fun.fengwk.msh.core.service.scrape.ScrapeOrchestrator;
import fun.fengwk.msh.core.service.scrape.ScrapeProperties;
import fun.fengwk.msh.core.service.scrape.model.ScrapeBatchReport;
import fun.fengwk.msh.core.service.scrape.model.ScrapeErrorKind;
import fun.fengwk.msh.core.service.scrape.model.ScrapeMode;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOutcome;
import fun.fengwk.msh.core.service.scrape.model.ScrapeTask;
import fun.fengwk.msh.core.service.scrape.model.ScrapeToggles;
import fun.fengwk.msh.core.service.scrape.runtime.ProbeBrowserTask;
import fun.fengwk.msh.core.service.scrape.runtime.ScrapeBrowserTask;
import fun.fengwk.msh.core.service.storage.ResultsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches scrape tasks in submission order under a concurrency bound and a start rate
 * limit. Each task has its own deadline, counted from when a browser worker picks it up;
 * failures become outcomes.
 *
 * @author fengwk
 */
@Slf4j
@Service
public class ScrapeOrchestratorImpl implements ScrapeOrchestrator {

    private final ScrapeProperties scrapeProperties;
    private final BrowserTaskExecutor browserTaskExecutor;
    private final ObjectMapper objectMapper;
    private final Semaphore permits;
    private final DispatchRateLimiter rateLimiter;

    public ScrapeOrchestratorImpl(ScrapeProperties scrapeProperties,
                                  BrowserTaskExecutor browserTaskExecutor,
                                  ObjectMapper objectMapper) {
        scrapeProperties.validate();
        this.scrapeProperties = scrapeProperties;
        this.browserTaskExecutor = browserTaskExecutor;
        this.objectMapper = objectMapper;
        this.permits = new Semaphore(scrapeProperties.getMaxConcurrent(), true);
        this.rateLimiter = new DispatchRateLimiter(Duration.ofMillis(scrapeProperties.getRateLimit().getDelayMs()));
    }

    @Override
    public ScrapeBatchReport scrape(List<String> urls, int scrapeTopN, ScrapeMode mode, ResultsStore resultsStore) {
        ScrapeMode effectiveMode = mode == null ? scrapeProperties.resolveDefaultMode() : mode;
        if (urls == null || urls.isEmpty()) {
            return ScrapeBatchReport.of(effectiveMode, List.of());
        }
        ScrapeToggles toggles = scrapeProperties.resolveToggles(effectiveMode);
        if (!resultsStore.isReady()) {
            try {
                resultsStore.ensureDirectoriesReady();
            } catch (IllegalStateException ex) {
                log.error("results store not ready, session={}, error={}", resultsStore.getSession().getRoot(), ex.getMessage());
            }
        }

        log.info("scrape batch started, urls={}, topN={}, mode={}, maxConcurrent={}",
            urls.size(), scrapeTopN, effectiveMode.getValue(), scrapeProperties.getMaxConcurrent());

        List<CompletableFuture<ScrapeOutcome>> futures = new ArrayList<>(urls.size());
        List<CompletableFuture<?>> workerRuns = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            ScrapeTask task = ScrapeTask.builder()
                .url(urls.get(i))
                .mode(effectiveMode)
                .fullExtraction(i < scrapeTopN)
                .build();
            boolean permitted = false;
            try {
                permits.acquire();
                permitted = true;
                rateLimiter.acquire();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                if (permitted) {
                    permits.release();
                }
                log.warn("scrape dispatch interrupted, dispatched={}, total={}", i, urls.size());
                for (int j = i; j < urls.size(); j++) {
                    futures.add(CompletableFuture.completedFuture(
                        ScrapeOutcome.failed(urls.get(j), j < scrapeTopN, ScrapeErrorKind.INTERNAL, "dispatch interrupted")));
                }
                break;
            }
            workerRuns.add(submit(task, toggles, resultsStore, futures));
        }

        List<ScrapeOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<ScrapeOutcome> future : futures) {
            outcomes.add(future.join());
        }
        // timed out tasks may still be running until their next checkpoint
        awaitWorkers(workerRuns);
        ScrapeBatchReport report = ScrapeBatchReport.of(effectiveMode, outcomes);
        log.info("scrape batch completed, total={}, succeeded={}, partiallyFailed={}, failed={}",
            report.total(), report.getSucceeded(), report.getPartiallyFailed(), report.getFailed());
        return report;
    }

    /**
     * Hand one task to the browser workers and add its outcome future to {@code outcomes}.
     * The deadline starts when a worker picks the task up, and the dispatch permit is held
     * until the worker is done with it, even past the deadline.
     *
     * @return the worker side future, completed when the worker has finished the task
     */
    private CompletableFuture<ScrapeOutcome> submit(ScrapeTask task, ScrapeToggles toggles, ResultsStore resultsStore,
                                                    List<CompletableFuture<ScrapeOutcome>> outcomes) {
        BrowserTaskSignal signal = new BrowserTaskSignal();
        BrowserTask<ScrapeOutcome> browserTask = task.isFullExtraction()
            ? new ScrapeBrowserTask(task, toggles, scrapeProperties, resultsStore, objectMapper)
            : new ProbeBrowserTask(task, toggles, scrapeProperties, resultsStore);

        CompletableFuture<ScrapeOutcome> submitted;
        try {
            submitted = browserTaskExecutor.submit(browserTask, signal);
        } catch (RuntimeException ex) {
            submitted = CompletableFuture.failedFuture(ex);
        }

        long startedAt = System.currentTimeMillis();
        long timeoutMs = scrapeProperties.getTaskTimeoutMs();
        CompletableFuture<ScrapeOutcome> deadline = new CompletableFuture<>();
        signal.whenStarted(() -> deadline.orTimeout(timeoutMs, TimeUnit.MILLISECONDS));
        submitted.whenComplete((outcome, error) -> {
            permits.release();
            if (error == null) {
                deadline.complete(outcome);
            } else {
                deadline.completeExceptionally(error);
            }
        });

        outcomes.add(deadline.handle((outcome, error) -> {
            if (error == null && outcome != null) {
                return outcome;
            }
            Throwable cause = unwrap(error);
            ScrapeOutcome failed;
            if (cause instanceof TimeoutException) {
                signal.cancel("task timed out");
                failed = ScrapeOutcome.failed(task.getUrl(), task.isFullExtraction(), ScrapeErrorKind.TIMEOUT,
                    "task timed out after " + timeoutMs + "ms");
            } else if (cause instanceof CancellationException) {
                failed = ScrapeOutcome.failed(task.getUrl(), task.isFullExtraction(), ScrapeErrorKind.TIMEOUT,
                    "task cancelled: " + cause.getMessage());
            } else {
                failed = ScrapeOutcome.failed(task.getUrl(), task.isFullExtraction(), ScrapeErrorKind.INTERNAL,
                    cause == null ? "task produced no outcome" : cause.getMessage());
            }
            failed.setDurationMs(System.currentTimeMillis() - startedAt);
            log.warn("scrape task failed, url={}, errorKind={}, error={}",
                task.getUrl(), failed.getErrorKind(), failed.getErrorMessage());
            return failed;
        }));
        return submitted;
    }

    private static void awaitWorkers(List<CompletableFuture<?>> workerRuns) {
        for (CompletableFuture<?> run : workerRuns) {
            try {
                run.join();
            } catch (CompletionException | CancellationException ex) {
                log.debug("scrape task ended after its outcome, error={}", ex.getMessage());
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

}
