package fun.fengwk.msh.core.service.scrape.runtime;

import fun.fengwk.msh.core.service.scrape.model.ArtifactFailure;
import fun.fengwk.msh.core.service.scrape.model.ScrapeErrorKind;
import fun.fengwk.msh.core.service.scrape.model.ScrapeOutcome;
import fun.fengwk.msh.core.service.scrape.model.ScrapeStatus;
import fun.fengwk.msh.core.service.storage.ArtifactKind;
import fun.fengwk.msh.core.service.storage.SaveResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects state transitions and saved artifacts of one task and turns them into its outcome.
 *
 * @author fengwk
 */
@Slf4j
class ScrapeTaskTracker {

    private final String url;
    private final boolean fullExtraction;
    private final long startedAt = System.currentTimeMillis();
    private final List<String> savedArtifactPaths = new ArrayList<>();
    private final List<ArtifactFailure> artifactFailures = new ArrayList<>();

    @Getter
    private ScrapeTaskState state = ScrapeTaskState.PENDING;

    private Integer statusCode;

    ScrapeTaskTracker(String url, boolean fullExtraction) {
        this.url = url;
        this.fullExtraction = fullExtraction;
    }

    void transition(ScrapeTaskState next) {
        log.debug("scrape task transition, url={}, from={}, to={}", url, state, next);
        state = next;
    }

    void statusCode(int statusCode) {
        this.statusCode = statusCode;
    }

    List<String> savedArtifactPaths() {
        return List.copyOf(savedArtifactPaths);
    }

    int artifactFailureCount() {
        return artifactFailures.size();
    }

    /**
     * Record a secondary artifact, failures do not fail the task.
     */
    void recordSecondary(SaveResult result, String source) {
        if (result.isSaved()) {
            savedArtifactPaths.add(result.getPath().toString());
        } else {
            recordFailure(result.getKind(), source, result.getMessage());
        }
    }

    void recordFailure(ArtifactKind kind, String source, String message) {
        log.warn("artifact failed, url={}, kind={}, source={}, error={}", url, kind, source, message);
        artifactFailures.add(ArtifactFailure.builder().kind(kind).source(source).message(message).build());
    }

    /**
     * Record the primary artifact.
     *
     * @return true when saved, otherwise the task must end with {@link #primaryFailed(SaveResult)}
     */
    boolean recordPrimary(SaveResult result) {
        if (result.isSaved()) {
            savedArtifactPaths.add(result.getPath().toString());
            return true;
        }
        return false;
    }

    ScrapeOutcome primaryFailed(SaveResult result) {
        ScrapeErrorKind kind = result.isStorageUnavailable() ? ScrapeErrorKind.STORAGE_UNAVAILABLE : ScrapeErrorKind.SAVE;
        return fail(ScrapeTaskState.FAILED, kind, "primary content not saved: " + result.getMessage());
    }

    ScrapeOutcome navigationFailed(ScrapeErrorKind errorKind, String message) {
        return fail(ScrapeTaskState.NAVIGATION_FAILED, errorKind, message);
    }

    ScrapeOutcome finish() {
        ScrapeStatus status = artifactFailures.isEmpty() ? ScrapeStatus.SUCCEEDED : ScrapeStatus.PARTIALLY_FAILED;
        transition(status == ScrapeStatus.SUCCEEDED ? ScrapeTaskState.SUCCEEDED : ScrapeTaskState.PARTIALLY_FAILED);
        return ScrapeOutcome.builder()
            .url(url)
            .status(status)
            .success(true)
            .fullExtraction(fullExtraction)
            .statusCode(statusCode)
            .savedArtifactPaths(List.copyOf(savedArtifactPaths))
            .artifactFailures(List.copyOf(artifactFailures))
            .durationMs(System.currentTimeMillis() - startedAt)
            .build();
    }

    private ScrapeOutcome fail(ScrapeTaskState failedState, ScrapeErrorKind errorKind, String message) {
        transition(failedState);
        log.warn("scrape task failed, url={}, errorKind={}, error={}", url, errorKind, message);
        return ScrapeOutcome.builder()
            .url(url)
            .status(ScrapeStatus.FAILED)
            .success(false)
            .fullExtraction(fullExtraction)
            .statusCode(statusCode)
            .savedArtifactPaths(List.copyOf(savedArtifactPaths))
            .artifactFailures(List.copyOf(artifactFailures))
            .errorKind(errorKind)
            .errorMessage(message)
            .durationMs(System.currentTimeMillis() - startedAt)
            .build();
    }

}
