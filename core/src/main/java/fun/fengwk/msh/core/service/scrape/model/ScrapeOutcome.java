package fun.fengwk.msh.core.service.scrape.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of one scrape task. Produced exactly once per submitted url.
 *
 * @author fengwk
 */
@Data
@Builder
public class ScrapeOutcome {

    private String url;
    private ScrapeStatus status;

    /**
     * True unless {@link #status} is {@link ScrapeStatus#FAILED}. Every path in
     * {@link #savedArtifactPaths} exists when this is true.
     */
    private boolean success;

    private boolean fullExtraction;
    private Integer statusCode;
    private List<String> savedArtifactPaths;
    private List<ArtifactFailure> artifactFailures;
    private ScrapeErrorKind errorKind;
    private String errorMessage;
    private long durationMs;

    public static ScrapeOutcome failed(String url, boolean fullExtraction, ScrapeErrorKind errorKind, String errorMessage) {
        return ScrapeOutcome.builder()
            .url(url)
            .status(ScrapeStatus.FAILED)
            .success(false)
            .fullExtraction(fullExtraction)
            .savedArtifactPaths(List.of())
            .artifactFailures(List.of())
            .errorKind(errorKind)
            .errorMessage(errorMessage)
            .build();
    }

}
