package fun.fengwk.msh.core.service.storage;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * One piece of scraped content headed for the session directory.
 *
 * @author fengwk
 */
@Data
@Builder
public class ScrapedArtifact {

    private String url;
    private ArtifactKind kind;
    private byte[] content;

    /**
     * Defaults to the kind's content type.
     */
    private String contentType;

    /**
     * Distinguishes several artifacts of one kind for the same url, e.g. the image index.
     */
    private String variant;

    /**
     * Defaults to the kind's extension.
     */
    private String extension;

    /**
     * Extra fields recorded in the sidecar.
     */
    private Map<String, Object> metadata;

}
