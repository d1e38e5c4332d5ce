package fun.fengwk.msh.core.service.scrape.model;

import fun.fengwk.msh.core.service.storage.ArtifactKind;
import lombok.Builder;
import lombok.Data;

/**
 * A secondary artifact that could not be saved.
 *
 * @author fengwk
 */
@Data
@Builder
public class ArtifactFailure {

    private ArtifactKind kind;

    /**
     * Resource the artifact came from, e.g. the image url.
     */
    private String source;

    private String message;

}
