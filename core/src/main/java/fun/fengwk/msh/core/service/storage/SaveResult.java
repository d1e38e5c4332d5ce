package fun.fengwk.msh.core.service.storage;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Outcome of one guarded write. Failed writes are reported here instead of thrown.
 *
 * @author fengwk
 */
@Data
@Builder
public class SaveResult {

    private boolean saved;
    private ArtifactKind kind;
    private Path path;
    private Path metadataPath;
    private SaveFailure failure;
    private String message;

    public static SaveResult saved(ArtifactKind kind, Path path, Path metadataPath) {
        return SaveResult.builder().saved(true).kind(kind).path(path).metadataPath(metadataPath).build();
    }

    public static SaveResult failed(ArtifactKind kind, SaveFailure failure, String message) {
        return SaveResult.builder().saved(false).kind(kind).failure(failure).message(message).build();
    }

    public boolean isStorageUnavailable() {
        return failure == SaveFailure.STORAGE_UNAVAILABLE;
    }

}
