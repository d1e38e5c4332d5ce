package fun.fengwk.msh.core.service.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Low level file write used by {@link ResultsStore}.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface ArtifactWriter {

    void write(Path target, byte[] content) throws IOException;

}
