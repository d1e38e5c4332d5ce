package fun.fengwk.msh.core.service.rank;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class RankedResult {

    private String url;

    /**
     * Relative to the batch it was ranked in, within [0, 1].
     */
    private double score;

}
