package fun.fengwk.msh.core.facade.search.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class CandidateUrl {

    private String url;

    /**
     * Provider that contributed the url.
     */
    private String provider;

}
