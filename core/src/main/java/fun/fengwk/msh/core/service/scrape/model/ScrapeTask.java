package fun.fengwk.msh.core.service.scrape.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class ScrapeTask {

    private String url;
    private ScrapeMode mode;

    /**
     * Full extraction, otherwise only the lightweight status pass.
     */
    private boolean fullExtraction;

}
