package fun.fengwk.msh.core.service.scrape.model;

/**
 * @author fengwk
 */
public enum ScrapeStatus {

    SUCCEEDED,

    /**
     * Primary content saved, at least one secondary artifact failed.
     */
    PARTIALLY_FAILED,

    FAILED

}
