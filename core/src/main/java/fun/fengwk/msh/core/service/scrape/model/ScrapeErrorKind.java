package fun.fengwk.msh.core.service.scrape.model;

/**
 * @author fengwk
 */
public enum ScrapeErrorKind {

    TIMEOUT,
    NAVIGATION,
    HTTP_STATUS,
    SAVE,
    STORAGE_UNAVAILABLE,
    INTERNAL

}
