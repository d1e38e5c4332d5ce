package fun.fengwk.msh.core.service.scrape.runtime;

/**
 * Lifecycle of one scrape task.
 *
 * @author fengwk
 */
public enum ScrapeTaskState {

    PENDING,
    NAVIGATING,
    RENDERED,
    NAVIGATION_FAILED,
    EXTRACTING,
    SAVING,
    SUCCEEDED,
    PARTIALLY_FAILED,
    FAILED

}
