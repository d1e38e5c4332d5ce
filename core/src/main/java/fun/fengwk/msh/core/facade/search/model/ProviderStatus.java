package fun.fengwk.msh.core.facade.search.model;

/**
 * @author fengwk
 */
public enum ProviderStatus {

    SUCCEEDED,

    /**
     * Transient failures exhausted the retry budget.
     */
    FAILED,

    /**
     * Permanent failure, no retry attempted.
     */
    SKIPPED,

    /**
     * Never called because enough candidates were already collected.
     */
    NOT_CONSULTED

}
