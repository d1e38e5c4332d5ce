package fun.fengwk.msh.core.service.storage;

/**
 * @author fengwk
 */
public enum SaveFailure {

    /**
     * The write was attempted and failed.
     */
    IO_ERROR,

    /**
     * The circuit breaker is open, nothing was attempted.
     */
    STORAGE_UNAVAILABLE

}
