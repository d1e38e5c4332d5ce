package fun.fengwk.msh.core.facade.search;

import lombok.Getter;

/**
 * Provider failure. Transient failures are retried, permanent ones skip the provider.
 *
 * @author fengwk
 */
@Getter
public class SearchProviderException extends RuntimeException {

    private final String provider;
    private final boolean transientFailure;

    private SearchProviderException(String provider, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.transientFailure = transientFailure;
    }

    public static SearchProviderException transientFailure(String provider, String message, Throwable cause) {
        return new SearchProviderException(provider, true, message, cause);
    }

    public static SearchProviderException permanent(String provider, String message) {
        return new SearchProviderException(provider, false, message, null);
    }

    public static SearchProviderException permanent(String provider, String message, Throwable cause) {
        return new SearchProviderException(provider, false, message, cause);
    }

    public static boolean isTransient(Throwable error) {
        return error instanceof SearchProviderException ex && ex.isTransientFailure();
    }

}
