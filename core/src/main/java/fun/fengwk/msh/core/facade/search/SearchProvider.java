package fun.fengwk.msh.core.facade.search;

import java.util.List;

/**
 * One external search API.
 *
 * @author fengwk
 */
public interface SearchProvider {

    /**
     * Provider name as referenced by {@code msh.search.fallback-order}.
     */
    String name();

    /**
     * Search candidate urls, best first.
     *
     * @param query search query
     * @param maxResults result cap
     * @return ordered urls, never null
     * @throws SearchProviderException on transport, auth or response failures
     */
    List<String> search(String query, int maxResults);

}
