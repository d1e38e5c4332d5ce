package fun.fengwk.msh.core.facade.search;

import fun.fengwk.msh.core.facade.search.model.AggregatedSearchResult;

/**
 * @author fengwk
 */
public interface SearchFacade {

    /**
     * Collect candidate urls for a query. Never fails because of provider errors; an empty
     * aggregate means no provider produced anything.
     */
    AggregatedSearchResult search(String query, int maxResults);

}
