package fun.fengwk.mph.core.facade.search;

import fun.fengwk.mph.core.facade.search.model.SearchRequest;
import fun.fengwk.mph.core.facade.search.model.SearchResponse;

/**
 * @author fengwk
 */
public interface PriceSearchFacade {

    /**
     * Query every eligible provider and return the consolidated, ranked offers.
     *
     * @throws IllegalArgumentException if the request is structurally invalid
     */
    SearchResponse search(SearchRequest request);

}
