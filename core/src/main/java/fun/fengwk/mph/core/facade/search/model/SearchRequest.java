package fun.fengwk.mph.core.facade.search.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Price search request input, null fields fall back to the configured defaults.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchRequest {

    /**
     * Product query text.
     */
    String query;

    /**
     * Two letter country code.
     */
    String country;

    /**
     * Max number of results to return, 0 means unlimited.
     */
    Integer maxResults;

    /**
     * Total search budget shared by all selected providers.
     */
    Duration timeout;

    /**
     * Currency code prices are converted to.
     */
    String targetCurrency;

    /**
     * Provider names to keep, case-insensitive (empty means all).
     */
    List<String> includeSources;

    /**
     * Provider names to drop, case-insensitive.
     */
    List<String> excludeSources;

}
