package fun.fengwk.mph.core.facade.search.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Consolidated price search response.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchResponse {

    /**
     * Ranked results, ordered by rank.
     */
    private List<SearchResultItem> results;

    private int totalResults;

    /**
     * Elapsed wall-clock time in seconds.
     */
    private double searchTime;

    /**
     * Providers that answered without failing or timing out, in dispatch order.
     */
    private List<String> sourcesUsed;

    /**
     * Providers that failed, mapped to {@code timeout} or the fault message.
     */
    private Map<String, String> failedSources;

    /**
     * Raw offers collected from all providers.
     */
    private int collectedOffers;

    /**
     * Offers dropped for an unparseable price.
     */
    private int droppedOffers;

    private String query;

    private String country;

    private Instant timestamp;

}
