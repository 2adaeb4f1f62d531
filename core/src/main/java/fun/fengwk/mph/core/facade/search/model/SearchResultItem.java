package fun.fengwk.mph.core.facade.search.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Single ranked offer.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchResultItem {

    private String link;

    /**
     * Normalized price as plain numeric text with two decimals.
     */
    private String price;

    private String currency;

    private String productName;

    private String availability;

    private Double rating;

    private Integer reviewsCount;

    private String seller;

    private String shippingCost;

    private String deliveryTime;

    private String imageUrl;

    private Map<String, String> specifications;

    private double confidenceScore;

    private String source;

    private Instant scrapedAt;

    /**
     * Relevance to the query, in [0, 1].
     */
    private double similarityScore;

    /**
     * 1-based rank.
     */
    private int rank;

    /**
     * Id of the duplicate group this offer represents.
     */
    private String duplicateGroup;

}
