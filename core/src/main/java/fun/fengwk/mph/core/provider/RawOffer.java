package fun.fengwk.mph.core.provider;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One offer as returned by a provider, before any normalization.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class RawOffer {

    /**
     * Product page url.
     */
    String link;

    /**
     * Free text price, e.g. "$1,049.99" or "₹1,29,900".
     */
    String price;

    /**
     * Declared currency code, may be null.
     */
    String currency;

    String productName;

    @Builder.Default
    String availability = "In Stock";

    /**
     * Rating in [0, 5], null when unknown.
     */
    Double rating;

    /**
     * Reviews count, null when unknown.
     */
    Integer reviewsCount;

    String seller;

    /**
     * Free text shipping cost, null when unknown.
     */
    String shippingCost;

    String deliveryTime;

    String imageUrl;

    Map<String, String> specifications;

    @Builder.Default
    double confidenceScore = 1.0;

    /**
     * Name of the provider that produced this offer.
     */
    String source;

    Instant scrapedAt;

}
