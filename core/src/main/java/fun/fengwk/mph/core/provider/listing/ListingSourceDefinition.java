package fun.fengwk.mph.core.provider.listing;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data-driven description of one listing source.
 *
 * @author fengwk
 */
@Data
public class ListingSourceDefinition {

    /**
     * Provider name, e.g. eBay.
     */
    private String name;

    /**
     * Priority for supported countries, lower is better.
     */
    private int priority = 1;

    /**
     * Markets keyed by upper-case country code.
     */
    private Map<String, ListingMarket> markets = new LinkedHashMap<>();

    private ListingSelectors selectors = new ListingSelectors();

    /**
     * Titles containing any of these keywords (case-insensitive) are skipped, e.g. ad tiles.
     */
    private List<String> skipTitleKeywords = new ArrayList<>();

    /**
     * Max offers parsed from one page.
     */
    private int maxItems = 15;

    /**
     * Minimum interval between two requests of this source, 0 disables throttling.
     */
    private long minRequestIntervalMs = 2000;

    /**
     * Request timeout in milliseconds.
     */
    private int requestTimeoutMs = 25000;

    /**
     * Availability reported when the page has no availability selector or text.
     */
    private String defaultAvailability = "Available";

    @Data
    public static class ListingMarket {

        /**
         * Search url template, {@code {query}} is replaced by the url-encoded query.
         */
        private String searchUrl;

        /**
         * Currency the market lists prices in.
         */
        private String currency;

    }

    @Data
    public static class ListingSelectors {

        private String item;
        private String title;
        private String price;
        private String link;
        private String image;
        private String shipping;
        private String seller;
        private String rating;
        private String reviews;
        private String availability;

    }

}
