package fun.fengwk.mph.core.provider.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mph.core.provider.RawOffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads schema.org {@code Product} offers from JSON-LD script blocks.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonLdOfferExtractor {

    private static final String SCHEMA_PREFIX = "schema.org/";

    private final ObjectMapper objectMapper;

    public List<RawOffer> extract(Document document, String source, String defaultCurrency, Instant scrapedAt) {
        List<RawOffer> offers = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            try {
                JsonNode root = objectMapper.readTree(script.data());
                collect(root, document.location(), source, defaultCurrency, scrapedAt, offers);
            } catch (Exception ex) {
                log.debug("skip unreadable json-ld block, source={}, error={}", source, ex.getMessage());
            }
        }
        return offers;
    }

    private void collect(JsonNode node, String baseUrl, String source, String defaultCurrency, Instant scrapedAt, List<RawOffer> offers) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collect(child, baseUrl, source, defaultCurrency, scrapedAt, offers);
            }
            return;
        }
        if (node.has("@graph")) {
            collect(node.get("@graph"), baseUrl, source, defaultCurrency, scrapedAt, offers);
        }
        String type = textOrNull(node.get("@type"));
        if ("ItemList".equals(type)) {
            for (JsonNode element : node.path("itemListElement")) {
                collect(element.has("item") ? element.get("item") : element, baseUrl, source, defaultCurrency, scrapedAt, offers);
            }
        } else if ("Product".equals(type)) {
            RawOffer offer = toOffer(node, baseUrl, source, defaultCurrency, scrapedAt);
            if (offer != null) {
                offers.add(offer);
            }
        }
    }

    private RawOffer toOffer(JsonNode product, String baseUrl, String source, String defaultCurrency, Instant scrapedAt) {
        String name = textOrNull(product.get("name"));
        JsonNode offer = product.path("offers");
        if (offer.isArray()) {
            offer = offer.size() == 0 ? null : offer.get(0);
        }
        if (StringUtils.isBlank(name) || offer == null || offer.isMissingNode()) {
            return null;
        }
        String price = textOrNull(offer.has("price") ? offer.get("price") : offer.get("lowPrice"));
        if (StringUtils.isBlank(price)) {
            return null;
        }
        String link = firstNonBlank(textOrNull(offer.get("url")), textOrNull(product.get("url")), baseUrl);
        String currency = firstNonBlank(textOrNull(offer.get("priceCurrency")), defaultCurrency);

        JsonNode aggregateRating = product.path("aggregateRating");
        Double rating = aggregateRating.has("ratingValue") ? aggregateRating.get("ratingValue").asDouble() : null;
        Integer reviews = null;
        JsonNode reviewCount = aggregateRating.has("reviewCount") ? aggregateRating.get("reviewCount") : aggregateRating.get("ratingCount");
        if (reviewCount != null && !reviewCount.isNull()) {
            reviews = ListingPageParser.parseReviews(reviewCount.asText());
        }

        return RawOffer.builder()
            .link(link)
            .price(price)
            .currency(currency)
            .productName(name.trim())
            .availability(toAvailability(textOrNull(offer.get("availability"))))
            .rating(rating != null && rating >= 0 && rating <= 5 ? rating : null)
            .reviewsCount(reviews)
            .seller(textOrNull(offer.path("seller").get("name")))
            .imageUrl(imageOrNull(product.get("image")))
            .source(source)
            .scrapedAt(scrapedAt)
            .build();
    }

    private String toAvailability(String schemaValue) {
        if (StringUtils.isBlank(schemaValue)) {
            return "Available";
        }
        String value = schemaValue.contains(SCHEMA_PREFIX)
            ? schemaValue.substring(schemaValue.indexOf(SCHEMA_PREFIX) + SCHEMA_PREFIX.length())
            : schemaValue;
        switch (value) {
            case "InStock":
            case "InStoreOnly":
            case "OnlineOnly":
                return "In Stock";
            case "LimitedAvailability":
                return "Limited";
            case "OutOfStock":
            case "SoldOut":
            case "Discontinued":
                return "Out of Stock";
            case "PreOrder":
                return "Pre-order";
            default:
                return value;
        }
    }

    private String imageOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return node.size() == 0 ? null : imageOrNull(node.get(0));
        }
        if (node.isObject()) {
            return textOrNull(node.get("url"));
        }
        return node.asText();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

}
