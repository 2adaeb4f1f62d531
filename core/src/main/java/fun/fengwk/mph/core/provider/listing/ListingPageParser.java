package fun.fengwk.mph.core.provider.listing;

import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.provider.listing.ListingSourceDefinition.ListingMarket;
import fun.fengwk.mph.core.provider.listing.ListingSourceDefinition.ListingSelectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses listing pages into raw offers with CSS selectors, falling back to JSON-LD.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListingPageParser {

    private static final Pattern DECIMAL_PATTERN = Pattern.compile("(\\d+(?:[.,]\\d+)?)");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("(\\d[\\d,.\\s]*)");

    private final JsonLdOfferExtractor jsonLdOfferExtractor;

    public List<RawOffer> parse(String html, String baseUrl, ListingSourceDefinition definition, ListingMarket market) {
        Document document = Jsoup.parse(html == null ? "" : html, baseUrl == null ? "" : baseUrl);
        Instant scrapedAt = Instant.now();
        ListingSelectors selectors = definition.getSelectors();

        List<RawOffer> offers = new ArrayList<>();
        Elements items = selectors == null || StringUtils.isBlank(selectors.getItem())
            ? new Elements()
            : document.select(selectors.getItem());
        for (Element item : items) {
            if (offers.size() >= definition.getMaxItems()) {
                break;
            }
            RawOffer offer = parseItem(item, definition, market, scrapedAt);
            if (offer != null) {
                offers.add(offer);
            }
        }

        if (items.isEmpty()) {
            // No item container matched, the page may only expose structured data.
            List<RawOffer> structured = jsonLdOfferExtractor.extract(document, definition.getName(), market.getCurrency(), scrapedAt);
            for (RawOffer offer : structured) {
                if (offers.size() >= definition.getMaxItems()) {
                    break;
                }
                if (!shouldSkipTitle(offer.getProductName(), definition)) {
                    offers.add(offer);
                }
            }
        }
        log.debug("listing page parsed, source={}, items={}, offers={}", definition.getName(), items.size(), offers.size());
        return offers;
    }

    private RawOffer parseItem(Element item, ListingSourceDefinition definition, ListingMarket market, Instant scrapedAt) {
        ListingSelectors selectors = definition.getSelectors();
        String title = selectText(item, selectors.getTitle());
        if (StringUtils.isBlank(title) || shouldSkipTitle(title, definition)) {
            return null;
        }
        String price = selectText(item, selectors.getPrice());
        if (StringUtils.isBlank(price)) {
            return null;
        }
        String link = selectLink(item, selectors.getLink());
        if (StringUtils.isBlank(link)) {
            return null;
        }

        String availability = selectText(item, selectors.getAvailability());
        return RawOffer.builder()
            .link(link)
            .price(price)
            .currency(market.getCurrency())
            .productName(title)
            .availability(StringUtils.isBlank(availability) ? definition.getDefaultAvailability() : availability)
            .rating(parseRating(item, selectors.getRating()))
            .reviewsCount(parseReviews(selectText(item, selectors.getReviews())))
            .seller(selectText(item, selectors.getSeller()))
            .shippingCost(normalizeShipping(selectText(item, selectors.getShipping())))
            .imageUrl(selectImage(item, selectors.getImage()))
            .source(definition.getName())
            .scrapedAt(scrapedAt)
            .build();
    }

    private boolean shouldSkipTitle(String title, ListingSourceDefinition definition) {
        if (StringUtils.isBlank(title)) {
            return true;
        }
        String lowerCaseTitle = title.toLowerCase(Locale.ROOT);
        for (String keyword : definition.getSkipTitleKeywords()) {
            if (StringUtils.isNotBlank(keyword) && lowerCaseTitle.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private String selectText(Element item, String selector) {
        Element element = selectFirst(item, selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private String selectLink(Element item, String selector) {
        Element element = selectFirst(item, selector);
        if (element == null) {
            element = item.selectFirst("a[href]");
        } else if (!element.hasAttr("href")) {
            element = element.selectFirst("a[href]");
        }
        if (element == null) {
            return null;
        }
        String href = element.attr("abs:href");
        return StringUtils.isBlank(href) ? element.attr("href") : href;
    }

    private String selectImage(Element item, String selector) {
        Element element = selectFirst(item, selector);
        if (element == null) {
            return null;
        }
        for (String attr : List.of("abs:src", "abs:data-src", "src", "data-src")) {
            String value = element.attr(attr);
            if (StringUtils.isNotBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private Element selectFirst(Element item, String selector) {
        if (StringUtils.isBlank(selector)) {
            return null;
        }
        return item.selectFirst(selector);
    }

    private Double parseRating(Element item, String selector) {
        Element element = selectFirst(item, selector);
        if (element == null) {
            return null;
        }
        // Star widgets often keep the value in an attribute only.
        for (String candidate : List.of(element.text(), element.attr("aria-label"), element.attr("title"))) {
            if (StringUtils.isBlank(candidate)) {
                continue;
            }
            Matcher matcher = DECIMAL_PATTERN.matcher(candidate);
            if (matcher.find()) {
                double rating = Double.parseDouble(matcher.group(1).replace(',', '.'));
                if (rating >= 0 && rating <= 5) {
                    return rating;
                }
            }
        }
        return null;
    }

    static Integer parseReviews(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Matcher matcher = INTEGER_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group(1).replaceAll("[^\\d]", "");
        if (digits.isEmpty() || digits.length() > 9) {
            return null;
        }
        return Integer.parseInt(digits);
    }

    private String normalizeShipping(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        return text.toLowerCase(Locale.ROOT).contains("free") ? "Free" : text;
    }

}
