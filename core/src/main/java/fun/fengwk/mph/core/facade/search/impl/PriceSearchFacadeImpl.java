package fun.fengwk.mph.core.facade.search.impl;

import fun.fengwk.mph.core.facade.search.PriceSearchFacade;
import fun.fengwk.mph.core.facade.search.SearchProperties;
import fun.fengwk.mph.core.facade.search.dispatch.ProviderDispatcher;
import fun.fengwk.mph.core.facade.search.dispatch.ProviderOutcome;
import fun.fengwk.mph.core.facade.search.model.SearchRequest;
import fun.fengwk.mph.core.facade.search.model.SearchResponse;
import fun.fengwk.mph.core.facade.search.model.SearchResultItem;
import fun.fengwk.mph.core.provider.PriceProvider;
import fun.fengwk.mph.core.provider.ProviderRegistry;
import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.service.consolidate.ConsolidationResult;
import fun.fengwk.mph.core.service.consolidate.ResultConsolidator;
import fun.fengwk.mph.core.service.pricing.NormalizedOffer;
import fun.fengwk.mph.core.service.pricing.PriceParser;
import fun.fengwk.mph.core.utils.CountryCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceSearchFacadeImpl implements PriceSearchFacade {

    private final ProviderRegistry providerRegistry;
    private final ProviderDispatcher providerDispatcher;
    private final ResultConsolidator resultConsolidator;
    private final SearchProperties searchProperties;

    @Override
    public SearchResponse search(SearchRequest request) {
        // Validate request and normalize defaults.
        if (request == null || StringUtils.isBlank(request.getQuery())) {
            throw new IllegalArgumentException("query is blank");
        }
        String query = request.getQuery().trim();
        String country = CountryCodes.normalize(request.getCountry());
        int maxResults = resolveMaxResults(request.getMaxResults());
        Duration timeout = resolveTimeout(request.getTimeout());
        String targetCurrency = resolveTargetCurrency(request.getTargetCurrency());

        Instant timestamp = Instant.now();
        long start = System.nanoTime();

        List<PriceProvider> selected = selectProviders(country, request.getIncludeSources(), request.getExcludeSources());
        if (selected.isEmpty()) {
            log.info("no provider selected, query={}, country={}", query, country);
            return SearchResponse.builder()
                .results(List.of())
                .totalResults(0)
                .searchTime(elapsedSeconds(start))
                .sourcesUsed(List.of())
                .failedSources(Map.of())
                .query(query)
                .country(country)
                .timestamp(timestamp)
                .build();
        }

        // The budget is split evenly, a slow neighbour can starve a fast provider.
        long perProviderTimeoutMs = Math.max(1L, timeout.toMillis() / Math.max(1, selected.size()));
        log.info("search started, query={}, country={}, providers={}, perProviderTimeoutMs={}",
            query, country, selected.size(), perProviderTimeoutMs);

        List<ProviderOutcome> outcomes = providerDispatcher.dispatch(selected, query, country, perProviderTimeoutMs);
        List<RawOffer> offers = new ArrayList<>();
        List<String> sourcesUsed = new ArrayList<>();
        Map<String, String> failedSources = new LinkedHashMap<>();
        for (ProviderOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                sourcesUsed.add(outcome.provider());
                offers.addAll(outcome.offers());
            } else {
                failedSources.put(outcome.provider(), outcome.error());
            }
        }

        ConsolidationResult consolidated = resultConsolidator.consolidate(offers, query, targetCurrency);
        List<NormalizedOffer> ranked = consolidated.ranked();
        if (maxResults > 0 && ranked.size() > maxResults) {
            ranked = ranked.subList(0, maxResults);
        }
        List<SearchResultItem> items = ranked.stream()
            .map(PriceSearchFacadeImpl::toResultItem)
            .toList();

        double searchTime = elapsedSeconds(start);
        log.info("search finished, query={}, results={}, sourcesUsed={}, failed={}, searchTime={}",
            query, items.size(), sourcesUsed.size(), failedSources.size(), searchTime);
        return SearchResponse.builder()
            .results(items)
            .totalResults(items.size())
            .searchTime(searchTime)
            .sourcesUsed(sourcesUsed)
            .failedSources(failedSources)
            .collectedOffers(offers.size())
            .droppedOffers(consolidated.droppedOffers())
            .query(query)
            .country(country)
            .timestamp(timestamp)
            .build();
    }

    List<PriceProvider> selectProviders(String country, List<String> includeSources, List<String> excludeSources) {
        Set<String> include = lowerCaseNames(includeSources);
        Set<String> exclude = lowerCaseNames(excludeSources);
        // findByCountry already keeps the stable priority order.
        return providerRegistry.findByCountry(country).stream()
            .filter(provider -> include.isEmpty() || include.contains(lowerCase(provider.getName())))
            .filter(provider -> !exclude.contains(lowerCase(provider.getName())))
            .toList();
    }

    private static SearchResultItem toResultItem(NormalizedOffer offer) {
        RawOffer raw = offer.getRawOffer();
        return SearchResultItem.builder()
            .link(raw.getLink())
            .price(formatPrice(offer.getNormalizedPrice()))
            .currency(offer.getNormalizedCurrency())
            .productName(raw.getProductName())
            .availability(raw.getAvailability())
            .rating(raw.getRating())
            .reviewsCount(raw.getReviewsCount())
            .seller(raw.getSeller())
            .shippingCost(raw.getShippingCost())
            .deliveryTime(raw.getDeliveryTime())
            .imageUrl(raw.getImageUrl())
            .specifications(raw.getSpecifications())
            .confidenceScore(raw.getConfidenceScore())
            .source(raw.getSource())
            .scrapedAt(raw.getScrapedAt())
            .similarityScore(offer.getSimilarityScore())
            .rank(offer.getFinalRank())
            .duplicateGroup(offer.getDuplicateGroupId())
            .build();
    }

    static String formatPrice(double price) {
        return BigDecimal.valueOf(price).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private int resolveMaxResults(Integer maxResults) {
        if (maxResults == null) {
            return searchProperties.getDefaultMaxResults();
        }
        if (maxResults < 0) {
            throw new IllegalArgumentException("maxResults must be >= 0");
        }
        return maxResults;
    }

    private Duration resolveTimeout(Duration timeout) {
        if (timeout == null) {
            return Duration.ofMillis(searchProperties.getDefaultTimeoutMs());
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return timeout;
    }

    private String resolveTargetCurrency(String targetCurrency) {
        String currency = StringUtils.isBlank(targetCurrency)
            ? searchProperties.getDefaultTargetCurrency()
            : targetCurrency;
        String normalized = PriceParser.normalizeCode(currency);
        if (normalized == null) {
            throw new IllegalArgumentException("targetCurrency is invalid");
        }
        return normalized;
    }

    private static Set<String> lowerCaseNames(List<String> names) {
        if (names == null) {
            return Set.of();
        }
        return names.stream()
            .filter(StringUtils::isNotBlank)
            .map(PriceSearchFacadeImpl::lowerCase)
            .collect(Collectors.toSet());
    }

    private static String lowerCase(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

}
