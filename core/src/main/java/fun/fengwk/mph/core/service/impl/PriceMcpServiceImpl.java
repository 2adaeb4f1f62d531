package fun.fengwk.mph.core.service.impl;

import fun.fengwk.mph.core.facade.search.PriceSearchFacade;
import fun.fengwk.mph.core.facade.search.model.SearchRequest;
import fun.fengwk.mph.core.facade.search.model.SearchResponse;
import fun.fengwk.mph.core.provider.ProviderRegistry;
import fun.fengwk.mph.core.service.PriceMcpService;
import fun.fengwk.mph.core.service.model.PriceSourceInfo;
import fun.fengwk.mph.core.utils.CountryCodes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class PriceMcpServiceImpl implements PriceMcpService {

    private final PriceSearchFacade priceSearchFacade;
    private final ProviderRegistry providerRegistry;

    @Override
    public SearchResponse search(String query, String country, Integer maxResults, String targetCurrency,
                                 Integer timeoutSeconds, List<String> includeSources, List<String> excludeSources) {
        SearchRequest request = SearchRequest.builder()
            .query(query)
            .country(country)
            .maxResults(maxResults)
            .targetCurrency(targetCurrency)
            .timeout(timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds))
            .includeSources(includeSources)
            .excludeSources(excludeSources)
            .build();
        return priceSearchFacade.search(request);
    }

    @Override
    public List<PriceSourceInfo> listSources(String country) {
        String normalizedCountry = CountryCodes.normalize(country);
        return providerRegistry.findByCountry(normalizedCountry).stream()
            .map(provider -> PriceSourceInfo.builder()
                .name(provider.getName())
                .priority(provider.priority(normalizedCountry))
                .build())
            .toList();
    }

}
