package fun.fengwk.mph.core.service;

import fun.fengwk.mph.core.facade.search.model.SearchResponse;
import fun.fengwk.mph.core.service.model.PriceSourceInfo;

import java.util.List;

/**
 * @author fengwk
 */
public interface PriceMcpService {

    SearchResponse search(String query, String country, Integer maxResults, String targetCurrency,
                          Integer timeoutSeconds, List<String> includeSources, List<String> excludeSources);

    /**
     * Providers supporting the country, in priority order.
     */
    List<PriceSourceInfo> listSources(String country);

}
