package fun.fengwk.mph.core.mcp;

import fun.fengwk.mph.core.facade.search.model.SearchResponse;
import fun.fengwk.mph.core.service.PriceMcpService;
import fun.fengwk.mph.core.service.model.PriceSourceInfo;
import fun.fengwk.mph.core.utils.CountryCodes;
import fun.fengwk.mph.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceMcp {

    private final PriceMcpService priceMcpService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "price_search",
        description = """
            Search product prices across all sources that serve a country, merge duplicate listings and rank the offers.
            Return format: ranked offer list with price, currency, source, link, availability, rating and shipping, \
            followed by the sources used and failed; or 'No results.'; or an error message.""",
        resultConverter = StringToolCallResultConverter.class)
    public String priceSearch(
        @ToolParam(description = "product query, e.g. iPhone 16 Pro 128GB") String query,
        @ToolParam(description = "two letter country code, e.g. US, GB, DE, IN") String country,
        @ToolParam(description = "max results, 0 means unlimited, default 50", required = false) Integer maxResults,
        @ToolParam(description = "currency code prices are converted to, default USD", required = false) String targetCurrency,
        @ToolParam(description = "total search budget in seconds, default 60", required = false) Integer timeoutSeconds,
        @ToolParam(description = "only query these source names", required = false) List<String> includeSources,
        @ToolParam(description = "skip these source names", required = false) List<String> excludeSources
    ) {
        SearchResponse response;
        try {
            response = priceMcpService.search(query, country, maxResults, targetCurrency, timeoutSeconds,
                includeSources, excludeSources);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            log.warn("price search rejected, query={}, country={}, error={}", query, country, ex.getMessage());
            return "Error: " + ex.getMessage();
        }
        return mcpFormatter.format("mph_price_search_result.ftl", response);
    }

    @Tool(name = "price_sources",
        description = """
            List the price sources that serve a country, in the order they are queried.
            Return format: source names with their priority; or 'No sources.'; or an error message.""",
        resultConverter = StringToolCallResultConverter.class)
    public String priceSources(
        @ToolParam(description = "two letter country code, e.g. US") String country
    ) {
        List<PriceSourceInfo> sources;
        try {
            sources = priceMcpService.listSources(country);
        } catch (IllegalArgumentException ex) {
            return "Error: " + ex.getMessage();
        }
        return mcpFormatter.format("mph_price_sources_result.ftl", Map.of(
            "country", CountryCodes.normalize(country),
            "sources", sources
        ));
    }

}
