package fun.fengwk.mph.core.provider.listing;

import fun.fengwk.mph.core.provider.PriceProvider;
import fun.fengwk.mph.core.provider.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the provider registry from provider beans and configured listing sources.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
public class ListingProviderConfiguration {

    @Bean
    public ProviderRegistry providerRegistry(
        ObjectProvider<PriceProvider> providerBeans,
        ListingProperties listingProperties,
        ListingPageFetcher listingPageFetcher,
        ListingPageParser listingPageParser
    ) {
        ProviderRegistry registry = new ProviderRegistry();
        providerBeans.orderedStream().forEach(registry::register);
        for (ListingSourceDefinition definition : listingProperties.getSources()) {
            registry.register(new HtmlListingProvider(definition, listingPageFetcher, listingPageParser));
        }
        List<String> names = registry.getProviders().stream()
            .map(PriceProvider::getName)
            .collect(Collectors.toList());
        log.info("provider registry initialized, providers={}", names);
        return registry;
    }

}
