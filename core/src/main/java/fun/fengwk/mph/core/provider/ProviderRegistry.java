package fun.fengwk.mph.core.provider;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registration-ordered list of providers.
 *
 * @author fengwk
 */
@Slf4j
public class ProviderRegistry {

    private final List<PriceProvider> providers = new CopyOnWriteArrayList<>();

    public ProviderRegistry() {
    }

    public ProviderRegistry(List<? extends PriceProvider> initialProviders) {
        if (initialProviders != null) {
            initialProviders.forEach(this::register);
        }
    }

    public synchronized void register(PriceProvider provider) {
        if (provider == null || StringUtils.isBlank(provider.getName())) {
            throw new IllegalArgumentException("provider name is blank");
        }
        String name = provider.getName().trim();
        for (PriceProvider existing : providers) {
            if (existing.getName().trim().equalsIgnoreCase(name)) {
                throw new IllegalArgumentException("duplicate provider: " + name);
            }
        }
        providers.add(provider);
        log.info("registered provider: {}", name);
    }

    /**
     * Snapshot in registration order.
     */
    public List<PriceProvider> getProviders() {
        return List.copyOf(providers);
    }

    /**
     * Providers supporting the country, ordered by priority; ties keep registration order.
     */
    public List<PriceProvider> findByCountry(String country) {
        if (StringUtils.isBlank(country)) {
            return List.of();
        }
        String normalizedCountry = country.trim().toUpperCase(Locale.ROOT);
        List<PriceProvider> supported = new ArrayList<>();
        for (PriceProvider provider : providers) {
            if (provider.supports(normalizedCountry)) {
                supported.add(provider);
            }
        }
        // List.sort is stable.
        supported.sort(Comparator.comparingInt(provider -> provider.priority(normalizedCountry)));
        return supported;
    }

}
