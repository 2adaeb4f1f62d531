package fun.fengwk.mph.core.provider.listing;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Listing provider configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.listing")
public class ListingProperties {

    /**
     * User agent sent with listing page requests.
     */
    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /**
     * Accept-Language header sent with listing page requests.
     */
    private String acceptLanguage = "en-US,en;q=0.5";

    /**
     * Connect timeout in milliseconds.
     */
    private int connectTimeoutMs = 10000;

    /**
     * Configured listing sources, each becomes one provider.
     */
    private List<ListingSourceDefinition> sources = new ArrayList<>();

}
