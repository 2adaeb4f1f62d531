package fun.fengwk.mph.core.service.pricing.currency;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static exchange rate table.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.currency")
public class CurrencyProperties {

    /**
     * Base currency of the rate table.
     */
    private String base = "EUR";

    /**
     * Units of each currency per one unit of base.
     */
    private Map<String, Double> rates = new LinkedHashMap<>();

}
