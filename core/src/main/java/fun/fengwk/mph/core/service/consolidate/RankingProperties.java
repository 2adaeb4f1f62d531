package fun.fengwk.mph.core.service.consolidate;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ranking configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.ranking")
public class RankingProperties {

    /**
     * Reliability in [0, 1] keyed by lower-case source name.
     */
    private Map<String, Double> sourceReliability = defaultSourceReliability();

    /**
     * Reliability of sources missing from {@link #sourceReliability}.
     */
    private double defaultSourceReliability = 0.6;

    private static Map<String, Double> defaultSourceReliability() {
        Map<String, Double> reliability = new LinkedHashMap<>();
        reliability.put("amazon", 0.9);
        reliability.put("apple", 0.95);
        reliability.put("bestbuy", 0.85);
        reliability.put("walmart", 0.8);
        reliability.put("target", 0.75);
        reliability.put("ebay", 0.7);
        return reliability;
    }

}
