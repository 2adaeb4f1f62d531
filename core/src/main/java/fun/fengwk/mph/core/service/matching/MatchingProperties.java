package fun.fengwk.mph.core.service.matching;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Duplicate detection thresholds.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.matching")
public class MatchingProperties {

    /**
     * Minimum name similarity for two offers to be duplicates.
     */
    private double duplicateThreshold = 0.85;

    /**
     * Relative price gap above which offers are unlikely to be the same product.
     */
    private double priceVarianceThreshold = 0.15;

    /**
     * Added to the duplicate threshold when the price gap exceeds the variance threshold.
     */
    private double thresholdPenalty = 0.05;

}
