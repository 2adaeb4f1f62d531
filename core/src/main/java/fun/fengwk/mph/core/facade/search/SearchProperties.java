package fun.fengwk.mph.core.facade.search;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Search orchestration configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mph.search")
public class SearchProperties {

    /**
     * Max provider fetches in flight for one search.
     */
    private int maxConcurrent = 10;

    /**
     * Result count used when the request does not set one, 0 means unlimited.
     */
    private int defaultMaxResults = 50;

    /**
     * Total search budget used when the request does not set one.
     */
    private long defaultTimeoutMs = 60000;

    private String defaultTargetCurrency = "USD";

}
