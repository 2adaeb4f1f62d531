package fun.fengwk.mph.core.service.model;

import lombok.Builder;
import lombok.Data;

/**
 * A provider able to serve a country.
 *
 * @author fengwk
 */
@Data
@Builder
public class PriceSourceInfo {

    private String name;

    /**
     * Priority for the country, lower first.
     */
    private int priority;

}
