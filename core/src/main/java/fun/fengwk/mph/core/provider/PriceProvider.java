package fun.fengwk.mph.core.provider;

import java.util.List;

/**
 * A named source of price offers.
 *
 * <p>Implementations must not share mutable state with other providers. The orchestrator bounds every
 * {@link #fetch(String, String)} call with its own timeout, still implementations should not block forever.
 *
 * @author fengwk
 */
public interface PriceProvider {

    /**
     * Priority returned for countries the provider does not support.
     */
    int UNSUPPORTED_PRIORITY = 999;

    /**
     * Unique provider name, compared case-insensitively.
     */
    String getName();

    boolean supports(String country);

    /**
     * Lower value means higher priority.
     */
    int priority(String country);

    /**
     * Fetch offers for the query, any exception is treated as a provider fault.
     */
    List<RawOffer> fetch(String query, String country) throws Exception;

}
