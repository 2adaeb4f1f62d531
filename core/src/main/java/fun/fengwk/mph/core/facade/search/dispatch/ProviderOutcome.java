package fun.fengwk.mph.core.facade.search.dispatch;

import fun.fengwk.mph.core.provider.RawOffer;

import java.util.List;

/**
 * Result of one provider fetch within a search.
 *
 * @author fengwk
 */
public record ProviderOutcome(String provider, Status status, List<RawOffer> offers, String error, long elapsedMs) {

    public static final String TIMEOUT_REASON = "timeout";

    public static ProviderOutcome success(String provider, List<RawOffer> offers, long elapsedMs) {
        return new ProviderOutcome(provider, Status.SUCCESS, offers == null ? List.of() : List.copyOf(offers), null, elapsedMs);
    }

    public static ProviderOutcome timeout(String provider, long elapsedMs) {
        return new ProviderOutcome(provider, Status.TIMEOUT, List.of(), TIMEOUT_REASON, elapsedMs);
    }

    public static ProviderOutcome failure(String provider, String error, long elapsedMs) {
        return new ProviderOutcome(provider, Status.FAILED, List.of(), error, elapsedMs);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public enum Status {
        SUCCESS,
        TIMEOUT,
        FAILED
    }

}
