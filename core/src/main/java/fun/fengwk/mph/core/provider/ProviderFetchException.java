package fun.fengwk.mph.core.provider;

/**
 * Raised when a provider cannot produce offers, e.g. upstream returned a non-2xx status.
 *
 * @author fengwk
 */
public class ProviderFetchException extends RuntimeException {

    public ProviderFetchException(String message) {
        super(message);
    }

    public ProviderFetchException(String message, Throwable cause) {
        super(message, cause);
    }

}
