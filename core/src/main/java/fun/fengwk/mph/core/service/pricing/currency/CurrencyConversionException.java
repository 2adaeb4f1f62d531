package fun.fengwk.mph.core.service.pricing.currency;

/**
 * @author fengwk
 */
public class CurrencyConversionException extends RuntimeException {

    public CurrencyConversionException(String message) {
        super(message);
    }

}
