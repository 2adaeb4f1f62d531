package fun.fengwk.mph.core.service.pricing.currency;

/**
 * Converts amounts between currencies.
 *
 * @author fengwk
 */
public interface CurrencyConverter {

    /**
     * Convert the amount.
     *
     * @throws CurrencyConversionException when either code is unknown or rates are unavailable
     */
    double convert(double amount, String fromCode, String toCode);

}
