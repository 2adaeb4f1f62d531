package fun.fengwk.mph.core.service.pricing;

/**
 * Amount and currency recovered from a price text; currency is null when the text does not name one.
 *
 * @author fengwk
 */
public record ParsedPrice(double amount, String currency) {
}
