package fun.fengwk.mph.core.service.pricing;

import java.util.List;

/**
 * Offers that survived normalization plus the number dropped for unparseable prices.
 *
 * @author fengwk
 */
public record NormalizationResult(List<NormalizedOffer> offers, int dropped) {
}
