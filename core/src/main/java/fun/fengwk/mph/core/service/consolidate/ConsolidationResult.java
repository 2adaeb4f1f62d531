package fun.fengwk.mph.core.service.consolidate;

import fun.fengwk.mph.core.service.pricing.NormalizedOffer;

import java.util.List;

/**
 * Ranked representatives plus the counts gathered along the way.
 *
 * @param ranked         one offer per duplicate group, best first
 * @param droppedOffers  offers dropped for an unparseable price
 * @param groupCount     number of duplicate groups
 * @author fengwk
 */
public record ConsolidationResult(List<NormalizedOffer> ranked, int droppedOffers, int groupCount) {

    public static ConsolidationResult empty() {
        return new ConsolidationResult(List.of(), 0, 0);
    }

}
