package fun.fengwk.mph.core.service.consolidate;

import fun.fengwk.mph.core.service.pricing.NormalizedOffer;

import java.util.List;

/**
 * Offers judged to be the same product, and the one chosen to represent them.
 *
 * @author fengwk
 */
public record DuplicateGroup(String id, List<NormalizedOffer> members, NormalizedOffer representative) {
}
