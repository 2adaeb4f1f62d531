package fun.fengwk.mph.core.service.consolidate;

import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.service.matching.ProductSimilarityScorer;
import fun.fengwk.mph.core.service.pricing.NormalizationResult;
import fun.fengwk.mph.core.service.pricing.NormalizedOffer;
import fun.fengwk.mph.core.service.pricing.PriceNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns the raw offers of one search into ranked, deduplicated offers.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultConsolidator {

    private final PriceNormalizer priceNormalizer;
    private final ProductSimilarityScorer similarityScorer;
    private final OfferDeduplicator offerDeduplicator;
    private final OfferRanker offerRanker;

    public ConsolidationResult consolidate(List<RawOffer> offers, String query, String targetCurrency) {
        if (offers.isEmpty()) {
            return ConsolidationResult.empty();
        }

        NormalizationResult normalization = priceNormalizer.normalizeAll(offers, targetCurrency);
        for (NormalizedOffer offer : normalization.offers()) {
            offer.setSimilarityScore(similarityScorer.relevance(offer.getProductName(), query));
        }

        List<DuplicateGroup> groups = offerDeduplicator.group(normalization.offers(), query);
        List<NormalizedOffer> representatives = groups.stream()
            .map(DuplicateGroup::representative)
            .toList();
        List<NormalizedOffer> ranked = offerRanker.rank(representatives);

        log.info("consolidation finished, raw={}, normalized={}, groups={}",
            offers.size(), normalization.offers().size(), groups.size());
        return new ConsolidationResult(ranked, normalization.dropped(), groups.size());
    }

}
