package fun.fengwk.mph.core.service.consolidate;

import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.service.pricing.NormalizedOffer;
import fun.fengwk.mph.core.service.pricing.PriceParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores offers on relevance, source trust, availability, rating, reviews and shipping, then orders them.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfferRanker {

    static final double RELEVANCE_WEIGHT = 0.40;
    static final double RELIABILITY_WEIGHT = 0.20;
    static final double IN_STOCK_BONUS = 0.15;
    static final double LIMITED_STOCK_BONUS = 0.10;
    static final double RATING_WEIGHT = 0.10;
    static final double REVIEWS_WEIGHT = 0.10;
    static final double SHIPPING_WEIGHT = 0.05;

    private static final Set<String> IN_STOCK = Set.of("in stock", "available");

    private static final Comparator<NormalizedOffer> RANK_ORDER =
        Comparator.comparingDouble(NormalizedOffer::getRankingScore).reversed()
            .thenComparingDouble(NormalizedOffer::getNormalizedPrice);

    private final RankingProperties rankingProperties;
    private final PriceParser priceParser;

    /**
     * Score every offer and return them best first, with {@code finalRank} set to 1..n.
     */
    public List<NormalizedOffer> rank(List<NormalizedOffer> offers) {
        for (NormalizedOffer offer : offers) {
            offer.setRankingScore(score(offer));
        }
        List<NormalizedOffer> ranked = new ArrayList<>(offers);
        ranked.sort(RANK_ORDER);
        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setFinalRank(i + 1);
        }
        return ranked;
    }

    /**
     * Composite score clamped to [0, 1].
     */
    public double score(NormalizedOffer offer) {
        RawOffer raw = offer.getRawOffer();
        double score = offer.getSimilarityScore() * RELEVANCE_WEIGHT;
        score += sourceReliability(raw.getSource()) * RELIABILITY_WEIGHT;
        score += availabilityBonus(raw.getAvailability());
        score += ratingBonus(raw.getRating());
        score += reviewsBonus(raw.getReviewsCount());
        score += shippingAdjustment(raw.getShippingCost(), offer.getOriginalAmount());
        return Math.max(0.0, Math.min(1.0, score));
    }

    double sourceReliability(String source) {
        if (StringUtils.isBlank(source)) {
            return rankingProperties.getDefaultSourceReliability();
        }
        Double reliability = rankingProperties.getSourceReliability().get(source.trim().toLowerCase(Locale.ROOT));
        return reliability == null ? rankingProperties.getDefaultSourceReliability() : reliability;
    }

    static double availabilityBonus(String availability) {
        if (StringUtils.isBlank(availability)) {
            return 0.0;
        }
        String lowerCase = availability.trim().toLowerCase(Locale.ROOT);
        if (IN_STOCK.contains(lowerCase)) {
            return IN_STOCK_BONUS;
        }
        if (lowerCase.contains("limited")) {
            return LIMITED_STOCK_BONUS;
        }
        return 0.0;
    }

    static double ratingBonus(Double rating) {
        if (rating == null || rating <= 0) {
            return 0.0;
        }
        return Math.min(rating / 5.0, 1.0) * RATING_WEIGHT;
    }

    static double reviewsBonus(Integer reviewsCount) {
        if (reviewsCount == null || reviewsCount <= 0) {
            return 0.0;
        }
        return Math.min(Math.log10(reviewsCount + 1.0) / 4.0, 1.0) * REVIEWS_WEIGHT;
    }

    double shippingAdjustment(String shippingCost, double originalAmount) {
        if (StringUtils.isBlank(shippingCost)) {
            return 0.0;
        }
        if (shippingCost.toLowerCase(Locale.ROOT).contains("free")) {
            return SHIPPING_WEIGHT;
        }
        Double shipping = priceParser.parseAmount(shippingCost);
        if (shipping == null) {
            return 0.0;
        }
        if (shipping == 0) {
            return SHIPPING_WEIGHT;
        }
        if (originalAmount <= 0) {
            return 0.0;
        }
        return -Math.min(shipping / originalAmount * SHIPPING_WEIGHT, SHIPPING_WEIGHT);
    }

}
