package fun.fengwk.mph.core.service.pricing;

import fun.fengwk.mph.core.provider.RawOffer;
import lombok.Builder;
import lombok.Data;

/**
 * A raw offer with its price expressed in a canonical currency, enriched as the pipeline advances.
 *
 * @author fengwk
 */
@Data
@Builder
public class NormalizedOffer {

    private final RawOffer rawOffer;

    /**
     * Price after conversion, always positive.
     */
    private final double normalizedPrice;

    /**
     * Currency of {@link #normalizedPrice}, the target currency unless conversion failed.
     */
    private final String normalizedCurrency;

    /**
     * Amount parsed from the raw price, before conversion.
     */
    private final double originalAmount;

    private final String originalCurrency;

    /**
     * Relevance of the product name to the query, in [0, 1].
     */
    private double similarityScore;

    private String duplicateGroupId;

    /**
     * Composite ranking score, in [0, 1].
     */
    private double rankingScore;

    /**
     * 1-based position in the ranked output, 0 until ranked.
     */
    private int finalRank;

    public String getProductName() {
        return rawOffer.getProductName();
    }

    public String getSource() {
        return rawOffer.getSource();
    }

}
