package fun.fengwk.mph.core.service.consolidate;

import fun.fengwk.mph.core.service.matching.ProductSimilarityScorer;
import fun.fengwk.mph.core.service.pricing.NormalizedOffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy single-pass clustering of offers into duplicate groups.
 *
 * <p>Each offer joins the first group holding a member it duplicates, otherwise it opens a new group.
 * Cost is quadratic in the offer count, which stays in the tens per query.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OfferDeduplicator {

    private static final int GROUP_ID_LENGTH = 8;

    /**
     * Highest relevance first, then lowest price; the stable sort keeps arrival order on full ties.
     */
    private static final Comparator<NormalizedOffer> REPRESENTATIVE_ORDER =
        Comparator.comparingDouble(NormalizedOffer::getSimilarityScore).reversed()
            .thenComparingDouble(NormalizedOffer::getNormalizedPrice);

    private final ProductSimilarityScorer similarityScorer;

    /**
     * Partition the offers into duplicate groups in creation order, tagging every member with its group id.
     */
    public List<DuplicateGroup> group(List<NormalizedOffer> offers, String query) {
        List<List<NormalizedOffer>> clusters = new ArrayList<>();
        for (NormalizedOffer offer : offers) {
            List<NormalizedOffer> target = findGroup(clusters, offer, query);
            if (target == null) {
                target = new ArrayList<>();
                clusters.add(target);
            }
            target.add(offer);
        }

        List<DuplicateGroup> groups = new ArrayList<>(clusters.size());
        Map<String, Integer> idUsage = new HashMap<>();
        for (List<NormalizedOffer> members : clusters) {
            NormalizedOffer representative = members.stream()
                .sorted(REPRESENTATIVE_ORDER)
                .findFirst()
                .orElseThrow();
            String id = uniqueGroupId(representative.getProductName(), idUsage);
            members.forEach(member -> member.setDuplicateGroupId(id));
            groups.add(new DuplicateGroup(id, List.copyOf(members), representative));
        }
        log.debug("deduplication finished, offers={}, groups={}", offers.size(), groups.size());
        return groups;
    }

    private List<NormalizedOffer> findGroup(List<List<NormalizedOffer>> clusters, NormalizedOffer offer, String query) {
        for (List<NormalizedOffer> cluster : clusters) {
            for (NormalizedOffer member : cluster) {
                if (similarityScorer.isDuplicate(
                    offer.getProductName(), offer.getNormalizedPrice(),
                    member.getProductName(), member.getNormalizedPrice(),
                    query)) {
                    return cluster;
                }
            }
        }
        return null;
    }

    private String uniqueGroupId(String productName, Map<String, Integer> idUsage) {
        String baseId = DigestUtils.md5Hex(productName == null ? "" : productName).substring(0, GROUP_ID_LENGTH);
        int usage = idUsage.merge(baseId, 1, Integer::sum);
        return usage == 1 ? baseId : baseId + "-" + usage;
    }

}
