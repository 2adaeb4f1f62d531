package fun.fengwk.mph.core.service.pricing;

import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.service.pricing.currency.CurrencyConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts raw offers into a canonical (amount, currency) pair.
 *
 * <p>Offers with unparseable prices are dropped. A failed conversion, e.g. a {@code CurrencyConversionException},
 * keeps the offer in its source currency.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceNormalizer {

    private final PriceParser priceParser;
    private final CurrencyConverter currencyConverter;

    public NormalizationResult normalizeAll(List<RawOffer> offers, String targetCurrency) {
        List<NormalizedOffer> normalized = new ArrayList<>(offers.size());
        int dropped = 0;
        for (RawOffer offer : offers) {
            NormalizedOffer result = normalize(offer, targetCurrency);
            if (result == null) {
                dropped++;
            } else {
                normalized.add(result);
            }
        }
        if (dropped > 0) {
            log.info("offers dropped for unparseable price, dropped={}, kept={}", dropped, normalized.size());
        }
        return new NormalizationResult(normalized, dropped);
    }

    /**
     * Normalize one offer, null when its price cannot be parsed.
     */
    public NormalizedOffer normalize(RawOffer offer, String targetCurrency) {
        if (offer == null) {
            return null;
        }
        String target = PriceParser.normalizeCode(targetCurrency);
        if (target == null) {
            throw new IllegalArgumentException("targetCurrency is invalid");
        }
        String declared = PriceParser.normalizeCode(offer.getCurrency());
        ParsedPrice parsed = priceParser.parse(offer.getPrice(), declared);
        if (parsed == null) {
            log.debug("price parse failed, source={}, price={}", offer.getSource(), offer.getPrice());
            return null;
        }

        String sourceCurrency = parsed.currency() != null ? parsed.currency()
            : declared != null ? declared
            : target;
        double normalizedPrice = parsed.amount();
        String normalizedCurrency = target;
        if (!sourceCurrency.equals(target)) {
            try {
                normalizedPrice = currencyConverter.convert(parsed.amount(), sourceCurrency, target);
            } catch (RuntimeException ex) {
                log.warn("currency conversion failed, keep source currency, source={}, from={}, to={}, error={}",
                    offer.getSource(), sourceCurrency, target, ex.getMessage());
                normalizedPrice = parsed.amount();
                normalizedCurrency = sourceCurrency;
            }
        }
        if (!(normalizedPrice > 0) || Double.isInfinite(normalizedPrice)) {
            log.debug("price normalized to invalid amount, source={}, price={}", offer.getSource(), offer.getPrice());
            return null;
        }

        return NormalizedOffer.builder()
            .rawOffer(offer)
            .normalizedPrice(normalizedPrice)
            .normalizedCurrency(normalizedCurrency)
            .originalAmount(parsed.amount())
            .originalCurrency(sourceCurrency)
            .build();
    }

}
