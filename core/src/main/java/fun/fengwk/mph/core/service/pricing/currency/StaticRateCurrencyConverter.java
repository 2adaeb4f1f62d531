package fun.fengwk.mph.core.service.pricing.currency;

import fun.fengwk.mph.core.service.pricing.PriceParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts through a fixed rate table expressed against one base currency.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class StaticRateCurrencyConverter implements CurrencyConverter {

    private final String base;
    private final Map<String, Double> rates;

    @Autowired
    public StaticRateCurrencyConverter(CurrencyProperties properties) {
        this(properties.getBase(), properties.getRates());
    }

    public StaticRateCurrencyConverter(String base, Map<String, Double> rates) {
        String normalizedBase = PriceParser.normalizeCode(base);
        if (normalizedBase == null) {
            throw new IllegalArgumentException("invalid base currency: " + base);
        }
        Map<String, Double> normalized = new HashMap<>();
        if (rates != null) {
            for (Map.Entry<String, Double> entry : rates.entrySet()) {
                String code = PriceParser.normalizeCode(entry.getKey());
                Double rate = entry.getValue();
                if (code == null || rate == null || rate <= 0) {
                    throw new IllegalArgumentException("invalid rate: " + entry.getKey() + "=" + rate);
                }
                normalized.put(code, rate);
            }
        }
        normalized.put(normalizedBase, 1.0);
        this.base = normalizedBase;
        this.rates = Collections.unmodifiableMap(normalized);
        log.info("currency rates loaded, base={}, currencies={}", this.base, this.rates.size());
    }

    @Override
    public double convert(double amount, String fromCode, String toCode) {
        String from = PriceParser.normalizeCode(fromCode);
        String to = PriceParser.normalizeCode(toCode);
        if (from == null || to == null) {
            throw new CurrencyConversionException("invalid currency code: " + fromCode + " -> " + toCode);
        }
        if (from.equals(to)) {
            return amount;
        }
        Double fromRate = rates.get(from);
        Double toRate = rates.get(to);
        if (fromRate == null || toRate == null) {
            throw new CurrencyConversionException("no rate for " + (fromRate == null ? from : to));
        }
        return amount / fromRate * toRate;
    }

}
