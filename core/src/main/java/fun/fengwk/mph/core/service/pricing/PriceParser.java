package fun.fengwk.mph.core.service.pricing;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free text prices such as {@code "$1,049.99"}, {@code "899,00 €"} or {@code "₹1,29,900"}.
 *
 * @author fengwk
 */
@Component
public class PriceParser {

    /**
     * Currencies written with a bare {@code $}.
     */
    static final Set<String> DOLLAR_CURRENCIES = Set.of("USD", "CAD", "AUD", "NZD", "SGD", "HKD", "MXN", "TWD");

    private static final String AMBIGUOUS_DOLLAR = "$";

    /**
     * Symbols checked in order, longer prefixes first so "US$" wins over "$".
     */
    private static final List<Map.Entry<String, String>> SYMBOLS = List.of(
        Map.entry("US$", "USD"),
        Map.entry("CA$", "CAD"),
        Map.entry("C$", "CAD"),
        Map.entry("AU$", "AUD"),
        Map.entry("A$", "AUD"),
        Map.entry("NZ$", "NZD"),
        Map.entry("HK$", "HKD"),
        Map.entry("S$", "SGD"),
        Map.entry("R$", "BRL"),
        Map.entry("£", "GBP"),
        Map.entry("€", "EUR"),
        Map.entry("₹", "INR"),
        Map.entry("¥", "JPY"),
        Map.entry("₩", "KRW"),
        Map.entry("₽", "RUB"),
        Map.entry("₱", "PHP"),
        Map.entry("$", AMBIGUOUS_DOLLAR)
    );

    private static final Set<String> ISO_CODES = Set.of(
        "USD", "EUR", "GBP", "INR", "JPY", "CNY", "CAD", "AUD", "NZD", "SGD", "HKD", "CHF", "SEK", "NOK", "DKK",
        "PLN", "CZK", "HUF", "BRL", "MXN", "KRW", "RUB", "TRY", "ZAR", "MYR", "PHP", "THB", "IDR", "AED", "SAR", "TWD"
    );

    /**
     * An upper-case code written right before or right after the amount.
     */
    private static final Pattern ISO_CODE_PATTERN = Pattern.compile(
        "(?<![A-Za-z])([A-Z]{3})[\\s\\u00A0]*(?=[\\d$€£¥₹])|\\d[\\s\\u00A0]*([A-Z]{3})(?![A-Za-z])");
    private static final Pattern RUPEE_PATTERN = Pattern.compile("(?i)\\b(rs\\.?|inr)\\s*(?=\\d)");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d[\\d.,' \\u00A0\\u202F]*\\d|\\d");

    /**
     * Parse the text, returns null when no positive amount is found.
     */
    public ParsedPrice parse(String text) {
        return parse(text, null);
    }

    /**
     * Parse the text, resolving a bare {@code $} to the declared currency when that is a dollar currency.
     */
    public ParsedPrice parse(String text, String declaredCurrency) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Double amount = parseAmount(text);
        if (amount == null || amount <= 0) {
            return null;
        }
        return new ParsedPrice(amount, resolveCurrency(text, declaredCurrency));
    }

    /**
     * Parse only the amount, zero included; null when the text holds no number.
     */
    public Double parseAmount(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Matcher matcher = NUMBER_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String number = matcher.group().replaceAll("[' \\u00A0\\u202F]", "");
        try {
            return Double.parseDouble(normalizeSeparators(number));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    String resolveCurrency(String text, String declaredCurrency) {
        Matcher isoMatcher = ISO_CODE_PATTERN.matcher(text);
        while (isoMatcher.find()) {
            String code = isoMatcher.group(1) != null ? isoMatcher.group(1) : isoMatcher.group(2);
            if (ISO_CODES.contains(code)) {
                return code;
            }
        }
        if (RUPEE_PATTERN.matcher(text).find()) {
            return "INR";
        }
        String upperCaseText = text.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, String> symbol : SYMBOLS) {
            if (!upperCaseText.contains(symbol.getKey())) {
                continue;
            }
            if (!AMBIGUOUS_DOLLAR.equals(symbol.getValue())) {
                return symbol.getValue();
            }
            String declared = normalizeCode(declaredCurrency);
            return declared != null && DOLLAR_CURRENCIES.contains(declared) ? declared : "USD";
        }
        return null;
    }

    /**
     * Rewrite grouping and decimal separators into a plain decimal number.
     */
    private String normalizeSeparators(String number) {
        int lastDot = number.lastIndexOf('.');
        int lastComma = number.lastIndexOf(',');
        if (lastDot >= 0 && lastComma >= 0) {
            // The later separator is the decimal one.
            if (lastDot > lastComma) {
                return number.replace(",", "");
            }
            return number.replace(".", "").replace(',', '.');
        }
        if (lastComma >= 0) {
            return normalizeSingleSeparator(number, ',');
        }
        if (lastDot >= 0) {
            return normalizeSingleSeparator(number, '.');
        }
        return number;
    }

    /**
     * A lone separator followed by exactly three digits groups thousands, anything else is the decimal point.
     */
    private String normalizeSingleSeparator(String number, char separator) {
        int count = StringUtils.countMatches(number, separator);
        int decimals = number.length() - number.lastIndexOf(separator) - 1;
        if (count == 1 && decimals != 3) {
            return number.replace(separator, '.');
        }
        return number.replace(String.valueOf(separator), "");
    }

    /**
     * Upper-case three letter code, null when blank or malformed.
     */
    public static String normalizeCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return normalized.matches("[A-Z]{3}") ? normalized : null;
    }

}
