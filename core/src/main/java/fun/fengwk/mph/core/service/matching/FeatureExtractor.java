package fun.fengwk.mph.core.service.matching;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives brand, model, storage, color, category and key specs from free text with ordered rule tables.
 *
 * <p>Rules are evaluated top to bottom and the first hit wins, except color where the earliest match in the text
 * wins. Brand is resolved before model because model rules are looked up by brand. New brands or models only need
 * new table rows.
 *
 * @author fengwk
 */
@Component
public class FeatureExtractor {

    static final List<PatternRule> BRAND_RULES = List.of(
        PatternRule.of("apple", "\\b(apple|iphone|ipad|macbook|imac|airpods)\\b"),
        PatternRule.of("samsung", "\\b(samsung|galaxy)\\b"),
        PatternRule.of("oneplus", "\\b(oneplus|one\\s*plus)\\b"),
        PatternRule.of("xiaomi", "\\b(xiaomi|mi|redmi|poco)\\b"),
        PatternRule.of("oppo", "\\b(oppo)\\b"),
        PatternRule.of("vivo", "\\b(vivo)\\b"),
        PatternRule.of("realme", "\\b(realme)\\b"),
        PatternRule.of("google", "\\b(google|pixel)\\b"),
        PatternRule.of("sony", "\\b(sony|xperia|playstation)\\b"),
        PatternRule.of("lg", "\\b(lg)\\b"),
        PatternRule.of("motorola", "\\b(motorola|moto)\\b"),
        PatternRule.of("nokia", "\\b(nokia)\\b"),
        PatternRule.of("huawei", "\\b(huawei|honor)\\b")
    );

    /**
     * Brand specific model rules, group 1 is the model.
     */
    static final Map<String, List<PatternRule>> MODEL_RULES = Map.of(
        "apple", List.of(
            PatternRule.of("iphone", "\\b(iphone\\s*\\d+(?:\\s*pro)?(?:\\s*max|\\s*plus|\\s*mini)?)\\b"),
            PatternRule.of("ipad", "\\b(ipad\\s*(?:pro|air|mini)?(?:\\s*\\d+)?)\\b"),
            PatternRule.of("macbook", "\\b(macbook\\s*(?:pro|air)?(?:\\s*m\\d)?)\\b")
        ),
        "samsung", List.of(
            PatternRule.of("galaxy", "\\bgalaxy\\s*([a-z]\\d+(?:\\s*\\+|\\s*plus|\\s*ultra|\\s*fe)?)\\b")
        ),
        "google", List.of(
            PatternRule.of("pixel", "\\b(pixel\\s*\\d+a?(?:\\s*pro)?(?:\\s*xl)?)\\b")
        ),
        "oneplus", List.of(
            PatternRule.of("oneplus", "\\b(?:oneplus|one\\s*plus)\\s*(\\d+[a-z]?(?:\\s*pro|\\s*r)?)\\b")
        )
    );

    static final PatternRule GENERIC_MODEL_RULE = PatternRule.of("generic", "\\b([a-z]+\\s*\\d+(?:\\s*[a-z]+)*)\\b");

    static final PatternRule STORAGE_RULE = PatternRule.of("storage", "\\b(\\d+)\\s*(gb|tb|mb)\\b(?!\\s*(?:ram|memory))");

    static final List<PatternRule> COLOR_RULES = List.of(
        PatternRule.of("black", "\\b(black|midnight|graphite)\\b"),
        PatternRule.of("white", "\\b(white|starlight)\\b"),
        PatternRule.of("blue", "\\bblue\\b"),
        PatternRule.of("red", "\\bred\\b"),
        PatternRule.of("green", "\\bgreen\\b"),
        PatternRule.of("gold", "\\bgold\\b"),
        PatternRule.of("silver", "\\bsilver\\b"),
        PatternRule.of("rose", "\\brose\\b"),
        PatternRule.of("pink", "\\bpink\\b"),
        PatternRule.of("purple", "\\bpurple\\b"),
        PatternRule.of("yellow", "\\byellow\\b"),
        PatternRule.of("orange", "\\borange\\b"),
        PatternRule.of("gray", "\\b(gray|grey)\\b"),
        PatternRule.of("natural", "\\bnatural\\b"),
        PatternRule.of("titanium", "\\btitanium\\b")
    );

    static final List<PatternRule> CATEGORY_RULES = List.of(
        PatternRule.of("smartphone", "\\b(phone|smartphone|mobile|iphone|galaxy|pixel)\\b"),
        PatternRule.of("laptop", "\\b(laptop|notebook|macbook)\\b"),
        PatternRule.of("tablet", "\\b(tablet|ipad)\\b"),
        PatternRule.of("headphones", "\\b(headphones|earphones|airpods|earbuds)\\b"),
        PatternRule.of("watch", "\\b(watch|smartwatch)\\b")
    );

    private static final Pattern RAM_PATTERN = Pattern.compile("\\b(\\d+)\\s*gb\\s*(?:ram|memory)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAMERA_PATTERN = Pattern.compile("\\b(\\d+)\\s*mp\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISPLAY_PATTERN = Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\s*(?:inch|\")", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Extract features from the product name, using the query as extra context.
     */
    public FeatureSet extract(String productName, String query) {
        String text = ((productName == null ? "" : productName) + " " + (query == null ? "" : query))
            .toLowerCase(Locale.ROOT);
        String brand = firstLabel(BRAND_RULES, text);
        return FeatureSet.builder()
            .brand(brand)
            .model(extractModel(text, brand))
            .storage(extractStorage(text))
            .color(earliestLabel(COLOR_RULES, text))
            .category(firstLabel(CATEGORY_RULES, text))
            .keySpecs(extractKeySpecs(text))
            .build();
    }

    private String extractModel(String text, String brand) {
        if (brand != null) {
            for (PatternRule rule : MODEL_RULES.getOrDefault(brand, List.of())) {
                Matcher matcher = rule.matcher(text);
                if (matcher.find()) {
                    return normalizeSpaces(matcher.group(1));
                }
            }
        }
        Matcher matcher = GENERIC_MODEL_RULE.matcher(text);
        return matcher.find() ? normalizeSpaces(matcher.group(1)) : null;
    }

    private String extractStorage(String text) {
        Matcher matcher = STORAGE_RULE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return matcher.group(1) + matcher.group(2).toUpperCase(Locale.ROOT);
    }

    private List<String> extractKeySpecs(String text) {
        List<String> specs = new ArrayList<>();
        Matcher ram = RAM_PATTERN.matcher(text);
        if (ram.find()) {
            specs.add(ram.group(1) + "GB RAM");
        }
        Matcher camera = CAMERA_PATTERN.matcher(text);
        if (camera.find()) {
            specs.add(camera.group(1) + "MP");
        }
        Matcher display = DISPLAY_PATTERN.matcher(text);
        if (display.find()) {
            specs.add(display.group(1) + "\"");
        }
        return List.copyOf(specs);
    }

    private static String firstLabel(List<PatternRule> rules, String text) {
        for (PatternRule rule : rules) {
            if (rule.matches(text)) {
                return rule.label();
            }
        }
        return null;
    }

    /**
     * Label of the rule matching earliest in the text, so the product name wins over the query.
     */
    private static String earliestLabel(List<PatternRule> rules, String text) {
        String label = null;
        int start = Integer.MAX_VALUE;
        for (PatternRule rule : rules) {
            Matcher matcher = rule.matcher(text);
            if (matcher.find() && matcher.start() < start) {
                start = matcher.start();
                label = rule.label();
            }
        }
        return label;
    }

    private static String normalizeSpaces(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

}
