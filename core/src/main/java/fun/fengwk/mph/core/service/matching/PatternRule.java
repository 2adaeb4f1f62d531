package fun.fengwk.mph.core.service.matching;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A label paired with the pattern that detects it.
 *
 * @author fengwk
 */
public record PatternRule(String label, Pattern pattern) {

    public static PatternRule of(String label, String regex) {
        return new PatternRule(label, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    public boolean matches(CharSequence text) {
        return pattern.matcher(text).find();
    }

    public Matcher matcher(CharSequence text) {
        return pattern.matcher(text);
    }

}
