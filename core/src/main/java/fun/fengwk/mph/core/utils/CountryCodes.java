package fun.fengwk.mph.core.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * @author fengwk
 */
public final class CountryCodes {

    private static final Pattern COUNTRY_PATTERN = Pattern.compile("[A-Za-z]{2}");

    private CountryCodes() {
    }

    /**
     * Upper-case two letter code.
     *
     * @throws IllegalArgumentException if the code is blank or not two letters
     */
    public static String normalize(String country) {
        if (StringUtils.isBlank(country) || !COUNTRY_PATTERN.matcher(country.trim()).matches()) {
            throw new IllegalArgumentException("country is invalid");
        }
        return country.trim().toUpperCase(Locale.ROOT);
    }

}
