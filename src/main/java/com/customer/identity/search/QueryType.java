package com.customer.identity.search;

import com.customer.identity.rules.ContactNormalizer;

import java.util.regex.Pattern;

/**
 * Shape of a search query, detected from its text.
 */
public enum QueryType {
    EMAIL,
    PHONE,
    NAME;

    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?[\\d\\s\\-().]{7,}$");

    /**
     * Anything containing {@code @} is an email; digits with phone punctuation (at least seven
     * characters) are a phone; everything else is a name.
     */
    public static QueryType detect(String query) {
        if (query == null) {
            return NAME;
        }
        String trimmed = query.trim();
        if (trimmed.contains("@")) {
            return EMAIL;
        }
        if (PHONE_PATTERN.matcher(trimmed).matches() && !ContactNormalizer.digitsOf(trimmed).isEmpty()) {
            return PHONE;
        }
        return NAME;
    }
}
