package com.customer.identity.rules;

import java.util.Locale;

/**
 * Canonical forms for email addresses and phone numbers.
 * Every provider record is normalized with these before any lookup or write, so exact
 * comparisons between providers are meaningful.
 */
public final class ContactNormalizer {

    private static final int NATIONAL_NUMBER_LENGTH = 10;

    private ContactNormalizer() {
        // Utility class
    }

    /**
     * Trims and lower-cases an email address.
     *
     * @return the normalized email, or {@code null} when blank
     */
    public static String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String trimmed = email.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Converts a phone number to E.164 where the number is recognisably North American,
     * otherwise keeps its digits with any leading {@code +}.
     * <ul>
     *   <li>{@code (512) 555-0100} becomes {@code +15125550100}</li>
     *   <li>{@code 1-512-555-0100} becomes {@code +15125550100}</li>
     *   <li>{@code +44 20 7946 0958} becomes {@code +442079460958}</li>
     * </ul>
     *
     * @return the normalized phone, or {@code null} when it carries no digits
     */
    public static String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String trimmed = phone.trim();
        String digits = digitsOf(trimmed);
        if (digits.isEmpty()) {
            return null;
        }
        if (trimmed.startsWith("+")) {
            return "+" + digits;
        }
        if (digits.length() == NATIONAL_NUMBER_LENGTH) {
            return "+1" + digits;
        }
        if (digits.length() == NATIONAL_NUMBER_LENGTH + 1 && digits.charAt(0) == '1') {
            return "+" + digits;
        }
        return digits;
    }

    /**
     * Strips everything except digits.
     */
    public static String digitsOf(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Comparison key for phones: the last ten digits, so that numbers stored with and
     * without a country code compare equal.
     *
     * @return the key, or an empty string when the value has no digits
     */
    public static String phoneKey(String phone) {
        String digits = digitsOf(phone);
        return digits.length() > NATIONAL_NUMBER_LENGTH
                ? digits.substring(digits.length() - NATIONAL_NUMBER_LENGTH) : digits;
    }
}
