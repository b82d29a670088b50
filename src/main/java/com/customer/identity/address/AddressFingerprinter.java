package com.customer.identity.address;

import com.customer.identity.core.model.CustomerIdentity;
import com.customer.identity.rules.AddressNormalizationRules;
import com.customer.identity.rules.NormalizationEngine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Computes a deterministic fingerprint for an address, used as a pseudo identifier for
 * providers that expose no email or phone.
 *
 * <p>Each field is lower-cased, stripped of punctuation and whitespace-collapsed by the
 * {@link NormalizationEngine}; the fields are joined in {@link AddressField} order with
 * {@code |} and hashed with SHA-256. The first {@value #HASH_LENGTH} hex characters form the
 * fingerprint. A missing country defaults to {@value #DEFAULT_COUNTRY}.</p>
 *
 * <p>An address that has neither a name nor a first line, or neither a city nor a postal code,
 * does not identify anyone and yields no fingerprint. Unit and suite numbers are kept, so
 * "Apt A" and "Apt B" fingerprint differently.</p>
 */
public class AddressFingerprinter {

    public static final int HASH_LENGTH = 16;
    public static final String DEFAULT_COUNTRY = "us";
    private static final String SEPARATOR = "|";

    private final NormalizationEngine engine;

    public AddressFingerprinter() {
        this(AddressNormalizationRules.createDefaultEngine());
    }

    public AddressFingerprinter(NormalizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Fingerprints the address.
     *
     * @return the hex fingerprint, or empty when the address is absent or insufficient
     */
    public Optional<String> fingerprint(AddressInput address) {
        if (!isSufficient(address)) {
            return Optional.empty();
        }
        return Optional.of(sha256Hex(canonicalForm(address)).substring(0, HASH_LENGTH));
    }

    /**
     * Returns the synthetic external id for an address, {@code address_hash:<hash>}.
     */
    public Optional<String> syntheticExternalId(AddressInput address) {
        return fingerprint(address).map(hash -> CustomerIdentity.ADDRESS_HASH_PREFIX + hash);
    }

    /**
     * Returns the normalized, separator-joined text that is hashed.
     * Missing components contribute an empty string.
     */
    public String canonicalForm(AddressInput address) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (AddressField field : AddressField.values()) {
            String value = address != null ? engine.normalize(address.get(field), field) : "";
            if (field == AddressField.COUNTRY && value.isEmpty()) {
                value = DEFAULT_COUNTRY;
            }
            joiner.add(value);
        }
        return joiner.toString();
    }

    public boolean isSufficient(AddressInput address) {
        if (address == null) {
            return false;
        }
        boolean hasWho = !normalized(address, AddressField.NAME).isEmpty()
                || !normalized(address, AddressField.LINE1).isEmpty();
        boolean hasWhere = !normalized(address, AddressField.CITY).isEmpty()
                || !normalized(address, AddressField.POSTAL_CODE).isEmpty();
        return hasWho && hasWhere;
    }

    private String normalized(AddressInput address, AddressField field) {
        return engine.normalize(address.get(field), field);
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
