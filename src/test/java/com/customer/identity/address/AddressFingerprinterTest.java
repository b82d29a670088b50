package com.customer.identity.address;

import com.customer.identity.core.model.CustomerIdentity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AddressFingerprinter Tests")
class AddressFingerprinterTest {

    private final AddressFingerprinter fingerprinter = new AddressFingerprinter();

    private static AddressInput janeDoe() {
        return AddressInput.builder()
                .name("Jane Doe")
                .line1("123 Main St")
                .city("Austin")
                .region("TX")
                .postalCode("78701")
                .build();
    }

    @Nested
    @DisplayName("Canonical form")
    class CanonicalFormTests {

        @Test
        @DisplayName("Should lower-case, strip punctuation and default the country")
        void canonicalForm() {
            AddressInput address = AddressInput.builder()
                    .name("Jane  Doe")
                    .line1("123 Main St.")
                    .line2("Apt #4")
                    .city("Austin")
                    .region("TX")
                    .postalCode("78701")
                    .build();

            assertEquals("jane doe|123 main st|apt 4|austin|tx|78701|us", fingerprinter.canonicalForm(address));
        }

        @Test
        @DisplayName("Missing components should contribute empty strings")
        void missingComponents() {
            AddressInput address = AddressInput.builder().line1("1 Elm").postalCode("10001").build();

            assertEquals("|1 elm||||10001|us", fingerprinter.canonicalForm(address));
        }

        @Test
        @DisplayName("Should strip leading zeros from the postal code")
        void postalLeadingZeros() {
            AddressInput address = AddressInput.builder().line1("1 Elm").postalCode("02134").build();

            assertTrue(fingerprinter.canonicalForm(address).contains("|2134|"));
        }

        @Test
        @DisplayName("Should map spelled-out United States to us")
        void countryAliases() {
            AddressInput usa = AddressInput.builder().line1("1 Elm").city("Boston").country("U.S.A.").build();
            AddressInput spelled = AddressInput.builder().line1("1 Elm").city("Boston")
                    .country("United States of America").build();

            assertTrue(fingerprinter.canonicalForm(usa).endsWith("|us"));
            assertTrue(fingerprinter.canonicalForm(spelled).endsWith("|us"));
        }
    }

    @Nested
    @DisplayName("Fingerprint")
    class FingerprintTests {

        @Test
        @DisplayName("Should be 16 lower-case hex characters")
        void format() {
            String hash = fingerprinter.fingerprint(janeDoe()).orElseThrow();

            assertEquals(AddressFingerprinter.HASH_LENGTH, hash.length());
            assertTrue(hash.matches("[0-9a-f]{16}"));
        }

        @Test
        @DisplayName("Formatting differences should not change the fingerprint")
        void formattingInsensitive() {
            AddressInput noisy = AddressInput.builder()
                    .name("  JANE DOE ")
                    .line1("123 Main St.")
                    .city("AUSTIN")
                    .region("tx")
                    .postalCode("078701")
                    .country("USA")
                    .build();

            assertEquals(fingerprinter.fingerprint(janeDoe()), fingerprinter.fingerprint(noisy));
        }

        @Test
        @DisplayName("Different units at the same street address should not collide")
        void unitsDiffer() {
            AddressInput unitA = AddressInput.builder().name("Jane Doe").line1("123 Main St").line2("Apt A")
                    .city("Austin").postalCode("78701").build();
            AddressInput unitB = AddressInput.builder().name("Jane Doe").line1("123 Main St").line2("Apt B")
                    .city("Austin").postalCode("78701").build();

            assertNotEquals(fingerprinter.fingerprint(unitA), fingerprinter.fingerprint(unitB));
        }

        @Test
        @DisplayName("Should be deterministic across instances")
        void deterministic() {
            assertEquals(fingerprinter.fingerprint(janeDoe()), new AddressFingerprinter().fingerprint(janeDoe()));
        }

        @Test
        @DisplayName("Synthetic external id should carry the address_hash prefix")
        void syntheticExternalId() {
            String hash = fingerprinter.fingerprint(janeDoe()).orElseThrow();

            assertEquals(Optional.of(CustomerIdentity.ADDRESS_HASH_PREFIX + hash),
                    fingerprinter.syntheticExternalId(janeDoe()));
        }
    }

    @Nested
    @DisplayName("Insufficient addresses")
    class InsufficientTests {

        @Test
        @DisplayName("Null address yields no fingerprint")
        void nullAddress() {
            assertTrue(fingerprinter.fingerprint(null).isEmpty());
        }

        @Test
        @DisplayName("Address without name or first line yields no fingerprint")
        void noWho() {
            AddressInput address = AddressInput.builder().city("Austin").postalCode("78701").build();

            assertFalse(fingerprinter.isSufficient(address));
            assertTrue(fingerprinter.fingerprint(address).isEmpty());
        }

        @Test
        @DisplayName("Address without city or postal code yields no fingerprint")
        void noWhere() {
            AddressInput address = AddressInput.builder().name("Jane Doe").line1("123 Main St").region("TX").build();

            assertTrue(fingerprinter.fingerprint(address).isEmpty());
        }

        @Test
        @DisplayName("Punctuation-only components count as missing")
        void punctuationOnly() {
            AddressInput address = AddressInput.builder().name("--").line1("#").city("Austin").build();

            assertTrue(fingerprinter.fingerprint(address).isEmpty());
        }

        @Test
        @DisplayName("Name and postal code alone are sufficient")
        void nameAndPostal() {
            AddressInput address = AddressInput.builder().name("Jane Doe").postalCode("78701").build();

            assertTrue(fingerprinter.fingerprint(address).isPresent());
        }
    }
}
