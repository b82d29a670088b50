package com.customer.identity.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContactNormalizer Tests")
class ContactNormalizerTest {

    @Nested
    @DisplayName("Email")
    class EmailTests {

        @Test
        @DisplayName("Should trim and lower-case")
        void trimAndLowerCase() {
            assertEquals("jane@example.com", ContactNormalizer.normalizeEmail("  Jane@Example.COM "));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t"})
        @DisplayName("Blank input should be absent")
        void blank(String email) {
            assertNull(ContactNormalizer.normalizeEmail(email));
        }
    }

    @Nested
    @DisplayName("Phone")
    class PhoneTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "'(512) 555-0100',    +15125550100",
                "'512.555.0100',      +15125550100",
                "'1-512-555-0100',    +15125550100",
                "'+1 512 555 0100',   +15125550100",
                "'+44 20 7946 0958',  +442079460958",
                "'555-0100',          5550100"
        })
        @DisplayName("Should normalize common formats")
        void formats(String input, String expected) {
            assertEquals(expected, ContactNormalizer.normalizePhone(input));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"  ", "n/a", "ext."})
        @DisplayName("Input without digits should be absent")
        void noDigits(String phone) {
            assertNull(ContactNormalizer.normalizePhone(phone));
        }

        @Test
        @DisplayName("Phone key should be the last ten digits")
        void phoneKey() {
            assertEquals("5125550100", ContactNormalizer.phoneKey("+1 (512) 555-0100"));
            assertEquals("5125550100", ContactNormalizer.phoneKey("512-555-0100"));
            assertEquals("5550100", ContactNormalizer.phoneKey("555-0100"));
            assertEquals("", ContactNormalizer.phoneKey(null));
        }

        @Test
        @DisplayName("Numbers with and without country code share a key")
        void keyIgnoresCountryCode() {
            assertEquals(ContactNormalizer.phoneKey(ContactNormalizer.normalizePhone("(512) 555-0100")),
                    ContactNormalizer.phoneKey("5125550100"));
        }
    }
}
