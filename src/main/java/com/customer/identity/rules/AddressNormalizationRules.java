package com.customer.identity.rules;

import com.customer.identity.address.AddressField;

import java.util.List;

/**
 * Built-in rules used to normalize addresses before fingerprinting.
 * Rules only remove formatting noise; they never collapse unit or suite numbers.
 */
public final class AddressNormalizationRules {

    private AddressNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getPostalCodeRules());
        engine.addRules(getCountryRules());
        return engine;
    }

    /**
     * Rules applied to every field, and to free text.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // "St." = "St", "O'Brien" = "OBrien", "#4" = "4"
                NormalizationRule.builder()
                        .name("common-strip-punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement("")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    public static List<NormalizationRule> getPostalCodeRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("postal-remove-spaces")
                        .pattern("\\s+")
                        .replacement("")
                        .applicableFields(AddressField.POSTAL_CODE)
                        .priority(150)
                        .build(),

                NormalizationRule.builder()
                        .name("postal-leading-zeros")
                        .pattern("^0+(?=\\p{Alnum})")
                        .replacement("")
                        .applicableFields(AddressField.POSTAL_CODE)
                        .priority(160)
                        .build()
        );
    }

    public static List<NormalizationRule> getCountryRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("country-united-states")
                        .pattern("^\\s*(usa|united\\s+states(\\s+of\\s+america)?)\\s*$")
                        .replacement("us")
                        .applicableFields(AddressField.COUNTRY)
                        .priority(150)
                        .build()
        );
    }
}
