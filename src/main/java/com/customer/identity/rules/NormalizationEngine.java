package com.customer.identity.rules;

import com.customer.identity.address.AddressField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies normalization rules to address text.
 * Rules are applied in priority order (lower priority number = higher precedence).
 * The engine is pure: it never performs I/O and never throws for any input.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.name().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes free text using only the rules that are not scoped to a field.
     */
    public String normalize(String value) {
        return normalize(value, null);
    }

    /**
     * Normalizes a single address field. Missing values normalize to the empty string.
     */
    public String normalize(String value, AddressField field) {
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = value.toLowerCase(Locale.ROOT);

        for (NormalizationRule rule : rules) {
            if (!rule.scopedTo(field)) {
                continue;
            }
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("address.rule_applied rule={} field={} before='{}' after='{}'",
                        rule.name(), field, before, result);
            }
        }

        return result.trim().replaceAll("\\s+", " ");
    }

    /**
     * Checks whether two values of the same field normalize identically.
     */
    public boolean areEquivalent(String value1, String value2, AddressField field) {
        return normalize(value1, field).equals(normalize(value2, field));
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }
}
