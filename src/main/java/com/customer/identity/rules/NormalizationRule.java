package com.customer.identity.rules;

import com.customer.identity.address.AddressField;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite. A rule with no fields is global: it applies to every
 * address field and to free text. A scoped rule applies only to its fields.
 *
 * @param name        unique rule name, used for removal and tracing
 * @param pattern     compiled pattern
 * @param replacement replacement text, may reference groups
 * @param fields      fields the rule is scoped to, empty when global
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, Set<AddressField> fields,
                                int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        fields = fields == null ? Set.of() : Set.copyOf(fields);
    }

    public boolean isGlobal() {
        return fields.isEmpty();
    }

    /**
     * Whether the rule runs for {@code field}; {@code null} stands for free text, which only
     * global rules touch.
     */
    public boolean scopedTo(AddressField field) {
        return field == null ? isGlobal() : isGlobal() || fields.contains(field);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "[" + pattern.pattern() + " -> '" + replacement + "', priority=" + priority
                + (isGlobal() ? "" : ", fields=" + fields) + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String regex;
        private String replacement;
        private final Set<AddressField> fields = EnumSet.noneOf(AddressField.class);
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder applicableFields(AddressField... fields) {
            this.fields.addAll(Set.of(fields));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(regex, "pattern is required");
            return new NormalizationRule(name,
                    Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    replacement, fields, priority);
        }
    }
}
