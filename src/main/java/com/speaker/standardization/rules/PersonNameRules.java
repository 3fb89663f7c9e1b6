package com.speaker.standardization.rules;

import java.util.List;

/**
 * Built-in rules for speaker names: leading honorifics and trailing degrees or generational suffixes.
 */
public final class PersonNameRules {

    private PersonNameRules() {
        // Utility class
    }

    public static NameNormalizationEngine createDefaultEngine() {
        return new NameNormalizationEngine(getRules());
    }

    public static List<NormalizationRule> getRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-honorific")
                        .pattern("^(Dr|Prof|Professor|Mr|Mrs|Ms|Mx)\\.?\\s+")
                        .priority(10)
                        .build(),

                // Repeats so that "Jane Smith, PhD, MBA" loses both
                NormalizationRule.builder()
                        .name("person-credential-suffix")
                        .pattern("(,?\\s+(Ph\\.?\\s?D\\.?|MBA|M\\.?D\\.?|CSP|Esq\\.?))+$")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("person-generational-suffix")
                        .pattern(",?\\s+(Jr\\.?|Sr\\.?|Junior|Senior)$")
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("person-trailing-punctuation")
                        .pattern("[,;]+$")
                        .priority(40)
                        .build()
        );
    }
}
