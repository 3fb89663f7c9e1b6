package com.speaker.standardization.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies {@link NormalizationRule}s to speaker names.
 *
 * <p>Unlike the fingerprint, the cleaned name keeps its case and punctuation: it is the value
 * stored as {@code name} and compared by the similarity scorer.</p>
 */
public class NameNormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizationEngine.class);

    private final List<NormalizationRule> rules = new ArrayList<>();

    public NameNormalizationEngine(List<NormalizationRule> rules) {
        addRules(rules);
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Cleans a raw name. Null or blank input yields {@code ""}.
     * Surrounding whitespace is trimmed and inner runs collapsed after all rules ran.
     */
    public String clean(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String result = name.strip();
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.trace("name.rule rule={} before='{}' after='{}'", rule.getName(), before, result);
            }
        }
        result = result.strip().replaceAll("\\s+", " ");
        // A name made only of a title stays as written.
        return result.isEmpty() ? name.strip().replaceAll("\\s+", " ") : result;
    }
}
