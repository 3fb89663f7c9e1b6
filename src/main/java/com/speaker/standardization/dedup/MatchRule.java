package com.speaker.standardization.dedup;

/**
 * The rule that accepted a duplicate.
 */
public enum MatchRule {
    /**
     * Name similarity above the base threshold.
     */
    NAME_SIMILARITY,

    /**
     * Name similarity above the location threshold, corroborated by the same city.
     */
    NAME_AND_LOCATION
}
