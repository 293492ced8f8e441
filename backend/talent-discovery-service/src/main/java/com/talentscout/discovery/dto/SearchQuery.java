package com.talentscout.discovery.dto;

/**
 * A single search-engine query. Lower priority values are tried first.
 */
public record SearchQuery(
        String text,
        QueryStrategy strategy,
        int priority
) {
}
