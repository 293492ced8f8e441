package com.talentscout.discovery.dto;

/**
 * Generation rule that produced a search query, in the order the rules are applied.
 */
public enum QueryStrategy {
    KEYWORD,
    TITLE_LOCATION,
    TITLE_EXACT,
    SKILL_PAIR,
    TITLE_SKILL,
    LOCATION_BROAD
}
