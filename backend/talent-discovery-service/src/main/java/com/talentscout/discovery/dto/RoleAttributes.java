package com.talentscout.discovery.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Role attributes produced by the job-description analyzer.
 * Strings are trimmed, missing values become empty and list entries are
 * deduplicated in order with blanks removed.
 */
public record RoleAttributes(
        String title,
        String location,
        List<String> skills,
        @JsonAlias("search_keywords") List<String> searchKeywords
) {
    public RoleAttributes {
        title = clean(title);
        location = clean(location);
        skills = cleanList(skills);
        searchKeywords = cleanList(searchKeywords);
    }

    public static RoleAttributes of(String title, String location, List<String> skills) {
        return new RoleAttributes(title, location, skills, List.of());
    }

    public boolean hasTitle() {
        return !title.isEmpty();
    }

    public boolean hasLocation() {
        return !location.isEmpty();
    }

    public boolean hasKeywords() {
        return !searchKeywords.isEmpty();
    }

    public boolean isEmpty() {
        return !hasTitle() && !hasLocation() && skills.isEmpty() && searchKeywords.isEmpty();
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            String cleaned = clean(value);
            if (!cleaned.isEmpty()) {
                unique.add(cleaned);
            }
        }
        return List.copyOf(new ArrayList<>(unique));
    }
}
