package com.talentscout.discovery.service.search;

import com.talentscout.discovery.config.DiscoveryProperties;
import com.talentscout.discovery.dto.QueryStrategy;
import com.talentscout.discovery.dto.RoleAttributes;
import com.talentscout.discovery.dto.SearchQuery;
import com.talentscout.discovery.exception.QueryBuildException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns role attributes into site-restricted search queries.
 *
 * Strategies, applied in this order:
 * 1. KEYWORD        - one query per search keyword (+ location)
 * 2. TITLE_LOCATION - title + location, only when no keyword query exists
 * 3. TITLE_EXACT    - quoted title, and quoted title + quoted location
 * 4. SKILL_PAIR     - top two skills, and with location
 * 5. TITLE_SKILL    - title + first skill
 * 6. LOCATION_BROAD - location + generic role nouns
 *
 * Queries are deduplicated by text (first wins) and capped.
 */
@Component
@Slf4j
public class QueryBuilder {

    private static final List<String> GENERIC_ROLES = List.of("developer", "engineer");

    private final String sitePrefix;
    private final int defaultMaxQueries;
    private final int keywordMaxQueries;

    @Autowired
    public QueryBuilder(DiscoveryProperties properties) {
        this(properties.getProfile().getDomain(),
                properties.getProfile().getPathPrefix(),
                properties.getQuery().getMaxQueries(),
                properties.getQuery().getKeywordMaxQueries());
    }

    public QueryBuilder(String profileDomain, String pathPrefix, int defaultMaxQueries, int keywordMaxQueries) {
        String prefix = pathPrefix.startsWith("/") ? pathPrefix : "/" + pathPrefix;
        this.sitePrefix = "site:" + profileDomain + prefix;
        this.defaultMaxQueries = defaultMaxQueries;
        this.keywordMaxQueries = keywordMaxQueries;
    }

    /**
     * Builds queries with the configured cap: a larger one when explicit keywords are present.
     */
    public List<SearchQuery> buildQueries(RoleAttributes attrs) {
        if (attrs == null) {
            throw QueryBuildException.missingAttributes();
        }
        return buildQueries(attrs, attrs.hasKeywords() ? keywordMaxQueries : defaultMaxQueries);
    }

    public List<SearchQuery> buildQueries(RoleAttributes attrs, int maxQueries) {
        if (attrs == null) {
            throw QueryBuildException.missingAttributes();
        }
        if (maxQueries < 1) {
            throw QueryBuildException.invalidLimit(maxQueries);
        }

        Map<String, QueryStrategy> candidates = new LinkedHashMap<>();

        for (String keyword : attrs.searchKeywords()) {
            if (candidates.size() >= maxQueries) {
                break;
            }
            add(candidates, QueryStrategy.KEYWORD, join(keyword, attrs.location()));
        }

        if (candidates.isEmpty() && (attrs.hasTitle() || attrs.hasLocation())) {
            add(candidates, QueryStrategy.TITLE_LOCATION, join(attrs.title(), attrs.location()));
        }

        if (attrs.hasTitle()) {
            add(candidates, QueryStrategy.TITLE_EXACT, quoted(attrs.title()));
            if (attrs.hasLocation()) {
                add(candidates, QueryStrategy.TITLE_EXACT, quoted(attrs.title(), attrs.location()));
            }
        }

        List<String> skills = attrs.skills();
        if (skills.size() >= 2) {
            add(candidates, QueryStrategy.SKILL_PAIR, quoted(skills.get(0), skills.get(1)));
            if (attrs.hasLocation()) {
                add(candidates, QueryStrategy.SKILL_PAIR, quoted(skills.get(0), skills.get(1), attrs.location()));
            }
        }

        if (attrs.hasTitle() && !skills.isEmpty()) {
            add(candidates, QueryStrategy.TITLE_SKILL, quoted(attrs.title(), skills.get(0)));
        }

        if (attrs.hasLocation()) {
            for (String role : GENERIC_ROLES) {
                add(candidates, QueryStrategy.LOCATION_BROAD, quoted(attrs.location()) + " " + role);
            }
        }

        List<SearchQuery> queries = new ArrayList<>();
        for (Map.Entry<String, QueryStrategy> entry : candidates.entrySet()) {
            if (queries.size() >= maxQueries) {
                break;
            }
            queries.add(new SearchQuery(entry.getKey(), entry.getValue(), queries.size()));
        }

        log.debug("Built {} queries (cap {}) from {} candidates", queries.size(), maxQueries, candidates.size());
        return queries;
    }

    private void add(Map<String, QueryStrategy> candidates, QueryStrategy strategy, String terms) {
        candidates.putIfAbsent(sitePrefix + " " + terms, strategy);
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(part);
        }
        return sb.toString();
    }

    private static String quoted(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append('"').append(part).append('"');
        }
        return sb.toString();
    }
}
