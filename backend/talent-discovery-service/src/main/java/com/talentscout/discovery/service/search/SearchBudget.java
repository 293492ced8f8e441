package com.talentscout.discovery.service.search;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Limits and counters of a single discovery run. Not thread-safe and never
 * shared between runs.
 */
public class SearchBudget {

    private final int maxTotalResults;
    private final int maxResultsPerQuery;
    private final Set<String> seenProfiles = new LinkedHashSet<>();
    private int queriesAttempted;

    public SearchBudget(int maxTotalResults, int maxResultsPerQuery) {
        if (maxTotalResults < 0) {
            throw new IllegalArgumentException("maxTotalResults must not be negative");
        }
        if (maxResultsPerQuery < 1) {
            throw new IllegalArgumentException("maxResultsPerQuery must be at least 1");
        }
        this.maxTotalResults = maxTotalResults;
        this.maxResultsPerQuery = maxResultsPerQuery;
    }

    public int getMaxTotalResults() {
        return maxTotalResults;
    }

    public int getMaxResultsPerQuery() {
        return maxResultsPerQuery;
    }

    public int getQueriesAttempted() {
        return queriesAttempted;
    }

    public void recordQueryAttempt() {
        queriesAttempted++;
    }

    /**
     * Records a canonical profile identity.
     *
     * @return true if it had not been seen in this run
     */
    public boolean recordProfile(String canonicalUrl) {
        return seenProfiles.add(canonicalUrl);
    }

    public int getDistinctProfileCount() {
        return seenProfiles.size();
    }

    public boolean isExhausted() {
        return seenProfiles.size() >= maxTotalResults;
    }
}
