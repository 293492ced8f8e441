package com.talentscout.discovery.dto;

import com.talentscout.discovery.exception.SearchBackendException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one discovery run: the profiles plus diagnostics about how they were found.
 * An empty profile list is a valid outcome.
 */
@Value
@Builder
public class DiscoveryResult {

    List<ProfileUrl> profiles;

    List<SearchQuery> queries;

    int queriesAttempted;

    int rawHitCount;

    /**
     * Hits dropped by URL validation
     */
    int rejectedHitCount;

    /**
     * Queries answered by each backend
     */
    @Singular("backendSuccess")
    Map<String, Integer> backendSuccesses;

    @Singular("backendFailure")
    Map<SearchBackendException.Kind, Integer> backendFailures;

    boolean cancelled;

    Instant startedAt;

    Instant finishedAt;

    public List<String> profileUrls() {
        return profiles.stream().map(ProfileUrl::url).toList();
    }

    public boolean isEmpty() {
        return profiles.isEmpty();
    }
}
