package com.talentscout.discovery.dto;

import com.talentscout.discovery.exception.SearchBackendException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * API response for a discovery request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryResponse {

    private List<String> profiles;

    private Integer totalProfiles;

    private List<String> queries;

    private Integer queriesAttempted;

    private Integer rawHits;

    private Integer rejectedHits;

    private Map<SearchBackendException.Kind, Integer> backendFailures;

    public static DiscoveryResponse from(DiscoveryResult result) {
        return DiscoveryResponse.builder()
                .profiles(result.profileUrls())
                .totalProfiles(result.getProfiles().size())
                .queries(result.getQueries().stream().map(SearchQuery::text).toList())
                .queriesAttempted(result.getQueriesAttempted())
                .rawHits(result.getRawHitCount())
                .rejectedHits(result.getRejectedHitCount())
                .backendFailures(result.getBackendFailures())
                .build();
    }
}
