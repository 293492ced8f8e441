package com.talentscout.discovery.service.search;

import com.talentscout.discovery.dto.ProfileUrl;
import com.talentscout.discovery.dto.SearchHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces raw hits to distinct, valid profiles in first-seen order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResultAggregator {

    private final ProfileUrlNormalizer normalizer;

    public List<ProfileUrl> aggregate(List<SearchHit> hits, int maxTotal) {
        if (maxTotal < 0) {
            throw new IllegalArgumentException("maxTotal must not be negative");
        }
        if (maxTotal == 0 || hits == null || hits.isEmpty()) {
            return List.of();
        }

        Map<String, ProfileUrl> distinct = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            if (distinct.size() >= maxTotal) {
                break;
            }
            ProfileUrl profile = normalizer.normalize(hit.url());
            if (profile != null) {
                distinct.putIfAbsent(profile.url(), profile);
            }
        }

        log.debug("Aggregated {} raw hits into {} profiles (max {})", hits.size(), distinct.size(), maxTotal);
        return new ArrayList<>(distinct.values());
    }

    /**
     * Number of hits that fail URL validation.
     */
    public int countRejected(List<SearchHit> hits) {
        if (hits == null) {
            return 0;
        }
        int rejected = 0;
        for (SearchHit hit : hits) {
            if (normalizer.normalize(hit.url()) == null) {
                rejected++;
            }
        }
        return rejected;
    }
}
