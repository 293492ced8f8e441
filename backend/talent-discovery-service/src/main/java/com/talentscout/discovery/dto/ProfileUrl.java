package com.talentscout.discovery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical profile link (scheme, host and path only, no trailing slash).
 * The url is the deduplication key.
 */
public record ProfileUrl(
        String url,
        @JsonProperty("profile_id") String profileId
) {
    @Override
    public String toString() {
        return url;
    }
}
