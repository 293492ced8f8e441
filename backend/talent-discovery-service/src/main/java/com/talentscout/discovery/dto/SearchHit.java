package com.talentscout.discovery.dto;

/**
 * Raw link returned by a search backend, before normalization.
 */
public record SearchHit(
        String url,
        String sourceBackend  // e.g., "serpapi", "duckduckgo", "google:www.google.com"
) {
}
