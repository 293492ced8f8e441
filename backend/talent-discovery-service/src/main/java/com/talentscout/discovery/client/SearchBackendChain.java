package com.talentscout.discovery.client;

import java.util.List;

/**
 * Ordered fallback chain of enabled search backends.
 */
public record SearchBackendChain(List<SearchBackendClient> backends) {

    public SearchBackendChain {
        backends = List.copyOf(backends);
    }

    public List<String> names() {
        return backends.stream().map(SearchBackendClient::name).toList();
    }

    public boolean isEmpty() {
        return backends.isEmpty();
    }
}
