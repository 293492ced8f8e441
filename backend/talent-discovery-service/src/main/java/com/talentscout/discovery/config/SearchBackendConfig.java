package com.talentscout.discovery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscout.discovery.client.BingSearchClient;
import com.talentscout.discovery.client.DuckDuckGoSearchClient;
import com.talentscout.discovery.client.GoogleRedirectSearchClient;
import com.talentscout.discovery.client.SearchBackendChain;
import com.talentscout.discovery.client.SearchBackendClient;
import com.talentscout.discovery.client.SerpApiSearchClient;
import com.talentscout.discovery.exception.DiscoveryConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Assembles the backend fallback chain from {@code discovery.backends.order}.
 *
 * Names: serpapi, duckduckgo, bing, google. "google" expands to one backend per
 * configured Google domain. serpapi is skipped while no API key is set.
 */
@Configuration
@Slf4j
public class SearchBackendConfig {

    @Bean
    public SearchBackendChain searchBackendChain(DiscoveryProperties properties,
                                                 WebClient searchWebClient,
                                                 ObjectMapper objectMapper) {
        SearchBackendChain chain = buildChain(properties, searchWebClient, objectMapper);
        log.info("Search backend chain initialized with {} backends: {}", chain.backends().size(), chain.names());
        return chain;
    }

    public static SearchBackendChain buildChain(DiscoveryProperties properties,
                                                WebClient webClient,
                                                ObjectMapper objectMapper) {
        DiscoveryProperties.Backends config = properties.getBackends();
        List<SearchBackendClient> backends = new ArrayList<>();

        for (String entry : config.getOrder()) {
            String name = entry == null ? "" : entry.trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case SerpApiSearchClient.NAME -> {
                    DiscoveryProperties.SerpApi serpapi = config.getSerpapi();
                    if (serpapi.isEnabled()) {
                        backends.add(new SerpApiSearchClient(webClient, objectMapper,
                                serpapi.getBaseUrl(), serpapi.getApiKey(), serpapi.getEngine()));
                    } else {
                        log.info("SerpAPI key not configured, skipping structured search backend");
                    }
                }
                case DuckDuckGoSearchClient.NAME ->
                        backends.add(new DuckDuckGoSearchClient(webClient, config.getDuckduckgo().getBaseUrl()));
                case BingSearchClient.NAME ->
                        backends.add(new BingSearchClient(webClient, config.getBing().getBaseUrl()));
                case GoogleRedirectSearchClient.NAME_PREFIX -> {
                    for (String domain : config.getGoogle().getDomains()) {
                        backends.add(new GoogleRedirectSearchClient(webClient, domain,
                                properties.getProfile().getDomain()));
                    }
                }
                default -> throw DiscoveryConfigurationException.unknownBackend(entry);
            }
        }

        return new SearchBackendChain(backends);
    }
}
