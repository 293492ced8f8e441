package com.talentscout.discovery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscout.discovery.client.SearchBackendChain;
import com.talentscout.discovery.exception.DiscoveryConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Backend chain assembly tests
 */
class SearchBackendConfigTest {

    private DiscoveryProperties properties;
    private final WebClient webClient = WebClient.builder().build();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
    }

    private SearchBackendChain build() {
        return SearchBackendConfig.buildChain(properties, webClient, objectMapper);
    }

    @Test
    @DisplayName("serpapi is skipped without a key and google expands per domain")
    void defaultOrderWithoutKey() {
        assertThat(build().names()).containsExactly(
                "duckduckgo", "google:www.google.com", "google:www.google.co.uk", "google:www.google.ca");
    }

    @Test
    @DisplayName("serpapi leads the chain once a key is set")
    void serpApiWithKey() {
        properties.getBackends().getSerpapi().setApiKey("abc123");
        properties.getBackends().getGoogle().setDomains(List.of("www.google.de"));

        assertThat(build().names()).containsExactly("serpapi", "duckduckgo", "google:www.google.de");
    }

    @Test
    @DisplayName("order entries are case-insensitive and trimmed")
    void customOrder() {
        properties.getBackends().setOrder(List.of(" Bing ", "DUCKDUCKGO"));

        assertThat(build().names()).containsExactly("bing", "duckduckgo");
    }

    @Test
    @DisplayName("an unknown backend name fails fast")
    void unknownBackend() {
        properties.getBackends().setOrder(List.of("duckduckgo", "altavista"));

        assertThatThrownBy(this::build)
                .isInstanceOf(DiscoveryConfigurationException.class)
                .hasMessageContaining("altavista");
    }

    @Test
    @DisplayName("only a keyless serpapi gives an empty chain")
    void emptyChain() {
        properties.getBackends().setOrder(List.of("serpapi"));

        assertThat(build().isEmpty()).isTrue();
    }
}
