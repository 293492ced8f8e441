package com.talentscout.discovery.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscout.discovery.dto.SearchHit;
import com.talentscout.discovery.exception.SearchBackendException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SerpApiSearchClient unit tests
 */
class SerpApiSearchClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private static final String RESULTS = """
            {
              "search_metadata": {"status": "Success"},
              "organic_results": [
                {"position": 1, "title": "Jane Doe - Engineer", "link": "https://www.linkedin.com/in/jane-doe"},
                {"position": 2, "title": "no link here"},
                {"position": 3, "title": "John", "link": "https://ca.linkedin.com/in/john-smith/"},
                {"position": 4, "title": "Mia", "link": "https://www.linkedin.com/in/mia-x"}
              ]
            }
            """;

    private SerpApiSearchClient client(StubExchange exchange) {
        return new SerpApiSearchClient(exchange.webClient(), new ObjectMapper(),
                "https://serpapi.test", "secret-key", "google");
    }

    @Test
    @DisplayName("reads organic_results links in order")
    void readsOrganicResults() {
        StubExchange exchange = StubExchange.json(RESULTS);

        List<SearchHit> hits = client(exchange).search("site:linkedin.com/in/ \"Java Developer\"", 10, TIMEOUT);

        assertThat(hits).extracting(SearchHit::url).containsExactly(
                "https://www.linkedin.com/in/jane-doe",
                "https://ca.linkedin.com/in/john-smith/",
                "https://www.linkedin.com/in/mia-x");
        assertThat(hits).extracting(SearchHit::sourceBackend).containsOnly("serpapi");
    }

    @Test
    @DisplayName("never returns more than the limit")
    void respectsLimit() {
        List<SearchHit> hits = client(StubExchange.json(RESULTS)).search("q", 2, TIMEOUT);

        assertThat(hits).hasSize(2);
    }

    @Test
    @DisplayName("sends query, engine, num and key with strict encoding")
    void buildsRequest() {
        StubExchange exchange = StubExchange.json(RESULTS);

        client(exchange).search("site:linkedin.com/in/ C++ & Go", 7, TIMEOUT);

        URI uri = exchange.lastRequest().url();
        assertThat(uri.getHost()).isEqualTo("serpapi.test");
        assertThat(uri.getPath()).isEqualTo("/search");
        assertThat(uri.getRawQuery())
                .contains("engine=google")
                .contains("num=7")
                .contains("api_key=secret-key")
                .contains("q=site%3Alinkedin.com%2Fin%2F%20C%2B%2B%20%26%20Go");
        assertThat(exchange.lastRequest().headers().getFirst(HttpHeaders.ACCEPT)).isEqualTo("application/json");
    }

    @Test
    @DisplayName("an empty organic_results array is a valid empty answer")
    void emptyResults() {
        List<SearchHit> hits = client(StubExchange.json("{\"organic_results\": []}")).search("q", 10, TIMEOUT);

        assertThat(hits).isEmpty();
    }

    @Test
    @DisplayName("missing organic_results is a parse failure carrying the API error")
    void missingResults() {
        SerpApiSearchClient client = client(StubExchange.json("{\"error\": \"Invalid API key.\"}"));

        assertThatThrownBy(() -> client.search("q", 10, TIMEOUT))
                .isInstanceOf(SearchBackendException.class)
                .hasMessageContaining("Invalid API key.")
                .extracting("kind").isEqualTo(SearchBackendException.Kind.PARSE_FAILURE);
    }

    @Test
    @DisplayName("malformed JSON is a parse failure")
    void malformedJson() {
        SerpApiSearchClient client = client(StubExchange.json("<html>captcha</html>"));

        assertThatThrownBy(() -> client.search("q", 10, TIMEOUT))
                .isInstanceOf(SearchBackendException.class)
                .extracting("kind").isEqualTo(SearchBackendException.Kind.PARSE_FAILURE);
    }

    @Test
    @DisplayName("HTTP 429 is reported as rate limiting")
    void rateLimited() {
        SerpApiSearchClient client = client(StubExchange.status(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.search("q", 10, TIMEOUT))
                .isInstanceOfSatisfying(SearchBackendException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(SearchBackendException.Kind.RATE_LIMITED);
                    assertThat(e.getBackend()).isEqualTo("serpapi");
                });
    }

    @Test
    @DisplayName("other HTTP errors are transport failures")
    void serverError() {
        SerpApiSearchClient client = client(StubExchange.status(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> client.search("q", 10, TIMEOUT))
                .isInstanceOf(SearchBackendException.class)
                .hasMessageContaining("HTTP 502")
                .extracting("kind").isEqualTo(SearchBackendException.Kind.TRANSPORT_FAILURE);
    }

    @Test
    @DisplayName("a response slower than the timeout is reported as a timeout")
    void timeout() {
        SerpApiSearchClient client = client(StubExchange.hang());

        assertThatThrownBy(() -> client.search("q", 10, Duration.ofMillis(100)))
                .isInstanceOf(SearchBackendException.class)
                .extracting("kind").isEqualTo(SearchBackendException.Kind.TIMEOUT);
    }

    @Test
    @DisplayName("connection errors are transport failures")
    void connectionRefused() {
        WebClientRequestException refused = new WebClientRequestException(
                new ConnectException("Connection refused"),
                HttpMethod.GET,
                URI.create("https://serpapi.test/search"),
                new HttpHeaders());
        SerpApiSearchClient client = client(StubExchange.fail(refused));

        assertThatThrownBy(() -> client.search("q", 10, TIMEOUT))
                .isInstanceOf(SearchBackendException.class)
                .extracting("kind").isEqualTo(SearchBackendException.Kind.TRANSPORT_FAILURE);
    }
}
