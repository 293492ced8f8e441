package com.talentscout.discovery.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings for profile discovery.
 *
 * Defaults target public LinkedIn profiles ({@code linkedin.com/in/<id>}).
 * Every value can be overridden under the {@code discovery} prefix.
 */
@ConfigurationProperties(prefix = "discovery")
@Validated
@Data
public class DiscoveryProperties {

    @Valid
    private Profile profile = new Profile();

    @Valid
    private Query query = new Query();

    @Valid
    private Search search = new Search();

    @Valid
    private Backends backends = new Backends();

    private Report report = new Report();

    private Cli cli = new Cli();

    @Data
    public static class Profile {
        /** Host (or parent domain) serving the profiles */
        @NotBlank
        private String domain = "linkedin.com";

        /** Path prefix in front of the profile identifier */
        @NotBlank
        private String pathPrefix = "/in/";
    }

    @Data
    public static class Query {
        /** Cap when only title/location/skills drive the queries */
        @Min(1)
        private int maxQueries = 4;

        /** Cap when explicit search keywords are supplied */
        @Min(1)
        private int keywordMaxQueries = 8;
    }

    @Data
    public static class Search {
        @Min(1)
        private int maxResultsPerQuery = 10;

        @Min(0)
        private int maxTotalResults = 50;

        /** Pause between two queries, also after failed ones */
        private Duration interQueryDelay = Duration.ofSeconds(1);

        /** Upper bound for a single backend call */
        private Duration backendTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Backends {
        /** Fallback chain, tried in this order for every query */
        @NotEmpty
        private List<String> order = new ArrayList<>(List.of("serpapi", "duckduckgo", "google"));

        private SerpApi serpapi = new SerpApi();

        private HtmlEngine duckduckgo = new HtmlEngine("https://html.duckduckgo.com");

        private HtmlEngine bing = new HtmlEngine("https://www.bing.com");

        private Google google = new Google();
    }

    @Data
    public static class SerpApi {
        /** The backend is skipped when no key is configured */
        private String apiKey = "";

        private String baseUrl = "https://serpapi.com";

        private String engine = "google";

        public boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class HtmlEngine {
        private String baseUrl;

        public HtmlEngine() {
        }

        public HtmlEngine(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    @Data
    public static class Google {
        /** One redirect-resolving backend is created per domain */
        private List<String> domains = new ArrayList<>(List.of("www.google.com", "www.google.co.uk", "www.google.ca"));
    }

    @Data
    public static class Report {
        private boolean enabled = false;

        private String outputFile = "linkedin_profiles.json";
    }

    @Data
    public static class Cli {
        private boolean enabled = false;
    }
}
