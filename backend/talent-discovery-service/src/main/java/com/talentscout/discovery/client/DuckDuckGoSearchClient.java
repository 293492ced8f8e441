package com.talentscout.discovery.client;

import com.talentscout.discovery.exception.SearchBackendException;
import com.talentscout.discovery.service.search.ProfileUrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scrapes the DuckDuckGo HTML endpoint. Result links are {@code a.result__a};
 * DuckDuckGo's own {@code /l/?uddg=} click-tracking wrapper is removed.
 */
public class DuckDuckGoSearchClient extends AbstractSearchBackendClient {

    public static final String NAME = "duckduckgo";

    private static final String RESULT_LINK = "a.result__a";
    private static final String TRACKING_PARAM = "uddg=";

    private final String baseUrl;

    public DuckDuckGoSearchClient(WebClient webClient, String baseUrl) {
        super(webClient);
        this.baseUrl = baseUrl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected URI buildUri(String query, int limit) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/html/")
                .queryParam("q", "{q}")
                .queryParam("kl", "us-en")
                .encode()
                .buildAndExpand(Map.of("q", query))
                .toUri();
    }

    @Override
    protected List<String> extractLinks(String body) {
        Document doc = Jsoup.parse(body, baseUrl);
        List<String> links = new ArrayList<>();
        for (Element anchor : doc.select(RESULT_LINK)) {
            String href = anchor.attr("href");
            if (!href.isBlank()) {
                links.add(unwrapTracking(href));
            }
        }
        if (links.isEmpty()) {
            throw SearchBackendException.parseFailure(NAME, "no result links on page");
        }
        return links;
    }

    static String unwrapTracking(String href) {
        int param = href.indexOf(TRACKING_PARAM);
        if (param < 0 || !href.contains("/l/?")) {
            return href;
        }
        String target = href.substring(param + TRACKING_PARAM.length());
        int end = target.indexOf('&');
        if (end >= 0) {
            target = target.substring(0, end);
        }
        String decoded = ProfileUrlNormalizer.percentDecode(target);
        return decoded != null ? decoded : href;
    }
}
