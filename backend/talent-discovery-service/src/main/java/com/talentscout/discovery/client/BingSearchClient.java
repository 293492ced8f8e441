package com.talentscout.discovery.client;

import com.talentscout.discovery.exception.SearchBackendException;
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
 * Scrapes Bing web results ({@code li.b_algo h2 a}).
 */
public class BingSearchClient extends AbstractSearchBackendClient {

    public static final String NAME = "bing";

    private static final String RESULT_LINK = "li.b_algo h2 a[href]";

    private final String baseUrl;

    public BingSearchClient(WebClient webClient, String baseUrl) {
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
                .path("/search")
                .queryParam("q", "{q}")
                .queryParam("count", limit)
                .encode()
                .buildAndExpand(Map.of("q", query))
                .toUri();
    }

    @Override
    protected List<String> extractLinks(String body) {
        Document doc = Jsoup.parse(body, baseUrl);
        List<String> links = new ArrayList<>();
        for (Element anchor : doc.select(RESULT_LINK)) {
            String href = anchor.absUrl("href");
            if (!href.isBlank()) {
                links.add(href);
            }
        }
        if (links.isEmpty()) {
            throw SearchBackendException.parseFailure(NAME, "no result links on page");
        }
        return links;
    }
}
