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
 * Low-precision fallback against a plain Google results page. Every anchor is
 * scanned, {@code /url?q=} redirect wrappers are decoded and only targets on the
 * profile host are kept.
 *
 * One instance serves one Google domain; configure several domains to get
 * several entries in the fallback chain.
 */
public class GoogleRedirectSearchClient extends AbstractSearchBackendClient {

    public static final String NAME_PREFIX = "google";

    private final String domain;
    private final String profileHost;

    public GoogleRedirectSearchClient(WebClient webClient, String domain, String profileHost) {
        super(webClient);
        this.domain = domain;
        this.profileHost = profileHost;
    }

    @Override
    public String name() {
        return NAME_PREFIX + ":" + domain;
    }

    @Override
    protected URI buildUri(String query, int limit) {
        return UriComponentsBuilder.newInstance()
                .scheme("https")
                .host(domain)
                .path("/search")
                .queryParam("q", "{q}")
                .queryParam("num", limit)
                .encode()
                .buildAndExpand(Map.of("q", query))
                .toUri();
    }

    @Override
    protected List<String> extractLinks(String body) {
        Document doc = Jsoup.parse(body);
        int redirects = 0;
        List<String> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("href");
            if (!href.startsWith("/url?q=")) {
                continue;
            }
            redirects++;
            String target = ProfileUrlNormalizer.unwrapRedirect(href);
            if (target != null && target.contains(profileHost)) {
                links.add(target);
            }
        }
        if (redirects == 0) {
            throw SearchBackendException.parseFailure(name(), "no redirect links on page");
        }
        return links;
    }
}
