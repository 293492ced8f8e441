package com.talentscout.discovery.client;

import com.talentscout.discovery.dto.SearchHit;
import com.talentscout.discovery.exception.SearchBackendException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared GET handling for search backends: one request, bounded by the caller's
 * timeout, with transport outcomes translated into {@link SearchBackendException} kinds.
 */
@Slf4j
public abstract class AbstractSearchBackendClient implements SearchBackendClient {

    protected final WebClient webClient;

    protected AbstractSearchBackendClient(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public List<SearchHit> search(String query, int limit, Duration timeout) {
        String body = fetch(buildUri(query, limit), timeout);
        List<String> links = extractLinks(body);

        List<SearchHit> hits = new ArrayList<>();
        for (String link : links) {
            if (hits.size() >= limit) {
                break;
            }
            hits.add(new SearchHit(link, name()));
        }
        log.debug("{} returned {} links for '{}'", name(), hits.size(), query);
        return hits;
    }

    protected abstract URI buildUri(String query, int limit);

    /**
     * Pulls result links out of a response body.
     *
     * @throws SearchBackendException with kind PARSE_FAILURE if the body is not a result page
     */
    protected abstract List<String> extractLinks(String body);

    protected Map<String, String> extraHeaders() {
        return Map.of();
    }

    protected String fetch(URI uri, Duration timeout) {
        try {
            String body = webClient.get()
                    .uri(uri)
                    .headers(headers -> extraHeaders().forEach(headers::set))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .onErrorMap(this::translate)
                    .block();
            if (body == null) {
                throw SearchBackendException.parseFailure(name(), "empty response body");
            }
            return body;
        } catch (SearchBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    private SearchBackendException translate(Throwable e) {
        if (e instanceof SearchBackendException sbe) {
            return sbe;
        }
        if (e instanceof WebClientResponseException wce) {
            int status = wce.getStatusCode().value();
            if (status == 429) {
                return SearchBackendException.rateLimited(name(), status);
            }
            return SearchBackendException.transportFailure(name(), "HTTP " + status, e);
        }
        if (isTimeout(e)) {
            return SearchBackendException.timeout(name(), e);
        }
        if (e instanceof WebClientRequestException) {
            return SearchBackendException.transportFailure(name(), String.valueOf(e.getMessage()), e);
        }
        return SearchBackendException.transportFailure(name(), e.toString(), e);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof java.util.concurrent.TimeoutException
                    || t instanceof TimeoutException
                    || t instanceof ReadTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
