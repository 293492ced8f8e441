package com.talentscout.discovery.service;

import com.talentscout.discovery.client.SearchBackendClient;
import com.talentscout.discovery.config.DiscoveryProperties;
import com.talentscout.discovery.dto.ProfileUrl;
import com.talentscout.discovery.dto.SearchHit;
import com.talentscout.discovery.dto.SearchQuery;
import com.talentscout.discovery.exception.SearchBackendException;
import com.talentscout.discovery.service.search.ProfileUrlNormalizer;
import com.talentscout.discovery.service.search.SearchBudget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Runs queries through the backend fallback chain.
 *
 * Per query, backends are tried in order until one returns hits; any backend
 * failure moves on to the next backend, and a query nobody answers contributes
 * zero hits. Between two queries the executor always waits the inter-query delay,
 * whether the previous query succeeded or not.
 *
 * The run stops before the next query once the budget holds maxTotalResults
 * distinct valid profiles, or when cancellation is requested. Cancellation is
 * checked before and after each pause, never during a backend call.
 */
@Service
@Slf4j
public class FallbackSearchExecutor {

    /**
     * Blocking pause between queries
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ProfileUrlNormalizer normalizer;
    private final Duration interQueryDelay;
    private final Duration backendTimeout;
    private final Sleeper sleeper;

    @Autowired
    public FallbackSearchExecutor(ProfileUrlNormalizer normalizer, DiscoveryProperties properties) {
        this(normalizer,
                properties.getSearch().getInterQueryDelay(),
                properties.getSearch().getBackendTimeout(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    public FallbackSearchExecutor(ProfileUrlNormalizer normalizer, Duration interQueryDelay,
                                  Duration backendTimeout, Sleeper sleeper) {
        this.normalizer = normalizer;
        this.interQueryDelay = interQueryDelay;
        this.backendTimeout = backendTimeout;
        this.sleeper = sleeper;
    }

    /**
     * Outcome of an execution: raw hits in arrival order plus per-backend statistics.
     */
    public record Execution(
            List<SearchHit> hits,
            Map<String, Integer> backendSuccesses,
            Map<SearchBackendException.Kind, Integer> backendFailures,
            boolean cancelled
    ) {}

    public List<SearchHit> execute(List<SearchQuery> queries, List<SearchBackendClient> backends, SearchBudget budget) {
        return execute(queries, backends, budget, () -> false).hits();
    }

    public Execution execute(List<SearchQuery> queries, List<SearchBackendClient> backends,
                             SearchBudget budget, BooleanSupplier cancelRequested) {
        List<SearchQuery> ordered = new ArrayList<>(queries);
        ordered.sort(Comparator.comparingInt(SearchQuery::priority));

        List<SearchHit> hits = new ArrayList<>();
        Map<String, Integer> successes = new LinkedHashMap<>();
        Map<SearchBackendException.Kind, Integer> failures = new EnumMap<>(SearchBackendException.Kind.class);
        boolean cancelled = false;

        for (int i = 0; i < ordered.size(); i++) {
            if (budget.isExhausted()) {
                log.info("Result budget of {} profiles reached, skipping remaining {} queries",
                        budget.getMaxTotalResults(), ordered.size() - i);
                break;
            }
            if (cancelRequested.getAsBoolean()) {
                log.info("Discovery cancelled before query {}/{}", i + 1, ordered.size());
                cancelled = true;
                break;
            }

            if (i > 0) {
                if (!pause()) {
                    log.info("Discovery interrupted before query {}/{}", i + 1, ordered.size());
                    cancelled = true;
                    break;
                }
                if (cancelRequested.getAsBoolean()) {
                    log.info("Discovery cancelled during pause before query {}/{}", i + 1, ordered.size());
                    cancelled = true;
                    break;
                }
            }

            SearchQuery query = ordered.get(i);
            budget.recordQueryAttempt();
            log.info("Query {}/{} [{}]: {}", i + 1, ordered.size(), query.strategy(), query.text());

            List<SearchHit> queryHits = runQuery(query, backends, budget, successes, failures);
            hits.addAll(queryHits);
            for (SearchHit hit : queryHits) {
                ProfileUrl profile = normalizer.normalize(hit.url());
                if (profile != null) {
                    budget.recordProfile(profile.url());
                }
            }

            log.info("Found {} links for query {}/{} (distinct profiles so far: {})",
                    queryHits.size(), i + 1, ordered.size(), budget.getDistinctProfileCount());
        }

        return new Execution(hits, successes, failures, cancelled);
    }

    private List<SearchHit> runQuery(SearchQuery query, List<SearchBackendClient> backends, SearchBudget budget,
                                     Map<String, Integer> successes,
                                     Map<SearchBackendException.Kind, Integer> failures) {
        for (int b = 0; b < backends.size(); b++) {
            SearchBackendClient backend = backends.get(b);
            try {
                List<SearchHit> result = backend.search(query.text(), budget.getMaxResultsPerQuery(), backendTimeout);
                if (result != null && !result.isEmpty()) {
                    successes.merge(backend.name(), 1, Integer::sum);
                    return result.size() > budget.getMaxResultsPerQuery()
                            ? List.copyOf(result.subList(0, budget.getMaxResultsPerQuery()))
                            : result;
                }
                log.debug("Backend {} returned no links for '{}' (attempt {}/{})",
                        backend.name(), query.text(), b + 1, backends.size());
            } catch (SearchBackendException e) {
                failures.merge(e.getKind(), 1, Integer::sum);
                log.warn("Backend {} failed for '{}' (attempt {}/{}): {} - {}",
                        e.getBackend(), query.text(), b + 1, backends.size(), e.getKind(), e.getMessage());
            } catch (RuntimeException e) {
                failures.merge(SearchBackendException.Kind.TRANSPORT_FAILURE, 1, Integer::sum);
                log.error("Backend {} raised an unexpected error for '{}' (attempt {}/{}): {}",
                        backend.name(), query.text(), b + 1, backends.size(), e.toString(), e);
            }
        }
        log.warn("All {} backends failed for query: {}", backends.size(), query.text());
        return List.of();
    }

    /**
     * @return false if the thread was interrupted while waiting
     */
    private boolean pause() {
        if (interQueryDelay == null || interQueryDelay.isZero() || interQueryDelay.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            sleeper.sleep(interQueryDelay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
