package com.talentscout.discovery.service;

import com.talentscout.discovery.client.SearchBackendChain;
import com.talentscout.discovery.config.DiscoveryProperties;
import com.talentscout.discovery.dto.DiscoveryResult;
import com.talentscout.discovery.dto.ProfileUrl;
import com.talentscout.discovery.dto.RoleAttributes;
import com.talentscout.discovery.dto.SearchQuery;
import com.talentscout.discovery.exception.DiscoveryConfigurationException;
import com.talentscout.discovery.exception.NoUsableQueryException;
import com.talentscout.discovery.exception.QueryBuildException;
import com.talentscout.discovery.service.search.QueryBuilder;
import com.talentscout.discovery.service.search.ResultAggregator;
import com.talentscout.discovery.service.search.SearchBudget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Talent discovery pipeline for one set of role attributes:
 * build queries, run them through the backend chain with a fresh budget,
 * aggregate distinct profiles and optionally persist the report.
 *
 * Finding nothing is a normal, empty result. Only unusable input or a
 * missing backend chain is reported as an exception, and always before any
 * network call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TalentDiscoveryService {

    private final QueryBuilder queryBuilder;
    private final FallbackSearchExecutor executor;
    private final ResultAggregator aggregator;
    private final DiscoveryReportWriter reportWriter;
    private final SearchBackendChain backendChain;
    private final DiscoveryProperties properties;

    public DiscoveryResult discover(RoleAttributes attrs) {
        return discover(attrs, properties.getSearch().getMaxTotalResults(), () -> false);
    }

    public DiscoveryResult discover(RoleAttributes attrs, int maxTotalResults) {
        return discover(attrs, maxTotalResults, () -> false);
    }

    public DiscoveryResult discover(RoleAttributes attrs, int maxTotalResults, BooleanSupplier cancelRequested) {
        if (attrs == null) {
            throw QueryBuildException.missingAttributes();
        }
        if (maxTotalResults < 0) {
            throw new QueryBuildException("maxTotalResults must not be negative but was " + maxTotalResults);
        }

        List<SearchQuery> queries = previewQueries(attrs);
        if (backendChain.isEmpty()) {
            throw DiscoveryConfigurationException.noBackends();
        }

        Instant startedAt = Instant.now();
        log.info("Starting profile discovery: title='{}', location='{}', {} queries, backends={}",
                attrs.title(), attrs.location(), queries.size(), backendChain.names());

        SearchBudget budget = new SearchBudget(maxTotalResults, properties.getSearch().getMaxResultsPerQuery());
        FallbackSearchExecutor.Execution execution =
                executor.execute(queries, backendChain.backends(), budget, cancelRequested);

        List<ProfileUrl> profiles = aggregator.aggregate(execution.hits(), maxTotalResults);
        int rejected = aggregator.countRejected(execution.hits());

        log.info("Discovery completed. Found {} valid profiles from {} links ({} rejected, {} queries attempted)",
                profiles.size(), execution.hits().size(), rejected, budget.getQueriesAttempted());

        if (properties.getReport().isEnabled()) {
            reportWriter.write(profiles, Path.of(properties.getReport().getOutputFile()));
        }

        return DiscoveryResult.builder()
                .profiles(profiles)
                .queries(queries)
                .queriesAttempted(budget.getQueriesAttempted())
                .rawHitCount(execution.hits().size())
                .rejectedHitCount(rejected)
                .backendSuccesses(execution.backendSuccesses())
                .backendFailures(execution.backendFailures())
                .cancelled(execution.cancelled())
                .startedAt(startedAt)
                .finishedAt(Instant.now())
                .build();
    }

    /**
     * Queries a discovery run would issue, without searching.
     *
     * @throws NoUsableQueryException if the attributes yield no query
     */
    public List<SearchQuery> previewQueries(RoleAttributes attrs) {
        List<SearchQuery> queries = queryBuilder.buildQueries(attrs);
        if (queries.isEmpty()) {
            throw new NoUsableQueryException();
        }
        return queries;
    }

    public List<String> backendNames() {
        return backendChain.names();
    }
}
