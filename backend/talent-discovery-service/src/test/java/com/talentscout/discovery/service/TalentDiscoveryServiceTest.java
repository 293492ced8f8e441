package com.talentscout.discovery.service;

import com.talentscout.discovery.client.SearchBackendChain;
import com.talentscout.discovery.client.SearchBackendClient;
import com.talentscout.discovery.config.DiscoveryProperties;
import com.talentscout.discovery.dto.DiscoveryResult;
import com.talentscout.discovery.dto.ProfileUrl;
import com.talentscout.discovery.dto.RoleAttributes;
import com.talentscout.discovery.dto.SearchHit;
import com.talentscout.discovery.dto.SearchQuery;
import com.talentscout.discovery.exception.DiscoveryConfigurationException;
import com.talentscout.discovery.exception.NoUsableQueryException;
import com.talentscout.discovery.exception.QueryBuildException;
import com.talentscout.discovery.exception.SearchBackendException;
import com.talentscout.discovery.service.search.ProfileUrlNormalizer;
import com.talentscout.discovery.service.search.QueryBuilder;
import com.talentscout.discovery.service.search.ResultAggregator;
import com.talentscout.discovery.service.search.SearchBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * TalentDiscoveryService unit tests
 */
@ExtendWith(MockitoExtension.class)
class TalentDiscoveryServiceTest {

    @Mock
    private FallbackSearchExecutor executor;

    @Mock
    private DiscoveryReportWriter reportWriter;

    @Mock
    private SearchBackendClient backend;

    private DiscoveryProperties properties;
    private TalentDiscoveryService service;

    private final RoleAttributes javaRole =
            RoleAttributes.of("Java Developer", "Toronto", List.of("Java", "Spring"));

    @BeforeEach
    void setUp() {
        properties = new DiscoveryProperties();
        service = newService(new SearchBackendChain(List.of(backend)));
    }

    private TalentDiscoveryService newService(SearchBackendChain chain) {
        ProfileUrlNormalizer normalizer = new ProfileUrlNormalizer(properties);
        return new TalentDiscoveryService(new QueryBuilder(properties), executor,
                new ResultAggregator(normalizer), reportWriter, chain, properties);
    }

    private static FallbackSearchExecutor.Execution execution(List<SearchHit> hits) {
        return new FallbackSearchExecutor.Execution(hits, Map.of("duckduckgo", 1), Map.of(), false);
    }

    @Test
    @DisplayName("aggregates the executor's hits into distinct profiles")
    void discoversProfiles() {
        when(executor.execute(anyList(), anyList(), any(SearchBudget.class), any())).thenReturn(execution(List.of(
                new SearchHit("https://www.linkedin.com/in/jane-doe", "duckduckgo"),
                new SearchHit("https://www.linkedin.com/in/jane-doe/?originalSubdomain=ca", "duckduckgo"),
                new SearchHit("https://www.linkedin.com/jobs/view/123", "duckduckgo"),
                new SearchHit("https://ca.linkedin.com/in/sam-wu", "duckduckgo"))));

        DiscoveryResult result = service.discover(javaRole, 10);

        assertThat(result.profileUrls()).containsExactly(
                "https://www.linkedin.com/in/jane-doe",
                "https://ca.linkedin.com/in/sam-wu");
        assertThat(result.getRawHitCount()).isEqualTo(4);
        assertThat(result.getRejectedHitCount()).isEqualTo(1);
        assertThat(result.getQueries()).hasSize(4);
        assertThat(result.getBackendSuccesses()).containsEntry("duckduckgo", 1);
        verify(reportWriter, never()).write(anyList(), any());
    }

    @Test
    @DisplayName("a fresh budget carries the requested maximum and the per-query limit")
    void passesBudget() {
        properties.getSearch().setMaxResultsPerQuery(7);
        when(executor.execute(anyList(), anyList(), any(SearchBudget.class), any())).thenReturn(execution(List.of()));

        service.discover(javaRole, 25);

        ArgumentCaptor<SearchBudget> budget = ArgumentCaptor.forClass(SearchBudget.class);
        verify(executor).execute(anyList(), eq(List.of(backend)), budget.capture(), any());
        assertThat(budget.getValue().getMaxTotalResults()).isEqualTo(25);
        assertThat(budget.getValue().getMaxResultsPerQuery()).isEqualTo(7);
        assertThat(budget.getValue().getDistinctProfileCount()).isZero();
    }

    @Test
    @DisplayName("finding nothing is an empty result, not an error")
    void emptyResult() {
        when(executor.execute(anyList(), anyList(), any(SearchBudget.class), any()))
                .thenReturn(new FallbackSearchExecutor.Execution(List.of(), Map.of(),
                        Map.of(SearchBackendException.Kind.TIMEOUT, 4), false));

        DiscoveryResult result = service.discover(javaRole);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getBackendFailures()).containsEntry(SearchBackendException.Kind.TIMEOUT, 4);
    }

    @Test
    @DisplayName("writes the report when enabled")
    void writesReport() {
        properties.getReport().setEnabled(true);
        properties.getReport().setOutputFile("out/profiles.json");
        when(executor.execute(anyList(), anyList(), any(SearchBudget.class), any())).thenReturn(execution(List.of(
                new SearchHit("https://www.linkedin.com/in/jane-doe", "duckduckgo"))));

        service.discover(javaRole, 5);

        verify(reportWriter).write(List.of(new ProfileUrl("https://www.linkedin.com/in/jane-doe", "jane-doe")),
                Path.of("out/profiles.json"));
    }

    @Test
    @DisplayName("missing attributes are rejected before searching")
    void nullAttributes() {
        assertThatThrownBy(() -> service.discover(null))
                .isInstanceOf(QueryBuildException.class);
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("negative maxResults is rejected")
    void negativeMax() {
        assertThatThrownBy(() -> service.discover(javaRole, -1))
                .isInstanceOf(QueryBuildException.class);
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("attributes without any searchable value raise NoUsableQueryException")
    void noUsableQuery() {
        RoleAttributes blank = new RoleAttributes(" ", null, List.of("Go"), List.of());

        assertThatThrownBy(() -> service.discover(blank))
                .isInstanceOf(NoUsableQueryException.class);
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("an empty backend chain is a configuration error")
    void emptyChain() {
        TalentDiscoveryService noBackends = newService(new SearchBackendChain(List.of()));

        assertThatThrownBy(() -> noBackends.discover(javaRole))
                .isInstanceOf(DiscoveryConfigurationException.class);
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("previewQueries returns the built queries without searching")
    void preview() {
        assertThat(service.previewQueries(javaRole)).extracting(SearchQuery::text).contains(
                "site:linkedin.com/in/ \"Java Developer\" \"Toronto\"");
        verifyNoInteractions(executor);
    }
}
