package com.talentscout.discovery.controller;

import com.talentscout.discovery.dto.DiscoveryResponse;
import com.talentscout.discovery.dto.RoleAttributes;
import com.talentscout.discovery.dto.SearchQuery;
import com.talentscout.discovery.service.TalentDiscoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * REST API for profile discovery.
 */
@RestController
@RequestMapping("/api/v1/discovery")
@RequiredArgsConstructor
@Slf4j
public class TalentDiscoveryController {

    private final TalentDiscoveryService discoveryService;

    /**
     * Runs a full discovery. The search blocks on rate-limit delays, so it runs
     * on the bounded elastic scheduler.
     */
    @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DiscoveryResponse> search(@RequestBody RoleAttributes attributes,
                                          @RequestParam(required = false) Integer maxResults) {
        log.info("Discovery request: title='{}', location='{}', maxResults={}",
                attributes.title(), attributes.location(), maxResults);
        return Mono.fromCallable(() -> maxResults == null
                        ? discoveryService.discover(attributes)
                        : discoveryService.discover(attributes, maxResults))
                .subscribeOn(Schedulers.boundedElastic())
                .map(DiscoveryResponse::from);
    }

    @PostMapping(value = "/queries", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public List<SearchQuery> previewQueries(@RequestBody RoleAttributes attributes) {
        return discoveryService.previewQueries(attributes);
    }

    @GetMapping("/backends")
    public Map<String, Object> backends() {
        return Map.of("backends", discoveryService.backendNames());
    }
}
