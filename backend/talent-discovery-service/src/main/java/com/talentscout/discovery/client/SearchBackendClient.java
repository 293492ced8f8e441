package com.talentscout.discovery.client;

import com.talentscout.discovery.dto.SearchHit;
import com.talentscout.discovery.exception.SearchBackendException;

import java.time.Duration;
import java.util.List;

/**
 * A search surface queried for candidate links.
 *
 * Implementations make exactly one attempt per call, honor the timeout and
 * return at most {@code limit} hits. Every failure is reported as a
 * {@link SearchBackendException}; retrying is left to the caller.
 */
public interface SearchBackendClient {

    String name();

    List<SearchHit> search(String query, int limit, Duration timeout) throws SearchBackendException;
}
