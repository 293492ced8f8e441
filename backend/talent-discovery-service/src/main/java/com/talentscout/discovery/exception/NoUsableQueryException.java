package com.talentscout.discovery.exception;

/**
 * Attributes were well-formed but none of them produced a search query,
 * so no search could be run. Distinct from a run that found nothing.
 */
public class NoUsableQueryException extends DiscoveryException {

    public NoUsableQueryException() {
        super("NO_USABLE_QUERY", "Role attributes contain no title, location, skill or keyword to search for");
    }
}
