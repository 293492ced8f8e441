package com.talentscout.discovery.exception;

/**
 * Invalid backend chain or other setup problem detected before searching.
 */
public class DiscoveryConfigurationException extends DiscoveryException {

    public DiscoveryConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }

    public static DiscoveryConfigurationException unknownBackend(String name) {
        return new DiscoveryConfigurationException("Unknown search backend: " + name);
    }

    public static DiscoveryConfigurationException noBackends() {
        return new DiscoveryConfigurationException("No search backend is enabled");
    }
}
