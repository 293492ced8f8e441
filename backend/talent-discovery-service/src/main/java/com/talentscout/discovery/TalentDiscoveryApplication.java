package com.talentscout.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * TalentScout Discovery Service Application
 *
 * Spring Boot service that finds public professional profiles for a job role:
 * - turns role attributes into site-restricted search queries
 * - runs them through an ordered chain of search backends (API and HTML scraping)
 * - validates, deduplicates and caps the discovered profile URLs
 *
 * Started with {@code --discovery.cli.enabled=true} it runs once and exits with
 * the code reported by {@link com.talentscout.discovery.cli.DiscoveryCommandLineRunner}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TalentDiscoveryApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(TalentDiscoveryApplication.class, args);
        if (context.getEnvironment().getProperty("discovery.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
