package com.talentscout.discovery.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscout.discovery.dto.DiscoveryResult;
import com.talentscout.discovery.dto.RoleAttributes;
import com.talentscout.discovery.exception.DiscoveryException;
import com.talentscout.discovery.service.TalentDiscoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * One-shot discovery from the command line.
 *
 * <pre>
 * java -jar talent-discovery-service.jar --discovery.cli.enabled=true \
 *      --spring.main.web-application-type=none --attributes=role.json [--max-results=20]
 * </pre>
 *
 * Prints one profile URL per line. Exit code 0 for any completed run, including
 * one that found no profiles; 2 for unreadable or unusable input.
 */
@Component
@ConditionalOnProperty(prefix = "discovery.cli", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DiscoveryCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIGURATION_ERROR = 2;

    private final TalentDiscoveryService discoveryService;
    private final ObjectMapper objectMapper;

    private PrintStream out = System.out;
    private int exitCode = EXIT_OK;

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> attributesArg = args.getOptionValues("attributes");
        if (attributesArg == null || attributesArg.isEmpty()) {
            log.error("Missing --attributes=<file> argument");
            exitCode = EXIT_CONFIGURATION_ERROR;
            return;
        }

        RoleAttributes attributes;
        try {
            attributes = objectMapper.readValue(Files.readString(Path.of(attributesArg.get(0))), RoleAttributes.class);
        } catch (JsonProcessingException e) {
            log.error("Malformed role attributes in {}: {}", attributesArg.get(0), e.getOriginalMessage());
            exitCode = EXIT_CONFIGURATION_ERROR;
            return;
        } catch (IOException e) {
            log.error("Cannot read role attributes from {}: {}", attributesArg.get(0), e.getMessage());
            exitCode = EXIT_CONFIGURATION_ERROR;
            return;
        }

        try {
            Integer maxResults = parseMaxResults(args);
            DiscoveryResult result = maxResults == null
                    ? discoveryService.discover(attributes)
                    : discoveryService.discover(attributes, maxResults);
            out.printf("Found %d profiles:%n", result.getProfiles().size());
            result.profileUrls().forEach(out::println);
            exitCode = EXIT_OK;
        } catch (DiscoveryException e) {
            log.error("Discovery could not start: {}", e.getMessage());
            exitCode = EXIT_CONFIGURATION_ERROR;
        }
    }

    private Integer parseMaxResults(ApplicationArguments args) {
        List<String> values = args.getOptionValues("max-results");
        if (values == null || values.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(values.get(0).trim());
        } catch (NumberFormatException e) {
            throw new DiscoveryException("BUILDER_ERROR", "--max-results must be a number: " + values.get(0));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
