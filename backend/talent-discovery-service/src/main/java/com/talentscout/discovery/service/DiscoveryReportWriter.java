package com.talentscout.discovery.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.talentscout.discovery.dto.DiscoveryReport;
import com.talentscout.discovery.dto.ProfileUrl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the JSON summary of a discovery run. A failed write is logged and
 * never affects the in-memory result.
 */
@Service
@Slf4j
public class DiscoveryReportWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectMapper objectMapper;

    public DiscoveryReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public DiscoveryReport toReport(List<ProfileUrl> profiles) {
        return DiscoveryReport.builder()
                .totalProfiles(profiles.size())
                .profiles(List.copyOf(profiles))
                .timestamp(LocalDateTime.now().format(TIMESTAMP_FORMAT))
                .build();
    }

    /**
     * @return true if the report was written
     */
    public boolean write(List<ProfileUrl> profiles, Path outputFile) {
        DiscoveryReport report = toReport(profiles);
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
                objectMapper.writeValue(writer, report);
            }
            log.info("Results saved to {} ({} profiles)", outputFile, report.getTotalProfiles());
            return true;
        } catch (IOException e) {
            log.error("Error saving results to {}: {}", outputFile, e.getMessage(), e);
            return false;
        }
    }
}
