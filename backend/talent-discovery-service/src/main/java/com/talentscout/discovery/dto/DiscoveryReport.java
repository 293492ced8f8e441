package com.talentscout.discovery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Persisted summary of one discovery run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryReport {

    @JsonProperty("total_profiles")
    private int totalProfiles;

    private List<ProfileUrl> profiles;

    /**
     * Local time the report was written, {@code yyyy-MM-dd HH:mm:ss}
     */
    private String timestamp;
}
