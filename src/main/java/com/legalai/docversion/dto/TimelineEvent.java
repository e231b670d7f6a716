package com.legalai.docversion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineEvent {

    public enum EventType {
        VERSION_CREATED,
        COMPARISON_MADE
    }

    private EventType type;
    private Instant timestamp;

    // Set for VERSION_CREATED
    private String versionId;
    private Integer versionNumber;

    // Set for COMPARISON_MADE
    private String comparisonId;

    private String description;
    private Map<String, Object> metadata;
}
