package com.longevitydigest.backend.model.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parsed response of a generation or revision call
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedContent {
    private String title;
    private String summary;
    private String body;
    @Builder.Default
    private List<String> keyInsights = new ArrayList<>();
    @Builder.Default
    private List<String> practicalApplications = new ArrayList<>();
    private Double confidenceScore;
}
