package com.longevitydigest.backend.model.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactCheckVerdict {
    private double accuracyScore;
    @Builder.Default
    private List<String> issues = new ArrayList<>();
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
    private boolean safeToPublish;

    /**
     * Verdict used when the fact-check provider could not deliver one
     */
    public static FactCheckVerdict failure(String providerName, String reason) {
        return FactCheckVerdict.builder()
                .accuracyScore(0.0)
                .issues(new ArrayList<>(List.of("Fact check failed (" + providerName + "): " + reason)))
                .safeToPublish(false)
                .build();
    }
}
