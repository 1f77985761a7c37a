package com.longevitydigest.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized publication or trial record prior to content generation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candidate {
    private String title;
    @Builder.Default
    private List<String> authors = new ArrayList<>();
    private String abstractText;
    private String venue;
    private String identifier; // DOI, NCT id; may be empty
    private String publishedDate;
    private String url;
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();
    private double relevanceScore;
    private String fullText;

    /**
     * Identifier when present, otherwise the title
     */
    @JsonIgnore
    public String getDedupKey() {
        if (identifier != null && !identifier.isBlank()) {
            return identifier;
        }
        return title != null ? title : "";
    }

    public boolean hasTag(String tag) {
        return tags != null && tags.contains(tag);
    }

    @JsonIgnore
    public SourceKind getSourceKind() {
        return SourceKind.classify(tags);
    }
}
