package com.longevitydigest.backend.pipeline;

import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of one run: finished drafts in processing order plus counters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunReport {
    @Builder.Default
    private List<Draft> drafts = new ArrayList<>();
    private int candidatesSelected;
    private int processed;
    private int ready;
    private int needsRevision;
    private int skipped;
    @Builder.Default
    private Map<SourceKind, Integer> selectedBySource = new EnumMap<>(SourceKind.class);
    @Builder.Default
    private List<String> savedFiles = new ArrayList<>();
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
}
