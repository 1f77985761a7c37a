package com.longevitydigest.backend.pipeline;

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
public class RegenerationReport {
    private int attempted;
    private int nowReady;
    private int stillNeedsRevision;
    private int failed;
    @Builder.Default
    private List<String> updatedFiles = new ArrayList<>();
}
